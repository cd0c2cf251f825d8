package com.flamingo.ai.regdocs.config;

import com.flamingo.ai.regdocs.agent.RelevanceAssessmentAgent;
import com.flamingo.ai.regdocs.agent.SearchPlanningAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the AI agents built with LangChain4j AI Services.
 *
 * <p>Pattern: agent interfaces declare @SystemMessage/@UserMessage templates, AiServices.builder()
 * produces the implementation.
 */
@Configuration
public class AiAgentConfig {

  /** Search planning agent. Returns the raw JSON object so the planner can tolerate odd shapes. */
  @Bean
  public SearchPlanningAgent searchPlanningAgent(ChatModel chatModel) {
    return AiServices.builder(SearchPlanningAgent.class).chatModel(chatModel).build();
  }

  /** Relevance assessment agent. Maps the JSON answer onto a RelevanceVerdict. */
  @Bean
  public RelevanceAssessmentAgent relevanceAssessmentAgent(ChatModel chatModel) {
    return AiServices.builder(RelevanceAssessmentAgent.class).chatModel(chatModel).build();
  }
}
