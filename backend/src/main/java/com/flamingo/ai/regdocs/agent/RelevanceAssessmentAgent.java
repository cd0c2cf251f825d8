package com.flamingo.ai.regdocs.agent;

import com.flamingo.ai.regdocs.agent.dto.RelevanceVerdict;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent judging whether the first pages of a PDF concern the target substance. */
public interface RelevanceAssessmentAgent {

  @SystemMessage(
      """
        Given the text of pages 1-3 of a PDF and the target API "{{substance}}", assess the
        relevance of this document for pharmaceutical research.

        Consider:
        - Does it mention the specific API name or close synonyms?
        - Is it an official regulatory document (approval, assessment, guidance)?
        - Does it contain clinical or safety information about the drug?

        Answer ONLY with JSON:
        {
          "relevance": "high" | "medium" | "low",
          "confidence": 0.0-1.0,
          "reasoning": "brief explanation"
        }
        """)
  @UserMessage("{{sample}}")
  RelevanceVerdict assess(@V("substance") String substance, @V("sample") String sample);
}
