package com.flamingo.ai.regdocs.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.regdocs.domain.enums.PipelineStatus;
import com.flamingo.ai.regdocs.domain.model.PipelineResult;
import com.flamingo.ai.regdocs.service.research.ResearchService;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/** Starts the application with a substance on the command line. */
@SpringBootTest(properties = "regdocs.cli.substance=Ibuprofen")
class ResearchCommandLineContextTest {

  @MockitoBean private ChatModel chatModel;

  @Autowired private ApplicationContext applicationContext;

  @Autowired private ResearchService researchService;

  @Test
  @DisplayName("Command line runner should research the configured substance at startup")
  void shouldRunResearch_whenSubstanceIsConfigured() {
    assertThat(applicationContext.getBeanNamesForType(ResearchCommandLineRunner.class))
        .hasSize(1);
    verify(researchService).research("Ibuprofen");
  }

  @TestConfiguration
  static class StubResearchConfig {

    @Bean
    @Primary
    ResearchService stubResearchService() {
      ResearchService stub = mock(ResearchService.class);
      when(stub.research("Ibuprofen"))
          .thenReturn(
              PipelineResult.builder()
                  .status(PipelineStatus.COMPLETED)
                  .substance("Ibuprofen")
                  .slug("ibuprofen")
                  .message("No PDF documents found")
                  .build());
      return stub;
    }
  }
}
