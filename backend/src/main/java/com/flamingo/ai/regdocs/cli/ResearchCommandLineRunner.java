package com.flamingo.ai.regdocs.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.regdocs.domain.model.PipelineResult;
import com.flamingo.ai.regdocs.service.research.ResearchService;
import java.io.PrintStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once at startup for {@code regdocs.cli.substance} and prints the result as
 * JSON on standard output.
 */
@Component
@ConditionalOnProperty(prefix = "regdocs.cli", name = "substance")
@Slf4j
public class ResearchCommandLineRunner implements ApplicationRunner {

  private final ResearchService researchService;
  private final ObjectMapper objectMapper;
  private final String substance;
  private final PrintStream out;

  @Autowired
  public ResearchCommandLineRunner(
      ResearchService researchService,
      ObjectMapper objectMapper,
      @Value("${regdocs.cli.substance}") String substance) {
    this(researchService, objectMapper, substance, System.out);
  }

  ResearchCommandLineRunner(
      ResearchService researchService,
      ObjectMapper objectMapper,
      String substance,
      PrintStream out) {
    this.researchService = researchService;
    this.objectMapper = objectMapper;
    this.substance = substance;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) throws JsonProcessingException {
    log.info("Running research from the command line for '{}'", substance);
    PipelineResult result = researchService.research(substance);
    out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
    if (result.isError()) {
      log.warn("Research for '{}' ended with an error: {}", substance, result.message());
    }
  }
}
