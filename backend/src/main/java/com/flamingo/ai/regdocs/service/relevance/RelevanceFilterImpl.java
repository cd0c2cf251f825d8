package com.flamingo.ai.regdocs.service.relevance;

import com.flamingo.ai.regdocs.agent.RelevanceAssessmentAgent;
import com.flamingo.ai.regdocs.agent.dto.RelevanceVerdict;
import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.service.extraction.TextExtractionEngine;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Assesses candidates in fixed-size concurrent batches with a pause between batches, which keeps
 * the request rate against both the document hosts and the AI service bounded.
 */
@Service
@Slf4j
public class RelevanceFilterImpl implements RelevanceFilter {

  private final TextExtractionEngine extractionEngine;
  private final RelevanceAssessmentAgent agent;
  private final RegDocsConfig config;
  private final Executor executor;
  private final MeterRegistry meterRegistry;

  public RelevanceFilterImpl(
      TextExtractionEngine extractionEngine,
      RelevanceAssessmentAgent agent,
      RegDocsConfig config,
      @Qualifier("researchExecutor") Executor executor,
      MeterRegistry meterRegistry) {
    this.extractionEngine = extractionEngine;
    this.agent = agent;
    this.config = config;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "research.filter", description = "Time to assess candidate relevance")
  public List<PdfCandidate> filter(List<PdfCandidate> candidates, String substanceName) {
    RegDocsConfig.Relevance settings = config.getRelevance();
    int batchSize = Math.max(1, settings.getBatchSize());
    List<PdfCandidate> relevant = new ArrayList<>();

    for (int i = 0; i < candidates.size(); i += batchSize) {
      if (i > 0) {
        pause(settings.getBatchDelayMs());
      }
      List<PdfCandidate> batch = candidates.subList(i, Math.min(i + batchSize, candidates.size()));
      log.debug("Assessing batch {}-{} of {}", i, i + batch.size(), candidates.size());

      List<CompletableFuture<Boolean>> verdicts =
          batch.stream().map(candidate -> submit(candidate, substanceName)).toList();

      for (int j = 0; j < batch.size(); j++) {
        if (verdicts.get(j).join()) {
          relevant.add(batch.get(j));
        }
      }
    }

    log.info(
        "{} of {} candidates relevant to {}", relevant.size(), candidates.size(), substanceName);
    return relevant;
  }

  private CompletableFuture<Boolean> submit(PdfCandidate candidate, String substanceName) {
    try {
      return CompletableFuture.supplyAsync(() -> isRelevant(candidate, substanceName), executor);
    } catch (RejectedExecutionException e) {
      log.warn("Assessment of {} rejected by executor: {}", candidate.url(), e.getMessage());
      meterRegistry.counter("research.relevance.errors").increment();
      return CompletableFuture.completedFuture(false);
    }
  }

  /** Never throws: any failure rejects the candidate. */
  boolean isRelevant(PdfCandidate candidate, String substanceName) {
    RegDocsConfig.Relevance settings = config.getRelevance();
    try {
      String sample =
          extractionEngine.extractSample(candidate.url(), config.getExtraction().getMaxPages());
      if (sample == null || sample.isBlank()) {
        log.warn("No text extracted from PDF: {}", candidate.url());
        meterRegistry.counter("research.relevance.rejected", "reason", "no_text").increment();
        return false;
      }

      String truncated =
          sample.length() > settings.getMaxSampleChars()
              ? sample.substring(0, settings.getMaxSampleChars())
              : sample;
      RelevanceVerdict verdict = agent.assess(substanceName, truncated);
      if (verdict == null) {
        log.warn("Empty relevance verdict for {}", candidate.url());
        meterRegistry.counter("research.relevance.rejected", "reason", "no_verdict").increment();
        return false;
      }

      boolean accepted = verdict.isAccepted(settings.getConfidenceThreshold());
      if (accepted) {
        log.info(
            "PDF deemed relevant: {} (relevance: {}, confidence: {})",
            candidate.title(),
            verdict.relevance(),
            verdict.confidence());
        meterRegistry.counter("research.relevance.accepted").increment();
      } else {
        log.debug(
            "PDF filtered out: {} (relevance: {}, confidence: {}, reasoning: {})",
            candidate.title(),
            verdict.relevance(),
            verdict.confidence(),
            verdict.reasoning());
        meterRegistry.counter("research.relevance.rejected", "reason", "verdict").increment();
      }
      return accepted;

    } catch (Exception e) {
      log.warn("Error assessing PDF relevance for {}: {}", candidate.url(), e.getMessage());
      meterRegistry.counter("research.relevance.errors").increment();
      return false;
    }
  }

  private static void pause(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
