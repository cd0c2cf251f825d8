package com.flamingo.ai.regdocs.service.source;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.domain.model.SearchPlan;
import com.flamingo.ai.regdocs.domain.model.SourceConfig;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the source strategy of every planned source and concatenates their candidates.
 *
 * <p>Sources run concurrently on the research executor and independently of each other: a failing
 * source is logged and contributes nothing. Results are merged in plan order once all sources
 * have finished.
 */
@Service
@Slf4j
public class SourceCrawler {

  private final SourceRegistry sourceRegistry;
  private final SourceStrategyRegistry strategyRegistry;
  private final RegDocsConfig config;
  private final Executor executor;
  private final MeterRegistry meterRegistry;

  public SourceCrawler(
      SourceRegistry sourceRegistry,
      SourceStrategyRegistry strategyRegistry,
      RegDocsConfig config,
      @Qualifier("researchExecutor") Executor executor,
      MeterRegistry meterRegistry) {
    this.sourceRegistry = sourceRegistry;
    this.strategyRegistry = strategyRegistry;
    this.config = config;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Discovers PDF candidates for every source in the plan.
   *
   * @param plan search term per source
   * @param substanceName normalised substance name
   * @return candidates from all sources, attributed, not yet deduplicated
   */
  @Timed(value = "research.discover", description = "Time to crawl all sources")
  public List<PdfCandidate> discover(SearchPlan plan, String substanceName) {
    List<CompletableFuture<List<PdfCandidate>>> perSource = new ArrayList<>();
    for (Map.Entry<String, String> entry : plan.queries().entrySet()) {
      String sourceName = entry.getKey();
      String term = entry.getValue();
      perSource.add(submit(sourceName, term, substanceName));
    }

    List<PdfCandidate> all = new ArrayList<>();
    for (CompletableFuture<List<PdfCandidate>> future : perSource) {
      all.addAll(future.join());
    }
    log.info("Found {} PDF candidates across {} sources", all.size(), perSource.size());
    return all;
  }

  private CompletableFuture<List<PdfCandidate>> submit(
      String sourceName, String term, String substanceName) {
    try {
      return CompletableFuture.supplyAsync(
          () -> searchSource(sourceName, term, substanceName), executor);
    } catch (RejectedExecutionException e) {
      log.warn("Search of {} rejected by executor: {}", sourceName, e.getMessage());
      meterRegistry.counter("research.sources.errors", "source", sourceName).increment();
      return CompletableFuture.completedFuture(List.of());
    }
  }

  List<PdfCandidate> searchSource(String sourceName, String term, String substanceName) {
    Optional<SourceConfig> source = sourceRegistry.find(sourceName);
    if (source.isEmpty()) {
      log.warn("No URL configured for source: {}", sourceName);
      return List.of();
    }
    log.info("Searching {} for '{}' using query: {}", sourceName, substanceName, term);
    try {
      List<PdfCandidate> found =
          strategyRegistry.resolve(sourceName).search(source.get(), term, substanceName);
      int cap = config.getCrawler().getPerSourceCap();
      List<PdfCandidate> attributed =
          found.stream().limit(cap).map(c -> c.withSource(sourceName)).toList();
      log.info("{} search complete: {} PDFs found", sourceName, attributed.size());
      return attributed;
    } catch (Exception e) {
      log.warn("Error searching {}: {}", sourceName, e.getMessage());
      meterRegistry.counter("research.sources.errors", "source", sourceName).increment();
      return List.of();
    }
  }
}
