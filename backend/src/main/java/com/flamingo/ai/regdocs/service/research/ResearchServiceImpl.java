package com.flamingo.ai.regdocs.service.research;

import com.flamingo.ai.regdocs.domain.enums.PipelineStatus;
import com.flamingo.ai.regdocs.domain.model.DownloadedFile;
import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.domain.model.PipelineDebugInfo;
import com.flamingo.ai.regdocs.domain.model.PipelineResult;
import com.flamingo.ai.regdocs.domain.model.SearchPlan;
import com.flamingo.ai.regdocs.domain.model.StoredFile;
import com.flamingo.ai.regdocs.domain.model.SubstanceQuery;
import com.flamingo.ai.regdocs.service.download.DownloadManager;
import com.flamingo.ai.regdocs.service.planning.QueryPlanner;
import com.flamingo.ai.regdocs.service.relevance.RelevanceFilter;
import com.flamingo.ai.regdocs.service.source.CandidateDeduplicator;
import com.flamingo.ai.regdocs.service.source.SourceCrawler;
import com.flamingo.ai.regdocs.service.source.SourceRegistry;
import com.flamingo.ai.regdocs.service.storage.DocumentStorageService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sequences the pipeline: normalise, plan, discover, filter, download, assemble.
 *
 * <p>Finding nothing is a normal outcome and ends the run early with status {@code completed}.
 * Only an exception reaching this class turns into a result with status {@code error}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchServiceImpl implements ResearchService {

  static final String NO_DOCUMENTS_MESSAGE = "No PDF documents found";
  static final String NO_RELEVANT_MESSAGE = "No relevant PDF documents found after filtering";

  private final SourceRegistry sourceRegistry;
  private final QueryPlanner queryPlanner;
  private final SourceCrawler sourceCrawler;
  private final RelevanceFilter relevanceFilter;
  private final DownloadManager downloadManager;
  private final DocumentStorageService storageService;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "research.run", description = "Time to run the whole research pipeline")
  public PipelineResult research(String substanceName) {
    PipelineResult result;
    try {
      result = runPipeline(substanceName);
    } catch (Exception e) {
      log.error("Error in research for '{}': {}", substanceName, e.getMessage(), e);
      result = errorResult(substanceName, e);
    }
    meterRegistry
        .counter("research.runs", "status", result.status().name().toLowerCase(Locale.ROOT))
        .increment();
    return result;
  }

  private PipelineResult runPipeline(String substanceName) {
    SubstanceQuery query = SubstanceQuery.of(substanceName);
    String name = query.normalizedName();
    log.info("Starting research for {} (slug: {})", name, query.slug());

    List<String> sourceNames = sourceRegistry.sourceNames();
    if (sourceNames.isEmpty()) {
      log.warn("Source registry is empty, nothing to search for {}", name);
      return noDocuments(query, sourceNames, new SearchPlan(Map.of(), false));
    }
    log.info("Loaded {} research sources: {}", sourceNames.size(), String.join(", ", sourceNames));

    SearchPlan plan = queryPlanner.plan(name, sourceNames);
    plan.queries().forEach((source, term) -> log.info("  - {}: {}", source, term));

    List<PdfCandidate> candidates =
        CandidateDeduplicator.deduplicate(sourceCrawler.discover(plan, name));
    if (candidates.isEmpty()) {
      log.warn("No PDF documents found in any source for {}", name);
      return noDocuments(query, sourceNames, plan);
    }
    log.info("Found {} unique PDF candidates for {}", candidates.size(), name);

    List<PdfCandidate> relevant = relevanceFilter.filter(candidates, name);
    if (relevant.isEmpty()) {
      log.warn("No relevant PDF documents found after filtering for {}", name);
      return PipelineResult.builder()
          .status(PipelineStatus.COMPLETED)
          .substance(name)
          .slug(query.slug())
          .message(NO_RELEVANT_MESSAGE)
          .totalFound(candidates.size())
          .totalRelevant(0)
          .totalDownloaded(0)
          .debugInfo(
              debugInfo(sourceNames, plan)
                  .candidatesFound(candidates.size())
                  .relevantFound(0)
                  .build())
          .build();
    }

    Path targetDir = storageService.prepareDirectory(query.slug());
    log.info("Downloading {} PDFs to {}", relevant.size(), targetDir);
    List<DownloadedFile> downloaded = downloadManager.downloadAll(relevant, targetDir);

    log.info("Research completed for {}: {} files downloaded", name, downloaded.size());
    return PipelineResult.builder()
        .status(PipelineStatus.COMPLETED)
        .substance(name)
        .slug(query.slug())
        .totalFound(candidates.size())
        .totalRelevant(relevant.size())
        .totalDownloaded(downloaded.size())
        .hits(downloaded)
        .downloadAllUrl(storageService.downloadAllUrl(query.slug()))
        .debugInfo(
            debugInfo(sourceNames, plan)
                .candidatesFound(candidates.size())
                .relevantFound(relevant.size())
                .filesDownloaded(downloaded.size())
                .build())
        .build();
  }

  @Override
  public List<StoredFile> listFiles(String slug) {
    return storageService.listFiles(slug);
  }

  @Override
  public void writeArchive(String slug, OutputStream out) throws IOException {
    storageService.writeArchive(slug, out);
  }

  private PipelineResult noDocuments(
      SubstanceQuery query, List<String> sourceNames, SearchPlan plan) {
    return PipelineResult.builder()
        .status(PipelineStatus.COMPLETED)
        .substance(query.normalizedName())
        .slug(query.slug())
        .message(NO_DOCUMENTS_MESSAGE)
        .totalFound(0)
        .totalRelevant(0)
        .totalDownloaded(0)
        .debugInfo(debugInfo(sourceNames, plan).candidatesFound(0).build())
        .build();
  }

  private static PipelineDebugInfo.PipelineDebugInfoBuilder debugInfo(
      List<String> sourceNames, SearchPlan plan) {
    return PipelineDebugInfo.builder()
        .sourcesSearched(List.copyOf(sourceNames))
        .searchQueries(plan.queries())
        .aiPlanned(plan.aiGenerated());
  }

  private static PipelineResult errorResult(String substanceName, Exception e) {
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return PipelineResult.builder()
        .status(PipelineStatus.ERROR)
        .substance(substanceName)
        .message("Search failed: " + message)
        .debugInfo(
            PipelineDebugInfo.builder()
                .errorType(e.getClass().getSimpleName())
                .error(message)
                .build())
        .build();
  }
}
