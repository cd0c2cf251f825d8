package com.flamingo.ai.regdocs.service.download;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.domain.model.DownloadedFile;
import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.http.FetchResponse;
import com.flamingo.ai.regdocs.http.WebFetcher;
import com.flamingo.ai.regdocs.service.storage.DocumentStorageService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Downloads accepted candidates into a substance directory, a few at a time.
 *
 * <p>Every file is written to a temporary sibling first and moved into place, so a failed download
 * never leaves a truncated PDF under its final name. A failure affects only its own candidate.
 */
@Service
@Slf4j
public class DownloadManager {

  private final WebFetcher webFetcher;
  private final DocumentStorageService storageService;
  private final RegDocsConfig config;
  private final Executor executor;
  private final MeterRegistry meterRegistry;

  public DownloadManager(
      WebFetcher webFetcher,
      DocumentStorageService storageService,
      RegDocsConfig config,
      @Qualifier("researchExecutor") Executor executor,
      MeterRegistry meterRegistry) {
    this.webFetcher = webFetcher;
    this.storageService = storageService;
    this.config = config;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Downloads the candidates into {@code targetDir}.
   *
   * @param candidates accepted candidates
   * @param targetDir existing substance directory
   * @return one entry per file actually written
   */
  @Timed(value = "research.download", description = "Time to download accepted documents")
  public List<DownloadedFile> downloadAll(List<PdfCandidate> candidates, Path targetDir) {
    int batchSize = Math.max(1, config.getDownload().getBatchSize());

    // names are fixed up front so concurrent downloads never target the same file
    Set<String> taken = new HashSet<>();
    List<String> filenames = new ArrayList<>();
    for (PdfCandidate candidate : candidates) {
      String filename =
          PdfFilenames.unique(PdfFilenames.derive(candidate.url(), candidate.title()), taken);
      taken.add(filename);
      filenames.add(filename);
    }

    List<DownloadedFile> downloaded = new ArrayList<>();
    for (int i = 0; i < candidates.size(); i += batchSize) {
      int end = Math.min(i + batchSize, candidates.size());
      List<CompletableFuture<Optional<DownloadedFile>>> batch = new ArrayList<>();
      for (int j = i; j < end; j++) {
        batch.add(submit(candidates.get(j), targetDir, filenames.get(j)));
      }
      batch.forEach(future -> future.join().ifPresent(downloaded::add));
    }

    log.info("Downloaded {} of {} PDFs to {}", downloaded.size(), candidates.size(), targetDir);
    return downloaded;
  }

  private CompletableFuture<Optional<DownloadedFile>> submit(
      PdfCandidate candidate, Path targetDir, String filename) {
    try {
      return CompletableFuture.supplyAsync(
          () -> downloadSingle(candidate, targetDir, filename), executor);
    } catch (RejectedExecutionException e) {
      log.warn("Download of {} rejected by executor: {}", candidate.url(), e.getMessage());
      meterRegistry.counter("research.download.failure").increment();
      return CompletableFuture.completedFuture(Optional.empty());
    }
  }

  Optional<DownloadedFile> downloadSingle(PdfCandidate candidate, Path targetDir, String filename) {
    Path target = targetDir.resolve(filename);
    Path partial = null;
    try {
      FetchResponse response =
          webFetcher.getOk(candidate.url(), config.getHttp().getPdfTimeout());

      partial = Files.createTempFile(targetDir, ".download-", ".part");
      Files.write(partial, response.body());
      moveIntoPlace(partial, target);
      partial = null;

      long size = Files.size(target);
      log.info("Downloaded PDF: {} -> {}", candidate.url(), target);
      meterRegistry.counter("research.download.success").increment();
      return Optional.of(
          new DownloadedFile(
              candidate.source(),
              candidate.title(),
              filename,
              storageService.publicUrl(targetDir, filename),
              candidate.url(),
              size));
    } catch (Exception e) {
      log.warn("Error downloading PDF {}: {}", candidate.url(), e.getMessage());
      meterRegistry.counter("research.download.failure").increment();
      return Optional.empty();
    } finally {
      if (partial != null) {
        try {
          Files.deleteIfExists(partial);
        } catch (IOException e) {
          log.warn("Could not remove partial download {}: {}", partial, e.getMessage());
        }
      }
    }
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
