package com.flamingo.ai.regdocs.service.extraction;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.http.FetchResponse;
import com.flamingo.ai.regdocs.http.WebFetcher;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Downloads a PDF and decodes its leading pages with a chain of {@link TextExtractor} tiers.
 *
 * <p>Tiers run in order and the first one whose stripped text is longer than {@code min-chars}
 * wins. The last tier's output is returned whatever its length. A failing tier just hands over to
 * the next one; if all fail the sample is empty.
 */
@Service
@Slf4j
public class TextExtractionEngine {

  private final WebFetcher webFetcher;
  private final List<TextExtractor> extractors;
  private final RegDocsConfig config;
  private final MeterRegistry meterRegistry;

  public TextExtractionEngine(
      WebFetcher webFetcher,
      List<TextExtractor> extractors,
      RegDocsConfig config,
      MeterRegistry meterRegistry) {
    this.webFetcher = webFetcher;
    this.extractors = List.copyOf(extractors);
    this.config = config;
    this.meterRegistry = meterRegistry;
    log.info(
        "Text extraction chain: {}", extractors.stream().map(TextExtractor::name).toList());
  }

  /**
   * Fetches a PDF and extracts text from its first pages.
   *
   * @param pdfUrl absolute PDF URL
   * @param maxPages number of leading pages to decode
   * @return extracted text; empty if the URL is not a reachable PDF or nothing decodes
   */
  public String extractSample(String pdfUrl, int maxPages) {
    throttle();

    Path tempFile = null;
    try {
      FetchResponse response = webFetcher.get(pdfUrl, config.getHttp().getPdfTimeout());
      if (!response.isOk()) {
        log.warn("Failed to download PDF: {} (status: {})", pdfUrl, response.statusCode());
        return "";
      }
      if (!response.isPdf()) {
        log.warn("URL doesn't appear to be a PDF: {} ({})", pdfUrl, response.contentType());
        return "";
      }

      tempFile = Files.createTempFile("regdocs-sample-", ".pdf");
      Files.write(tempFile, response.body());
      return extract(tempFile, maxPages).text();
    } catch (Exception e) {
      log.warn("Error extracting text from PDF {}: {}", pdfUrl, e.getMessage());
      return "";
    } finally {
      deleteQuietly(tempFile);
    }
  }

  /**
   * Runs the tier chain over a local file.
   *
   * @param pdfFile local PDF
   * @param maxPages number of leading pages to decode
   * @return text and the name of the tier that produced it
   */
  public ExtractedSample extract(Path pdfFile, int maxPages) {
    int minChars = config.getExtraction().getMinChars();
    for (int i = 0; i < extractors.size(); i++) {
      TextExtractor extractor = extractors.get(i);
      boolean lastTier = i == extractors.size() - 1;
      try {
        String text = extractor.extract(pdfFile, maxPages);
        if (text == null) {
          text = "";
        }
        if (lastTier || text.strip().length() > minChars) {
          meterRegistry
              .counter("research.extraction.tier", "extractor", extractor.name())
              .increment();
          log.debug("Extracted {} characters with {}", text.length(), extractor.name());
          return new ExtractedSample(text, extractor.name());
        }
        log.debug(
            "{} produced only {} characters, trying next tier",
            extractor.name(),
            text.strip().length());
      } catch (Exception | LinkageError e) {
        log.debug("{} extraction failed: {}", extractor.name(), e.toString());
      }
    }
    log.warn("All text extraction tiers failed for {}", pdfFile.getFileName());
    return ExtractedSample.EMPTY;
  }

  private void throttle() {
    long delay = config.getExtraction().getThrottleMs();
    if (delay <= 0) {
      return;
    }
    try {
      Thread.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Could not delete temporary file {}: {}", file, e.getMessage());
    }
  }
}
