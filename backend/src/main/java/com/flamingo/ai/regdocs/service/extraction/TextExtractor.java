package com.flamingo.ai.regdocs.service.extraction;

import java.nio.file.Path;

/**
 * One PDF decoding tier. Implementations are tried in {@code @Order} order by {@link
 * TextExtractionEngine} until one yields enough text.
 */
public interface TextExtractor {

  /** Short name recorded with the sample and in metrics. */
  String name();

  /**
   * Extracts text from the first pages of a PDF.
   *
   * @param pdfFile local PDF file
   * @param maxPages number of leading pages to read
   * @return extracted text, possibly empty
   * @throws com.flamingo.ai.regdocs.exception.TextExtractionException if the PDF cannot be decoded
   */
  String extract(Path pdfFile, int maxPages);
}
