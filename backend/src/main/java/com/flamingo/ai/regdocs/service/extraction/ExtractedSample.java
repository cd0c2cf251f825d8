package com.flamingo.ai.regdocs.service.extraction;

/**
 * Text produced by the extraction chain.
 *
 * @param text extracted text, empty when every tier failed
 * @param extractor name of the tier that produced the text, null when none did
 */
public record ExtractedSample(String text, String extractor) {

  static final ExtractedSample EMPTY = new ExtractedSample("", null);

  public boolean isEmpty() {
    return text.isBlank();
  }
}
