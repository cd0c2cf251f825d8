package com.flamingo.ai.regdocs.exception;

/** Exception thrown when one text extraction tier cannot decode a PDF. */
public class TextExtractionException extends RuntimeException {

  private final String extractor;

  public TextExtractionException(String extractor, String message, Throwable cause) {
    super(extractor + ": " + message, cause);
    this.extractor = extractor;
  }

  public String getExtractor() {
    return extractor;
  }
}
