package com.flamingo.ai.regdocs.exception;

/** Exception thrown when no stored files exist for a substance slug. */
public class SubstanceFilesNotFoundException extends RuntimeException {

  private final String slug;

  public SubstanceFilesNotFoundException(String slug) {
    super("No files found for substance: " + slug);
    this.slug = slug;
  }

  public String getSlug() {
    return slug;
  }
}
