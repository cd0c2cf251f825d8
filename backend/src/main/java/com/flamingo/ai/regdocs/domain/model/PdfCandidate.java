package com.flamingo.ai.regdocs.domain.model;

/**
 * A discovered PDF link not yet judged for relevance. The absolute {@code url} identifies the
 * candidate within a run.
 *
 * @param url absolute document URL
 * @param title anchor text, or "Document" when the anchor had none
 * @param source name of the source the link was found through
 * @param foundOn page the anchor was found on
 */
public record PdfCandidate(String url, String title, String source, String foundOn) {

  public PdfCandidate withSource(String sourceName) {
    return new PdfCandidate(url, title, sourceName, foundOn);
  }
}
