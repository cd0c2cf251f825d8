package com.flamingo.ai.regdocs.service.relevance;

import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import java.util.List;

/** Keeps the PDF candidates an AI assessment judges relevant to the substance. */
public interface RelevanceFilter {

  /**
   * Assesses every candidate and returns the accepted ones.
   *
   * @param candidates deduplicated candidates
   * @param substanceName normalised substance name
   * @return accepted candidates; order is not significant
   */
  List<PdfCandidate> filter(List<PdfCandidate> candidates, String substanceName);
}
