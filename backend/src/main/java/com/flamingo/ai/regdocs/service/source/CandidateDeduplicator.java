package com.flamingo.ai.regdocs.service.source;

import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Removes candidates whose URL was already seen; the first occurrence, and its source, wins. */
public final class CandidateDeduplicator {

  private CandidateDeduplicator() {}

  public static List<PdfCandidate> deduplicate(List<PdfCandidate> candidates) {
    Set<String> seenUrls = new HashSet<>();
    List<PdfCandidate> unique = new ArrayList<>();
    for (PdfCandidate candidate : candidates) {
      if (seenUrls.add(candidate.url())) {
        unique.add(candidate);
      }
    }
    return unique;
  }
}
