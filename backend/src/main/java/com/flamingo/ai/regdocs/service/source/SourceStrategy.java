package com.flamingo.ai.regdocs.service.source;

import com.flamingo.ai.regdocs.domain.model.PdfCandidate;
import com.flamingo.ai.regdocs.domain.model.SourceConfig;
import java.util.List;

/**
 * Navigation logic for one regulatory source. Each site lays out its listings differently, so each
 * gets its own implementation; {@link GenericSourceStrategy} handles sources without one.
 */
public interface SourceStrategy {

  /** Source name as it appears in the registry, e.g. {@code EPAR}. */
  String sourceName();

  /**
   * Collects PDF candidates from the source.
   *
   * @param source registry entry with the landing page URL
   * @param searchTerm term proposed by the query planner
   * @param substanceName normalised substance name used for anchor matching
   * @return candidates, at most the per-source cap; source attribution is applied by the caller
   */
  List<PdfCandidate> search(SourceConfig source, String searchTerm, String substanceName);
}
