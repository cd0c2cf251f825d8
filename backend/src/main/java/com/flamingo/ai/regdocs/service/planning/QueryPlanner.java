package com.flamingo.ai.regdocs.service.planning;

import com.flamingo.ai.regdocs.domain.model.SearchPlan;
import java.util.List;

/** Produces the search term to use on each regulatory source. */
public interface QueryPlanner {

  /**
   * Plans one search term per source. Never throws: when the AI service is unavailable or answers
   * nonsense the deterministic fallback plan is returned.
   *
   * @param substanceName normalised substance name
   * @param sourceNames configured source names
   * @return a plan with exactly one entry per source name
   */
  SearchPlan plan(String substanceName, List<String> sourceNames);
}
