package com.flamingo.ai.regdocs.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Search term per source name, in source order.
 *
 * @param queries source name to search term
 * @param aiGenerated false when the deterministic fallback plan was used
 */
public record SearchPlan(Map<String, String> queries, boolean aiGenerated) {

  public SearchPlan {
    queries = Collections.unmodifiableMap(new LinkedHashMap<>(queries));
  }

  public String termFor(String sourceName) {
    return queries.get(sourceName);
  }

  public int size() {
    return queries.size();
  }
}
