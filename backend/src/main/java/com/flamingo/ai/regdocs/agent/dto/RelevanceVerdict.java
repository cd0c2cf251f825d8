package com.flamingo.ai.regdocs.agent.dto;

import com.flamingo.ai.regdocs.domain.enums.Relevance;

/**
 * Structured output from RelevanceAssessmentAgent. Fields may be missing when the model strays
 * from the requested format; missing values never count towards acceptance.
 */
public record RelevanceVerdict(
    String relevance, // "high" | "medium" | "low"
    Double confidence, // 0.0-1.0
    String reasoning) {

  public Relevance grade() {
    return Relevance.fromLabel(relevance);
  }

  public double confidenceOrZero() {
    return confidence == null ? 0.0 : confidence;
  }

  /** Accepted iff graded high or medium and confidence strictly above {@code threshold}. */
  public boolean isAccepted(double threshold) {
    Relevance grade = grade();
    return (grade == Relevance.HIGH || grade == Relevance.MEDIUM)
        && confidenceOrZero() > threshold;
  }
}
