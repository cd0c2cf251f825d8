package com.flamingo.ai.regdocs.domain.enums;

import java.util.Locale;

/** Relevance grade assigned to a document sample by the assessment agent. */
public enum Relevance {
  HIGH,
  MEDIUM,
  LOW;

  /** Parses the agent's label; anything unrecognised counts as {@link #LOW}. */
  public static Relevance fromLabel(String label) {
    if (label == null || label.isBlank()) {
      return LOW;
    }
    return switch (label.trim().toLowerCase(Locale.ROOT)) {
      case "high" -> HIGH;
      case "medium" -> MEDIUM;
      default -> LOW;
    };
  }
}
