package com.flamingo.ai.regdocs.service.source;

import java.util.List;
import java.util.Locale;

/** Cheap text heuristics deciding which anchors are worth following or keeping. */
final class LinkRelevance {

  static final List<String> PHARMA_KEYWORDS =
      List.of(
          "approval",
          "assessment",
          "authorization",
          "summary",
          "product",
          "clinical",
          "safety",
          "efficacy",
          "medicine",
          "drug",
          "therapeutic",
          "indication",
          "dosage",
          "prescribing",
          "regulatory",
          "guidance");

  private LinkRelevance() {}

  /** True if the text names the substance or carries a pharmaceutical keyword. */
  static boolean isPotentiallyRelevant(String text, String substanceName) {
    String lower = text.toLowerCase(Locale.ROOT);
    if (lower.contains(substanceName.toLowerCase(Locale.ROOT))) {
      return true;
    }
    return PHARMA_KEYWORDS.stream().anyMatch(lower::contains);
  }

  /** True if the text contains the substance name or any of the given keywords. */
  static boolean mentionsAny(String text, String substanceName, List<String> keywords) {
    String lower = text.toLowerCase(Locale.ROOT);
    return lower.contains(substanceName.toLowerCase(Locale.ROOT))
        || keywords.stream().anyMatch(lower::contains);
  }

  /** An href points at a PDF if it ends in .pdf or carries a filetype=pdf marker. */
  static boolean isPdfLink(String href) {
    String lower = href.toLowerCase(Locale.ROOT);
    return lower.endsWith(".pdf") || lower.contains("filetype=pdf");
  }
}
