package com.flamingo.ai.regdocs.service.planning;

import java.util.Locale;
import java.util.Map;

/** Web domain of each known source, used by fallback {@code site:} queries. */
final class SourceDomains {

  private static final Map<String, String> DOMAINS =
      Map.of(
          "EPAR", "ema.europa.eu",
          "EMA-PSBG", "ema.europa.eu",
          "FDA-Approvals", "accessdata.fda.gov",
          "FDA-PSBG", "accessdata.fda.gov");

  private SourceDomains() {}

  static String domainFor(String sourceName) {
    String domain = DOMAINS.get(sourceName);
    if (domain != null) {
      return domain;
    }
    return sourceName.toLowerCase(Locale.ROOT).replace(" ", "").replace("-", "");
  }
}
