package com.flamingo.ai.regdocs.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Terminal status of one research run. */
public enum PipelineStatus {
  COMPLETED,
  ERROR;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
