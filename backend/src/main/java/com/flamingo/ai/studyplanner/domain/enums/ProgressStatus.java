package com.flamingo.ai.studyplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Status carried by a progress event. */
public enum ProgressStatus {
  LOADING,
  SUCCESS,
  ERROR;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
