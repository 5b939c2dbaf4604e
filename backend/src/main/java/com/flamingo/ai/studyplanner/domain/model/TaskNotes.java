package com.flamingo.ai.studyplanner.domain.model;

/** Structured study notes attached to every task. */
public record TaskNotes(String focus, String practice, String memorize, String selfTest) {

  public String render() {
    return "Focus: "
        + focus
        + " | Practice: "
        + practice
        + " | Memorize: "
        + memorize
        + " | Self-Test: "
        + selfTest;
  }
}
