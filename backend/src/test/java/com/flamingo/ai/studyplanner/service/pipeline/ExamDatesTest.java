package com.flamingo.ai.studyplanner.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ExamDates Tests")
class ExamDatesTest {

  @Test
  @DisplayName("parses ISO dates")
  void shouldParseDate_whenIso() {
    assertThat(ExamDates.parse("2026-11-04")).isEqualTo(LocalDate.of(2026, 11, 4));
    assertThat(ExamDates.parse(" 2026-11-04 ")).isEqualTo(LocalDate.of(2026, 11, 4));
  }

  @Test
  @DisplayName("ignores the time part of an ISO date-time")
  void shouldParseDate_whenIsoDateTime() {
    assertThat(ExamDates.parse("2026-11-04T09:00:00")).isEqualTo(LocalDate.of(2026, 11, 4));
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"unknown", "N/A", "none", "  ", "TBD", "next Tuesday", "2026-13-45"})
  @DisplayName("placeholders and garbage count as not detected")
  void shouldReturnNull_whenNotADate(String text) {
    assertThat(ExamDates.parse(text)).isNull();
  }
}
