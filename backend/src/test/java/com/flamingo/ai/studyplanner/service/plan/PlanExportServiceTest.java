package com.flamingo.ai.studyplanner.service.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.studyplanner.domain.enums.TaskKind;
import com.flamingo.ai.studyplanner.domain.model.StudyTask;
import com.flamingo.ai.studyplanner.domain.model.TaskNotes;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PlanExportService Tests")
class PlanExportServiceTest {

  private final PlanExportService exportService = new PlanExportService();

  @Test
  void shouldWriteHeaderAndQuotedRows_whenExportingCsv() {
    // Given
    StudyTask task = task("Graphs", "Ch 5", 2.0, TaskKind.LEARN);

    // When
    String csv = exportService.toCsv(List.of(task));

    // Then
    String[] lines = csv.split("\r\n");
    assertThat(csv).endsWith("\r\n");
    assertThat(lines[0]).isEqualTo("Date,Course,Topic,Task Type,Duration (H),Resources,Notes");
    assertThat(lines[1])
        .startsWith("\"2026-10-20\",\"CS101\",\"Graphs\",\"learn\",\"2\",\"Ch 5\",\"Focus: ");
  }

  @Test
  @DisplayName("fields with commas, quotes and line breaks survive a round trip")
  void shouldReadBackSameFields_whenFieldsNeedEscaping() {
    // Given
    StudyTask tricky =
        task("Trees, \"balanced\"\nand heaps", "Ch 4, \"AVL\" (pp. 80-95)", 1.25, TaskKind.REVIEW);
    StudyTask plain = task("Sorting", "Handout", 0.5, TaskKind.PRACTICE);

    // When
    List<CsvPlanRow> rows = exportService.parseCsv(exportService.toCsv(List.of(tricky, plain)));

    // Then
    assertThat(rows).hasSize(2);
    CsvPlanRow first = rows.get(0);
    assertThat(first.date()).isEqualTo(LocalDate.of(2026, 10, 20));
    assertThat(first.course()).isEqualTo("CS101");
    assertThat(first.topic()).isEqualTo("Trees, \"balanced\"\nand heaps");
    assertThat(first.taskType()).isEqualTo(TaskKind.REVIEW);
    assertThat(first.durationHours()).isEqualTo(1.25);
    assertThat(first.resources()).isEqualTo("Ch 4, \"AVL\" (pp. 80-95)");
    assertThat(first.notes()).isEqualTo(tricky.notes().render());
    assertThat(rows.get(1).topic()).isEqualTo("Sorting");
  }

  @Test
  void shouldWriteOnlyHeader_whenPlanIsEmpty() {
    // When
    String csv = exportService.toCsv(List.of());

    // Then
    assertThat(csv).isEqualTo("Date,Course,Topic,Task Type,Duration (H),Resources,Notes\r\n");
    assertThat(exportService.parseCsv(csv)).isEmpty();
  }

  @Test
  void shouldRejectCsv_whenRowIsMalformed() {
    String header = String.join(",", PlanExportService.CSV_HEADER) + "\r\n";

    assertThatThrownBy(() -> exportService.parseCsv(header + "\"2026-10-20\",\"CS101\"\r\n"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("expected 7");
    assertThatThrownBy(() -> exportService.parseCsv(header + "\"2026-10-20,CS101\r\n"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unterminated");
  }

  @Test
  void shouldEscapePipes_whenExportingMarkdown() {
    // Given
    StudyTask task = task("A | B\nC", "Ch 1|2", 1.5, TaskKind.LEARN);

    // When
    String markdown = exportService.toMarkdown(List.of(task));

    // Then
    String[] lines = markdown.split("\n");
    assertThat(lines).hasSize(3);
    assertThat(lines[0]).isEqualTo("| Date | Course | Topic | Task Type | Hours | Resources |");
    assertThat(lines[2]).isEqualTo("| 2026-10-20 | CS101 | A \\| B C | learn | 1.5 | Ch 1\\|2 |");
  }

  private static StudyTask task(String topic, String resource, double hours, TaskKind kind) {
    return new StudyTask(
        LocalDate.of(2026, 10, 20),
        "c1",
        "CS101",
        "#4a5d45",
        topic,
        kind,
        hours,
        resource,
        new TaskNotes("Read " + resource, "Solve, then check", "Key \"terms\"", "Quiz"),
        false,
        false);
  }
}
