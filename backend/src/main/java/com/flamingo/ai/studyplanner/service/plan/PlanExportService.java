package com.flamingo.ai.studyplanner.service.plan;

import com.flamingo.ai.studyplanner.domain.enums.TaskKind;
import com.flamingo.ai.studyplanner.domain.model.StudyTask;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Service;

/** Renders a plan as CSV (RFC 4180) or as a Markdown table, and reads the CSV back. */
@Service
public class PlanExportService {

  static final List<String> CSV_HEADER =
      List.of("Date", "Course", "Topic", "Task Type", "Duration (H)", "Resources", "Notes");

  private static final String CRLF = "\r\n";

  /** Row fields are quoted; embedded quotes are doubled; lines end with CRLF. */
  public String toCsv(List<StudyTask> tasks) {
    StringBuilder csv = new StringBuilder();
    csv.append(String.join(",", CSV_HEADER)).append(CRLF);
    for (StudyTask task : tasks) {
      csv.append(
              Stream.of(
                      task.date().toString(),
                      task.courseCode(),
                      task.topic(),
                      task.kind().label(),
                      formatHours(task.durationHours()),
                      task.resource(),
                      task.notes().render())
                  .map(PlanExportService::quote)
                  .collect(Collectors.joining(",")))
          .append(CRLF);
    }
    return csv.toString();
  }

  /**
   * Parses CSV produced by {@link #toCsv}. Quoted fields may contain commas, doubled quotes and
   * line breaks. The header row is skipped.
   *
   * @throws IllegalArgumentException if a row is malformed
   */
  public List<CsvPlanRow> parseCsv(String csv) {
    List<List<String>> records = readRecords(csv);
    List<CsvPlanRow> rows = new ArrayList<>();
    for (int i = 1; i < records.size(); i++) {
      List<String> fields = records.get(i);
      if (fields.size() != CSV_HEADER.size()) {
        throw new IllegalArgumentException(
            "Row " + i + " has " + fields.size() + " fields, expected " + CSV_HEADER.size());
      }
      rows.add(
          new CsvPlanRow(
              LocalDate.parse(fields.get(0)),
              fields.get(1),
              fields.get(2),
              TaskKind.fromLabel(fields.get(3)),
              Double.parseDouble(fields.get(4)),
              fields.get(5),
              fields.get(6)));
    }
    return rows;
  }

  /** Pipe table of the plan; pipes inside cells are escaped and line breaks flattened. */
  public String toMarkdown(List<StudyTask> tasks) {
    StringBuilder md = new StringBuilder();
    md.append("| Date | Course | Topic | Task Type | Hours | Resources |\n");
    md.append("| --- | --- | --- | --- | --- | --- |\n");
    for (StudyTask task : tasks) {
      md.append("| ")
          .append(cell(task.date().toString()))
          .append(" | ")
          .append(cell(task.courseCode()))
          .append(" | ")
          .append(cell(task.topic()))
          .append(" | ")
          .append(cell(task.kind().label()))
          .append(" | ")
          .append(formatHours(task.durationHours()))
          .append(" | ")
          .append(cell(task.resource()))
          .append(" |\n");
    }
    return md.toString();
  }

  private static String quote(String value) {
    String text = value == null ? "" : value;
    return "\"" + text.replace("\"", "\"\"") + "\"";
  }

  private static String cell(String value) {
    if (value == null) {
      return "";
    }
    return value.replace("|", "\\|").replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
  }

  /** 2.0 becomes "2", 1.25 stays "1.25". */
  private static String formatHours(double hours) {
    return BigDecimal.valueOf(hours).stripTrailingZeros().toPlainString();
  }

  private static List<List<String>> readRecords(String csv) {
    List<List<String>> records = new ArrayList<>();
    List<String> fields = new ArrayList<>();
    StringBuilder field = new StringBuilder();
    boolean quoted = false;
    boolean fieldStarted = false;
    int i = 0;
    while (i < csv.length()) {
      char c = csv.charAt(i);
      if (quoted) {
        if (c == '"') {
          if (i + 1 < csv.length() && csv.charAt(i + 1) == '"') {
            field.append('"');
            i++;
          } else {
            quoted = false;
          }
        } else {
          field.append(c);
        }
      } else if (c == '"') {
        quoted = true;
        fieldStarted = true;
      } else if (c == ',') {
        fields.add(field.toString());
        field.setLength(0);
        fieldStarted = true;
      } else if (c == '\r' || c == '\n') {
        if (c == '\r' && i + 1 < csv.length() && csv.charAt(i + 1) == '\n') {
          i++;
        }
        if (fieldStarted || field.length() > 0 || !fields.isEmpty()) {
          fields.add(field.toString());
          records.add(fields);
        }
        fields = new ArrayList<>();
        field.setLength(0);
        fieldStarted = false;
      } else {
        field.append(c);
        fieldStarted = true;
      }
      i++;
    }
    if (quoted) {
      throw new IllegalArgumentException("Unterminated quoted field");
    }
    if (fieldStarted || field.length() > 0 || !fields.isEmpty()) {
      fields.add(field.toString());
      records.add(fields);
    }
    return records;
  }
}
