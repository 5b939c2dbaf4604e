package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.domain.enums.TaskKind;
import com.flamingo.ai.studyplanner.domain.model.TaskNotes;
import org.springframework.stereotype.Component;

/** Writes the structured study notes of a task from its topic, resource and kind. */
@Component
public class TaskNoteGenerator {

  public TaskNotes notesFor(String topic, String resource, TaskKind kind) {
    return switch (kind) {
      case LEARN ->
          new TaskNotes(
              "Read " + resource + " on " + topic + " and outline the core ideas",
              "Work through the worked examples for " + topic,
              "Key definitions and formulas of " + topic,
              "Explain " + topic + " in your own words without notes");
      case PRACTICE ->
          new TaskNotes(
              "Apply " + topic + " to problems",
              "Solve end-of-section exercises from " + resource,
              "Common mistakes you made while solving",
              "Do two problems on " + topic + " under time pressure");
      case REVIEW ->
          new TaskNotes(
              "Consolidate " + topic,
              "Redo the problems you got wrong on " + topic,
              "Summary sheet of " + topic,
              "Answer past exam questions on " + topic + " from memory");
    };
  }
}
