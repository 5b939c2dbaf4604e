package com.flamingo.ai.studyplanner.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.studyplanner.domain.model.ProgressEvent;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one progress event, on the stream and in the log. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressEventResponse {

  private static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("hh:mm:ss a", Locale.US);

  /** Present, and true, only on the terminal event. */
  @JsonProperty("_done")
  private Boolean done;

  private String agent;
  private String message;

  /** loading, success or error. */
  private String status;

  /** Wall-clock time in the planner's zone, e.g. "02:15:07 PM". */
  private String timestamp;

  private String error;

  /** Creates a ProgressEventResponse from a progress event. */
  public static ProgressEventResponse fromEvent(ProgressEvent event, ZoneId zone) {
    return ProgressEventResponse.builder()
        .done(event.done() ? Boolean.TRUE : null)
        .agent(event.agent())
        .message(event.message())
        .status(event.status().label())
        .timestamp(TIME_FORMAT.format(event.timestamp().atZone(zone)))
        .error(event.error())
        .build();
  }
}
