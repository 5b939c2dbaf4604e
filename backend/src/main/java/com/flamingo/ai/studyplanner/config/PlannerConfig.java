package com.flamingo.ai.studyplanner.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the study plan pipeline. */
@Configuration
@ConfigurationProperties(prefix = "planner")
@Validated
@Getter
@Setter
public class PlannerConfig {

  /** Zone used for "today" and event timestamps; blank means the system zone. */
  private String timeZone = "";

  /** Palette assigned to courses by position when the request carries no color. */
  private List<String> courseColors =
      new ArrayList<>(List.of("#4a5d45", "#8c7851", "#51688c", "#8c5151", "#518c86"));

  private RateLimit rateLimit = new RateLimit();
  private Extraction extraction = new Extraction();
  @Valid private Schedule schedule = new Schedule();
  private Pipeline pipeline = new Pipeline();
  private Storage storage = new Storage();

  public ZoneId zoneId() {
    return timeZone == null || timeZone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timeZone);
  }

  public String colorFor(int courseIndex) {
    if (courseColors.isEmpty()) {
      return "#4a5d45";
    }
    return courseColors.get(courseIndex % courseColors.size());
  }

  @Getter
  @Setter
  public static class RateLimit {
    /** Minimum gap between the starts of two external calls, process-wide. */
    private Duration minInterval = Duration.ofSeconds(4);
  }

  @Getter
  @Setter
  public static class Extraction {
    private int maxModules = 10;
    private int maxTopicsPerModule = 3;
    private int maxScopeTopics = 15;

    /** Syllabus and exam overview text is cut to this many characters before extraction. */
    private int maxInputChars = 30_000;

    /** Leading textbook pages scanned for the table of contents. */
    private int tocPages = 15;

    /** Pages sampled from the start of each located section. */
    private int sampledPagesPerSection = 3;

    private int maxMapperChars = 15_000;

    /** Estimate used for topics the mapper could not size. */
    private double defaultHours = 2.0;

    /** Upper bound on a mapped estimate; larger answers are cut down to it. */
    private double maxTopicHours = 8.0;

    private String defaultResource = "Textbook";
  }

  @Getter
  @Setter
  public static class Schedule {
    /** Consecutive study days after which a rest day is inserted when the budget allows. */
    @Min(4)
    @Max(6)
    private int restAfterStudyDays = 5;
  }

  @Getter
  @Setter
  public static class Pipeline {
    /** A run with no progress event for this long is aborted. */
    private Duration stallTimeout = Duration.ofMinutes(10);

    /** How long a finished run is kept when nobody fetches its result. */
    private Duration resultTtl = Duration.ofMinutes(30);

    private long sweepIntervalMs = 30_000;

    private Duration keepaliveInterval = Duration.ofSeconds(15);
  }

  @Getter
  @Setter
  public static class Storage {
    /** Root directory for uploaded course documents. */
    private String basePath = "data/sessions";
  }
}
