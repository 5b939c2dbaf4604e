package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.flamingo.ai.studyplanner.domain.enums.ProgressStatus;
import com.flamingo.ai.studyplanner.exception.ExtractionTransportException;
import com.flamingo.ai.studyplanner.exception.PipelineCancelledException;
import com.flamingo.ai.studyplanner.exception.StageException;
import com.flamingo.ai.studyplanner.service.pipeline.ProgressListener;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Template for the extraction stages: progress events, skip handling and failure wrapping live
 * here, subclasses only supply the extraction itself.
 */
@Slf4j
public abstract class AbstractExtractionStage<I extends StageInput, O>
    implements ExtractionStage<I, O> {

  static final String TRUNCATION_MARKER = "\n[...truncated...]";

  private final MeterRegistry meterRegistry;

  protected AbstractExtractionStage(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public O run(I input, ProgressListener progress) {
    String code = input.course().code();
    progress.onProgress(agentName(), startMessage(input), ProgressStatus.LOADING);

    Optional<String> skipReason = skipReason(input);
    if (skipReason.isPresent()) {
      log.debug("{} skipped for {}: {}", agentName(), code, skipReason.get());
      progress.onProgress(agentName(), skipReason.get(), ProgressStatus.SUCCESS);
      return fallback(input);
    }

    try {
      O output = extract(input);
      if (output == null) {
        throw new IllegalStateException("empty response");
      }
      progress.onProgress(agentName(), successMessage(input, output), ProgressStatus.SUCCESS);
      return output;
    } catch (PipelineCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      String reason = describe(e);
      log.error("{} failed for {}: {}", agentName(), code, reason, e);
      meterRegistry.counter("pipeline.stage.failures", "stage", agentName()).increment();
      progress.onProgress(
          agentName(), agentName() + " failed for " + code + ": " + reason, ProgressStatus.ERROR);
      throw new StageException(agentName(), reason, e);
    }
  }

  /** Message of the loading event. */
  protected abstract String startMessage(I input);

  /** Present when the stage has nothing to work on for this input. */
  protected abstract Optional<String> skipReason(I input);

  /** Performs the external call and normalizes its output. Null counts as a failure. */
  protected abstract O extract(I input);

  protected abstract String successMessage(I input, O output);

  /** Cuts {@code text} to {@code maxChars}, marking the cut. */
  protected static String clamp(String text, int maxChars) {
    if (text.length() <= maxChars) {
      return text;
    }
    return text.substring(0, maxChars) + TRUNCATION_MARKER;
  }

  protected static boolean isBlank(String text) {
    return text == null || text.isBlank();
  }

  /** First few names for a progress message, e.g. "a, b, c (+2 more)". */
  protected static String preview(List<String> names, int limit) {
    if (names.size() <= limit) {
      return String.join(", ", names);
    }
    return String.join(", ", names.subList(0, limit))
        + " (+"
        + (names.size() - limit)
        + " more)";
  }

  private static String describe(RuntimeException e) {
    if (e instanceof ExtractionTransportException transport && transport.isRateLimited()) {
      return "rate limited by the extraction service";
    }
    Throwable cause =
        e instanceof ExtractionTransportException && e.getCause() != null ? e.getCause() : e;
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }
}
