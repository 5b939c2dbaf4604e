package com.flamingo.ai.studyplanner.service.pipeline;

import com.flamingo.ai.studyplanner.domain.enums.ProgressStatus;

/** Receives progress events raised while a run is executing. */
@FunctionalInterface
public interface ProgressListener {

  void onProgress(String agent, String message, ProgressStatus status);
}
