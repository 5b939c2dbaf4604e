package com.flamingo.ai.studyplanner.domain.model;

import com.flamingo.ai.studyplanner.domain.enums.DocumentKind;
import java.nio.file.Path;

/** Points at a stored course document. The handle is opaque outside the document package. */
public record DocumentRef(String courseId, DocumentKind kind, Path handle) {

  public String fileName() {
    return handle.getFileName().toString();
  }
}
