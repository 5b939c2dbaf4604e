package com.flamingo.ai.studyplanner.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {

  private String id;
  private String name;
  private String path;
  private String status;
}
