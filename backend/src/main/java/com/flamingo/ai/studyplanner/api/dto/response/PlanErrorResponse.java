package com.flamingo.ai.studyplanner.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of the result endpoint while no plan is available. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlanErrorResponse {

  private String error;
}
