package com.flamingo.ai.studyplanner.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.studyplanner.service.run.RunRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

  @Mock private RunRegistry runRegistry;

  @Test
  void shouldReportActiveRuns_whenKeyConfigured() throws Exception {
    // Given
    when(runRegistry.activeRunCount()).thenReturn(2L);
    HealthController controller = new HealthController(runRegistry, "sk-test");

    // When / Then
    MockMvcBuilders.standaloneSetup(controller)
        .build()
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.apiKeyConfigured").value(true))
        .andExpect(jsonPath("$.activeRuns").value(2));
  }

  @Test
  void shouldFlagMissingKey_whenKeyBlank() throws Exception {
    HealthController controller = new HealthController(runRegistry, " ");

    MockMvcBuilders.standaloneSetup(controller)
        .build()
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.apiKeyConfigured").value(false));
  }
}
