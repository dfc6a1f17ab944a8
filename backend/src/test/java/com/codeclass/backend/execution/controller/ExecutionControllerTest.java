package com.codeclass.backend.execution.controller;

import com.codeclass.backend.execution.dto.response.ExecuteResultResponse;
import com.codeclass.backend.execution.exception.QueueOverloadedException;
import com.codeclass.backend.execution.exception.RunAccessDeniedException;
import com.codeclass.backend.execution.exception.RunConflictException;
import com.codeclass.backend.execution.exception.RunNotCancellableException;
import com.codeclass.backend.execution.exception.RunNotFoundException;
import com.codeclass.backend.execution.exception.RunThrottledException;
import com.codeclass.backend.execution.model.Run;
import com.codeclass.backend.execution.model.RunStatus;
import com.codeclass.backend.execution.queue.EnqueueResult;
import com.codeclass.backend.execution.service.ExecutionAdmissionService;
import com.codeclass.backend.execution.service.RunQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExecutionController.class)
class ExecutionControllerTest {
  private static final String BODY = "{\"language\":\"python\",\"attempt_id\":11,\"stdin\":\"\","
          + "\"files\":[{\"name\":\"main.py\",\"path\":\"main.py\",\"content\":\"print('hi')\",\"is_main\":true}]}";

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private ExecutionAdmissionService admissionService;

  @MockBean
  private RunQueryService queryService;

  @Test
  void acceptedRunReturnsRunIdAndPosition() throws Exception {
    Run run = new Run(11L, Instant.parse("2026-03-01T10:00:00Z"));
    run.setId(42L);
    when(admissionService.submit(eq(11L), any(), any())).thenReturn(new ExecutionAdmissionService.Admission(run, 2));

    mockMvc.perform(post("/api/execute").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.run_id").value(42))
            .andExpect(jsonPath("$.status").value("queued"))
            .andExpect(jsonPath("$.position").value(2))
            .andExpect(jsonPath("$.message").value("Run queued. Poll /api/execute/42 for results."));
  }

  @Test
  void conflictCarriesBlockingRunId() throws Exception {
    when(admissionService.submit(eq(11L), any(), any())).thenThrow(new RunConflictException(7L));

    mockMvc.perform(post("/api/execute").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.run_id").value(7))
            .andExpect(jsonPath("$.status_code").value(409));
  }

  @Test
  void throttleReturnsRetryAfter() throws Exception {
    when(admissionService.submit(eq(11L), any(), any()))
            .thenThrow(new RunThrottledException(Duration.ofSeconds(2), Duration.ofMillis(1500)));

    mockMvc.perform(post("/api/execute").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isTooManyRequests())
            .andExpect(header().string("Retry-After", "2"))
            .andExpect(jsonPath("$.retry_after").value(1.5));
  }

  @Test
  void retryAfterRoundsUpToWholeSeconds() throws Exception {
    when(admissionService.submit(eq(11L), any(), any()))
            .thenThrow(new RunThrottledException(Duration.ofSeconds(2), Duration.ofMillis(200)));

    mockMvc.perform(post("/api/execute").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isTooManyRequests())
            .andExpect(header().string("Retry-After", "1"))
            .andExpect(jsonPath("$.retry_after").value(0.2));
  }

  @Test
  void submitForForeignAttemptIs403() throws Exception {
    when(admissionService.submit(eq(11L), any(), eq("other"))).thenThrow(new RunAccessDeniedException(11L));

    mockMvc.perform(post("/api/execute").header("X-User-Id", "other")
                    .contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.detail").value("Unauthorized"));
  }

  @Test
  void overloadReturns503() throws Exception {
    when(admissionService.submit(eq(11L), any(), any()))
            .thenThrow(new QueueOverloadedException(43L, EnqueueResult.OVERLOADED));

    mockMvc.perform(post("/api/execute").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.detail").value(EnqueueResult.OVERLOADED))
            .andExpect(jsonPath("$.run_id").value(43));
  }

  @Test
  void invalidRequestIsRejectedBeforeAdmission() throws Exception {
    String noFiles = "{\"language\":\"python\",\"attempt_id\":11,\"files\":[]}";

    mockMvc.perform(post("/api/execute").contentType(MediaType.APPLICATION_JSON).content(noFiles))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status_code").value(400));
    verifyNoInteractions(admissionService);
  }

  @Test
  void pollReturnsRunView() throws Exception {
    ExecuteResultResponse view = new ExecuteResultResponse(42L, 11L, RunStatus.SUCCESS, null, "hi\n", "", 0, 0.1,
            null, null, null, 0.3, "ab");
    when(queryService.get(42L, "user-1")).thenReturn(view);

    mockMvc.perform(get("/api/execute/42").header("X-User-Id", "user-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.stdout").value("hi\n"))
            .andExpect(jsonPath("$.exit_code").value(0))
            .andExpect(jsonPath("$.total_time").value(0.3));
  }

  @Test
  void unknownRunIs404() throws Exception {
    when(queryService.get(99L, null)).thenThrow(new RunNotFoundException(99L));

    mockMvc.perform(get("/api/execute/99"))
            .andExpect(status().isNotFound());
  }

  @Test
  void deniedRunIs403() throws Exception {
    when(queryService.get(42L, "other")).thenThrow(new RunAccessDeniedException(11L));

    mockMvc.perform(get("/api/execute/42").header("X-User-Id", "other"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.detail").value("Unauthorized"));
  }

  @Test
  void cancellingRunningRunIs409() throws Exception {
    when(queryService.cancel(42L, null)).thenThrow(new RunNotCancellableException(42L, RunStatus.RUNNING));

    mockMvc.perform(post("/api/execute/42/cancel"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.run_id").value(42));
  }
}
