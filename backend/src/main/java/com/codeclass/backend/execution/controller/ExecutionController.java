package com.codeclass.backend.execution.controller;

import com.codeclass.backend.execution.dto.request.ExecuteRequest;
import com.codeclass.backend.execution.dto.response.ExecuteEnqueueResponse;
import com.codeclass.backend.execution.dto.response.ExecuteResultResponse;
import com.codeclass.backend.execution.model.RunStatus;
import com.codeclass.backend.execution.service.ExecutionAdmissionService;
import com.codeclass.backend.execution.service.RunQueryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 코드 실행 요청을 받는 컨트롤러.
 */
@RestController
@RequestMapping("/api/execute")
public class ExecutionController {
  static final String USER_HEADER = "X-User-Id";

  private final ExecutionAdmissionService admissionService;
  private final RunQueryService queryService;

  public ExecutionController(ExecutionAdmissionService admissionService, RunQueryService queryService) {
    this.admissionService = admissionService;
    this.queryService = queryService;
  }

  @PostMapping
  @ResponseStatus(HttpStatus.ACCEPTED)
  public ExecuteEnqueueResponse execute(@Valid @RequestBody ExecuteRequest request,
                                        @RequestHeader(value = USER_HEADER, required = false) String principal) {
    // runId를 반환하고 실행은 워커가 진행한다. 결과는 GET으로 폴링
    ExecutionAdmissionService.Admission admission = admissionService.submit(request.getAttemptId(), request,
            principal);
    Long runId = admission.getRun().getId();
    return new ExecuteEnqueueResponse(runId, RunStatus.QUEUED, admission.getPosition(),
            "Run queued. Poll /api/execute/" + runId + " for results.");
  }

  @GetMapping("/{runId}")
  public ExecuteResultResponse result(@PathVariable Long runId,
                                      @RequestHeader(value = USER_HEADER, required = false) String principal) {
    return queryService.get(runId, principal);
  }

  @PostMapping("/{runId}/cancel")
  public ExecuteResultResponse cancel(@PathVariable Long runId,
                                      @RequestHeader(value = USER_HEADER, required = false) String principal) {
    return queryService.cancel(runId, principal);
  }
}
