package com.codeclass.backend.execution.exception;

import com.codeclass.backend.execution.model.RunStatus;

/**
 * 대기 중이 아닌 Run을 취소하려 할 때. 실행 중 취소는 지원하지 않는다.
 */
public class RunNotCancellableException extends RuntimeException {
  private final Long runId;

  public RunNotCancellableException(Long runId, RunStatus status) {
    super("Run " + runId + " cannot be cancelled in state " + status.getValue());
    this.runId = runId;
  }

  public Long getRunId() {
    return runId;
  }
}
