package com.codeclass.backend.execution.exception;

/**
 * 같은 attempt에 아직 끝나지 않은 Run이 있을 때.
 */
public class RunConflictException extends RuntimeException {
  private final Long runId;

  public RunConflictException(Long runId) {
    super("Run already in progress for this attempt (run_id=" + runId + ")");
    this.runId = runId;
  }

  public Long getRunId() {
    return runId;
  }
}
