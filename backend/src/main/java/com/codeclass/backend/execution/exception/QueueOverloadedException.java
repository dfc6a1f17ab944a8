package com.codeclass.backend.execution.exception;

/**
 * 큐가 작업을 받지 못했을 때. 이미 만들어진 Run은 error로 기록된 상태다.
 */
public class QueueOverloadedException extends RuntimeException {
  private final Long runId;

  public QueueOverloadedException(Long runId, String reason) {
    super(reason);
    this.runId = runId;
  }

  public Long getRunId() {
    return runId;
  }
}
