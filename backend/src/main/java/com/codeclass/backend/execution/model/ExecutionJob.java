package com.codeclass.backend.execution.model;

import java.time.Instant;

/**
 * 큐에 들어가는 실행 작업. 영속화되지 않는다.
 */
public class ExecutionJob {
  // 대상 Run 식별자
  private final Long runId;
  // 실행에 필요한 요청 전체
  private final ExecutionPayload payload;
  // 큐 투입 시각
  private final Instant enqueuedAt;

  public ExecutionJob(Long runId, ExecutionPayload payload, Instant enqueuedAt) {
    this.runId = runId;
    this.payload = payload;
    this.enqueuedAt = enqueuedAt;
  }

  public Long getRunId() {
    return runId;
  }

  public ExecutionPayload getPayload() {
    return payload;
  }

  public Long getAttemptId() {
    return payload.getAttemptId();
  }

  public Instant getEnqueuedAt() {
    return enqueuedAt;
  }

  @Override
  public String toString() {
    return "ExecutionJob{runId=" + runId + ", attemptId=" + getAttemptId() + "}";
  }
}
