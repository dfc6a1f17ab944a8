package com.codeclass.backend.execution.service;

import com.codeclass.backend.execution.executor.ExecutionOutcome;
import com.codeclass.backend.execution.executor.PhaseResult;
import com.codeclass.backend.execution.executor.ProjectExecutor;
import com.codeclass.backend.execution.model.ExecutionJob;
import com.codeclass.backend.execution.model.ExecutionPayload;
import com.codeclass.backend.execution.model.Run;
import com.codeclass.backend.execution.model.RunStatus;
import com.codeclass.backend.execution.queue.JobProcessor;
import com.codeclass.backend.execution.repository.RunRepository;
import com.codeclass.backend.execution.websocket.RunStatusWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 워커가 꺼낸 작업 하나를 실행하고 결과를 Run에 기록한다.
 *
 * <p>Run을 running으로 점유하는 데 성공한 워커만 이후 상태를 바꾼다. 점유에 실패하면(취소되었거나 이미
 * 정리된 Run) 아무것도 실행하지 않는다. 자동 재시도는 없다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunJobProcessor implements JobProcessor {
  private final RunRepository runRepository;
  private final ProjectExecutor executor;
  private final RunPayloadCodec payloadCodec;
  private final RunStatusWebSocketHandler statusPublisher;
  private final Clock clock;

  @Override
  public void process(ExecutionJob job) {
    Long runId = job.getRunId();
    if (!runRepository.markRunning(runId, clock.instant())) {
      log.info("Run {} is no longer queued, skipping", runId);
      return;
    }
    statusPublisher.publish(runId, RunStatus.RUNNING);
    log.info("Executing run {} (attempt {}, waited {} ms)", runId, job.getAttemptId(),
            Duration.between(job.getEnqueuedAt(), clock.instant()).toMillis());

    ExecutionPayload payload = job.getPayload();
    RunStatus finalStatus;
    try {
      ExecutionOutcome outcome = executor.run(payload.getLanguage(), payload.getFiles(), payload.getStdin(),
              payload.getBuildCommand(), payload.getRunCommand());
      finalStatus = complete(runId, outcome) ? outcome.getStatus() : null;
    } catch (Exception e) {
      log.error("Error executing run {}", runId, e);
      boolean failed = runRepository.markFailed(runId, "Internal execution error: " + e.getMessage(),
              clock.instant(), RunStatus.RUNNING);
      finalStatus = failed ? RunStatus.ERROR : null;
    }

    if (finalStatus == null) {
      log.warn("Run {} was resolved by someone else while executing; result discarded", runId);
      return;
    }
    statusPublisher.publish(runId, finalStatus);
  }

  @Override
  public void processStored(Long runId) {
    Optional<Run> stored = runRepository.findById(runId);
    if (stored.isEmpty()) {
      log.error("Run {} not found", runId);
      return;
    }
    ExecutionPayload payload;
    try {
      payload = payloadCodec.decode(stored.get().getRequestJson());
    } catch (Exception e) {
      log.error("Failed to parse request for run {}", runId, e);
      if (runRepository.markFailed(runId, "Invalid request payload: " + e.getMessage(), clock.instant(),
              RunStatus.QUEUED)) {
        statusPublisher.publish(runId, RunStatus.ERROR);
      }
      return;
    }
    process(new ExecutionJob(runId, payload, stored.get().getCreatedAt()));
  }

  private boolean complete(Long runId, ExecutionOutcome outcome) {
    PhaseResult build = outcome.getBuildResult();
    PhaseResult run = outcome.getRunResult();
    int updated = runRepository.complete(
            runId,
            outcome.getStatus(),
            clock.instant(),
            build == null ? null : build.getStdout(),
            build == null ? null : build.getStderr(),
            build == null ? null : build.getExitCode(),
            build == null ? null : build.getElapsedSeconds(),
            run == null ? null : run.getStdout(),
            run == null ? null : run.getStderr(),
            run == null ? null : run.getExitCode(),
            run == null ? null : run.getElapsedSeconds(),
            RunStatus.RUNNING);
    if (updated == 1) {
      log.info("Run {} completed with status {} (build={}, run={})", runId, outcome.getStatus().getValue(),
              build == null ? "-" : build.getElapsedSeconds() + "s",
              run == null ? "-" : run.getElapsedSeconds() + "s");
    }
    return updated == 1;
  }
}
