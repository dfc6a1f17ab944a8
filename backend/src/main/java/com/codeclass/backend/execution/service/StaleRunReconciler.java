package com.codeclass.backend.execution.service;

import com.codeclass.backend.execution.config.ExecutionProperties;
import com.codeclass.backend.execution.model.Run;
import com.codeclass.backend.execution.model.RunStatus;
import com.codeclass.backend.execution.repository.RunRepository;
import com.codeclass.backend.execution.websocket.RunStatusWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 주인을 잃은 Run을 error로 정리한다.
 *
 * <p>대기열에 넣은 뒤 프로세스가 죽었거나(로컬 큐는 재시작하면 비워진다) 워커가 실행 중에 죽으면 Run이
 * queued/running에 머문다. 유예 시간이 지난 Run만 조건부 갱신으로 마감하므로 그 사이 정상적으로 끝난
 * Run은 건드리지 않는다.
 */
@Slf4j
@Component
public class StaleRunReconciler implements SchedulingConfigurer {
  static final String QUEUED_MESSAGE = "Run was never picked up by a worker";
  static final String RUNNING_MESSAGE = "Worker stopped before the run finished";

  private final RunRepository runRepository;
  private final RunStatusWebSocketHandler statusPublisher;
  private final Clock clock;
  private final Duration interval;
  private final Duration queuedGrace;
  private final Duration runningGrace;

  public StaleRunReconciler(RunRepository runRepository, RunStatusWebSocketHandler statusPublisher,
                            ExecutionProperties properties, Clock clock) {
    this.runRepository = runRepository;
    this.statusPublisher = statusPublisher;
    this.clock = clock;
    this.interval = properties.getReconcile().getInterval();
    this.queuedGrace = properties.effectiveQueuedGrace();
    this.runningGrace = properties.effectiveRunningGrace();
  }

  @Override
  public void configureTasks(ScheduledTaskRegistrar registrar) {
    registrar.addFixedDelayTask(this::reconcileSafely, interval);
  }

  /**
   * 한 번 훑는다.
   *
   * @return error로 바꾼 Run 수
   */
  public int reconcile() {
    Instant now = clock.instant();
    int resolved = 0;

    List<Run> queued = runRepository.findByStatusAndCreatedAtBefore(RunStatus.QUEUED, now.minus(queuedGrace));
    for (Run run : queued) {
      resolved += resolve(run, RunStatus.QUEUED, QUEUED_MESSAGE, now);
    }
    List<Run> running = runRepository.findByStatusAndStartedAtBefore(RunStatus.RUNNING, now.minus(runningGrace));
    for (Run run : running) {
      resolved += resolve(run, RunStatus.RUNNING, RUNNING_MESSAGE, now);
    }

    if (resolved > 0) {
      log.warn("Reconciled {} stale runs", resolved);
    }
    return resolved;
  }

  private int resolve(Run run, RunStatus expected, String message, Instant now) {
    if (!runRepository.markFailed(run.getId(), message, now, expected)) {
      return 0;
    }
    log.warn("Run {} (attempt {}) marked error: stuck in {}", run.getId(), run.getAttemptId(), expected.getValue());
    statusPublisher.publish(run.getId(), RunStatus.ERROR);
    return 1;
  }

  private void reconcileSafely() {
    try {
      reconcile();
    } catch (RuntimeException e) {
      log.error("Stale run reconciliation failed", e);
    }
  }
}
