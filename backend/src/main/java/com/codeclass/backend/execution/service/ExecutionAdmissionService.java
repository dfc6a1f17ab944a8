package com.codeclass.backend.execution.service;

import com.codeclass.backend.execution.config.ExecutionProperties;
import com.codeclass.backend.execution.dto.request.ExecuteRequest;
import com.codeclass.backend.execution.dto.request.FileData;
import com.codeclass.backend.execution.exception.QueueOverloadedException;
import com.codeclass.backend.execution.exception.RunAccessDeniedException;
import com.codeclass.backend.execution.exception.RunConflictException;
import com.codeclass.backend.execution.exception.RunThrottledException;
import com.codeclass.backend.execution.model.ExecutionJob;
import com.codeclass.backend.execution.model.ExecutionPayload;
import com.codeclass.backend.execution.model.Run;
import com.codeclass.backend.execution.model.RunStatus;
import com.codeclass.backend.execution.model.SourceFile;
import com.codeclass.backend.execution.queue.EnqueueResult;
import com.codeclass.backend.execution.queue.ExecutionQueue;
import com.codeclass.backend.execution.repository.RunRepository;
import com.codeclass.backend.execution.websocket.RunStatusWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 실행 요청 접수.
 *
 * <p>요청자가 attempt에 접근할 수 없으면 바로 거절한다. 이어서 순서대로 검사한다: attempt당 미완료 Run은
 * 하나(strict lock), attempt당 최소 실행 간격(throttle). 거절되면 아무것도 기록하지 않는다. 통과하면
 * queued Run을 만든 뒤 큐에 넣고, 큐가 거절하면 그 Run을 error로 마감한다.
 *
 * <p>검사와 생성은 같은 attempt에 대해 이 프로세스 안에서만 직렬화된다. 여러 노드 사이에서는 여전히
 * 조회 후 삽입이므로 동시에 들어온 중복 요청이 둘 다 통과할 수 있다.
 */
@Slf4j
@Service
public class ExecutionAdmissionService {
  private static final int LOCK_STRIPES = 64;

  private final RunRepository runRepository;
  private final ExecutionQueue executionQueue;
  private final RunPayloadCodec payloadCodec;
  private final RunStatusWebSocketHandler statusPublisher;
  private final AttemptAccessPolicy accessPolicy;
  private final Duration throttle;
  private final Clock clock;
  private final Object[] attemptLocks = new Object[LOCK_STRIPES];

  public ExecutionAdmissionService(RunRepository runRepository, ExecutionQueue executionQueue,
                                   RunPayloadCodec payloadCodec, RunStatusWebSocketHandler statusPublisher,
                                   AttemptAccessPolicy accessPolicy, ExecutionProperties properties, Clock clock) {
    this.runRepository = runRepository;
    this.executionQueue = executionQueue;
    this.payloadCodec = payloadCodec;
    this.statusPublisher = statusPublisher;
    this.accessPolicy = accessPolicy;
    this.throttle = properties.getThrottle();
    this.clock = clock;
    for (int i = 0; i < LOCK_STRIPES; i++) {
      attemptLocks[i] = new Object();
    }
  }

  /**
   * 접수 결과: 생성된 Run과 대기열 위치.
   */
  public static final class Admission {
    private final Run run;
    private final Integer position;

    public Admission(Run run, Integer position) {
      this.run = run;
      this.position = position;
    }

    public Run getRun() {
      return run;
    }

    public Integer getPosition() {
      return position;
    }
  }

  public Admission submit(Long attemptId, ExecuteRequest request, String principal) {
    if (!accessPolicy.canAccess(attemptId, principal)) {
      log.warn("Rejecting run for attempt {}: principal {} has no access", attemptId, principal);
      throw new RunAccessDeniedException(attemptId);
    }
    ExecutionPayload payload = toPayload(attemptId, request);

    Run run;
    synchronized (lockFor(attemptId)) {
      run = createRun(attemptId, payload);
    }

    EnqueueResult result = executionQueue.enqueue(new ExecutionJob(run.getId(), payload, clock.instant()));
    if (!result.isAccepted()) {
      // 만들어진 Run은 error로 마감한다
      log.error("Run {} rejected by queue: {}", run.getId(), result.getReason());
      if (runRepository.markFailed(run.getId(), result.getReason(), clock.instant(), RunStatus.QUEUED)) {
        statusPublisher.publish(run.getId(), RunStatus.ERROR);
      }
      throw new QueueOverloadedException(run.getId(), result.getReason());
    }
    return new Admission(run, executionQueue.position());
  }

  private Run createRun(Long attemptId, ExecutionPayload payload) {
    Optional<Run> active = runRepository.findFirstByAttemptIdAndStatusInOrderByCreatedAtAsc(attemptId, RunStatus.ACTIVE);
    if (active.isPresent()) {
      log.warn("Rejecting run for attempt {}: run {} still {}", attemptId, active.get().getId(),
              active.get().getStatus().getValue());
      throw new RunConflictException(active.get().getId());
    }

    Instant now = clock.instant();
    Optional<Run> last = runRepository.findFirstByAttemptIdOrderByCreatedAtDesc(attemptId);
    if (last.isPresent()) {
      Duration since = Duration.between(last.get().getCreatedAt(), now);
      if (since.compareTo(throttle) < 0) {
        Duration remaining = throttle.minus(since);
        log.warn("Throttling attempt {}: {} ms until next run allowed", attemptId, remaining.toMillis());
        throw new RunThrottledException(throttle, remaining);
      }
    }

    Run run = new Run(attemptId, now);
    run.setRequestJson(payloadCodec.encode(payload));
    RunPayloadCodec.Snapshot snapshot = payloadCodec.snapshot(payload.getFiles());
    run.setSnapshotHash(snapshot.getHash());
    run.setCodeSnapshot(snapshot.getContent());
    if (snapshot.getContent() == null) {
      log.info("Snapshot for attempt {} is {} bytes, keeping hash only", attemptId, snapshot.getSizeBytes());
    }
    Run saved = runRepository.saveAndFlush(run);
    log.info("Created run {} for attempt {}", saved.getId(), attemptId);
    return saved;
  }

  private Object lockFor(Long attemptId) {
    return attemptLocks[Math.floorMod(attemptId.hashCode(), LOCK_STRIPES)];
  }

  private static ExecutionPayload toPayload(Long attemptId, ExecuteRequest request) {
    List<SourceFile> files = request.getFiles().stream()
            .map(ExecutionAdmissionService::toSourceFile)
            .collect(Collectors.toList());
    return new ExecutionPayload(attemptId, request.getLanguage(), files,
            request.getStdin() == null ? "" : request.getStdin(),
            request.getBuildCommand(), request.getRunCommand());
  }

  private static SourceFile toSourceFile(FileData file) {
    String path = file.getPath() == null ? file.getName() : file.getPath();
    return new SourceFile(file.getName(), path, file.getContent(), Boolean.TRUE.equals(file.getIsMain()));
  }
}
