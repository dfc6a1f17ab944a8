package com.codeclass.backend.execution.service;

import com.codeclass.backend.execution.dto.response.ExecuteResultResponse;
import com.codeclass.backend.execution.exception.RunAccessDeniedException;
import com.codeclass.backend.execution.exception.RunNotCancellableException;
import com.codeclass.backend.execution.exception.RunNotFoundException;
import com.codeclass.backend.execution.model.Run;
import com.codeclass.backend.execution.model.RunStatus;
import com.codeclass.backend.execution.repository.RunRepository;
import com.codeclass.backend.execution.websocket.RunStatusWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class RunQueryService {
  private final RunRepository runRepository;
  private final AttemptAccessPolicy accessPolicy;
  private final RunStatusWebSocketHandler statusPublisher;
  private final Clock clock;

  /**
   * 현재 상태 조회. 아무것도 바꾸지 않는다.
   */
  public ExecuteResultResponse get(Long runId, String principal) {
    return ExecuteResultResponse.from(load(runId, principal));
  }

  /**
   * 아직 대기 중인 Run만 취소한다. 이미 워커가 점유했거나 끝난 Run이면 {@link RunNotCancellableException}.
   */
  public ExecuteResultResponse cancel(Long runId, String principal) {
    Run run = load(runId, principal);
    if (!runRepository.markCancelled(runId, clock.instant())) {
      Run current = runRepository.findById(runId).orElse(run);
      log.warn("Run {} not cancellable in state {}", runId, current.getStatus().getValue());
      throw new RunNotCancellableException(runId, current.getStatus());
    }
    log.info("Run {} cancelled (attempt {})", runId, run.getAttemptId());
    statusPublisher.publish(runId, RunStatus.CANCELLED);
    return ExecuteResultResponse.from(runRepository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId)));
  }

  private Run load(Long runId, String principal) {
    Run run = runRepository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
    if (!accessPolicy.canAccess(run.getAttemptId(), principal)) {
      throw new RunAccessDeniedException(run.getAttemptId());
    }
    return run;
  }
}
