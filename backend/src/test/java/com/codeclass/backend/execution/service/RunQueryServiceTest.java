package com.codeclass.backend.execution.service;

import com.codeclass.backend.execution.dto.response.ExecuteResultResponse;
import com.codeclass.backend.execution.exception.RunAccessDeniedException;
import com.codeclass.backend.execution.exception.RunNotCancellableException;
import com.codeclass.backend.execution.exception.RunNotFoundException;
import com.codeclass.backend.execution.model.Run;
import com.codeclass.backend.execution.model.RunStatus;
import com.codeclass.backend.execution.repository.RunRepository;
import com.codeclass.backend.execution.websocket.RunStatusWebSocketHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RunQueryServiceTest {
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private RunRepository runRepository;
  private AttemptAccessPolicy policy;
  private RunStatusWebSocketHandler publisher;
  private RunQueryService service;

  @BeforeEach
  void setUp() {
    runRepository = mock(RunRepository.class);
    policy = mock(AttemptAccessPolicy.class);
    publisher = mock(RunStatusWebSocketHandler.class);
    service = new RunQueryService(runRepository, policy, publisher, new MutableClock(NOW));
    when(policy.canAccess(any(), any())).thenReturn(true);
  }

  @Test
  void returnsFinishedRunView() {
    Run run = run(RunStatus.SUCCESS);
    run.setStartedAt(NOW.minusMillis(1500));
    run.setFinishedAt(NOW);
    run.setStdout("hi\n");
    run.setExitCode(0);
    when(runRepository.findById(4L)).thenReturn(Optional.of(run));

    ExecuteResultResponse view = service.get(4L, "u1");

    assertThat(view.getStatus()).isEqualTo(RunStatus.SUCCESS);
    assertThat(view.getStdout()).isEqualTo("hi\n");
    assertThat(view.getTotalTime()).isEqualTo(1.5);
    assertThat(view.getBuildOutput()).isNull();
  }

  @Test
  void unknownRunIsNotFound() {
    when(runRepository.findById(4L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.get(4L, null)).isInstanceOf(RunNotFoundException.class);
  }

  @Test
  void policyCanDenyAccess() {
    when(runRepository.findById(4L)).thenReturn(Optional.of(run(RunStatus.QUEUED)));
    when(policy.canAccess(9L, "intruder")).thenReturn(false);

    assertThatThrownBy(() -> service.get(4L, "intruder")).isInstanceOf(RunAccessDeniedException.class);
  }

  @Test
  void cancelsQueuedRun() {
    Run queued = run(RunStatus.QUEUED);
    Run cancelled = run(RunStatus.CANCELLED);
    cancelled.setFinishedAt(NOW);
    when(runRepository.findById(4L)).thenReturn(Optional.of(queued), Optional.of(cancelled));
    when(runRepository.markCancelled(4L, NOW)).thenReturn(true);

    ExecuteResultResponse view = service.cancel(4L, null);

    assertThat(view.getStatus()).isEqualTo(RunStatus.CANCELLED);
    verify(publisher).publish(4L, RunStatus.CANCELLED);
  }

  @Test
  void runningRunCannotBeCancelled() {
    Run running = run(RunStatus.RUNNING);
    when(runRepository.findById(4L)).thenReturn(Optional.of(running));
    when(runRepository.markCancelled(4L, NOW)).thenReturn(false);

    assertThatThrownBy(() -> service.cancel(4L, null)).isInstanceOf(RunNotCancellableException.class);
    verify(publisher, never()).publish(any(), any());
  }

  private static Run run(RunStatus status) {
    Run run = new Run(9L, NOW.minusSeconds(10));
    run.setId(4L);
    run.setStatus(status);
    return run;
  }
}
