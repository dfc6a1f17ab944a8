package com.codeclass.backend.execution.executor;

import com.codeclass.backend.execution.model.RunStatus;

/**
 * 실행 파이프라인의 최종 결과. 실행 단계 결과와 (있다면) 빌드 단계 결과를 함께 담는다.
 */
public class ExecutionOutcome {
  private final RunStatus status;
  // 빌드 실패 시 null
  private final PhaseResult runResult;
  // 빌드가 없었으면 null
  private final PhaseResult buildResult;

  private ExecutionOutcome(RunStatus status, PhaseResult runResult, PhaseResult buildResult) {
    this.status = status;
    this.runResult = runResult;
    this.buildResult = buildResult;
  }

  public static ExecutionOutcome compilationError(PhaseResult buildResult) {
    return new ExecutionOutcome(RunStatus.COMPILATION_ERROR, null, buildResult);
  }

  public static ExecutionOutcome of(PhaseResult runResult, PhaseResult buildResult) {
    RunStatus status;
    if (runResult.isTimedOut()) {
      status = RunStatus.TIMEOUT;
    } else if (runResult.getExitCode() != 0) {
      status = RunStatus.ERROR;
    } else {
      status = RunStatus.SUCCESS;
    }
    return new ExecutionOutcome(status, runResult, buildResult);
  }

  // 아무 것도 실행하지 못한 경우
  public static ExecutionOutcome error(String message, PhaseResult buildResult) {
    return new ExecutionOutcome(RunStatus.ERROR, PhaseResult.failedToStart(message, 0), buildResult);
  }

  public RunStatus getStatus() {
    return status;
  }

  public PhaseResult getRunResult() {
    return runResult;
  }

  public PhaseResult getBuildResult() {
    return buildResult;
  }
}
