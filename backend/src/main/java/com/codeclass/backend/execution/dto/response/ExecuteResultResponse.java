package com.codeclass.backend.execution.dto.response;

import com.codeclass.backend.execution.model.Run;
import com.codeclass.backend.execution.model.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * 실행 상태/결과 조회 응답.
 *
 * <p>queued, running 상태에서는 아직 기록되지 않은 필드가 null 이다.
 */
@Getter
@AllArgsConstructor
public class ExecuteResultResponse {
  private Long runId;
  private Long attemptId;
  private RunStatus status;
  // 빌드 단계를 거치지 않았으면 null
  private BuildOutput buildOutput;
  private String stdout;
  private String stderr;
  private Integer exitCode;
  private Double runTime;
  private Instant createdAt;
  private Instant startedAt;
  private Instant finishedAt;
  // finished_at - started_at (초)
  private Double totalTime;
  private String snapshotHash;

  public static ExecuteResultResponse from(Run run) {
    BuildOutput buildOutput = null;
    if (run.getBuildExitCode() != null) {
      buildOutput = new BuildOutput(run.getBuildStdout(), run.getBuildStderr(),
              run.getBuildExitCode(), run.getBuildTime());
    }
    return new ExecuteResultResponse(
            run.getId(),
            run.getAttemptId(),
            run.getStatus(),
            buildOutput,
            run.getStdout(),
            run.getStderr(),
            run.getExitCode(),
            run.getRunTime(),
            run.getCreatedAt(),
            run.getStartedAt(),
            run.getFinishedAt(),
            totalTime(run.getStartedAt(), run.getFinishedAt()),
            run.getSnapshotHash()
    );
  }

  // 단계별 시간을 더하지 않는다. 대기 시간이 중복 계산되지 않게 타임스탬프 차이만 쓴다
  static Double totalTime(Instant startedAt, Instant finishedAt) {
    if (startedAt == null || finishedAt == null) {
      return null;
    }
    return Duration.between(startedAt, finishedAt).toNanos() / 1_000_000_000.0;
  }
}
