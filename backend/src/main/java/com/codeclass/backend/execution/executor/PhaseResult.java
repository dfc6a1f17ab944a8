package com.codeclass.backend.execution.executor;

/**
 * 빌드 또는 실행 단계 하나의 결과.
 */
public class PhaseResult {
  // 타임아웃 또는 실행 불가일 때의 종료 코드
  public static final int NO_EXIT_CODE = -1;

  private final String stdout;
  private final String stderr;
  private final int exitCode;
  // 경과 시간 (초)
  private final double elapsedSeconds;
  private final boolean timedOut;

  public PhaseResult(String stdout, String stderr, int exitCode, double elapsedSeconds, boolean timedOut) {
    this.stdout = stdout;
    this.stderr = stderr;
    this.exitCode = exitCode;
    this.elapsedSeconds = elapsedSeconds;
    this.timedOut = timedOut;
  }

  public static PhaseResult failedToStart(String message, double elapsedSeconds) {
    return new PhaseResult("", message, NO_EXIT_CODE, elapsedSeconds, false);
  }

  public String getStdout() {
    return stdout;
  }

  public String getStderr() {
    return stderr;
  }

  public int getExitCode() {
    return exitCode;
  }

  public double getElapsedSeconds() {
    return elapsedSeconds;
  }

  public boolean isTimedOut() {
    return timedOut;
  }

  public boolean isSuccessful() {
    return !timedOut && exitCode == 0;
  }

  @Override
  public String toString() {
    return "PhaseResult{exitCode=" + exitCode + ", elapsed=" + elapsedSeconds + "s, timedOut=" + timedOut + "}";
  }
}
