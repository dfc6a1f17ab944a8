package com.codeclass.backend.execution.executor;

/**
 * 언어별 기본 빌드/실행 스펙.
 */
public class ExecutionSpec {
  // 기본 빌드 커맨드 (없으면 null)
  private final String buildCommand;
  // 기본 실행 커맨드
  private final String runCommand;
  // 이 파일이 있을 때만 빌드한다 (null이면 항상 빌드)
  private final String buildRequiredFile;

  public ExecutionSpec(String buildCommand, String runCommand, String buildRequiredFile) {
    this.buildCommand = buildCommand;
    this.runCommand = runCommand;
    this.buildRequiredFile = buildRequiredFile;
  }

  public String getBuildCommand() {
    return buildCommand;
  }

  public String getRunCommand() {
    return runCommand;
  }

  public String getBuildRequiredFile() {
    return buildRequiredFile;
  }
}
