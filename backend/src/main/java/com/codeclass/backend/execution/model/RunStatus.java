package com.codeclass.backend.execution.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * 실행(Run) 상태.
 */
public enum RunStatus {
  QUEUED("queued"),
  RUNNING("running"),
  SUCCESS("success"),
  ERROR("error"),
  TIMEOUT("timeout"),
  COMPILATION_ERROR("compilation_error"),
  // 대기 중 취소만 허용된다. 실행 중 취소는 없다.
  CANCELLED("cancelled");

  // 시도(attempt)당 하나만 존재할 수 있는 상태
  public static final Set<RunStatus> ACTIVE = EnumSet.of(QUEUED, RUNNING);

  private final String value;

  RunStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public boolean isTerminal() {
    return !ACTIVE.contains(this);
  }
}
