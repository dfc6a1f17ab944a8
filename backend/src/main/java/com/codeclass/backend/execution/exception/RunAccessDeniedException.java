package com.codeclass.backend.execution.exception;

public class RunAccessDeniedException extends RuntimeException {
  public RunAccessDeniedException(Long attemptId) {
    super("Unauthorized for attempt " + attemptId);
  }
}
