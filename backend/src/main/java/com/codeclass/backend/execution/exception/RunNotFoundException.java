package com.codeclass.backend.execution.exception;

public class RunNotFoundException extends RuntimeException {
  public RunNotFoundException(Long runId) {
    super("Run not found: " + runId);
  }
}
