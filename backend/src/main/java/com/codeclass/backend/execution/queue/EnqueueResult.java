package com.codeclass.backend.execution.queue;

/**
 * 큐 투입 결과.
 */
public final class EnqueueResult {
  public static final String OVERLOADED = "Execution queue overloaded";

  private static final EnqueueResult ACCEPTED = new EnqueueResult(true, null);

  private final boolean accepted;
  private final String reason;

  private EnqueueResult(boolean accepted, String reason) {
    this.accepted = accepted;
    this.reason = reason;
  }

  public static EnqueueResult accepted() {
    return ACCEPTED;
  }

  public static EnqueueResult rejected(String reason) {
    return new EnqueueResult(false, reason);
  }

  public boolean isAccepted() {
    return accepted;
  }

  public String getReason() {
    return reason;
  }
}
