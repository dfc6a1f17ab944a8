package com.codeclass.backend.execution.exception;

import java.time.Duration;
import java.util.Locale;

/**
 * 같은 attempt의 직전 Run 이후 최소 간격이 지나지 않았을 때.
 */
public class RunThrottledException extends RuntimeException {
  private final Duration remaining;

  public RunThrottledException(Duration throttle, Duration remaining) {
    super(String.format(Locale.ROOT, "Please wait %.1fs between runs (%.1fs remaining)",
            throttle.toMillis() / 1000.0, remaining.toMillis() / 1000.0));
    this.remaining = remaining;
  }

  public Duration getRemaining() {
    return remaining;
  }

  public double getRemainingSeconds() {
    return remaining.toMillis() / 1000.0;
  }
}
