package io.netguard.application.error;

import java.time.Duration;

/**
 * Raised when a sampling pass or an intercepted exchange exceeds its time budget.
 *
 * @since 0.1.0
 */
public class CaptureTimeoutException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient Duration budget;

  public CaptureTimeoutException(String operation, Duration budget, Throwable cause) {
    super(operation + " exceeded " + budget.toMillis() + " ms", cause);
    this.budget = budget;
  }

  public Duration budget() {
    return budget;
  }
}
