package io.netguard.application.error;

/**
 * Raised when training data lacks examples for a class; the previous model stays active.
 *
 * @since 0.1.0
 */
public class InsufficientDataException extends Exception {
  private static final long serialVersionUID = 1L;

  public InsufficientDataException(String message) {
    super(message);
  }
}
