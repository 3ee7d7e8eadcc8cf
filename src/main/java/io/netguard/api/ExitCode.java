package io.netguard.api;

/**
 * <strong>What:</strong> Process exit codes shared by every NetGuard command.
 * <p><strong>Why:</strong> Scripts and service managers react to the numeric status, so each failure class keeps a
 * fixed value.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the command. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The hosts file could not be written; rerun with administrator rights. */
  PERMISSION_DENIED(6),
  /** The classifier could not be trained because a class had no examples. */
  INSUFFICIENT_DATA(7),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return numeric process status */
  public int code() {
    return code;
  }
}
