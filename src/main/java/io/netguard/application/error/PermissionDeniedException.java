package io.netguard.application.error;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when the hosts override table cannot be written because the process lacks privileges.
 *
 * <p>The block list is left unchanged; the next reconciliation tick retries.</p>
 *
 * @since 0.1.0
 */
public class PermissionDeniedException extends IOException {
  private static final long serialVersionUID = 1L;

  private final transient Path target;

  public PermissionDeniedException(Path target, Throwable cause) {
    super("permission denied writing " + target + (cause == null ? "" : ": " + cause.getMessage()), cause);
    this.target = target;
  }

  /** @return file the write was attempted against */
  public Path target() {
    return target;
  }
}
