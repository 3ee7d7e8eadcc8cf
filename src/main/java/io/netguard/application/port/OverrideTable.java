package io.netguard.application.port;

import io.netguard.application.error.PermissionDeniedException;
import java.io.IOException;

/**
 * <strong>What:</strong> Port over the host-resolution override table (the hosts file).
 * <p><strong>Why:</strong> The enforcement manager owns the managed-region format; this port only moves text so it
 * can be faked in tests without touching {@code /etc/hosts}.</p>
 * <p><strong>Thread-safety:</strong> Callers serialize access; the enforcement manager holds a lock around
 * read-modify-write cycles.</p>
 *
 * @since 0.1.0
 */
public interface OverrideTable {
  /**
   * Reads the whole table.
   *
   * @return current content, empty when the file does not exist
   * @throws IOException if the table cannot be read
   */
  String read() throws IOException;

  /**
   * Replaces the whole table.
   *
   * @param content new content
   * @throws PermissionDeniedException if the process lacks the privilege to write the table
   * @throws IOException for other write failures
   */
  void write(String content) throws IOException;

  /** @return location shown in logs and diagnostics */
  String describe();
}
