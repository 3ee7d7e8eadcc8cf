package io.netguard.application.port;

import io.netguard.domain.net.SocketEntry;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Port that enumerates the host's current sockets.
 * <p><strong>Why:</strong> Keeps the sampler independent of the operating system's connection table format.</p>
 * <p><strong>Role:</strong> Implemented by {@code ProcNetConnectionSource} on Linux and
 * {@code DisabledConnectionSource} elsewhere.</p>
 * <p><strong>Thread-safety:</strong> Called from one sampler thread at a time.</p>
 * <p><strong>Performance:</strong> Each call may walk {@code /proc}; the sampler bounds it with a timeout.</p>
 *
 * @since 0.1.0
 */
public interface ConnectionSource {
  /**
   * Returns a snapshot of all sockets visible to this process, unfiltered.
   *
   * @return socket rows; never {@code null}
   * @throws IOException if the connection table cannot be read
   */
  List<SocketEntry> enumerate() throws IOException;

  /** @return short human readable name used in logs */
  default String name() {
    return getClass().getSimpleName();
  }
}
