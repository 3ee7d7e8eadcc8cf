package io.netguard.domain.net;

import java.util.Objects;

/**
 * Change notification produced when the sampler diffs two polls.
 *
 * @param type whether the connection appeared or expired
 * @param connection connection snapshot at the time of the event
 * @since 0.1.0
 */
public record ConnectionEvent(Type type, Connection connection) {
  public ConnectionEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(connection, "connection");
  }

  /** Event kinds emitted by the sampler. */
  public enum Type {
    /** First poll that saw the connection. */
    OPENED,
    /** Connection was absent for longer than the idle timeout. */
    CLOSED
  }

  public static ConnectionEvent opened(Connection connection) {
    return new ConnectionEvent(Type.OPENED, connection);
  }

  public static ConnectionEvent closed(Connection connection) {
    return new ConnectionEvent(Type.CLOSED, connection);
  }
}
