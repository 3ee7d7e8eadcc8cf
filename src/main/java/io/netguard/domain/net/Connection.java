package io.netguard.domain.net;

import java.time.Instant;
import java.util.Objects;

/**
 * Outbound connection observed by the connection sampler.
 *
 * <p>Instances are immutable snapshots; the sampler replaces an entry with {@link #touch(Instant)} on every poll
 * that still sees the socket.</p>
 *
 * @param remoteAddress literal remote IP address
 * @param remoteHost resolved host name, or the literal address when reverse lookup failed
 * @param remotePort remote TCP/UDP port
 * @param pid owning process id, or {@code -1} when unknown
 * @param processName owning process name, or empty when unknown
 * @param protocol transport protocol label ({@code tcp}, {@code tcp6})
 * @param firstSeen first poll that observed the connection
 * @param lastSeen most recent poll that observed the connection
 * @since 0.1.0
 */
public record Connection(
    String remoteAddress,
    String remoteHost,
    int remotePort,
    int pid,
    String processName,
    String protocol,
    Instant firstSeen,
    Instant lastSeen) {

  public Connection {
    Objects.requireNonNull(remoteAddress, "remoteAddress");
    remoteHost = remoteHost == null || remoteHost.isBlank() ? remoteAddress : remoteHost;
    if (remotePort < 0 || remotePort > 65_535) {
      throw new IllegalArgumentException("remotePort out of range: " + remotePort);
    }
    processName = processName == null ? "" : processName;
    Objects.requireNonNull(protocol, "protocol");
    Objects.requireNonNull(firstSeen, "firstSeen");
    Objects.requireNonNull(lastSeen, "lastSeen");
    if (lastSeen.isBefore(firstSeen)) {
      throw new IllegalArgumentException("lastSeen must not precede firstSeen");
    }
  }

  /**
   * Returns the identity used to diff consecutive polls.
   *
   * @return connection key
   */
  public ConnectionKey key() {
    return new ConnectionKey(remoteAddress, remotePort, pid, protocol);
  }

  /**
   * Returns a copy with {@code lastSeen} advanced to {@code now}.
   *
   * @param now poll timestamp
   * @return refreshed connection
   */
  public Connection touch(Instant now) {
    Instant effective = now.isBefore(lastSeen) ? lastSeen : now;
    return new Connection(
        remoteAddress, remoteHost, remotePort, pid, processName, protocol, firstSeen, effective);
  }
}
