package io.netguard.domain.net;

import java.util.Objects;

/**
 * Raw socket row as enumerated by a {@code ConnectionSource}, before filtering and host resolution.
 *
 * @param protocol transport label ({@code tcp}, {@code tcp6})
 * @param localAddress local IP literal
 * @param localPort local port
 * @param remoteAddress remote IP literal
 * @param remotePort remote port, {@code 0} for listening sockets
 * @param state kernel socket state name such as {@code ESTABLISHED} or {@code LISTEN}
 * @param pid owning process id, {@code -1} when unknown
 * @param processName owning process name, empty when unknown
 * @since 0.1.0
 */
public record SocketEntry(
    String protocol,
    String localAddress,
    int localPort,
    String remoteAddress,
    int remotePort,
    String state,
    int pid,
    String processName) {

  public SocketEntry {
    Objects.requireNonNull(protocol, "protocol");
    Objects.requireNonNull(localAddress, "localAddress");
    Objects.requireNonNull(remoteAddress, "remoteAddress");
    state = state == null ? "" : state;
    processName = processName == null ? "" : processName;
  }

  /** @return {@code true} for listening sockets, which have no remote peer */
  public boolean listening() {
    return "LISTEN".equals(state) || remotePort == 0;
  }
}
