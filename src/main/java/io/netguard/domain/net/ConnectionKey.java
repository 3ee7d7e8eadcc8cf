package io.netguard.domain.net;

import java.util.Objects;

/**
 * Identity of an outbound socket across sampler polls.
 *
 * @param remoteAddress literal remote IP address
 * @param remotePort remote port
 * @param pid owning process id, {@code -1} when unknown
 * @param protocol transport protocol label
 * @since 0.1.0
 */
public record ConnectionKey(String remoteAddress, int remotePort, int pid, String protocol) {
  public ConnectionKey {
    Objects.requireNonNull(remoteAddress, "remoteAddress");
    Objects.requireNonNull(protocol, "protocol");
  }

  @Override
  public String toString() {
    return protocol + ":" + remoteAddress + ":" + remotePort + "/" + pid;
  }
}
