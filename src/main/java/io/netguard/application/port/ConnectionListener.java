package io.netguard.application.port;

import io.netguard.domain.net.ConnectionEvent;

/** Receives connection events from the sampler, on the sampler thread. */
@FunctionalInterface
public interface ConnectionListener {
  void onConnectionEvent(ConnectionEvent event);
}
