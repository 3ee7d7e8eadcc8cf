package io.netguard.application.port;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * <strong>What:</strong> Port controlling the dev-mode intercepting proxy.
 * <p><strong>Role:</strong> Implemented by {@code InterceptingProxy}; started and stopped by the monitoring service
 * when dev mode toggles.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #stop()} may be called from any thread; repeated
 * calls are no-ops.</p>
 *
 * @since 0.1.0
 */
public interface TrafficInterceptor {
  /**
   * Binds the listening socket and begins accepting clients.
   *
   * @throws IOException if the port cannot be bound or the certificate authority cannot be loaded
   */
  void start() throws IOException;

  /** Stops accepting clients and waits (bounded) for in-flight exchanges to finish. */
  void stop();

  boolean isRunning();

  /** @return bound address, or the configured address when not running */
  InetSocketAddress address();
}
