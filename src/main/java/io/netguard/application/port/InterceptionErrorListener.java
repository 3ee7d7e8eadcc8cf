package io.netguard.application.port;

import io.netguard.application.error.CaptureTimeoutException;
import io.netguard.application.error.InterceptionException;

/**
 * Receives failures from the intercepting proxy. Failures are isolated to the affected client connection.
 *
 * @since 0.1.0
 */
public interface InterceptionErrorListener {
  /**
   * Called when a session could not be intercepted (for example a TLS handshake rejected by the client).
   *
   * @param error failure with the target host attached
   */
  void onInterceptionError(InterceptionException error);

  /**
   * Called when an exchange exceeded the socket read timeout and its connection was closed.
   *
   * @param host target host, or empty when the request line was never read
   * @param timeout timeout failure
   */
  void onTimeout(String host, CaptureTimeoutException timeout);
}
