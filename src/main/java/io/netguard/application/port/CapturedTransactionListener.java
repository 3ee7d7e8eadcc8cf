package io.netguard.application.port;

import io.netguard.domain.capture.CapturedTransaction;

/**
 * Receives every completed exchange from the intercepting proxy.
 *
 * <p>Invoked on the proxy's connection thread before the response is released to the client, so implementations
 * must hand work off quickly (the detection pipeline enqueues and returns).</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CapturedTransactionListener {
  void onTransaction(CapturedTransaction transaction);
}
