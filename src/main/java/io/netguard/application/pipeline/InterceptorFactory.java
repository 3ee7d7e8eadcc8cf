package io.netguard.application.pipeline;

import io.netguard.application.port.CapturedTransactionListener;
import io.netguard.application.port.InterceptionErrorListener;
import io.netguard.application.port.TrafficInterceptor;

/**
 * Creates the dev-mode interceptor once its listeners exist.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface InterceptorFactory {
  TrafficInterceptor create(CapturedTransactionListener transactions, InterceptionErrorListener errors);
}
