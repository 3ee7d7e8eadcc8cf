/**
 * Dev-mode HTTP/HTTPS intercepting proxy and its local certificate authority.
 * <p><strong>Role:</strong> Adapter behind {@code TrafficInterceptor}; feeds {@code CapturedTransaction}s to the
 * detection pipeline.</p>
 * <p><strong>Concurrency:</strong> One accept thread plus one pooled thread per client connection.</p>
 * <p><strong>Metrics:</strong> Emits {@code intercept.*} counters.</p>
 * <p><strong>Security:</strong> Binds to loopback by default. The root CA private key stays in the local PKCS#12
 * keystore; only the public certificate is exported.</p>
 */
package io.netguard.infrastructure.intercept;
