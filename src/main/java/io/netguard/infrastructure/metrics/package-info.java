/**
 * Metrics adapters bridging {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Thread-safe; instruments are cached per metric key.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code sampler.*}, {@code intercept.*}, {@code pipeline.*},
 * {@code enforce.*}, {@code classifier.*} and {@code audit.*} namespaces.</p>
 * <p><strong>Security:</strong> Only counters and durations are exported, never domains or payloads.</p>
 */
package io.netguard.infrastructure.metrics;
