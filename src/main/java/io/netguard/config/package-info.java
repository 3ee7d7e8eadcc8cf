/**
 * Configuration record, YAML and lexicon loaders, and the composition root for the NetGuard CLI.
 * <p><strong>Role:</strong> Bootstrap layer translating merged key/value settings into a wired
 * {@link io.netguard.application.pipeline.MonitoringService}.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; the composition root is used from one thread.</p>
 * <p><strong>Security:</strong> The CA keystore password is redacted from {@code toString()}; a non-loopback proxy
 * bind address needs an explicit acknowledgement.</p>
 */
package io.netguard.config;
