/**
 * <strong>Purpose:</strong> Ports defining the sampler -> classify -> decide -> enforce -> audit contracts.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces to
 * integrate the operating system, the filesystem and the network.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Security:</strong> Port boundaries assume domains already normalized by
 * {@link io.netguard.validation.Net#normalizeDomain(String)}.</p>
 *
 * @since 0.1.0
 */
package io.netguard.application.port;
