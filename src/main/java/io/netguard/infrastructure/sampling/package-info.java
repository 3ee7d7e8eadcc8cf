/**
 * Connection enumeration and reverse-DNS adapters used by the connection sampler.
 * <p><strong>Role:</strong> Adapters behind {@code ConnectionSource} and {@code HostResolver}.</p>
 * <p><strong>Concurrency:</strong> Sources are called from the sampler's single enumeration thread; the resolver
 * cache is concurrent.</p>
 * <p><strong>Security:</strong> Read-only access to procfs; no packet capture and no payload inspection.</p>
 */
package io.netguard.infrastructure.sampling;
