/**
 * Time adapters for {@code ClockPort}.
 * <p><strong>Concurrency:</strong> Stateless and thread-safe.</p>
 */
package io.netguard.infrastructure.time;
