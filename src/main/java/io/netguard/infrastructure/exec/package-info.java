/**
 * Executor factories producing named, daemon-aware threads for lanes, ticks and proxy connections.
 *
 * @since 0.1.0
 */
package io.netguard.infrastructure.exec;
