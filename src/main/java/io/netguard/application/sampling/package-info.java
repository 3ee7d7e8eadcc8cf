/**
 * <strong>Purpose:</strong> Connection sampling stage.
 * <p><strong>Concurrency:</strong> One tick thread owns the connection table; enumeration runs on a separate worker
 * so a hung {@code /proc} walk can be abandoned after its timeout.</p>
 * <p><strong>Metrics:</strong> {@code sampler.*}.</p>
 *
 * @since 0.1.0
 */
package io.netguard.application.sampling;
