/**
 * Audit log record types: detections, enforcement actions and pipeline errors, plus query and statistics shapes.
 * <p><strong>Concurrency:</strong> Immutable records; the audit log adapter owns ordering.</p>
 *
 * @since 0.1.0
 */
package io.netguard.domain.audit;
