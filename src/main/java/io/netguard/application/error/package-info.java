/**
 * Checked failures raised by NetGuard stages.
 * <p><strong>Observability:</strong> Every exception here is logged by the stage that catches it and recorded as a
 * {@link io.netguard.domain.audit.PipelineError} in the audit log.</p>
 *
 * @since 0.1.0
 */
package io.netguard.application.error;
