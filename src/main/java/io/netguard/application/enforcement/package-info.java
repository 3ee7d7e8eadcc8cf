/**
 * <strong>Purpose:</strong> Enforcement stage mirroring the active block list into the hosts file.
 * <p><strong>Concurrency:</strong> Single writer; {@link io.netguard.application.enforcement.EnforcementManager}
 * serializes passes with a lock.</p>
 * <p><strong>Security:</strong> Only the delimited managed region is ever rewritten.</p>
 * <p><strong>Metrics:</strong> {@code enforce.*}.</p>
 *
 * @since 0.1.0
 */
package io.netguard.application.enforcement;
