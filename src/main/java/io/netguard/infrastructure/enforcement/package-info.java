/**
 * Override table adapters that apply block decisions to the local name-resolution configuration.
 * <p><strong>Role:</strong> Adapter behind {@code OverrideTable}.</p>
 * <p><strong>Concurrency:</strong> Callers serialize writes; the enforcement manager holds a lock around reconcile.</p>
 * <p><strong>Security:</strong> Requires elevated privileges on most systems; access failures surface as
 * {@code PermissionDeniedException} and are retried on the next reconcile tick.</p>
 */
package io.netguard.infrastructure.enforcement;
