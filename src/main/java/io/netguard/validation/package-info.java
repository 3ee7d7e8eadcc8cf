/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Domain support for the sampler, decision, and enforcement stages; ensures
 * invalid inputs are rejected before adapters allocate sockets or rewrite the hosts file.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Domain normalization rejects whitespace and control characters so a crafted name
 * cannot inject extra lines into the hosts file.
 *
 * @since 0.1.0
 */
package io.netguard.validation;
