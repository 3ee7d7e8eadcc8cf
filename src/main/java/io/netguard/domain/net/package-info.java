/**
 * Connection-level domain types produced by the sampler.
 * <p><strong>Role:</strong> Immutable snapshots shared between the sampler and the detection pipeline.</p>
 * <p><strong>Concurrency:</strong> Records are immutable and safe to publish across threads.</p>
 */
package io.netguard.domain.net;
