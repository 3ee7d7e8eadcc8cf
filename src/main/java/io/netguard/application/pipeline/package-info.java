/**
 * <strong>Purpose:</strong> Detection pipeline lanes and the {@link io.netguard.application.pipeline.MonitoringService}
 * facade.
 * <p><strong>Pipeline role:</strong> Glue between sources (sampler, proxy) and the classify, decide, enforce and
 * audit stages.</p>
 * <p><strong>Concurrency:</strong> Per-domain ordering via hashed single-consumer lanes; lifecycle guarded by the
 * service monitor.</p>
 * <p><strong>Metrics:</strong> {@code pipeline.*}, {@code errors.*}.</p>
 *
 * @since 0.1.0
 */
package io.netguard.application.pipeline;
