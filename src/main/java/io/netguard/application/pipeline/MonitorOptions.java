package io.netguard.application.pipeline;

import io.netguard.application.decision.DecisionEngine;
import io.netguard.application.enforcement.EnforcementManager;
import io.netguard.application.sampling.SamplerSettings;
import io.netguard.validation.Numbers;
import io.netguard.validation.Strings;
import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for {@link MonitoringService} that are not operator settings.
 *
 * @param sampler sampler timing
 * @param pipeline lane layout
 * @param reconcileInterval period of the background reconciliation tick
 * @param observeBand width of the observe band below the block threshold
 * @param redirectAddress address blocked domains resolve to
 * @since 0.1.0
 */
public record MonitorOptions(
    SamplerSettings sampler,
    PipelineSettings pipeline,
    Duration reconcileInterval,
    double observeBand,
    String redirectAddress) {

  public MonitorOptions {
    Objects.requireNonNull(sampler, "sampler");
    Objects.requireNonNull(pipeline, "pipeline");
    Objects.requireNonNull(reconcileInterval, "reconcileInterval");
    Numbers.requireRange("reconcileInterval", reconcileInterval.toMillis(), 100, 86_400_000);
    Numbers.requireRange("observeBand", observeBand, 0.0, 1.0);
    redirectAddress = Strings.requireNonBlank("redirectAddress", redirectAddress);
  }

  public static MonitorOptions defaults() {
    return new MonitorOptions(
        SamplerSettings.defaults(),
        PipelineSettings.defaults(),
        Duration.ofSeconds(30),
        DecisionEngine.DEFAULT_OBSERVE_BAND,
        EnforcementManager.DEFAULT_REDIRECT_ADDRESS);
  }
}
