package io.netguard.application.sampling;

import io.netguard.validation.Numbers;
import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs for {@link ConnectionSampler}.
 *
 * @param pollInterval delay between sampling passes
 * @param idleTimeout how long a connection may be absent before it is reported closed
 * @param enumerationTimeout budget for one enumeration of the connection table
 * @param reanalysisWindow minimum time between two classifications of the same host
 * @since 0.1.0
 */
public record SamplerSettings(
    Duration pollInterval, Duration idleTimeout, Duration enumerationTimeout, Duration reanalysisWindow) {

  public SamplerSettings {
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(idleTimeout, "idleTimeout");
    Objects.requireNonNull(enumerationTimeout, "enumerationTimeout");
    Objects.requireNonNull(reanalysisWindow, "reanalysisWindow");
    Numbers.requireRange("pollInterval", pollInterval.toMillis(), 100, 3_600_000);
    Numbers.requireRange("idleTimeout", idleTimeout.toMillis(), 0, 86_400_000);
    Numbers.requireRange("enumerationTimeout", enumerationTimeout.toMillis(), 10, 3_600_000);
    Numbers.requireRange("reanalysisWindow", reanalysisWindow.toMillis(), 0, 86_400_000);
  }

  public static SamplerSettings defaults() {
    return new SamplerSettings(
        Duration.ofSeconds(2), Duration.ofSeconds(30), Duration.ofSeconds(2), Duration.ofMinutes(5));
  }
}
