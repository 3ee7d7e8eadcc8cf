package io.netguard.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the monitoring pipeline.
 * <p><strong>Why:</strong> Sampler idle eviction, re-analysis windows and audit retention all depend on time;
 * tests inject deterministic clocks.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads occur on sampler, lane and
 * proxy threads.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see io.netguard.infrastructure.time.SystemClockAdapter
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** @return current time as an {@link Instant} */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
