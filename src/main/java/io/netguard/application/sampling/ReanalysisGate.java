package io.netguard.application.sampling;

import io.netguard.application.port.ClockPort;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Admits a host for classification at most once per window. Browsers open many sockets to the same host; only
 * the first in each window is worth scoring. Admissions sweep expired hosts at most once per window, so the gate
 * stays bounded by the hosts seen within roughly two windows.
 *
 * @since 0.1.0
 */
public final class ReanalysisGate {
  private final Duration window;
  private final ClockPort clock;
  private final Map<String, Instant> lastAdmitted = new ConcurrentHashMap<>();
  private volatile Instant nextSweep;

  public ReanalysisGate(Duration window, ClockPort clock) {
    this.window = Objects.requireNonNull(window, "window");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.nextSweep = clock.now().plus(window);
  }

  /**
   * Returns {@code true} and records the admission when {@code host} was not admitted within the window.
   *
   * @param host host name
   * @return whether the caller should classify the host now
   */
  public boolean tryAdmit(String host) {
    Instant now = clock.now();
    if (!now.isBefore(nextSweep)) {
      nextSweep = now.plus(window);
      evictExpired();
    }
    boolean[] admitted = new boolean[1];
    lastAdmitted.compute(host, (key, previous) -> {
      if (previous == null || !now.isBefore(previous.plus(window))) {
        admitted[0] = true;
        return now;
      }
      return previous;
    });
    return admitted[0];
  }

  /** Drops entries older than the window so the map does not grow without bound. */
  public void evictExpired() {
    Instant cutoff = clock.now().minus(window);
    lastAdmitted.values().removeIf(ts -> ts.isBefore(cutoff));
  }

  /** Forgets every host, e.g. after a retrain so new models rescore immediately. */
  public void clear() {
    lastAdmitted.clear();
  }

  int size() {
    return lastAdmitted.size();
  }
}
