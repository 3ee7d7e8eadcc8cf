package io.netguard.domain.decision;

import java.time.Instant;
import java.util.Objects;

/**
 * Verdict for one domain at one point in time. The latest decision for a domain wins.
 *
 * @param domain normalized domain
 * @param verdict block, allow or observe
 * @param reason classifier score or a manual override
 * @param score classifier score that was evaluated
 * @param conflict {@code true} when a manual allow suppressed what the classifier would have blocked
 * @param timestamp decision time
 * @since 0.1.0
 */
public record BlockDecision(
    String domain,
    Verdict verdict,
    DecisionReason reason,
    double score,
    boolean conflict,
    Instant timestamp) {

  public BlockDecision {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(verdict, "verdict");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(timestamp, "timestamp");
    if (conflict && reason != DecisionReason.MANUAL_ALLOW) {
      throw new IllegalArgumentException("conflict is only meaningful for manual allow decisions");
    }
  }

  public boolean blocks() {
    return verdict == Verdict.BLOCK;
  }
}
