package io.netguard.application.decision;

import io.netguard.application.port.ClockPort;
import io.netguard.domain.classify.ClassificationResult;
import io.netguard.domain.decision.BlockDecision;
import io.netguard.domain.decision.DecisionReason;
import io.netguard.domain.decision.Verdict;
import io.netguard.validation.Numbers;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns a classification into a block, allow or observe verdict.
 * <p><strong>Priority:</strong>
 * <ol>
 *   <li>manual block, then manual allow, regardless of score;</li>
 *   <li>block when {@code score >= threshold(sensitivity)};</li>
 *   <li>observe when the score lies within the observe band below the threshold;</li>
 *   <li>allow otherwise.</li>
 * </ol>
 * <p>A manual allow that suppresses what would have been a classifier block is flagged as a conflict and logged at
 * WARN so operators can review it.</p>
 * <p><strong>Thread-safety:</strong> Sensitivity is volatile; {@link #decide} is safe from every lane.</p>
 *
 * @since 0.1.0
 */
public final class DecisionEngine {
  private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

  public static final double DEFAULT_OBSERVE_BAND = 0.10;

  private final ManualOverrides overrides;
  private final ClockPort clock;
  private final double observeBand;
  private volatile int sensitivity;

  public DecisionEngine(ManualOverrides overrides, ClockPort clock, double observeBand, int sensitivity) {
    this.overrides = Objects.requireNonNull(overrides, "overrides");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.observeBand = Numbers.requireRange("observeBand", observeBand, 0.0, 1.0);
    this.sensitivity = (int) Numbers.requireRange("sensitivity", sensitivity, 0, 100);
  }

  public int sensitivity() {
    return sensitivity;
  }

  public void setSensitivity(int value) {
    this.sensitivity = (int) Numbers.requireRange("sensitivity", value, 0, 100);
  }

  public ManualOverrides overrides() {
    return overrides;
  }

  public double threshold() {
    return SensitivityThreshold.forSensitivity(sensitivity);
  }

  /**
   * Decides on one classification.
   *
   * @param result classifier output
   * @return decision timestamped now
   */
  public BlockDecision decide(ClassificationResult result) {
    Objects.requireNonNull(result, "result");
    String domain = result.domain();
    double score = result.score();
    double threshold = threshold();
    boolean classifierBlocks = score >= threshold;

    if (overrides.isManuallyBlocked(domain)) {
      return new BlockDecision(domain, Verdict.BLOCK, DecisionReason.MANUAL_BLOCK, score, false, clock.now());
    }
    if (overrides.isManuallyAllowed(domain)) {
      if (classifierBlocks) {
        log.warn("Manual allow overrides classifier block for {} (score {} >= threshold {}, model v{})",
            domain, format(score), format(threshold), result.modelVersion());
      }
      return new BlockDecision(
          domain, Verdict.ALLOW, DecisionReason.MANUAL_ALLOW, score, classifierBlocks, clock.now());
    }
    Verdict verdict;
    if (classifierBlocks) {
      verdict = Verdict.BLOCK;
    } else if (score >= threshold - observeBand) {
      verdict = Verdict.OBSERVE;
    } else {
      verdict = Verdict.ALLOW;
    }
    return new BlockDecision(domain, verdict, DecisionReason.CLASSIFIER, score, false, clock.now());
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }
}
