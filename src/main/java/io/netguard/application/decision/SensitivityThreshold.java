package io.netguard.application.decision;

import io.netguard.validation.Numbers;

/**
 * Maps the 0 to 100 sensitivity dial to a block threshold: {@code t(s) = 0.95 - 0.90 * s / 100}.
 *
 * <p>Strictly decreasing, so raising sensitivity can only turn an allow into a block. Sensitivity 50 gives 0.50;
 * the extremes give 0.95 and 0.05 so neither end blocks or allows everything.</p>
 *
 * @since 0.1.0
 */
public final class SensitivityThreshold {
  static final double LEAST_SENSITIVE_THRESHOLD = 0.95;
  static final double THRESHOLD_SPAN = 0.90;

  private SensitivityThreshold() {
    // Utility
  }

  /**
   * @param sensitivity dial position, 0 to 100
   * @return block threshold in {@code [0.05, 0.95]}
   * @throws IllegalArgumentException if {@code sensitivity} is out of range
   */
  public static double forSensitivity(int sensitivity) {
    Numbers.requireRange("sensitivity", sensitivity, 0, 100);
    return LEAST_SENSITIVE_THRESHOLD - THRESHOLD_SPAN * sensitivity / 100.0;
  }
}
