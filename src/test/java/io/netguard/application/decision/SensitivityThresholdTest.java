package io.netguard.application.decision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SensitivityThresholdTest {

  @Test
  void mapsDialToThreshold() {
    assertEquals(0.95, SensitivityThreshold.forSensitivity(0), 1e-9);
    assertEquals(0.50, SensitivityThreshold.forSensitivity(50), 1e-9);
    assertEquals(0.05, SensitivityThreshold.forSensitivity(100), 1e-9);
    assertEquals(0.77, SensitivityThreshold.forSensitivity(20), 1e-9);
  }

  @Test
  void thresholdStrictlyDecreases() {
    for (int s = 1; s <= 100; s++) {
      assertTrue(SensitivityThreshold.forSensitivity(s) < SensitivityThreshold.forSensitivity(s - 1),
          "threshold must fall at sensitivity " + s);
    }
  }

  @Test
  void rejectsOutOfRangeDial() {
    assertThrows(IllegalArgumentException.class, () -> SensitivityThreshold.forSensitivity(-1));
    assertThrows(IllegalArgumentException.class, () -> SensitivityThreshold.forSensitivity(101));
  }
}
