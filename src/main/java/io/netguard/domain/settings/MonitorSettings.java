package io.netguard.domain.settings;

/**
 * Operator settings that survive restarts.
 *
 * @param sensitivity detection sensitivity, 0 (least) to 100 (most)
 * @param devMode whether the intercepting proxy runs while monitoring
 * @param monitoringEnabled whether monitoring starts automatically
 * @since 0.1.0
 */
public record MonitorSettings(int sensitivity, boolean devMode, boolean monitoringEnabled) {
  public static final int DEFAULT_SENSITIVITY = 50;

  public MonitorSettings {
    if (sensitivity < 0 || sensitivity > 100) {
      throw new IllegalArgumentException("sensitivity must be between 0 and 100 (was " + sensitivity + ")");
    }
  }

  public static MonitorSettings defaults() {
    return new MonitorSettings(DEFAULT_SENSITIVITY, false, true);
  }

  public MonitorSettings withSensitivity(int value) {
    return new MonitorSettings(value, devMode, monitoringEnabled);
  }

  public MonitorSettings withDevMode(boolean value) {
    return new MonitorSettings(sensitivity, value, monitoringEnabled);
  }

  public MonitorSettings withMonitoringEnabled(boolean value) {
    return new MonitorSettings(sensitivity, devMode, value);
  }
}
