package io.netguard.infrastructure.persistence;

import io.netguard.application.port.SettingsStore;
import io.netguard.domain.settings.MonitorSettings;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SettingsStore} backed by a {@code settings.properties} file.
 *
 * <p>Missing keys fall back to {@link MonitorSettings#defaults()}; out-of-range values are rejected with
 * {@link IllegalArgumentException} rather than silently clamped.</p>
 *
 * @since 0.1.0
 */
public final class PropertiesSettingsStore implements SettingsStore {
  private static final Logger log = LoggerFactory.getLogger(PropertiesSettingsStore.class);

  public static final String FILE_NAME = "settings.properties";
  static final String SENSITIVITY = "sensitivity";
  static final String DEV_MODE = "devMode";
  static final String MONITORING_ENABLED = "monitoringEnabled";

  private final Path file;

  public PropertiesSettingsStore(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
  }

  @Override
  public synchronized MonitorSettings load() throws IOException {
    MonitorSettings defaults = MonitorSettings.defaults();
    if (!Files.exists(file)) {
      return defaults;
    }
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    int sensitivity = parseInt(props.getProperty(SENSITIVITY), defaults.sensitivity());
    boolean devMode = parseBoolean(props.getProperty(DEV_MODE), defaults.devMode());
    boolean enabled = parseBoolean(props.getProperty(MONITORING_ENABLED), defaults.monitoringEnabled());
    MonitorSettings settings = new MonitorSettings(sensitivity, devMode, enabled);
    log.debug("Loaded settings {} from {}", settings, file);
    return settings;
  }

  @Override
  public synchronized void save(MonitorSettings settings) throws IOException {
    Objects.requireNonNull(settings, "settings");
    Properties props = new Properties();
    props.setProperty(SENSITIVITY, Integer.toString(settings.sensitivity()));
    props.setProperty(DEV_MODE, Boolean.toString(settings.devMode()));
    props.setProperty(MONITORING_ENABLED, Boolean.toString(settings.monitoringEnabled()));
    Files.createDirectories(file.getParent());
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      props.store(writer, "NetGuard monitor settings");
    }
  }

  private static int parseInt(String raw, int fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("sensitivity must be an integer (was " + raw + ")", ex);
    }
  }

  private static boolean parseBoolean(String raw, boolean fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String value = raw.trim().toLowerCase(Locale.ROOT);
    if (value.equals("true") || value.equals("false")) {
      return Boolean.parseBoolean(value);
    }
    throw new IllegalArgumentException("expected true or false but was " + raw);
  }
}
