package io.netguard.application.port;

import io.netguard.domain.settings.MonitorSettings;
import java.io.IOException;

/** Persists {@link MonitorSettings}; a missing store yields {@link MonitorSettings#defaults()}. */
public interface SettingsStore {
  MonitorSettings load() throws IOException;

  void save(MonitorSettings settings) throws IOException;
}
