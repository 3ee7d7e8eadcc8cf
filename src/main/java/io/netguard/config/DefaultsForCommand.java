package io.netguard.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Flattened default key/value maps for each NetGuard CLI command.
 *
 * <p>Values come from {@link NetGuardConfig#defaults()} so the record stays the single source of truth.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForCommand {
  /** Commands understood by {@link #asFlatMap(String)}. */
  public static final Set<String> COMMANDS = Set.of("monitor", "classify", "sites", "detections", "cleanup");

  private DefaultsForCommand() {}

  /**
   * Returns common defaults merged with the defaults of {@code command}.
   *
   * @param command CLI command name
   * @return unmodifiable map of default values as strings
   * @throws IllegalArgumentException if the command is unknown
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    if (!COMMANDS.contains(normalized)) {
      throw new IllegalArgumentException("Unsupported command: " + command);
    }
    NetGuardConfig defaults = NetGuardConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>(common(defaults));
    if (normalized.equals("monitor")) {
      map.putAll(monitor(defaults));
    } else if (normalized.equals("cleanup")) {
      map.put("retentionDays", "30");
    }
    return Map.copyOf(map);
  }

  private static Map<String, String> common(NetGuardConfig defaults) {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("dataDir", defaults.dataDir().toString());
    map.put("hostsFile", defaults.hostsFile().toString());
    map.put("redirectAddress", defaults.redirectAddress());
    map.put("observeBand", Double.toString(defaults.observeBand()));
    map.put("lexicon", "");
    map.put("seedCorpus", "");
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return map;
  }

  private static Map<String, String> monitor(NetGuardConfig defaults) {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("pollIntervalMs", Long.toString(defaults.sampler().pollInterval().toMillis()));
    map.put("idleTimeoutMs", Long.toString(defaults.sampler().idleTimeout().toMillis()));
    map.put("enumerationTimeoutMs", Long.toString(defaults.sampler().enumerationTimeout().toMillis()));
    map.put("reanalysisWindowSec", Long.toString(defaults.sampler().reanalysisWindow().toSeconds()));
    map.put("laneCount", Integer.toString(defaults.pipeline().laneCount()));
    map.put("laneCapacity", Integer.toString(defaults.pipeline().laneCapacity()));
    map.put("reconcileIntervalMs", Long.toString(defaults.reconcileInterval().toMillis()));
    map.put("proxyHost", defaults.proxyAddress().getHostString());
    map.put("proxyPort", Integer.toString(defaults.proxyAddress().getPort()));
    map.put("allowRemoteProxy", "false");
    map.put("socketTimeoutMs", Long.toString(defaults.socketTimeout().toMillis()));
    map.put("drainTimeoutMs", Long.toString(defaults.drainTimeout().toMillis()));
    map.put("transactionCapacity", Integer.toString(defaults.transactionCapacity()));
    map.put("transactionMaxAgeMin", Long.toString(defaults.transactionMaxAge().toMinutes()));
    return map;
  }
}
