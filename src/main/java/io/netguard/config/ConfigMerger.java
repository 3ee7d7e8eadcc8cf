package io.netguard.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges embedded defaults, YAML and CLI key/value pairs with precedence CLI &gt; YAML &gt; defaults, then checks the
 * cross-key rules a single {@link NetGuardConfig#fromMap(Map)} call cannot see.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration for one command.
   *
   * @param command CLI command being configured
   * @param yaml settings from the YAML file, if one was given
   * @param cli CLI key/value overrides; may be {@code null}
   * @param defaults embedded defaults for the command; may be {@code null}
   * @param warn receives one message per CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException if the merged values break a cross-key rule
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> fromYaml = yaml.orElse(Map.of());

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(fromYaml);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        if (fromYaml.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, value);
      });
    }

    validate(command, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String command, Map<String, String> effective) {
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }

    long poll = parseLong(effective.get("pollIntervalMs"), -1L);
    long enumeration = parseLong(effective.get("enumerationTimeoutMs"), -1L);
    if (poll > 0 && enumeration > poll) {
      throw new IllegalArgumentException(
          "enumerationTimeoutMs (" + enumeration + ") must not exceed pollIntervalMs (" + poll + ")");
    }

    String hosts = trim(effective.get("hostsFile"));
    if (!hosts.isEmpty() && Files.isDirectory(Path.of(hosts))) {
      throw new IllegalArgumentException("hostsFile must name a file, not a directory: " + hosts);
    }

    if ("monitor".equalsIgnoreCase(command)) {
      String proxyHost = trim(effective.get("proxyHost"));
      boolean loopback = proxyHost.isEmpty()
          || proxyHost.equalsIgnoreCase("localhost")
          || proxyHost.startsWith("127.")
          || proxyHost.equals("::1");
      if (!loopback && !parseBoolean(effective.get("allowRemoteProxy"), false)) {
        throw new IllegalArgumentException(
            "proxyHost " + proxyHost + " is not a loopback address; set allowRemoteProxy=true to acknowledge");
      }
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static long parseLong(String value, long fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      // NetGuardConfig.fromMap reports the malformed value with its allowed range.
      return fallback;
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
