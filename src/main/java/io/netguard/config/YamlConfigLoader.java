package io.netguard.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a NetGuard YAML file and flattens the {@code common} section plus one command section into
 * dotted key/value pairs.
 *
 * <pre>
 * common:
 *   dataDir: /var/lib/netguard
 * monitor:
 *   pollIntervalMs: 1000
 *   proxyPort: 8888
 * </pre>
 *
 * <p>Command section values override {@code common}. Nested mappings flatten to dotted keys. Lists are
 * rejected.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and returns the flattened view for {@code command}.
   *
   * @param path YAML file
   * @param command CLI command whose section is merged over {@code common}
   * @return flattened map, or empty when the file does not exist
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the document is not a mapping of scalars
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(command, "command");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Object> root = mapping(document, "root");
    Map<String, String> flat = new LinkedHashMap<>();
    flattenSection(root, COMMON_SECTION, flat);
    flattenSection(root, command.trim().toLowerCase(Locale.ROOT), flat);
    return Optional.of(Map.copyOf(flat));
  }

  private static void flattenSection(Map<String, Object> root, String name, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (!entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name) || entry.getValue() == null) {
        continue;
      }
      flatten(mapping(entry.getValue(), name), "", target);
    }
  }

  static Map<String, Object> mapping(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(name, value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(mapping(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + composite);
      } else {
        target.put(composite, value == null ? "" : value.toString());
      }
    });
  }
}
