package io.netguard.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies the telemetry keys of a command's configuration into the {@code otel.*} system properties read by the
 * OpenTelemetry bootstrap, removing them from the map.
 *
 * <p>Keys: {@code metricsExporter} ({@code otlp}|{@code none}), {@code otelEndpoint} (http or https URL),
 * {@code otelResourceAttributes} ({@code k=v,...}) and {@code metricsIntervalMs}.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    String exporter = trimmed(args.remove("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty()) {
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
      System.setProperty("otel.metrics.exporter", exporter);
    }

    String endpoint = trimmed(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String attributes = trimmed(args.remove("otelResourceAttributes"));
    if (!attributes.isEmpty()) {
      requirePrintableAscii("otelResourceAttributes", attributes);
      System.setProperty("otel.resource.attributes", attributes);
    }

    String interval = trimmed(args.remove("metricsIntervalMs"));
    if (!interval.isEmpty()) {
      try {
        long millis = Long.parseLong(interval);
        if (millis < 1_000 || millis > 3_600_000) {
          throw new IllegalArgumentException("metricsIntervalMs must be between 1000 and 3600000");
        }
        System.setProperty("otel.metric.export.interval", Long.toString(millis));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("metricsIntervalMs must be an integer", ex);
      }
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static void requirePrintableAscii(String name, String value) {
    if (value.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
      throw new IllegalArgumentException(name + " must be at most " + MAX_RESOURCE_ATTRIBUTES_LENGTH + " characters");
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(name + " must be printable ASCII");
      }
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
