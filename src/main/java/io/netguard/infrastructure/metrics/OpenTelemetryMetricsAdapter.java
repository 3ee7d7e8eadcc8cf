package io.netguard.infrastructure.metrics;

import io.netguard.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that publishes NetGuard counters and histograms through OpenTelemetry.
 * <p><strong>Why:</strong> Lets operators watch sampler, pipeline and enforcement health from any OTLP backend.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; safe for all worker threads.</p>
 * <p><strong>Observability:</strong> Each instrument carries a {@code netguard.metric.key} attribute holding the
 * unsanitised key.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("netguard.metric.key");
  private static final String FALLBACK_NAME = "netguard.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Attributes> attributes = new ConcurrentHashMap<>();

  /** Creates an adapter configured from {@code otel.*} properties or environment variables. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    String k = Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(k, this::counter).add(1, attributesFor(k));
  }

  @Override
  public void observe(String key, long value) {
    String k = Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(k, this::histogram).record(value, attributesFor(k));
  }

  /** Pushes buffered measurements to the exporter; used before a CLI command exits. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter counter(String key) {
    return meter.counterBuilder(sanitize(key)).setUnit("1").setDescription("NetGuard counter " + key).build();
  }

  private LongHistogram histogram(String key) {
    return meter.histogramBuilder(sanitize(key)).ofLongs().setDescription("NetGuard observation " + key).build();
  }

  private Attributes attributesFor(String key) {
    return attributes.computeIfAbsent(key, k -> Attributes.of(METRIC_KEY, k));
  }

  static String sanitize(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder out = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      out.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      out.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String name = out.toString();
    if (!name.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, name);
    }
    return name;
  }
}
