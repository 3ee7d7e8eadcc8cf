package io.netguard.config;

import io.netguard.application.classify.GamblingClassifier;
import io.netguard.application.classify.LexicalFeatureExtractor;
import io.netguard.application.classify.Lexicon;
import io.netguard.application.error.InsufficientDataException;
import io.netguard.application.pipeline.InterceptorFactory;
import io.netguard.application.pipeline.MonitoringService;
import io.netguard.application.port.ClockPort;
import io.netguard.application.port.ConnectionSource;
import io.netguard.application.port.MetricsPort;
import io.netguard.domain.classify.LabeledExample;
import io.netguard.domain.settings.MonitorSettings;
import io.netguard.infrastructure.enforcement.HostsFileOverrideTable;
import io.netguard.infrastructure.intercept.CertificateAuthority;
import io.netguard.infrastructure.intercept.InterceptingProxy;
import io.netguard.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.netguard.infrastructure.persistence.InMemoryTransactionStore;
import io.netguard.infrastructure.persistence.JsonBlockedSiteStore;
import io.netguard.infrastructure.persistence.JsonLinesAuditLog;
import io.netguard.infrastructure.persistence.JsonModelRepository;
import io.netguard.infrastructure.persistence.PropertiesSettingsStore;
import io.netguard.infrastructure.sampling.DisabledConnectionSource;
import io.netguard.infrastructure.sampling.ProcNetConnectionSource;
import io.netguard.infrastructure.sampling.ReverseDnsHostResolver;
import io.netguard.infrastructure.time.SystemClockAdapter;
import io.netguard.validation.Paths;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the monitoring service to concrete adapters.
 * <p><strong>Why:</strong> Keeps every {@code new} of an infrastructure class in one place so the CLI commands and
 * tests only deal with a {@link NetGuardConfig}.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning sampler, interceptor, classifier, enforcement and
 * audit.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the file-backed stores under {@link NetGuardConfig#dataDir()}.</li>
 *   <li>Pick the {@code /proc} connection source on Linux and a disabled source elsewhere.</li>
 *   <li>Bootstrap the classifier from the persisted model or the seed corpus.</li>
 *   <li>Build the dev-mode proxy with a lazily loaded root CA.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use from the CLI thread; {@link #close()} once at exit.</p>
 * <p><strong>Observability:</strong> Owns the {@link MetricsPort} shared by every component it builds.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final NetGuardConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;

  private JsonLinesAuditLog auditLog;
  private GamblingClassifier classifier;
  private MonitoringService service;
  private boolean closed;

  /**
   * Creates a root that exports metrics through OpenTelemetry.
   *
   * @param config validated configuration
   */
  public CompositionRoot(NetGuardConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), new SystemClockAdapter());
  }

  /**
   * Creates a root with explicit metrics and clock, used by tests.
   *
   * @param config validated configuration
   * @param metrics metrics sink shared by every component
   * @param clock time source shared by every component
   */
  public CompositionRoot(NetGuardConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public NetGuardConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  /**
   * Returns the classifier, loading the lexicon and bootstrapping the model on first call.
   *
   * @return ready classifier
   * @throws IOException if the lexicon, seed corpus or persisted model cannot be read
   * @throws InsufficientDataException if no model is persisted and the seed corpus lacks a class
   */
  public synchronized GamblingClassifier classifier() throws IOException, InsufficientDataException {
    if (classifier != null) {
      return classifier;
    }
    Path dataDir = dataDir();
    Lexicon lexicon = config.lexiconFile().isPresent()
        ? LexiconLoader.load(config.lexiconFile().get())
        : LexiconLoader.loadDefault();
    List<LabeledExample> seed = config.seedCorpusFile().isPresent()
        ? SeedCorpusLoader.load(config.seedCorpusFile().get())
        : SeedCorpusLoader.loadDefault();
    log.debug("Lexicon languages {}; seed corpus {} documents", lexicon.languages(), seed.size());
    GamblingClassifier created = new GamblingClassifier(
        new LexicalFeatureExtractor(lexicon),
        new JsonModelRepository(dataDir.resolve(JsonModelRepository.FILE_NAME)),
        clock,
        metrics);
    created.bootstrap(seed);
    classifier = created;
    return created;
  }

  /**
   * Returns the monitoring service, wiring it on first call. The service is not started.
   *
   * @return monitoring facade
   * @throws IOException if a store under the data directory cannot be opened
   * @throws InsufficientDataException if the classifier cannot be bootstrapped
   */
  public synchronized MonitoringService monitoringService() throws IOException, InsufficientDataException {
    if (service != null) {
      return service;
    }
    Path dataDir = dataDir();
    GamblingClassifier gamblingClassifier = classifier();
    JsonBlockedSiteStore sites = JsonBlockedSiteStore.open(dataDir.resolve(JsonBlockedSiteStore.FILE_NAME));
    auditLog = JsonLinesAuditLog.open(config.auditDir(), metrics);
    PropertiesSettingsStore settingsStore =
        new PropertiesSettingsStore(dataDir.resolve(PropertiesSettingsStore.FILE_NAME));
    MonitorSettings settings = settingsStore.load();
    log.info("Wiring monitor: data {}, hosts file {}, sensitivity {}, dev mode {}",
        dataDir, config.hostsFile(), settings.sensitivity(), settings.devMode());

    service = new MonitoringService(
        connectionSource(),
        new ReverseDnsHostResolver(clock),
        interceptorFactory(),
        gamblingClassifier,
        sites,
        new HostsFileOverrideTable(config.hostsFile()),
        auditLog,
        new InMemoryTransactionStore(config.transactionCapacity(), config.transactionMaxAge(), clock),
        settingsStore,
        settings,
        clock,
        metrics,
        config.monitorOptions());
    return service;
  }

  /** @return {@code /proc} source when readable, otherwise a source that reports nothing */
  ConnectionSource connectionSource() {
    ProcNetConnectionSource proc = new ProcNetConnectionSource();
    if (proc.isAvailable()) {
      return proc;
    }
    return new DisabledConnectionSource(
        "connection table not readable on " + System.getProperty("os.name", "this platform"));
  }

  InterceptorFactory interceptorFactory() {
    CertificateAuthority.Source authority =
        CertificateAuthority.lazy(config.caDir(), config.caPassword().toCharArray());
    InetSocketAddress bind = new InetSocketAddress(
        config.proxyAddress().getHostString(), config.proxyAddress().getPort());
    return (transactions, errors) -> new InterceptingProxy(
        bind, authority, transactions, errors, clock, metrics, config.socketTimeout(), config.drainTimeout());
  }

  private Path dataDir() {
    return Paths.requireWritableDir(config.dataDir(), true);
  }

  /** Stops the service if it was built and releases the audit files and the metrics exporter. */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (service != null) {
      service.close();
    }
    if (auditLog != null) {
      try {
        auditLog.close();
      } catch (IOException ex) {
        log.warn("Failed to close audit log", ex);
      }
    }
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
