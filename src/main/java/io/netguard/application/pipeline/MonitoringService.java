package io.netguard.application.pipeline;

import io.netguard.application.classify.GamblingClassifier;
import io.netguard.application.classify.ValidationReport;
import io.netguard.application.decision.DecisionEngine;
import io.netguard.application.decision.StoreBackedOverrides;
import io.netguard.application.enforcement.EnforcementManager;
import io.netguard.application.enforcement.ReconcileResult;
import io.netguard.application.error.CaptureTimeoutException;
import io.netguard.application.error.InsufficientDataException;
import io.netguard.application.error.InterceptionException;
import io.netguard.application.port.AuditLog;
import io.netguard.application.port.BlockedSiteStore;
import io.netguard.application.port.ClockPort;
import io.netguard.application.port.ConnectionSource;
import io.netguard.application.port.ErrorRecorder;
import io.netguard.application.port.HostResolver;
import io.netguard.application.port.InterceptionErrorListener;
import io.netguard.application.port.MetricsPort;
import io.netguard.application.port.OverrideTable;
import io.netguard.application.port.SettingsStore;
import io.netguard.application.port.TrafficInterceptor;
import io.netguard.application.port.TransactionStore;
import io.netguard.application.sampling.ConnectionSampler;
import io.netguard.application.sampling.ReanalysisGate;
import io.netguard.domain.audit.AuditStatistics;
import io.netguard.domain.audit.DetectionLogEntry;
import io.netguard.domain.audit.DetectionQuery;
import io.netguard.domain.audit.DetectionSource;
import io.netguard.domain.audit.EnforcementAction;
import io.netguard.domain.audit.PipelineError;
import io.netguard.domain.capture.CapturedTransaction;
import io.netguard.domain.capture.HttpHeaders;
import io.netguard.domain.classify.ClassificationResult;
import io.netguard.domain.classify.Label;
import io.netguard.domain.classify.LabeledExample;
import io.netguard.domain.classify.ModelInfo;
import io.netguard.domain.decision.BlockDecision;
import io.netguard.domain.decision.DecisionReason;
import io.netguard.domain.decision.Verdict;
import io.netguard.domain.net.Connection;
import io.netguard.domain.settings.MonitorSettings;
import io.netguard.domain.site.BlockSource;
import io.netguard.domain.site.BlockedSite;
import io.netguard.domain.stats.MonitoringStats;
import io.netguard.infrastructure.exec.ExecutorFactories;
import io.netguard.validation.Net;
import io.netguard.validation.Strings;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> External facade of the monitor: lifecycle, block list management, settings, feedback and
 * audit queries.
 * <p><strong>Role:</strong> Owns the sampler, the detection pipeline, the periodic reconciliation tick and the
 * dev-mode interceptor. Dashboards and the CLI call only this class.</p>
 * <p><strong>Lifecycle:</strong> {@link #start()} and {@link #stop()} are idempotent. Stopping stops the interceptor
 * (draining in-flight exchanges), the sampler and the lanes, then runs a final reconciliation so the hosts file
 * matches the committed block list.</p>
 * <p><strong>Errors:</strong> Implements {@link ErrorRecorder}; every stage failure is logged and appended to the
 * audit log as a {@link PipelineError}. No capture or classification failure stops monitoring.</p>
 * <p><strong>Thread-safety:</strong> Lifecycle and settings mutations are synchronized. Block list and allow list
 * mutations share the pipeline's site lock, so an override never interleaves with an automatic block.</p>
 *
 * @since 0.1.0
 */
public final class MonitoringService implements ErrorRecorder, InterceptionErrorListener, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MonitoringService.class);

  private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000L;

  private final GamblingClassifier classifier;
  private final DecisionEngine decisions;
  private final EnforcementManager enforcement;
  private final BlockedSiteStore sites;
  private final AuditLog audit;
  private final TransactionStore transactions;
  private final SettingsStore settingsStore;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final MonitorOptions options;
  private final ReanalysisGate gate;
  private final DetectionPipeline pipeline;
  private final ConnectionSampler sampler;
  private final TrafficInterceptor interceptor;

  private final AtomicBoolean reconcilePending = new AtomicBoolean();
  private volatile MonitorSettings settings;
  private volatile ScheduledExecutorService ticks;
  private volatile boolean running;

  public MonitoringService(
      ConnectionSource connectionSource,
      HostResolver hostResolver,
      InterceptorFactory interceptorFactory,
      GamblingClassifier classifier,
      BlockedSiteStore sites,
      OverrideTable overrideTable,
      AuditLog audit,
      TransactionStore transactions,
      SettingsStore settingsStore,
      MonitorSettings initialSettings,
      ClockPort clock,
      MetricsPort metrics,
      MonitorOptions options) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.sites = Objects.requireNonNull(sites, "sites");
    this.audit = Objects.requireNonNull(audit, "audit");
    this.transactions = Objects.requireNonNull(transactions, "transactions");
    this.settingsStore = Objects.requireNonNull(settingsStore, "settingsStore");
    this.settings = Objects.requireNonNull(initialSettings, "initialSettings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.options = Objects.requireNonNull(options, "options");

    this.decisions = new DecisionEngine(
        new StoreBackedOverrides(sites), clock, options.observeBand(), initialSettings.sensitivity());
    this.enforcement = new EnforcementManager(
        overrideTable, sites, audit, clock, this.metrics, options.redirectAddress());
    this.gate = new ReanalysisGate(options.sampler().reanalysisWindow(), clock);
    this.pipeline = new DetectionPipeline(
        classifier, decisions, sites, audit, transactions, gate, this::requestReconcile, this, clock,
        this.metrics, options.pipeline());
    this.sampler = new ConnectionSampler(
        Objects.requireNonNull(connectionSource, "connectionSource"),
        Objects.requireNonNull(hostResolver, "hostResolver"),
        pipeline, this, clock, this.metrics, options.sampler());
    this.interceptor = Objects.requireNonNull(interceptorFactory, "interceptorFactory").create(pipeline, this);
  }

  /** Starts sampling, the lanes, the reconciliation tick and, in dev mode, the interceptor. */
  public synchronized void start() {
    if (running) {
      return;
    }
    pipeline.start();
    ticks = ExecutorFactories.newTickScheduler("netguard-reconcile",
        (t, ex) -> log.error("Reconcile thread {} crashed", t.getName(), ex));
    long period = options.reconcileInterval().toMillis();
    ticks.scheduleWithFixedDelay(this::reconcileTick, 0L, period, TimeUnit.MILLISECONDS);
    sampler.start();
    if (settings.devMode()) {
      startInterceptor();
    }
    running = true;
    log.info("Monitoring started (sensitivity {}, dev mode {}, model v{})",
        settings.sensitivity(), settings.devMode(), classifier.currentModel().version());
  }

  /** Stops all tasks and runs a final reconciliation. */
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    stopInterceptor();
    sampler.stop();
    pipeline.stop();
    ScheduledExecutorService scheduler = ticks;
    ticks = null;
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
          scheduler.shutdownNow();
          log.warn("Reconcile tick still running after {} ms", SHUTDOWN_TIMEOUT_MILLIS);
        }
      } catch (InterruptedException ie) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    try {
      enforcement.reconcile();
    } catch (IOException ex) {
      record("enforce", "", ex);
    }
    log.info("Monitoring stopped");
  }

  public boolean isRunning() {
    return running;
  }

  @Override
  public void close() {
    stop();
    sampler.close();
  }

  public MonitoringStats currentStats() {
    MonitorSettings current = settings;
    return new MonitoringStats(
        running,
        current.devMode(),
        sampler.connectionsObserved(),
        sampler.activeConnections(),
        pipeline.transactionsCaptured(),
        sites.active().size(),
        audit.statistics(clock.now()).totalDetections(),
        pipeline.lastClassificationAt(),
        classifier.currentModel().version(),
        current.sensitivity());
  }

  public List<DetectionLogEntry> listDetections(DetectionQuery query) {
    return audit.queryDetections(Objects.requireNonNull(query, "query"));
  }

  /**
   * Blocks a domain manually and removes it from the allow list.
   *
   * @param domain domain, host or URL
   * @param reason operator supplied reason
   * @return the active entry
   * @throws IOException if the block list cannot be persisted
   */
  public BlockedSite blockDomain(String domain, String reason) throws IOException {
    String normalized = Net.normalizeDomain(domain);
    String why = Strings.singleLine(reason);
    BlockedSite site;
    synchronized (pipeline.siteLock()) {
      sites.setAllowed(normalized, false);
      Optional<BlockedSite> existing = sites.find(normalized);
      if (existing.isPresent() && existing.get().active() && existing.get().source() == BlockSource.MANUAL) {
        site = existing.get();
      } else {
        site = BlockedSite.active(normalized, BlockSource.MANUAL, why.isEmpty() ? "manual" : why, clock.now());
        sites.save(site);
      }
    }
    recordManual(normalized, Verdict.BLOCK, DecisionReason.MANUAL_BLOCK);
    log.info("Manually blocked {}", normalized);
    requestReconcile();
    return site;
  }

  /**
   * Deactivates a domain's block and adds it to the allow list so the classifier cannot re-block it.
   *
   * @param domain domain, host or URL
   * @return {@code true} when an active block was deactivated
   * @throws IOException if the block list cannot be persisted
   */
  public boolean unblockDomain(String domain) throws IOException {
    String normalized = Net.normalizeDomain(domain);
    boolean deactivated = false;
    synchronized (pipeline.siteLock()) {
      Optional<BlockedSite> existing = sites.find(normalized);
      if (existing.isPresent() && existing.get().active()) {
        sites.save(existing.get().deactivate(clock.now()));
        deactivated = true;
      }
      sites.setAllowed(normalized, true);
    }
    recordManual(normalized, Verdict.ALLOW, DecisionReason.MANUAL_ALLOW);
    log.info("Manually unblocked {} (active block removed: {})", normalized, deactivated);
    requestReconcile();
    return deactivated;
  }

  public synchronized void setSensitivity(int sensitivity) throws IOException {
    decisions.setSensitivity(sensitivity);
    updateSettings(settings.withSensitivity(sensitivity));
    log.info("Sensitivity set to {} (threshold {})", sensitivity, decisions.threshold());
  }

  public int sensitivity() {
    return decisions.sensitivity();
  }

  /**
   * Enables or disables dev mode; while running the interceptor starts or stops immediately.
   *
   * @param enabled new dev mode flag
   * @throws IOException if the setting cannot be persisted
   */
  public synchronized void setDevMode(boolean enabled) throws IOException {
    updateSettings(settings.withDevMode(enabled));
    if (running) {
      if (enabled) {
        startInterceptor();
      } else {
        stopInterceptor();
      }
    }
    log.info("Dev mode {}", enabled ? "enabled" : "disabled");
  }

  public void submitFeedback(String domain, Label label) {
    classifier.submitFeedback(domain, label);
  }

  /**
   * Retrains the classifier with pending feedback and clears the re-analysis cache.
   *
   * @return new model version
   * @throws InsufficientDataException if the training set lacks a class; the current model stays live
   */
  public long retrain() throws InsufficientDataException {
    try {
      long version = classifier.retrain();
      gate.clear();
      return version;
    } catch (InsufficientDataException ex) {
      record("classify", "", ex);
      throw ex;
    }
  }

  /**
   * Reconciles the hosts file now.
   *
   * @return what changed
   * @throws IOException including {@link io.netguard.application.error.PermissionDeniedException}
   */
  public ReconcileResult reconcileNow() throws IOException {
    try {
      return enforcement.reconcile();
    } catch (IOException ex) {
      record("enforce", "", ex);
      throw ex;
    }
  }

  /**
   * Applies retention to the audit log and the transaction store.
   *
   * @param retention entries older than {@code now - retention} are removed
   * @return removal counts
   * @throws IOException if the audit log cannot be rewritten
   */
  public CleanupResult cleanup(Duration retention) throws IOException {
    Objects.requireNonNull(retention, "retention");
    if (retention.isNegative()) {
      throw new IllegalArgumentException("retention must not be negative");
    }
    Instant horizon = clock.now().minus(retention);
    Set<String> protectedDomains = new HashSet<>();
    for (BlockedSite site : sites.active()) {
      protectedDomains.add(site.domain());
    }
    int auditRemoved = audit.cleanup(horizon, protectedDomains);
    int txRemoved = transactions.purgeOlderThan(horizon);
    log.info("Cleanup before {} removed {} audit entries and {} transactions", horizon, auditRemoved, txRemoved);
    return new CleanupResult(auditRemoved, txRemoved);
  }

  public List<BlockedSite> exportBlockedSites() {
    return sites.all();
  }

  /**
   * Imports block list entries. Active entries activate their domain; inactive entries are kept as history only
   * for domains the store does not know yet.
   *
   * @param imported entries, typically from {@link #exportBlockedSites()}
   * @return number of entries written
   * @throws IOException if the block list cannot be persisted
   */
  public int importBlockedSites(List<BlockedSite> imported) throws IOException {
    Objects.requireNonNull(imported, "imported");
    int written = 0;
    synchronized (pipeline.siteLock()) {
      for (BlockedSite incoming : imported) {
        String domain = Net.normalizeDomain(incoming.domain());
        Optional<BlockedSite> existing = sites.find(domain);
        BlockedSite normalized = new BlockedSite(domain, incoming.source(), incoming.reason(),
            incoming.addedAt(), incoming.active(), incoming.deactivatedAt());
        if (incoming.active()) {
          if (existing.isEmpty() || !existing.get().active()) {
            sites.save(normalized);
            sites.setAllowed(domain, false);
            written++;
          }
        } else if (existing.isEmpty()) {
          sites.save(normalized);
          written++;
        }
      }
    }
    log.info("Imported {} of {} block list entries", written, imported.size());
    if (written > 0) {
      requestReconcile();
    }
    return written;
  }

  public Set<String> allowList() {
    return sites.allowList();
  }

  /**
   * Adds imported allow-list domains. Domains with an active block keep it; allowing them needs an explicit
   * {@link #unblockDomain(String)}.
   *
   * @param domains allow-listed domains, typically from {@link #allowList()}
   * @return number of domains newly allowed
   * @throws IOException if the block list cannot be persisted
   */
  public int importAllowList(Set<String> domains) throws IOException {
    Objects.requireNonNull(domains, "domains");
    int added = 0;
    synchronized (pipeline.siteLock()) {
      Set<String> current = sites.allowList();
      for (String raw : domains) {
        String domain = Net.normalizeDomain(raw);
        Optional<BlockedSite> existing = sites.find(domain);
        if (current.contains(domain) || (existing.isPresent() && existing.get().active())) {
          continue;
        }
        sites.setAllowed(domain, true);
        added++;
      }
    }
    log.info("Imported {} of {} allow list entries", added, domains.size());
    return added;
  }

  public List<Connection> listConnections() {
    return sampler.snapshot();
  }

  public List<CapturedTransaction> listTransactions(int limit) {
    return transactions.recent(limit);
  }

  public List<EnforcementAction> listEnforcementActions(int limit) {
    return audit.recentEnforcementActions(limit);
  }

  public List<PipelineError> listErrors(int limit) {
    return audit.recentErrors(limit);
  }

  /**
   * Classifies a URL without enforcement or audit.
   *
   * @param url absolute URL or host
   * @param headers response headers, may be {@code null}
   * @param body body excerpt, may be {@code null}
   * @return classification, would-be decision and threshold
   */
  public DryRunResult classify(String url, HttpHeaders headers, String body) {
    String domain = Net.normalizeDomain(url);
    String target = url.contains("://") ? url : "http://" + url;
    ClassificationResult result = classifier.classify(target, domain, target, headers, body);
    return new DryRunResult(result, decisions.decide(result), decisions.threshold());
  }

  public ModelInfo modelInfo() {
    return classifier.modelInfo();
  }

  /**
   * Scores a labelled corpus against the live model at the current sensitivity threshold.
   *
   * @param corpus labelled documents
   * @return confusion counts
   */
  public ValidationReport validate(List<LabeledExample> corpus) {
    return classifier.validate(corpus, decisions.threshold());
  }

  public AuditStatistics auditStatistics() {
    return audit.statistics(clock.now());
  }

  public MonitorSettings settings() {
    return settings;
  }

  @Override
  public void record(String stage, String domain, Throwable error) {
    String where = domain == null ? "" : domain;
    metrics.increment("errors." + stage);
    log.warn("{} failure{}: {}", stage, where.isEmpty() ? "" : " for " + where, String.valueOf(error.getMessage()));
    PipelineError entry = new PipelineError(
        UUID.randomUUID().toString(), stage, where, error.getClass().getSimpleName(),
        String.valueOf(error.getMessage()), clock.now());
    try {
      audit.appendError(entry);
    } catch (IOException ex) {
      log.error("Failed to audit {} failure", stage, ex);
    }
  }

  @Override
  public void onInterceptionError(InterceptionException error) {
    record("intercept", error.host(), error);
  }

  @Override
  public void onTimeout(String host, CaptureTimeoutException timeout) {
    record("intercept", host, timeout);
  }

  DetectionPipeline pipeline() {
    return pipeline;
  }

  ConnectionSampler sampler() {
    return sampler;
  }

  private void recordManual(String domain, Verdict verdict, DecisionReason reason) {
    try {
      String url = "http://" + domain;
      ClassificationResult result = classifier.classify(url, domain, url, null, null);
      BlockDecision decision = new BlockDecision(domain, verdict, reason, result.score(), false, clock.now());
      audit.appendDetection(new DetectionLogEntry(
          UUID.randomUUID().toString(), 0L, result, decision, DetectionSource.MANUAL, null, "", 0, clock.now()));
    } catch (IOException ex) {
      record("audit", domain, ex);
    }
  }

  private void requestReconcile() {
    ScheduledExecutorService scheduler = ticks;
    if (scheduler == null || !reconcilePending.compareAndSet(false, true)) {
      return;
    }
    try {
      scheduler.execute(() -> {
        reconcilePending.set(false);
        reconcileTick();
      });
    } catch (RejectedExecutionException ex) {
      reconcilePending.set(false);
      log.debug("Reconcile request ignored; monitor stopping");
    }
  }

  private void reconcileTick() {
    MDC.put("pipeline", "reconcile");
    try {
      enforcement.reconcile();
    } catch (IOException ex) {
      record("enforce", "", ex);
    } catch (RuntimeException ex) {
      log.error("Reconciliation failed", ex);
      record("enforce", "", ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void startInterceptor() {
    if (interceptor.isRunning()) {
      return;
    }
    try {
      interceptor.start();
      log.info("Traffic interceptor listening on {}", interceptor.address());
    } catch (IOException ex) {
      log.error("Traffic interceptor failed to start; continuing with connection metadata only", ex);
      record("intercept", "", ex);
    }
  }

  private void stopInterceptor() {
    if (interceptor.isRunning()) {
      interceptor.stop();
    }
  }

  private void updateSettings(MonitorSettings next) throws IOException {
    settings = next;
    settingsStore.save(next);
  }
}
