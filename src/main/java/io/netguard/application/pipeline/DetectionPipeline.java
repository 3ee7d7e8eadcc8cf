package io.netguard.application.pipeline;

import io.netguard.application.classify.GamblingClassifier;
import io.netguard.application.decision.DecisionEngine;
import io.netguard.application.port.AuditLog;
import io.netguard.application.port.BlockedSiteStore;
import io.netguard.application.port.CapturedTransactionListener;
import io.netguard.application.port.ClockPort;
import io.netguard.application.port.ConnectionListener;
import io.netguard.application.port.ErrorRecorder;
import io.netguard.application.port.MetricsPort;
import io.netguard.application.port.TransactionStore;
import io.netguard.application.sampling.ReanalysisGate;
import io.netguard.domain.audit.DetectionLogEntry;
import io.netguard.domain.capture.CapturedTransaction;
import io.netguard.domain.classify.ClassificationResult;
import io.netguard.domain.decision.BlockDecision;
import io.netguard.domain.decision.DecisionReason;
import io.netguard.domain.decision.Verdict;
import io.netguard.domain.net.Connection;
import io.netguard.domain.net.ConnectionEvent;
import io.netguard.domain.site.BlockSource;
import io.netguard.domain.site.BlockedSite;
import io.netguard.infrastructure.exec.ExecutorFactories;
import io.netguard.validation.Net;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Connects the evidence sources to classify, decide, enforce and audit.
 * <p><strong>Why:</strong> Sources run on sampler and proxy threads that must not block on classification or file
 * IO; the pipeline hands work to lanes and returns immediately.</p>
 * <p><strong>Ordering:</strong> A domain always hashes to the same single-consumer lane, so decisions for one
 * domain are applied in arrival order while different domains proceed in parallel.</p>
 * <p><strong>Backpressure:</strong> Lanes are bounded; a full lane drops the item with a WARN and the
 * {@code pipeline.lane.dropped} counter.</p>
 * <p><strong>Failure handling:</strong> Every failure is recorded through the {@link ErrorRecorder}; no failure
 * stops a lane.</p>
 *
 * @since 0.1.0
 */
public final class DetectionPipeline implements ConnectionListener, CapturedTransactionListener, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DetectionPipeline.class);

  private static final long WORKER_IDLE_POLL_MILLIS = 25L;
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final int DROP_LOG_EVERY = 1_000;

  private final GamblingClassifier classifier;
  private final DecisionEngine decisions;
  private final BlockedSiteStore sites;
  private final AuditLog audit;
  private final TransactionStore transactions;
  private final ReanalysisGate gate;
  private final Runnable reconcileRequest;
  private final ErrorRecorder errors;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final PipelineSettings settings;

  private final List<BlockingQueue<DetectionWork>> lanes;
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicInteger dropCount = new AtomicInteger();
  private final AtomicLong transactionsCaptured = new AtomicLong();
  private final AtomicReference<Instant> lastClassificationAt = new AtomicReference<>();
  private final Object siteLock = new Object();

  private volatile ExecutorService laneExecutor;

  public DetectionPipeline(
      GamblingClassifier classifier,
      DecisionEngine decisions,
      BlockedSiteStore sites,
      AuditLog audit,
      TransactionStore transactions,
      ReanalysisGate gate,
      Runnable reconcileRequest,
      ErrorRecorder errors,
      ClockPort clock,
      MetricsPort metrics,
      PipelineSettings settings) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.decisions = Objects.requireNonNull(decisions, "decisions");
    this.sites = Objects.requireNonNull(sites, "sites");
    this.audit = Objects.requireNonNull(audit, "audit");
    this.transactions = Objects.requireNonNull(transactions, "transactions");
    this.gate = Objects.requireNonNull(gate, "gate");
    this.reconcileRequest = Objects.requireNonNull(reconcileRequest, "reconcileRequest");
    this.errors = Objects.requireNonNull(errors, "errors");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.settings = Objects.requireNonNull(settings, "settings");
    List<BlockingQueue<DetectionWork>> queues = new ArrayList<>(settings.laneCount());
    for (int i = 0; i < settings.laneCount(); i++) {
      queues.add(new ArrayBlockingQueue<>(settings.laneCapacity()));
    }
    this.lanes = List.copyOf(queues);
  }

  /** Starts one worker per lane; a no-op when already started. */
  public synchronized void start() {
    if (laneExecutor != null) {
      return;
    }
    stopRequested.set(false);
    dropCount.set(0);
    transactionsCaptured.set(0);
    laneExecutor = ExecutorFactories.newLanePool(settings.laneCount(), "netguard-lane",
        (t, ex) -> log.error("Lane thread {} crashed", t.getName(), ex));
    for (int i = 0; i < lanes.size(); i++) {
      laneExecutor.execute(new LaneWorker(i));
    }
    log.info("Detection pipeline started with {} lanes of capacity {}",
        settings.laneCount(), settings.laneCapacity());
  }

  /** Stops accepting work, drains queued items and waits for lanes to finish; a no-op when stopped. */
  public synchronized void stop() {
    ExecutorService executor = laneExecutor;
    if (executor == null) {
      return;
    }
    stopRequested.set(true);
    executor.shutdown();
    boolean terminated = false;
    try {
      terminated = executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        metrics.increment("pipeline.shutdown.force");
        log.warn("Pipeline lanes active after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
        terminated = executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      metrics.increment("pipeline.shutdown.interrupted");
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      log.error("Pipeline lanes failed to terminate cleanly");
    }
    laneExecutor = null;
    log.info("Detection pipeline stopped");
  }

  public boolean isRunning() {
    return laneExecutor != null;
  }

  @Override
  public void close() {
    stop();
  }

  @Override
  public void onConnectionEvent(ConnectionEvent event) {
    if (event.type() != ConnectionEvent.Type.OPENED) {
      return;
    }
    Connection connection = event.connection();
    String host = connection.remoteHost();
    if (host.equals(connection.remoteAddress())) {
      metrics.increment("pipeline.connection.unresolved");
      log.debug("Skipping unresolved peer {}", host);
      return;
    }
    Optional<String> domain = normalize(host);
    if (domain.isEmpty() || !gate.tryAdmit(domain.get())) {
      metrics.increment("pipeline.connection.deduplicated");
      return;
    }
    enqueue(DetectionWork.forConnection(domain.get(), host));
  }

  @Override
  public void onTransaction(CapturedTransaction transaction) {
    transactionsCaptured.incrementAndGet();
    transactions.add(transaction);
    Optional<String> domain;
    try {
      domain = normalize(Net.hostOf(transaction.requestUrl()));
    } catch (IllegalArgumentException ex) {
      log.debug("Skipping transaction {} with unusable URL {}", transaction.id(), transaction.requestUrl());
      return;
    }
    domain.ifPresent(d -> enqueue(DetectionWork.forTransaction(d, transaction)));
  }

  /**
   * Classifies, decides, enforces and audits one item on the calling thread.
   *
   * @param work item to process
   * @return the appended log entry, or empty when processing failed (the failure is recorded)
   */
  public Optional<DetectionLogEntry> process(DetectionWork work) {
    try {
      ClassificationResult result =
          classifier.classify(work.url(), work.domain(), work.url(), work.headers(), work.body());
      lastClassificationAt.set(result.timestamp());
      BlockDecision decision = decisions.decide(result);
      metrics.increment("pipeline.verdict." + decision.verdict().name().toLowerCase(Locale.ROOT));
      if (decision.verdict() == Verdict.BLOCK && decision.reason() == DecisionReason.CLASSIFIER
          && !activateAutoBlock(decision, result.modelVersion())) {
        decision = new BlockDecision(
            decision.domain(), Verdict.ALLOW, DecisionReason.MANUAL_ALLOW, decision.score(), true,
            decision.timestamp());
      }
      CapturedTransaction tx = work.transaction();
      DetectionLogEntry entry = new DetectionLogEntry(
          UUID.randomUUID().toString(),
          0L,
          result,
          decision,
          work.source(),
          tx == null ? null : tx.id(),
          tx == null ? "" : tx.method(),
          tx == null ? 0 : tx.statusCode(),
          clock.now());
      DetectionLogEntry stored = audit.appendDetection(entry);
      metrics.increment("pipeline.processed");
      return Optional.of(stored);
    } catch (IOException | RuntimeException ex) {
      metrics.increment("pipeline.process.error");
      errors.record("pipeline", work.domain(), ex);
      return Optional.empty();
    }
  }

  /** @return time of the most recent classification, or {@code null} */
  public Instant lastClassificationAt() {
    return lastClassificationAt.get();
  }

  /** @return transactions received since the lanes were last started */
  public long transactionsCaptured() {
    return transactionsCaptured.get();
  }

  /** @return items currently queued across all lanes */
  public int queuedItems() {
    int total = 0;
    for (BlockingQueue<DetectionWork> lane : lanes) {
      total += lane.size();
    }
    return total;
  }

  /** Lock serializing block list mutations between the lanes and operator overrides. */
  Object siteLock() {
    return siteLock;
  }

  int laneFor(String domain) {
    return Math.floorMod(domain.hashCode(), lanes.size());
  }

  /**
   * Stores an automatic block unless the operator allow-listed the domain after the decision was taken.
   *
   * @return {@code false} when a manual allow now covers the domain and nothing was stored
   */
  private boolean activateAutoBlock(BlockDecision decision, long modelVersion) throws IOException {
    String domain = decision.domain();
    synchronized (siteLock) {
      if (decisions.overrides().isManuallyAllowed(domain)) {
        metrics.increment("pipeline.autoblock.suppressed");
        log.warn("Manual allow overrides classifier block for {} (allowed while classifying)", domain);
        return false;
      }
      Optional<BlockedSite> existing = sites.find(domain);
      if (existing.isPresent() && existing.get().active()) {
        return true;
      }
      String reason = String.format(Locale.ROOT, "classifier score %.3f (model v%d)", decision.score(), modelVersion);
      sites.save(BlockedSite.active(domain, BlockSource.AUTO, reason, decision.timestamp()));
    }
    metrics.increment("pipeline.autoblock");
    log.info("Auto-blocked {} (score {})", domain, String.format(Locale.ROOT, "%.3f", decision.score()));
    reconcileRequest.run();
    return true;
  }

  private void enqueue(DetectionWork work) {
    if (laneExecutor == null || stopRequested.get()) {
      metrics.increment("pipeline.enqueue.rejected");
      log.debug("Pipeline not running; dropping work for {}", work.domain());
      return;
    }
    BlockingQueue<DetectionWork> lane = lanes.get(laneFor(work.domain()));
    if (lane.offer(work)) {
      metrics.increment("pipeline.enqueued");
      return;
    }
    metrics.increment("pipeline.lane.dropped");
    int drops = dropCount.incrementAndGet();
    if (drops == 1 || drops % DROP_LOG_EVERY == 0) {
      log.warn("Lane {} full (capacity {}); dropped work for {} ({} drops so far)",
          laneFor(work.domain()), settings.laneCapacity(), work.domain(), drops);
    }
  }

  private Optional<String> normalize(String host) {
    try {
      return Optional.of(Net.normalizeDomain(host));
    } catch (IllegalArgumentException ex) {
      metrics.increment("pipeline.domain.invalid");
      log.debug("Skipping host {}: {}", host, ex.getMessage());
      return Optional.empty();
    }
  }

  private final class LaneWorker implements Runnable {
    private final int index;

    LaneWorker(int index) {
      this.index = index;
    }

    @Override
    public void run() {
      BlockingQueue<DetectionWork> queue = lanes.get(index);
      MDC.put("pipeline", "lane-" + index);
      try {
        while (true) {
          if (stopRequested.get() && queue.isEmpty()) {
            break;
          }
          DetectionWork work = queue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (work != null) {
            process(work);
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (!stopRequested.get()) {
          metrics.increment("pipeline.lane.interrupted");
        }
      } finally {
        MDC.remove("pipeline");
      }
    }
  }
}
