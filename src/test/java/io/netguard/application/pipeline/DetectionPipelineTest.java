package io.netguard.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.application.classify.GamblingClassifier;
import io.netguard.application.decision.DecisionEngine;
import io.netguard.application.decision.ManualOverrides;
import io.netguard.application.decision.StoreBackedOverrides;
import io.netguard.application.port.ModelRepository;
import io.netguard.application.sampling.ReanalysisGate;
import io.netguard.domain.audit.DetectionLogEntry;
import io.netguard.domain.audit.DetectionQuery;
import io.netguard.domain.audit.DetectionSource;
import io.netguard.domain.capture.CapturedTransaction;
import io.netguard.domain.capture.HttpHeaders;
import io.netguard.domain.decision.DecisionReason;
import io.netguard.domain.decision.Verdict;
import io.netguard.domain.net.Connection;
import io.netguard.domain.net.ConnectionEvent;
import io.netguard.domain.site.BlockSource;
import io.netguard.domain.site.BlockedSite;
import io.netguard.infrastructure.persistence.InMemoryTransactionStore;
import io.netguard.infrastructure.persistence.JsonBlockedSiteStore;
import io.netguard.infrastructure.persistence.JsonLinesAuditLog;
import io.netguard.testing.ManualClock;
import io.netguard.testing.RecordingMetrics;
import io.netguard.testing.TestCorpus;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DetectionPipelineTest {
  private static final String GAMBLING_BODY = "live casino jackpot roulette poker betting casino jackpot";

  @TempDir
  Path dataDir;

  private final ManualClock clock = new ManualClock();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final AtomicInteger reconcileRequests = new AtomicInteger();
  private final List<String> errorStages = new CopyOnWriteArrayList<>();
  private JsonBlockedSiteStore sites;
  private JsonLinesAuditLog audit;
  private InMemoryTransactionStore transactions;
  private GamblingClassifier classifier;
  private DetectionPipeline pipeline;

  @BeforeEach
  void setUp() throws Exception {
    classifier = new GamblingClassifier(TestCorpus.extractor(), ModelRepository.NONE, clock,
        metrics);
    classifier.bootstrap(TestCorpus.seed());
    sites = JsonBlockedSiteStore.open(dataDir.resolve(JsonBlockedSiteStore.FILE_NAME));
    audit = JsonLinesAuditLog.open(dataDir, metrics);
    transactions = new InMemoryTransactionStore(100, Duration.ofHours(1), clock);
    DecisionEngine decisions = new DecisionEngine(new StoreBackedOverrides(sites), clock, 0.10, 50);
    pipeline = new DetectionPipeline(classifier, decisions, sites, audit, transactions,
        new ReanalysisGate(Duration.ofMinutes(5), clock), reconcileRequests::incrementAndGet,
        (stage, domain, error) -> errorStages.add(stage), clock, metrics, new PipelineSettings(2, 8));
  }

  @AfterEach
  void tearDown() throws Exception {
    pipeline.stop();
    audit.close();
  }

  @Test
  void gamblingTransactionIsAutoBlockedAndAudited() throws Exception {
    CapturedTransaction tx = transaction("tx-1", "https://casino-jackpot.example/lobby", GAMBLING_BODY);

    DetectionLogEntry entry = pipeline.process(DetectionWork.forTransaction("casino-jackpot.example", tx))
        .orElseThrow();

    assertEquals(Verdict.BLOCK, entry.decision().verdict());
    assertEquals(DecisionReason.CLASSIFIER, entry.decision().reason());
    assertEquals(DetectionSource.INTERCEPT, entry.source());
    assertEquals("tx-1", entry.transactionId());
    assertEquals(1L, entry.sequence());
    BlockedSite site = sites.find("casino-jackpot.example").orElseThrow();
    assertTrue(site.active());
    assertEquals(BlockSource.AUTO, site.source());
    assertTrue(site.reason().startsWith("classifier score"));
    assertEquals(1, reconcileRequests.get());
    assertEquals(clock.now(), pipeline.lastClassificationAt());
  }

  @Test
  void repeatedBlockDoesNotRewriteExistingEntry() throws Exception {
    CapturedTransaction tx = transaction("tx-1", "https://casino-jackpot.example/", GAMBLING_BODY);
    pipeline.process(DetectionWork.forTransaction("casino-jackpot.example", tx));
    clock.advance(Duration.ofMinutes(1));

    pipeline.process(DetectionWork.forTransaction("casino-jackpot.example", tx));

    assertEquals(1, reconcileRequests.get());
    assertEquals(clock.now().minus(Duration.ofMinutes(1)),
        sites.find("casino-jackpot.example").orElseThrow().addedAt());
    assertEquals(2, audit.queryDetections(DetectionQuery.all()).size());
  }

  @Test
  void allowListedDomainIsNeverAutoBlocked() throws Exception {
    sites.setAllowed("casino-jackpot.example", true);
    CapturedTransaction tx = transaction("tx-1", "https://www.casino-jackpot.example/", GAMBLING_BODY);

    DetectionLogEntry entry = pipeline.process(DetectionWork.forTransaction("casino-jackpot.example", tx))
        .orElseThrow();

    assertEquals(Verdict.ALLOW, entry.decision().verdict());
    assertEquals(DecisionReason.MANUAL_ALLOW, entry.decision().reason());
    assertTrue(entry.decision().conflict());
    assertTrue(sites.find("casino-jackpot.example").isEmpty());
    assertEquals(0, reconcileRequests.get());
  }

  @Test
  void allowListingWhileClassifyingSuppressesTheAutoBlock() throws Exception {
    StoreBackedOverrides stored = new StoreBackedOverrides(sites);
    AtomicBoolean operatorPending = new AtomicBoolean(true);
    ManualOverrides allowAfterFirstRead = new ManualOverrides() {
      @Override
      public boolean isManuallyBlocked(String domain) {
        return stored.isManuallyBlocked(domain);
      }

      @Override
      public boolean isManuallyAllowed(String domain) {
        boolean allowed = stored.isManuallyAllowed(domain);
        if (operatorPending.compareAndSet(true, false)) {
          try {
            sites.setAllowed(domain, true);
          } catch (IOException ex) {
            throw new UncheckedIOException(ex);
          }
        }
        return allowed;
      }
    };
    DetectionPipeline racing = new DetectionPipeline(
        classifier, new DecisionEngine(allowAfterFirstRead, clock, 0.10, 50), sites, audit, transactions,
        new ReanalysisGate(Duration.ofMinutes(5), clock), reconcileRequests::incrementAndGet,
        (stage, domain, error) -> errorStages.add(stage), clock, metrics, new PipelineSettings(1, 8));
    CapturedTransaction tx = transaction("tx-1", "https://casino-jackpot.example/", GAMBLING_BODY);

    DetectionLogEntry entry = racing.process(DetectionWork.forTransaction("casino-jackpot.example", tx))
        .orElseThrow();

    assertTrue(sites.allowList().contains("casino-jackpot.example"));
    assertTrue(sites.find("casino-jackpot.example").isEmpty());
    assertEquals(Verdict.ALLOW, entry.decision().verdict());
    assertEquals(DecisionReason.MANUAL_ALLOW, entry.decision().reason());
    assertTrue(entry.decision().conflict());
    assertEquals(0, reconcileRequests.get());
    assertEquals(1, metrics.count("pipeline.autoblock.suppressed"));
  }

  @Test
  void benignPageIsAllowed() {
    CapturedTransaction tx = transaction("tx-2", "https://weather.example/today",
        "latest news and weather research knowledge");

    DetectionLogEntry entry = pipeline.process(DetectionWork.forTransaction("weather.example", tx)).orElseThrow();

    assertEquals(Verdict.ALLOW, entry.decision().verdict());
    assertTrue(sites.all().isEmpty());
  }

  @Test
  void auditFailureIsRecordedAsPipelineError() throws Exception {
    audit.close();

    Optional<DetectionLogEntry> entry = pipeline.process(DetectionWork.forConnection("weather.example",
        "weather.example"));

    assertTrue(entry.isEmpty());
    assertEquals(List.of("pipeline"), errorStages);
    assertEquals(1, metrics.count("pipeline.process.error"));
  }

  @Test
  void connectionEventsAreFilteredBeforeQueueing() {
    pipeline.onConnectionEvent(ConnectionEvent.opened(connection("93.184.216.34", "93.184.216.34")));
    assertEquals(1, metrics.count("pipeline.connection.unresolved"));

    pipeline.onConnectionEvent(ConnectionEvent.opened(connection("93.184.216.34", "edge.casino.example")));
    assertEquals(1, metrics.count("pipeline.enqueue.rejected"));

    pipeline.onConnectionEvent(ConnectionEvent.opened(connection("93.184.216.35", "edge.casino.example")));
    assertEquals(1, metrics.count("pipeline.connection.deduplicated"));

    pipeline.onConnectionEvent(ConnectionEvent.closed(connection("93.184.216.36", "other.example")));
    assertEquals(0, pipeline.queuedItems());
  }

  @Test
  void runningLanesProcessQueuedConnections() throws Exception {
    pipeline.start();
    pipeline.onConnectionEvent(ConnectionEvent.opened(connection("93.184.216.34", "www.weather.example")));
    pipeline.onTransaction(transaction("tx-3", "https://casino-jackpot.example/", GAMBLING_BODY));

    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (audit.queryDetections(DetectionQuery.all()).size() < 2 && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    pipeline.stop();

    List<DetectionLogEntry> entries = audit.queryDetections(DetectionQuery.all());
    assertEquals(2, entries.size());
    assertTrue(entries.stream().anyMatch(e -> e.domain().equals("weather.example")
        && e.source() == DetectionSource.CONNECTION));
    assertEquals(1, transactions.size());
    assertFalse(pipeline.isRunning());
  }

  @Test
  void capturedTransactionCountIncludesEvictedOnes() {
    DetectionPipeline small = new DetectionPipeline(
        classifier, new DecisionEngine(new StoreBackedOverrides(sites), clock, 0.10, 50), sites, audit,
        new InMemoryTransactionStore(1, Duration.ofHours(1), clock), new ReanalysisGate(Duration.ofMinutes(5), clock),
        reconcileRequests::incrementAndGet, (stage, domain, error) -> errorStages.add(stage), clock, metrics,
        new PipelineSettings(1, 8));

    small.onTransaction(transaction("tx-1", "https://weather.example/", "weather"));
    small.onTransaction(transaction("tx-2", "https://weather.example/radar", "weather"));

    assertEquals(2L, small.transactionsCaptured());
  }

  @Test
  void lanesAreChosenByDomain() {
    assertEquals(pipeline.laneFor("casino.example"), pipeline.laneFor("casino.example"));
  }

  private CapturedTransaction transaction(String id, String url, String body) {
    HttpHeaders headers = HttpHeaders.builder().add("Content-Type", "text/html; charset=utf-8").build();
    return new CapturedTransaction(id, url, "GET", null, null, 200, headers, body, body.length(), 12, clock.now());
  }

  private Connection connection(String address, String host) {
    return new Connection(address, host, 443, 1200, "firefox", "tcp", clock.now(), clock.now());
  }
}
