package io.netguard.infrastructure.persistence;

import io.netguard.application.port.AuditLog;
import io.netguard.application.port.MetricsPort;
import io.netguard.domain.audit.AuditStatistics;
import io.netguard.domain.audit.DetectionLogEntry;
import io.netguard.domain.audit.DetectionQuery;
import io.netguard.domain.audit.EnforcementAction;
import io.netguard.domain.audit.PipelineError;
import io.netguard.validation.Paths;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link AuditLog} backed by three append-only JSON-lines files in a data directory.
 * <p><strong>Why:</strong> Detections, enforcement actions and pipeline errors must survive restarts and stay
 * greppable by operators without a database.</p>
 * <p><strong>Role:</strong> Infrastructure adapter used by the detection pipeline, the enforcement manager and the
 * CLI.</p>
 * <p><strong>Thread-safety:</strong> All operations synchronize on the instance; appends are flushed before
 * returning. Files are read once on open and mirrored in memory for queries.</p>
 * <p><strong>Observability:</strong> Emits {@code audit.detection.appended}, {@code audit.enforcement.appended},
 * {@code audit.error.appended} and {@code audit.cleanup.removed}; unreadable lines are skipped with a WARN.</p>
 *
 * @since 0.1.0
 */
public final class JsonLinesAuditLog implements AuditLog {
  private static final Logger log = LoggerFactory.getLogger(JsonLinesAuditLog.class);

  static final String DETECTIONS_FILE = "detections.jsonl";
  static final String ENFORCEMENT_FILE = "enforcement.jsonl";
  static final String ERRORS_FILE = "errors.jsonl";

  /** Window counted as "recent" by {@link #statistics(Instant)}. */
  public static final Duration RECENT_WINDOW = Duration.ofHours(24);
  /** Score at or above which a detection counts as gambling in statistics. */
  public static final double GAMBLING_SCORE = 0.5;

  private final Path directory;
  private final MetricsPort metrics;
  private final List<DetectionLogEntry> detections;
  private final List<EnforcementAction> enforcement;
  private final List<PipelineError> errors;
  private BufferedWriter detectionWriter;
  private BufferedWriter enforcementWriter;
  private BufferedWriter errorWriter;
  private long nextSequence;
  private boolean closed;

  private JsonLinesAuditLog(Path directory, MetricsPort metrics) throws IOException {
    this.directory = directory;
    this.metrics = metrics;
    this.detections = load(directory.resolve(DETECTIONS_FILE), AuditRecordCodec::decodeDetection);
    this.enforcement = load(directory.resolve(ENFORCEMENT_FILE), AuditRecordCodec::decodeEnforcement);
    this.errors = load(directory.resolve(ERRORS_FILE), AuditRecordCodec::decodeError);
    this.detections.sort((a, b) -> Long.compare(a.sequence(), b.sequence()));
    this.nextSequence = detections.isEmpty() ? 1L : detections.get(detections.size() - 1).sequence() + 1;
    openWriters();
  }

  /**
   * Opens (creating when absent) the audit log stored under {@code directory}.
   *
   * @param directory data directory; created if missing
   * @param metrics metrics sink; {@code null} uses {@link MetricsPort#NO_OP}
   * @return open audit log
   * @throws IOException if existing files cannot be read or opened for append
   * @throws IllegalArgumentException if the directory is not writable
   */
  public static JsonLinesAuditLog open(Path directory, MetricsPort metrics) throws IOException {
    Path dir = Paths.requireWritableDir(Objects.requireNonNull(directory, "directory"), true);
    return new JsonLinesAuditLog(dir, metrics == null ? MetricsPort.NO_OP : metrics);
  }

  public Path directory() {
    return directory;
  }

  @Override
  public synchronized DetectionLogEntry appendDetection(DetectionLogEntry entry) throws IOException {
    Objects.requireNonNull(entry, "entry");
    ensureOpen();
    DetectionLogEntry sequenced = entry.withSequence(nextSequence);
    writeLine(detectionWriter, AuditRecordCodec.encodeDetection(sequenced));
    nextSequence++;
    detections.add(sequenced);
    metrics.increment("audit.detection.appended");
    return sequenced;
  }

  @Override
  public synchronized void appendEnforcement(EnforcementAction action) throws IOException {
    Objects.requireNonNull(action, "action");
    ensureOpen();
    writeLine(enforcementWriter, AuditRecordCodec.encodeEnforcement(action));
    enforcement.add(action);
    metrics.increment("audit.enforcement.appended");
  }

  @Override
  public synchronized void appendError(PipelineError error) throws IOException {
    Objects.requireNonNull(error, "error");
    ensureOpen();
    writeLine(errorWriter, AuditRecordCodec.encodeError(error));
    errors.add(error);
    metrics.increment("audit.error.appended");
  }

  @Override
  public synchronized List<DetectionLogEntry> queryDetections(DetectionQuery query) {
    Objects.requireNonNull(query, "query");
    List<DetectionLogEntry> page = new ArrayList<>(Math.min(query.limit(), 64));
    int skipped = 0;
    for (int i = detections.size() - 1; i >= 0 && page.size() < query.limit(); i--) {
      DetectionLogEntry entry = detections.get(i);
      if (!query.matches(entry)) {
        continue;
      }
      if (skipped < query.offset()) {
        skipped++;
        continue;
      }
      page.add(entry);
    }
    return List.copyOf(page);
  }

  @Override
  public synchronized List<EnforcementAction> recentEnforcementActions(int limit) {
    return newestFirst(enforcement, limit);
  }

  @Override
  public synchronized List<PipelineError> recentErrors(int limit) {
    return newestFirst(errors, limit);
  }

  /**
   * Removes entries older than {@code horizon}. The newest detection of every protected domain is kept regardless
   * of age so an active block always has an explanation on record.
   *
   * @param horizon entries strictly before this instant are removed
   * @param protectedDomains domains whose latest detection must survive
   * @return number of entries removed across all three files
   * @throws IOException if a file cannot be rewritten; in-memory state is left unchanged in that case
   */
  @Override
  public synchronized int cleanup(Instant horizon, Set<String> protectedDomains) throws IOException {
    Objects.requireNonNull(horizon, "horizon");
    Set<String> keep = protectedDomains == null ? Set.of() : protectedDomains;
    ensureOpen();

    Map<String, Long> latestProtected = new HashMap<>();
    for (DetectionLogEntry entry : detections) {
      if (keep.contains(entry.domain())) {
        latestProtected.merge(entry.domain(), entry.sequence(), Math::max);
      }
    }
    List<DetectionLogEntry> retainedDetections = new ArrayList<>();
    for (DetectionLogEntry entry : detections) {
      boolean young = !entry.timestamp().isBefore(horizon);
      Long latest = latestProtected.get(entry.domain());
      if (young || (latest != null && latest == entry.sequence())) {
        retainedDetections.add(entry);
      }
    }
    List<EnforcementAction> retainedEnforcement = new ArrayList<>();
    for (EnforcementAction action : enforcement) {
      if (!action.timestamp().isBefore(horizon)) {
        retainedEnforcement.add(action);
      }
    }
    List<PipelineError> retainedErrors = new ArrayList<>();
    for (PipelineError error : errors) {
      if (!error.timestamp().isBefore(horizon)) {
        retainedErrors.add(error);
      }
    }

    int removed = (detections.size() - retainedDetections.size())
        + (enforcement.size() - retainedEnforcement.size())
        + (errors.size() - retainedErrors.size());
    if (removed == 0) {
      return 0;
    }

    closeWriters();
    try {
      rewrite(directory.resolve(DETECTIONS_FILE), retainedDetections, AuditRecordCodec::encodeDetection);
      rewrite(directory.resolve(ENFORCEMENT_FILE), retainedEnforcement, AuditRecordCodec::encodeEnforcement);
      rewrite(directory.resolve(ERRORS_FILE), retainedErrors, AuditRecordCodec::encodeError);
    } finally {
      openWriters();
    }
    detections.clear();
    detections.addAll(retainedDetections);
    enforcement.clear();
    enforcement.addAll(retainedEnforcement);
    errors.clear();
    errors.addAll(retainedErrors);
    metrics.observe("audit.cleanup.removed", removed);
    log.info("Audit cleanup removed {} entries older than {}", removed, horizon);
    return removed;
  }

  @Override
  public synchronized AuditStatistics statistics(Instant now) {
    Instant recentFrom = Objects.requireNonNull(now, "now").minus(RECENT_WINDOW);
    long blocked = 0;
    long recent = 0;
    long gambling = 0;
    for (DetectionLogEntry entry : detections) {
      if (entry.decision().blocks()) {
        blocked++;
      }
      if (!entry.timestamp().isBefore(recentFrom)) {
        recent++;
      }
      if (entry.result().score() >= GAMBLING_SCORE) {
        gambling++;
      }
    }
    return new AuditStatistics(
        detections.size(), blocked, recent, gambling, enforcement.size(), errors.size());
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    closeWriters();
  }

  private void ensureOpen() throws IOException {
    if (closed) {
      throw new IOException("audit log is closed: " + directory);
    }
  }

  private void openWriters() throws IOException {
    detectionWriter = appender(directory.resolve(DETECTIONS_FILE));
    enforcementWriter = appender(directory.resolve(ENFORCEMENT_FILE));
    errorWriter = appender(directory.resolve(ERRORS_FILE));
  }

  private void closeWriters() throws IOException {
    IOException failure = null;
    for (BufferedWriter writer : new BufferedWriter[] {detectionWriter, enforcementWriter, errorWriter}) {
      if (writer == null) {
        continue;
      }
      try {
        writer.close();
      } catch (IOException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    detectionWriter = null;
    enforcementWriter = null;
    errorWriter = null;
    if (failure != null) {
      throw failure;
    }
  }

  private static BufferedWriter appender(Path file) throws IOException {
    return Files.newBufferedWriter(
        file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  private static void writeLine(BufferedWriter writer, String line) throws IOException {
    writer.write(line);
    writer.write('\n');
    writer.flush();
  }

  private static <T> List<T> load(Path file, Function<String, T> decoder) throws IOException {
    List<T> records = new ArrayList<>();
    if (!Files.exists(file)) {
      return records;
    }
    int lineNumber = 0;
    for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      try {
        records.add(decoder.apply(line));
      } catch (IllegalArgumentException | NullPointerException ex) {
        log.warn("Skipping unreadable audit record {}:{}: {}", file.getFileName(), lineNumber, ex.getMessage());
      }
    }
    return records;
  }

  private static <T> void rewrite(Path file, List<T> records, Function<T, String> encoder) throws IOException {
    Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
    try {
      try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        for (T record : records) {
          writer.write(encoder.apply(record));
          writer.write('\n');
        }
      }
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static <T> List<T> newestFirst(List<T> source, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<T> out = new ArrayList<>(Math.min(limit, source.size()));
    for (int i = source.size() - 1; i >= 0 && out.size() < limit; i--) {
      out.add(source.get(i));
    }
    return List.copyOf(out);
  }
}
