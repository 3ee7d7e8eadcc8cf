package io.netguard.application.port;

import io.netguard.domain.audit.AuditStatistics;
import io.netguard.domain.audit.DetectionLogEntry;
import io.netguard.domain.audit.DetectionQuery;
import io.netguard.domain.audit.EnforcementAction;
import io.netguard.domain.audit.PipelineError;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * <strong>What:</strong> Port for the append-only audit trail of detections, enforcement actions and errors.
 * <p><strong>Why:</strong> Operators review why a domain was blocked; the log is the only durable record of
 * classifier decisions.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code JsonLinesAuditLog}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append entries with strictly increasing sequence numbers.</li>
 *   <li>Answer filtered, paginated detection queries newest first.</li>
 *   <li>Apply retention without losing the latest evidence for active blocks.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Appends may arrive concurrently from every lane; implementations serialize
 * them.</p>
 * <p><strong>Observability:</strong> Implementations emit {@code audit.*} counters.</p>
 *
 * @since 0.1.0
 */
public interface AuditLog extends AutoCloseable {
  /**
   * Appends a detection and assigns its sequence number.
   *
   * @param entry detection to record; its sequence is ignored
   * @return the stored entry with the assigned sequence
   * @throws IOException if the append cannot be persisted
   */
  DetectionLogEntry appendDetection(DetectionLogEntry entry) throws IOException;

  void appendEnforcement(EnforcementAction action) throws IOException;

  void appendError(PipelineError error) throws IOException;

  /**
   * Returns detections that match {@code query}, newest first, paginated.
   *
   * @param query filter and page
   * @return matching entries
   */
  List<DetectionLogEntry> queryDetections(DetectionQuery query);

  /** @return enforcement actions newest first, at most {@code limit} */
  List<EnforcementAction> recentEnforcementActions(int limit);

  /** @return pipeline errors newest first, at most {@code limit} */
  List<PipelineError> recentErrors(int limit);

  /**
   * Deletes entries older than {@code horizon}, keeping the newest detection of each protected domain.
   *
   * @param horizon exclusive cutoff
   * @param protectedDomains domains with an active block whose latest evidence must survive
   * @return number of entries removed across all streams
   * @throws IOException if the files cannot be rewritten
   */
  int cleanup(Instant horizon, Set<String> protectedDomains) throws IOException;

  /**
   * Aggregates counters over retained entries.
   *
   * @param now reference time for the 24 hour window
   * @return statistics snapshot
   */
  AuditStatistics statistics(Instant now);

  @Override
  default void close() throws IOException {}
}
