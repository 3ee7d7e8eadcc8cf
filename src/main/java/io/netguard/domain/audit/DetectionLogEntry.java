package io.netguard.domain.audit;

import io.netguard.domain.classify.ClassificationResult;
import io.netguard.domain.decision.BlockDecision;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable audit record of one classification and the decision taken on it.
 *
 * @param id unique entry identifier
 * @param sequence append order assigned by the audit log; strictly increasing
 * @param result classifier output
 * @param decision decision engine output
 * @param source origin of the evidence
 * @param transactionId captured transaction id for intercept detections, otherwise {@code null}
 * @param method HTTP method for intercept detections, otherwise empty
 * @param statusCode HTTP status for intercept detections, otherwise {@code 0}
 * @param timestamp time the entry was recorded
 * @since 0.1.0
 */
public record DetectionLogEntry(
    String id,
    long sequence,
    ClassificationResult result,
    BlockDecision decision,
    DetectionSource source,
    String transactionId,
    String method,
    int statusCode,
    Instant timestamp) {

  public DetectionLogEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(decision, "decision");
    Objects.requireNonNull(source, "source");
    method = method == null ? "" : method;
    Objects.requireNonNull(timestamp, "timestamp");
  }

  public String domain() {
    return decision.domain();
  }

  /** Returns a copy carrying the sequence number assigned on append. */
  public DetectionLogEntry withSequence(long assigned) {
    return new DetectionLogEntry(
        id, assigned, result, decision, source, transactionId, method, statusCode, timestamp);
  }
}
