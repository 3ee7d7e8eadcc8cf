package io.netguard.testing;

import io.netguard.domain.audit.DetectionLogEntry;
import io.netguard.domain.audit.DetectionSource;
import io.netguard.domain.classify.ClassificationResult;
import io.netguard.domain.decision.BlockDecision;
import io.netguard.domain.decision.DecisionReason;
import io.netguard.domain.decision.Verdict;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Builders for audit records used across persistence and pipeline tests. */
public final class AuditEntries {
  private AuditEntries() {}

  public static DetectionLogEntry detection(String domain, Verdict verdict, double score, Instant at) {
    ClassificationResult result =
        new ClassificationResult("https://" + domain + "/", domain, score, List.of(), 1L, at);
    BlockDecision decision = new BlockDecision(domain, verdict, DecisionReason.CLASSIFIER, score, false, at);
    return new DetectionLogEntry(
        UUID.randomUUID().toString(), 0L, result, decision, DetectionSource.CONNECTION, null, "GET", 200, at);
  }
}
