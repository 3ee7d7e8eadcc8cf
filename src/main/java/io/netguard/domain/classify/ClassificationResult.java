package io.netguard.domain.classify;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of scoring one subject against the live model.
 *
 * @param subject what was scored (URL or host)
 * @param domain normalized domain the subject belongs to
 * @param score probability of {@link Label#GAMBLING} in {@code [0, 1]}
 * @param topTerms strongest contributing terms, strongest first
 * @param modelVersion version of the model that produced the score
 * @param timestamp scoring time
 * @since 0.1.0
 */
public record ClassificationResult(
    String subject,
    String domain,
    double score,
    List<TermContribution> topTerms,
    long modelVersion,
    Instant timestamp) {

  public ClassificationResult {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(domain, "domain");
    if (!(score >= 0.0 && score <= 1.0)) {
      throw new IllegalArgumentException("score must be within [0,1] (was " + score + ")");
    }
    topTerms = topTerms == null ? List.of() : List.copyOf(topTerms);
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
