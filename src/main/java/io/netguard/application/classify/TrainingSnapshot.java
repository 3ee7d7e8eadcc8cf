package io.netguard.application.classify;

import io.netguard.domain.classify.LabeledExample;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persisted form of the live model: its training documents plus version metadata.
 *
 * <p>Training is deterministic, so reloading a snapshot rebuilds an identical model at the same version.</p>
 *
 * @param version model version
 * @param trainedAt training timestamp
 * @param examples training documents
 * @since 0.1.0
 */
public record TrainingSnapshot(long version, Instant trainedAt, List<LabeledExample> examples) {
  public TrainingSnapshot {
    if (version < 1) {
      throw new IllegalArgumentException("version must be >= 1 (was " + version + ")");
    }
    Objects.requireNonNull(trainedAt, "trainedAt");
    examples = List.copyOf(Objects.requireNonNull(examples, "examples"));
  }
}
