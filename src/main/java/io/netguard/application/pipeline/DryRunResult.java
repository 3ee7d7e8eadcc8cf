package io.netguard.application.pipeline;

import io.netguard.domain.classify.ClassificationResult;
import io.netguard.domain.decision.BlockDecision;
import java.util.Objects;

/**
 * Classification and the decision it would produce, without enforcement or audit.
 *
 * @param result classifier output
 * @param decision decision that would be applied
 * @param threshold block threshold at the current sensitivity
 */
public record DryRunResult(ClassificationResult result, BlockDecision decision, double threshold) {
  public DryRunResult {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(decision, "decision");
  }
}
