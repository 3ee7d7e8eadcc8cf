package io.netguard.domain.decision;

/** What drove a {@link BlockDecision}. */
public enum DecisionReason {
  CLASSIFIER,
  MANUAL_ALLOW,
  MANUAL_BLOCK
}
