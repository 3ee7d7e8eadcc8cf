package io.netguard.domain.decision;

/** Outcome of the decision engine for one domain. */
public enum Verdict {
  /** Domain is added to the managed hosts region. */
  BLOCK,
  /** Domain is left alone. */
  ALLOW,
  /** Score is close to the threshold; logged for review but not enforced. */
  OBSERVE
}
