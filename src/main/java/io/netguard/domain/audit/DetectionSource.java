package io.netguard.domain.audit;

/** Where the evidence behind a detection came from. */
public enum DetectionSource {
  /** Connection metadata from the sampler (host name only). */
  CONNECTION,
  /** Full HTTP exchange from the intercepting proxy. */
  INTERCEPT,
  /** Operator action or dry-run classification. */
  MANUAL
}
