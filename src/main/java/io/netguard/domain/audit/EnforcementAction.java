package io.netguard.domain.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * Audit record of one hosts-file change attempted by the enforcement manager.
 *
 * @param id unique identifier
 * @param domain affected domain
 * @param action add or remove
 * @param outcome applied or failed
 * @param detail failure message or empty
 * @param timestamp attempt time
 * @since 0.1.0
 */
public record EnforcementAction(
    String id, String domain, Action action, Outcome outcome, String detail, Instant timestamp) {

  public EnforcementAction {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(outcome, "outcome");
    detail = detail == null ? "" : detail;
    Objects.requireNonNull(timestamp, "timestamp");
  }

  public enum Action {
    ADD,
    REMOVE
  }

  public enum Outcome {
    APPLIED,
    FAILED
  }
}
