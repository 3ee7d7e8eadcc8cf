package io.netguard.application.enforcement;

import java.util.Set;

/**
 * Outcome of one reconciliation pass.
 *
 * @param added domains newly written to the managed region
 * @param removed domains removed from the managed region
 * @param written whether the override table was rewritten
 */
public record ReconcileResult(Set<String> added, Set<String> removed, boolean written) {
  public ReconcileResult {
    added = Set.copyOf(added);
    removed = Set.copyOf(removed);
  }

  public static ReconcileResult unchanged() {
    return new ReconcileResult(Set.of(), Set.of(), false);
  }
}
