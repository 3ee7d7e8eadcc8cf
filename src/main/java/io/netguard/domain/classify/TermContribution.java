package io.netguard.domain.classify;

import java.util.Objects;

/**
 * Signed contribution of one term to a classification score, in log-odds units.
 * Positive values push toward {@link Label#GAMBLING}.
 *
 * @param term feature term
 * @param contribution weight times the log likelihood ratio for the term
 */
public record TermContribution(String term, double contribution) {
  public TermContribution {
    Objects.requireNonNull(term, "term");
  }
}
