package io.netguard.application.classify;

/**
 * Inverse document frequencies learned from a training corpus.
 *
 * @since 0.1.0
 */
public interface Vocabulary {
  /**
   * Returns the smoothed inverse document frequency of {@code term}.
   *
   * <p>Seen terms use {@code ln((1 + N) / (1 + df)) + 1}; unseen terms use the df = 0 value
   * {@code ln(1 + N) + 1}, so no term weighs zero.</p>
   *
   * @param term extracted term
   * @return positive IDF
   */
  double idf(String term);

  /** Vocabulary of an empty corpus: every term weighs 1. */
  Vocabulary UNIFORM = term -> 1.0;
}
