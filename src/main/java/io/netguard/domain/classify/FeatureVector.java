package io.netguard.domain.classify;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Sparse term to weight mapping produced by the lexical feature extractor.
 *
 * <p>Terms are unique and iterated in natural order so scoring sums in a stable order for a given model.</p>
 *
 * @param weights term weights; zero or negative weights are dropped
 * @since 0.1.0
 */
public record FeatureVector(Map<String, Double> weights) {
  private static final FeatureVector EMPTY = new FeatureVector(Map.of());

  public FeatureVector {
    Objects.requireNonNull(weights, "weights");
    TreeMap<String, Double> sorted = new TreeMap<>();
    weights.forEach((term, weight) -> {
      if (term != null && !term.isEmpty() && weight != null && weight > 0.0 && Double.isFinite(weight)) {
        sorted.put(term, weight);
      }
    });
    weights = Collections.unmodifiableMap(sorted);
  }

  public static FeatureVector empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return weights.isEmpty();
  }

  public int size() {
    return weights.size();
  }

  public double weight(String term) {
    return weights.getOrDefault(term, 0.0);
  }
}
