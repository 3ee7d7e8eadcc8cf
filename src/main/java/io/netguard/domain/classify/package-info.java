/**
 * Classifier value types: feature vectors, labels, training examples and scoring results.
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 *
 * @since 0.1.0
 */
package io.netguard.domain.classify;
