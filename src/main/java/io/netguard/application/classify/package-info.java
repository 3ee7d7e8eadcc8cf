/**
 * <strong>Purpose:</strong> Lexical feature extraction and the trainable naive Bayes gambling classifier.
 * <p><strong>Pipeline role:</strong> Classify stage between the sources (sampler, proxy) and the decision engine.</p>
 * <p><strong>Concurrency:</strong> Models are immutable and swapped atomically; extraction is stateless.</p>
 * <p><strong>Metrics:</strong> {@code classifier.*}.</p>
 *
 * @since 0.1.0
 */
package io.netguard.application.classify;
