package io.netguard.domain.classify;

import java.util.Objects;

/**
 * Training document paired with its label.
 *
 * @param text raw document text as produced by the feature extractor's text assembly
 * @param label class label
 * @since 0.1.0
 */
public record LabeledExample(String text, Label label) {
  public LabeledExample {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(label, "label");
  }
}
