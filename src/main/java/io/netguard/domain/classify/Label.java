package io.netguard.domain.classify;

import java.util.Locale;

/** Class labels understood by the gambling classifier. */
public enum Label {
  GAMBLING,
  BENIGN;

  /**
   * Parses a label case-insensitively.
   *
   * @param value label text such as {@code gambling}
   * @return parsed label
   * @throws IllegalArgumentException if the text names no label
   */
  public static Label parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("label must not be blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown label: " + value + " (expected gambling or benign)", ex);
    }
  }
}
