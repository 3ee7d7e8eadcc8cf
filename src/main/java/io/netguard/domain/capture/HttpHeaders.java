package io.netguard.domain.capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered multimap of HTTP header fields with case-insensitive lookup.
 *
 * <p>Insertion order and original name casing are preserved so captured traffic can be replayed byte for byte.
 * Instances are immutable; use {@link Builder} to assemble one.</p>
 *
 * @since 0.1.0
 */
public final class HttpHeaders {
  private static final HttpHeaders EMPTY = new HttpHeaders(List.of());

  private final List<Map.Entry<String, String>> entries;

  private HttpHeaders(List<Map.Entry<String, String>> entries) {
    this.entries = entries;
  }

  public static HttpHeaders empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the first value for {@code name}, ignoring case.
   *
   * @param name header name
   * @return first value if present
   */
  public Optional<String> first(String name) {
    Objects.requireNonNull(name, "name");
    for (Map.Entry<String, String> e : entries) {
      if (e.getKey().equalsIgnoreCase(name)) {
        return Optional.of(e.getValue());
      }
    }
    return Optional.empty();
  }

  /**
   * Returns every value for {@code name} in insertion order, ignoring case.
   *
   * @param name header name
   * @return immutable list of values, empty when absent
   */
  public List<String> all(String name) {
    Objects.requireNonNull(name, "name");
    List<String> values = new ArrayList<>();
    for (Map.Entry<String, String> e : entries) {
      if (e.getKey().equalsIgnoreCase(name)) {
        values.add(e.getValue());
      }
    }
    return Collections.unmodifiableList(values);
  }

  public boolean contains(String name) {
    return first(name).isPresent();
  }

  /** @return immutable header entries in insertion order */
  public List<Map.Entry<String, String>> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HttpHeaders)) {
      return false;
    }
    return entries.equals(((HttpHeaders) o).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return "HttpHeaders" + entries;
  }

  /** Mutable builder; not thread-safe. */
  public static final class Builder {
    private final List<Map.Entry<String, String>> entries = new ArrayList<>();

    private Builder() {}

    /**
     * Appends a header field, keeping any existing values for the same name.
     *
     * @param name header name; must not be blank
     * @param value header value; {@code null} becomes empty
     * @return this builder
     */
    public Builder add(String name, String value) {
      Objects.requireNonNull(name, "name");
      String trimmed = name.trim();
      if (trimmed.isEmpty()) {
        throw new IllegalArgumentException("header name must not be blank");
      }
      entries.add(Map.entry(trimmed, value == null ? "" : value.trim()));
      return this;
    }

    /**
     * Removes every field named {@code name}, ignoring case.
     *
     * @param name header name
     * @return this builder
     */
    public Builder remove(String name) {
      String lower = name.toLowerCase(Locale.ROOT);
      entries.removeIf(e -> e.getKey().toLowerCase(Locale.ROOT).equals(lower));
      return this;
    }

    public HttpHeaders build() {
      if (entries.isEmpty()) {
        return EMPTY;
      }
      return new HttpHeaders(List.copyOf(entries));
    }
  }
}
