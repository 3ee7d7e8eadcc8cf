package io.netguard.domain.audit;

import io.netguard.domain.decision.Verdict;
import java.time.Instant;
import java.util.Locale;

/**
 * Filter and page selection for detection log queries. Results are ordered newest first.
 *
 * @param from inclusive lower time bound, or {@code null} for unbounded
 * @param to exclusive upper time bound, or {@code null} for unbounded
 * @param domainContains case-insensitive domain substring, or {@code null}/empty for any
 * @param verdict verdict filter, or {@code null} for any
 * @param limit maximum entries returned (1 to 10,000)
 * @param offset entries skipped after filtering
 * @since 0.1.0
 */
public record DetectionQuery(
    Instant from, Instant to, String domainContains, Verdict verdict, int limit, int offset) {

  public static final int DEFAULT_LIMIT = 100;
  public static final int MAX_LIMIT = 10_000;

  public DetectionQuery {
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + " (was " + limit + ")");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0 (was " + offset + ")");
    }
    if (from != null && to != null && to.isBefore(from)) {
      throw new IllegalArgumentException("to must not precede from");
    }
    domainContains = domainContains == null || domainContains.isBlank()
        ? null
        : domainContains.trim().toLowerCase(Locale.ROOT);
  }

  /** Returns the first page of all detections. */
  public static DetectionQuery all() {
    return new DetectionQuery(null, null, null, null, DEFAULT_LIMIT, 0);
  }

  public DetectionQuery withDomain(String substring) {
    return new DetectionQuery(from, to, substring, verdict, limit, offset);
  }

  public DetectionQuery withVerdict(Verdict value) {
    return new DetectionQuery(from, to, domainContains, value, limit, offset);
  }

  public DetectionQuery withRange(Instant fromInclusive, Instant toExclusive) {
    return new DetectionQuery(fromInclusive, toExclusive, domainContains, verdict, limit, offset);
  }

  public DetectionQuery withPage(int pageLimit, int pageOffset) {
    return new DetectionQuery(from, to, domainContains, verdict, pageLimit, pageOffset);
  }

  /**
   * Tests whether an entry passes the filter part of this query (paging excluded).
   *
   * @param entry candidate entry
   * @return {@code true} when the entry matches
   */
  public boolean matches(DetectionLogEntry entry) {
    Instant ts = entry.timestamp();
    if (from != null && ts.isBefore(from)) {
      return false;
    }
    if (to != null && !ts.isBefore(to)) {
      return false;
    }
    if (verdict != null && entry.decision().verdict() != verdict) {
      return false;
    }
    return domainContains == null
        || entry.domain().toLowerCase(Locale.ROOT).contains(domainContains);
  }
}
