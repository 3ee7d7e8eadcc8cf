package io.netguard.domain.capture;

import java.time.Instant;
import java.util.Objects;

/**
 * One completed request/response exchange observed by the intercepting proxy.
 *
 * <p>Body excerpts are already bounded by the interceptor; the record never carries a full payload.</p>
 *
 * @param id unique transaction identifier
 * @param requestUrl absolute request URL including scheme and host
 * @param method HTTP method
 * @param requestHeaders request header fields in wire order
 * @param requestBodyExcerpt bounded request body excerpt, empty when absent
 * @param statusCode response status code
 * @param responseHeaders response header fields in wire order
 * @param responseBodyExcerpt bounded, decoded response body excerpt
 * @param responseSize total response body size in bytes as relayed to the client
 * @param durationMillis time from request receipt to response completion
 * @param timestamp request receipt time
 * @since 0.1.0
 */
public record CapturedTransaction(
    String id,
    String requestUrl,
    String method,
    HttpHeaders requestHeaders,
    String requestBodyExcerpt,
    int statusCode,
    HttpHeaders responseHeaders,
    String responseBodyExcerpt,
    long responseSize,
    long durationMillis,
    Instant timestamp) {

  public CapturedTransaction {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(requestUrl, "requestUrl");
    Objects.requireNonNull(method, "method");
    requestHeaders = requestHeaders == null ? HttpHeaders.empty() : requestHeaders;
    requestBodyExcerpt = requestBodyExcerpt == null ? "" : requestBodyExcerpt;
    responseHeaders = responseHeaders == null ? HttpHeaders.empty() : responseHeaders;
    responseBodyExcerpt = responseBodyExcerpt == null ? "" : responseBodyExcerpt;
    if (responseSize < 0) {
      throw new IllegalArgumentException("responseSize must be >= 0");
    }
    if (durationMillis < 0) {
      throw new IllegalArgumentException("durationMillis must be >= 0");
    }
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
