package io.netguard.application.pipeline;

import io.netguard.domain.audit.DetectionSource;
import io.netguard.domain.capture.CapturedTransaction;
import io.netguard.domain.capture.HttpHeaders;
import java.util.Objects;

/**
 * One unit of classification work queued on a lane.
 *
 * @param domain normalized domain; selects the lane
 * @param url URL used for text assembly
 * @param headers response headers, empty for connection evidence
 * @param body response body excerpt, empty for connection evidence
 * @param source evidence source
 * @param transaction captured exchange for intercept evidence, otherwise {@code null}
 */
public record DetectionWork(
    String domain,
    String url,
    HttpHeaders headers,
    String body,
    DetectionSource source,
    CapturedTransaction transaction) {

  public DetectionWork {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(url, "url");
    headers = headers == null ? HttpHeaders.empty() : headers;
    body = body == null ? "" : body;
    Objects.requireNonNull(source, "source");
  }

  static DetectionWork forConnection(String domain, String host) {
    return new DetectionWork(domain, "http://" + host, HttpHeaders.empty(), "", DetectionSource.CONNECTION, null);
  }

  static DetectionWork forTransaction(String domain, CapturedTransaction tx) {
    return new DetectionWork(
        domain, tx.requestUrl(), tx.responseHeaders(), tx.responseBodyExcerpt(), DetectionSource.INTERCEPT, tx);
  }
}
