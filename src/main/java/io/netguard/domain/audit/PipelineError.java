package io.netguard.domain.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * Audit record of a failure in any monitoring stage.
 *
 * @param id unique identifier
 * @param stage stage name such as {@code sampler}, {@code intercept}, {@code classify}, {@code enforce}
 * @param domain affected domain, or empty when not attributable
 * @param errorType simple class name of the failure
 * @param message failure message
 * @param timestamp failure time
 * @since 0.1.0
 */
public record PipelineError(
    String id, String stage, String domain, String errorType, String message, Instant timestamp) {

  public PipelineError {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(stage, "stage");
    domain = domain == null ? "" : domain;
    Objects.requireNonNull(errorType, "errorType");
    message = message == null ? "" : message;
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
