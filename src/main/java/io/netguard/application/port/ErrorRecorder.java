package io.netguard.application.port;

/**
 * Records stage failures on the audit surface. Implementations log and append a
 * {@link io.netguard.domain.audit.PipelineError}; they never throw.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ErrorRecorder {
  /**
   * @param stage stage name such as {@code sampler} or {@code enforce}
   * @param domain affected domain, or empty
   * @param error failure
   */
  void record(String stage, String domain, Throwable error);
}
