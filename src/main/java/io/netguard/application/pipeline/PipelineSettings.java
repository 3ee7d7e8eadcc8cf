package io.netguard.application.pipeline;

import io.netguard.validation.Numbers;

/**
 * Lane layout for {@link DetectionPipeline}.
 *
 * @param laneCount number of single-consumer lanes
 * @param laneCapacity bounded queue capacity per lane
 * @since 0.1.0
 */
public record PipelineSettings(int laneCount, int laneCapacity) {
  public PipelineSettings {
    Numbers.requireRange("laneCount", laneCount, 1, 64);
    Numbers.requireRange("laneCapacity", laneCapacity, 1, 100_000);
  }

  public static PipelineSettings defaults() {
    return new PipelineSettings(Math.max(2, Runtime.getRuntime().availableProcessors() / 2), 256);
  }
}
