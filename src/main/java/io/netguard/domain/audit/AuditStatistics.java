package io.netguard.domain.audit;

/**
 * Aggregate counters over the detection log.
 *
 * @param totalDetections detections currently retained
 * @param blockedDetections detections whose verdict was block
 * @param recentDetections detections in the last 24 hours
 * @param gamblingDetections detections whose score crossed 0.5
 * @param enforcementActions enforcement actions currently retained
 * @param pipelineErrors pipeline errors currently retained
 */
public record AuditStatistics(
    long totalDetections,
    long blockedDetections,
    long recentDetections,
    long gamblingDetections,
    long enforcementActions,
    long pipelineErrors) {}
