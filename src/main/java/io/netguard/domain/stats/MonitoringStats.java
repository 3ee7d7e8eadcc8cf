package io.netguard.domain.stats;

import java.time.Instant;

/**
 * Point-in-time view of the monitoring service.
 *
 * @param running whether the sampler and pipeline are active
 * @param devMode whether the intercepting proxy is enabled
 * @param connectionsObserved connections opened since start
 * @param activeConnections connections in the sampler table now
 * @param transactionsCaptured transactions captured by the interceptor since start, evicted ones included
 * @param blockCount currently active blocked sites
 * @param detectionsLogged detections currently retained in the audit log
 * @param lastClassificationAt time of the most recent classification, or {@code null}
 * @param modelVersion live classifier version
 * @param sensitivity current sensitivity, 0 to 100
 * @since 0.1.0
 */
public record MonitoringStats(
    boolean running,
    boolean devMode,
    long connectionsObserved,
    int activeConnections,
    long transactionsCaptured,
    int blockCount,
    long detectionsLogged,
    Instant lastClassificationAt,
    long modelVersion,
    int sensitivity) {}
