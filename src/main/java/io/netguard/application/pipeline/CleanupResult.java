package io.netguard.application.pipeline;

/**
 * Counts removed by {@link MonitoringService#cleanup}.
 *
 * @param auditEntriesRemoved detection, enforcement and error entries removed
 * @param transactionsRemoved captured transactions removed
 */
public record CleanupResult(int auditEntriesRemoved, int transactionsRemoved) {}
