package io.agentflow.config;

/**
 * Raw shape of {@code agentflow-settings.json}. Every field is optional.
 */
public record EngineSettingsFile(
        Integer minIntervalMinutes,
        Integer lookAheadHours,
        Integer defaultMaxExecutionsPerDay,
        Integer reconcileBatchSize,
        Long completionTimeoutMs,
        Long completionPollIntervalMs,
        Integer scheduledPriority,
        Integer webhookPriority,
        Integer manualPriority,
        Integer scheduledMaxRetries,
        Long retryBackoffMs,
        Long resourceRetryDelayMs,
        Long workerPollIntervalMs,
        Integer defaultAgentMemoryMb,
        Long defaultAgentTimeoutMs,
        Long memorySampleIntervalMs,
        Integer failureAlertThreshold,
        Integer failureAlertWindowMinutes,
        Boolean autoDisableOnFailureAlert,
        Long metricsIntervalMs,
        String cronStrategy
) {
}
