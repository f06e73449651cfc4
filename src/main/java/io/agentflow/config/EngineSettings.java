package io.agentflow.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record EngineSettings(
        int minIntervalMinutes,
        int lookAheadHours,
        int defaultMaxExecutionsPerDay,
        int reconcileBatchSize,
        long completionTimeoutMs,
        long completionPollIntervalMs,
        int scheduledPriority,
        int webhookPriority,
        int manualPriority,
        int scheduledMaxRetries,
        long retryBackoffMs,
        long resourceRetryDelayMs,
        long workerPollIntervalMs,
        int defaultAgentMemoryMb,
        long defaultAgentTimeoutMs,
        long memorySampleIntervalMs,
        int failureAlertThreshold,
        int failureAlertWindowMinutes,
        boolean autoDisableOnFailureAlert,
        long metricsIntervalMs,
        String cronStrategy
) {
    public static final String CRON_QUARTZ = "quartz";
    public static final String CRON_PLACEHOLDER = "placeholder";

    public static EngineSettings defaults() {
        return new EngineSettings(
                AgentFlowConfig.DEFAULT_MIN_INTERVAL_MINUTES,
                AgentFlowConfig.DEFAULT_LOOK_AHEAD_HOURS,
                AgentFlowConfig.DEFAULT_MAX_EXECUTIONS_PER_DAY,
                AgentFlowConfig.DEFAULT_RECONCILE_BATCH_SIZE,
                AgentFlowConfig.DEFAULT_COMPLETION_TIMEOUT_MS,
                AgentFlowConfig.DEFAULT_COMPLETION_POLL_INTERVAL_MS,
                AgentFlowConfig.DEFAULT_SCHEDULED_PRIORITY,
                AgentFlowConfig.DEFAULT_WEBHOOK_PRIORITY,
                AgentFlowConfig.DEFAULT_MANUAL_PRIORITY,
                AgentFlowConfig.DEFAULT_SCHEDULED_MAX_RETRIES,
                AgentFlowConfig.DEFAULT_RETRY_BACKOFF_MS,
                AgentFlowConfig.DEFAULT_RESOURCE_RETRY_DELAY_MS,
                AgentFlowConfig.DEFAULT_WORKER_POLL_INTERVAL_MS,
                AgentFlowConfig.DEFAULT_AGENT_MEMORY_MB,
                AgentFlowConfig.DEFAULT_AGENT_TIMEOUT_MS,
                AgentFlowConfig.DEFAULT_MEMORY_SAMPLE_INTERVAL_MS,
                AgentFlowConfig.DEFAULT_FAILURE_ALERT_THRESHOLD,
                AgentFlowConfig.DEFAULT_FAILURE_ALERT_WINDOW_MINUTES,
                false,
                AgentFlowConfig.DEFAULT_METRICS_INTERVAL_MS,
                CRON_QUARTZ
        );
    }

    public static EngineSettings fromFile(EngineSettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        // The interval floor can be raised but never lowered below the anti-abuse minimum.
        int minInterval = sanitizeInt(file.minIntervalMinutes(), defaults.minIntervalMinutes(),
                AgentFlowConfig.DEFAULT_MIN_INTERVAL_MINUTES);
        long completionTimeout = sanitizeLong(file.completionTimeoutMs(), defaults.completionTimeoutMs(), 1L);
        long completionPoll = sanitizeLong(file.completionPollIntervalMs(), defaults.completionPollIntervalMs(), 10L);
        return new EngineSettings(
                minInterval,
                sanitizeInt(file.lookAheadHours(), defaults.lookAheadHours(), 1),
                sanitizeInt(file.defaultMaxExecutionsPerDay(), defaults.defaultMaxExecutionsPerDay(), 1),
                sanitizeInt(file.reconcileBatchSize(), defaults.reconcileBatchSize(), 1),
                completionTimeout,
                completionPoll,
                sanitizeInt(file.scheduledPriority(), defaults.scheduledPriority(), 1),
                sanitizeInt(file.webhookPriority(), defaults.webhookPriority(), 1),
                sanitizeInt(file.manualPriority(), defaults.manualPriority(), 1),
                sanitizeInt(file.scheduledMaxRetries(), defaults.scheduledMaxRetries(), 0),
                sanitizeLong(file.retryBackoffMs(), defaults.retryBackoffMs(), 0L),
                sanitizeLong(file.resourceRetryDelayMs(), defaults.resourceRetryDelayMs(), 0L),
                sanitizeLong(file.workerPollIntervalMs(), defaults.workerPollIntervalMs(), 10L),
                sanitizeInt(file.defaultAgentMemoryMb(), defaults.defaultAgentMemoryMb(), 1),
                sanitizeLong(file.defaultAgentTimeoutMs(), defaults.defaultAgentTimeoutMs(), 1L),
                sanitizeLong(file.memorySampleIntervalMs(), defaults.memorySampleIntervalMs(), 1L),
                sanitizeInt(file.failureAlertThreshold(), defaults.failureAlertThreshold(), 1),
                sanitizeInt(file.failureAlertWindowMinutes(), defaults.failureAlertWindowMinutes(), 1),
                sanitizeBoolean(file.autoDisableOnFailureAlert(), defaults.autoDisableOnFailureAlert()),
                sanitizeLong(file.metricsIntervalMs(), defaults.metricsIntervalMs(), 1_000L),
                sanitizeCronStrategy(file.cronStrategy(), defaults.cronStrategy())
        );
    }

    public static List<String> diffFields(EngineSettings before, EngineSettings after) {
        if (before == null || after == null) {
            return List.of();
        }
        List<String> changed = new ArrayList<>();
        if (before.minIntervalMinutes() != after.minIntervalMinutes()) changed.add("minIntervalMinutes");
        if (before.lookAheadHours() != after.lookAheadHours()) changed.add("lookAheadHours");
        if (before.defaultMaxExecutionsPerDay() != after.defaultMaxExecutionsPerDay()) changed.add("defaultMaxExecutionsPerDay");
        if (before.reconcileBatchSize() != after.reconcileBatchSize()) changed.add("reconcileBatchSize");
        if (before.completionTimeoutMs() != after.completionTimeoutMs()) changed.add("completionTimeoutMs");
        if (before.completionPollIntervalMs() != after.completionPollIntervalMs()) changed.add("completionPollIntervalMs");
        if (before.scheduledPriority() != after.scheduledPriority()) changed.add("scheduledPriority");
        if (before.webhookPriority() != after.webhookPriority()) changed.add("webhookPriority");
        if (before.manualPriority() != after.manualPriority()) changed.add("manualPriority");
        if (before.scheduledMaxRetries() != after.scheduledMaxRetries()) changed.add("scheduledMaxRetries");
        if (before.retryBackoffMs() != after.retryBackoffMs()) changed.add("retryBackoffMs");
        if (before.resourceRetryDelayMs() != after.resourceRetryDelayMs()) changed.add("resourceRetryDelayMs");
        if (before.workerPollIntervalMs() != after.workerPollIntervalMs()) changed.add("workerPollIntervalMs");
        if (before.defaultAgentMemoryMb() != after.defaultAgentMemoryMb()) changed.add("defaultAgentMemoryMb");
        if (before.defaultAgentTimeoutMs() != after.defaultAgentTimeoutMs()) changed.add("defaultAgentTimeoutMs");
        if (before.memorySampleIntervalMs() != after.memorySampleIntervalMs()) changed.add("memorySampleIntervalMs");
        if (before.failureAlertThreshold() != after.failureAlertThreshold()) changed.add("failureAlertThreshold");
        if (before.failureAlertWindowMinutes() != after.failureAlertWindowMinutes()) changed.add("failureAlertWindowMinutes");
        if (before.autoDisableOnFailureAlert() != after.autoDisableOnFailureAlert()) changed.add("autoDisableOnFailureAlert");
        if (before.metricsIntervalMs() != after.metricsIntervalMs()) changed.add("metricsIntervalMs");
        if (!before.cronStrategy().equals(after.cronStrategy())) changed.add("cronStrategy");
        return changed;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static String sanitizeCronStrategy(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (CRON_QUARTZ.equals(v) || CRON_PLACEHOLDER.equals(v)) {
            return v;
        }
        return fallback;
    }
}
