package io.agentflow.scheduler;

import io.agentflow.error.ValidationException;
import io.agentflow.model.ScheduleConfig;

import java.time.DateTimeException;
import java.time.ZoneId;

final class ScheduleValidator {
    private ScheduleValidator() {
    }

    static void validate(ScheduleConfig config, int minIntervalMinutes, NextOccurrence cron) {
        if (config == null) {
            throw new ValidationException("Schedule configuration is required");
        }
        if (config.agentId() == null || config.agentId().isBlank()) {
            throw new ValidationException("agent_id is required");
        }
        if (config.ownerId() == null || config.ownerId().isBlank()) {
            throw new ValidationException("owner_id is required");
        }
        if (config.scheduleType() == null) {
            throw new ValidationException("schedule_type is required");
        }
        switch (config.scheduleType()) {
            case INTERVAL:
                if (config.intervalMinutes() == null || config.intervalMinutes() < 1) {
                    throw new ValidationException("Interval must be at least 1 minute");
                }
                if (config.intervalMinutes() < minIntervalMinutes) {
                    throw new ValidationException("Minimum interval is " + minIntervalMinutes + " minutes to prevent abuse");
                }
                rejectOthers(config, config.cronExpression(), config.webhookEndpoint());
                break;
            case CRON:
                cron.validate(config.cronExpression());
                rejectOthers(config, config.intervalMinutes(), config.webhookEndpoint());
                break;
            case WEBHOOK_TRIGGER:
                if (config.webhookEndpoint() == null || config.webhookEndpoint().isBlank()) {
                    throw new ValidationException("Webhook endpoint is required for webhook triggers");
                }
                rejectOthers(config, config.intervalMinutes(), config.cronExpression());
                break;
            default:
                throw new ValidationException("Unsupported schedule_type: " + config.scheduleType());
        }
        if (config.maxExecutionsPerDay() != null && config.maxExecutionsPerDay() < 1) {
            throw new ValidationException("max_executions_per_day must be at least 1");
        }
        try {
            ZoneId.of(config.timezone());
        } catch (DateTimeException | NullPointerException e) {
            throw new ValidationException("Unknown timezone: " + config.timezone());
        }
    }

    private static void rejectOthers(ScheduleConfig config, Object first, Object second) {
        if (present(first) || present(second)) {
            throw new ValidationException("A " + config.scheduleType().wireName()
                    + " schedule accepts only its own trigger field");
        }
    }

    private static boolean present(Object value) {
        if (value instanceof String) {
            return !((String) value).isBlank();
        }
        return value != null;
    }
}
