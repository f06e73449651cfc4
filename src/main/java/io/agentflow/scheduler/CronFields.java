package io.agentflow.scheduler;

import io.agentflow.error.ValidationException;

final class CronFields {
    static final int FIELD_COUNT = 5;

    private CronFields() {
    }

    static String[] split(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("Cron expression is required for cron schedules");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != FIELD_COUNT) {
            throw new ValidationException("Invalid cron expression format");
        }
        return parts;
    }
}
