package io.agentflow.model;

import java.util.Locale;

public enum ScheduledExecutionStatus {
    SCHEDULED,
    EXECUTING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScheduledExecutionStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Scheduled execution status cannot be empty");
        }
        for (ScheduledExecutionStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown scheduled execution status: " + raw);
    }
}
