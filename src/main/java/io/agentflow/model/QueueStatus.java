package io.agentflow.model;

import java.util.Locale;

public enum QueueStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static QueueStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Queue status cannot be empty");
        }
        for (QueueStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown queue status: " + raw);
    }
}
