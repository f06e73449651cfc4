package io.agentflow.model;

import java.util.Locale;

public enum QueueSource {
    MANUAL,
    SCHEDULED,
    WEBHOOK;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static QueueSource fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MANUAL;
        }
        for (QueueSource value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown queue source: " + raw);
    }
}
