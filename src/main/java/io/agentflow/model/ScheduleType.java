package io.agentflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ScheduleType {
    INTERVAL("interval"),
    CRON("cron"),
    WEBHOOK_TRIGGER("webhook_trigger");

    private final String wireName;

    ScheduleType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ScheduleType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Schedule type cannot be empty");
        }
        for (ScheduleType value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown schedule type: " + raw);
    }
}
