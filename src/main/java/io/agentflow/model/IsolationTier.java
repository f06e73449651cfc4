package io.agentflow.model;

public enum IsolationTier {
    BASIC,
    ENHANCED,
    STRICT;

    public static IsolationTier fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return BASIC;
        }
        for (IsolationTier value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown isolation tier: " + raw);
    }
}
