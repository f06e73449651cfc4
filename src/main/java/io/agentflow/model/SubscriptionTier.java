package io.agentflow.model;

public enum SubscriptionTier {
    FREE,
    PRO,
    ENTERPRISE,
    UNKNOWN;

    public static SubscriptionTier fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        for (SubscriptionTier value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
