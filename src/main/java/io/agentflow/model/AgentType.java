package io.agentflow.model;

/**
 * Trust classification of an agent. Drives the default isolation tier.
 */
public enum AgentType {
    SIMPLE,
    ADVANCED,
    ENTERPRISE;

    public IsolationTier defaultTier() {
        switch (this) {
            case ENTERPRISE:
                return IsolationTier.STRICT;
            case ADVANCED:
                return IsolationTier.ENHANCED;
            default:
                return IsolationTier.BASIC;
        }
    }

    public static AgentType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SIMPLE;
        }
        for (AgentType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + raw);
    }
}
