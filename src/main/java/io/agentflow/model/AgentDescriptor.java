package io.agentflow.model;

/**
 * Catalog facts about an agent that the engine needs for permission checks and sizing.
 */
public record AgentDescriptor(
        String id,
        String name,
        String developerId,
        AgentType type,
        int memoryMb,
        long timeoutMs
) {
    public AgentDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        name = name == null || name.isBlank() ? id : name;
        type = type == null ? AgentType.SIMPLE : type;
    }
}
