package io.agentflow.agent;

public record AgentContext(
        String executionId,
        String agentId,
        String ownerId,
        String organizationId,
        String payload,
        int attempt
) {
    public AgentContext withPayload(String value) {
        return new AgentContext(executionId, agentId, ownerId, organizationId, value, attempt);
    }
}
