package io.agentflow.model;

public record ScheduledExecution(
        String id,
        String scheduleId,
        String agentId,
        String ownerId,
        long scheduledForMs,
        ScheduledExecutionStatus status,
        String queueItemId,
        String executionResult,
        Long executionTimeMs,
        String errorMessage,
        Long startedAtMs,
        Long completedAtMs
) {
    public static ScheduledExecution planned(String id, String scheduleId, String agentId, String ownerId, long scheduledForMs) {
        return new ScheduledExecution(id, scheduleId, agentId, ownerId, scheduledForMs,
                ScheduledExecutionStatus.SCHEDULED, null, null, null, null, null, null);
    }
}
