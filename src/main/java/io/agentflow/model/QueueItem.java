package io.agentflow.model;

public record QueueItem(
        String id,
        long seq,
        String organizationId,
        String agentId,
        String ownerId,
        QueueSource source,
        String scheduleExecutionId,
        QueueStatus status,
        int priority,
        String payload,
        int retryCount,
        int maxRetries,
        String result,
        String lastError,
        String claimedBy,
        long availableAtMs,
        long createdAtMs,
        long updatedAtMs
) {
}
