package io.agentflow.integration;

public interface NotificationSink {
    void notify(Notification notification);

    record Notification(
            String ownerId,
            String eventType,
            boolean success,
            String agentId,
            String agentName,
            String error,
            boolean email,
            boolean webhook
    ) {
    }
}
