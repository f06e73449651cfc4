package io.agentflow.model;

/**
 * Partial update of a schedule. Null fields are left unchanged.
 */
public record ScheduleUpdate(
        Integer intervalMinutes,
        String cronExpression,
        String webhookEndpoint,
        String timezone,
        Boolean enabled,
        Integer maxExecutionsPerDay,
        Boolean retryOnFailure,
        NotificationPreferences notificationPreferences
) {
    public static ScheduleUpdate enabled(boolean value) {
        return new ScheduleUpdate(null, null, null, null, value, null, null, null);
    }
}
