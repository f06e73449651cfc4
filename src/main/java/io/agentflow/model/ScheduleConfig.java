package io.agentflow.model;

/**
 * Declarative schedule as submitted by an owner. Exactly one of {@code intervalMinutes},
 * {@code cronExpression} or {@code webhookEndpoint} is meaningful, selected by {@code scheduleType}.
 */
public record ScheduleConfig(
        String agentId,
        String ownerId,
        ScheduleType scheduleType,
        Integer intervalMinutes,
        String cronExpression,
        String webhookEndpoint,
        String timezone,
        boolean enabled,
        Integer maxExecutionsPerDay,
        boolean retryOnFailure,
        NotificationPreferences notificationPreferences
) {
    public static ScheduleConfig interval(String agentId, String ownerId, int intervalMinutes, int maxExecutionsPerDay) {
        return new ScheduleConfig(agentId, ownerId, ScheduleType.INTERVAL, intervalMinutes, null, null,
                "UTC", true, maxExecutionsPerDay, false, NotificationPreferences.defaults());
    }

    public static ScheduleConfig cron(String agentId, String ownerId, String cronExpression, int maxExecutionsPerDay) {
        return new ScheduleConfig(agentId, ownerId, ScheduleType.CRON, null, cronExpression, null,
                "UTC", true, maxExecutionsPerDay, false, NotificationPreferences.defaults());
    }

    public ScheduleConfig withEnabled(boolean value) {
        return new ScheduleConfig(agentId, ownerId, scheduleType, intervalMinutes, cronExpression, webhookEndpoint,
                timezone, value, maxExecutionsPerDay, retryOnFailure, notificationPreferences);
    }

    public ScheduleConfig withRetryOnFailure(boolean value) {
        return new ScheduleConfig(agentId, ownerId, scheduleType, intervalMinutes, cronExpression, webhookEndpoint,
                timezone, enabled, maxExecutionsPerDay, value, notificationPreferences);
    }

    public ScheduleConfig withNotificationPreferences(NotificationPreferences value) {
        return new ScheduleConfig(agentId, ownerId, scheduleType, intervalMinutes, cronExpression, webhookEndpoint,
                timezone, enabled, maxExecutionsPerDay, retryOnFailure, value);
    }
}
