package io.agentflow.model;

public record NotificationPreferences(
        boolean onSuccess,
        boolean onFailure,
        boolean email,
        boolean webhook
) {
    public static NotificationPreferences defaults() {
        return new NotificationPreferences(false, true, true, false);
    }

    public boolean matches(boolean success) {
        return (success && onSuccess) || (!success && onFailure);
    }
}
