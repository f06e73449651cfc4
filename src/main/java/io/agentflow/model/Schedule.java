package io.agentflow.model;

public record Schedule(
        String id,
        ScheduleConfig config,
        long createdAtMs,
        long updatedAtMs
) {
    public boolean enabled() {
        return config.enabled();
    }

    public Schedule withConfig(ScheduleConfig next, long nowMs) {
        return new Schedule(id, next, createdAtMs, nowMs);
    }
}
