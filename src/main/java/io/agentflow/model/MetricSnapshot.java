package io.agentflow.model;

public record MetricSnapshot(
        String runtimeId,
        long timestampMs,
        int executionCount,
        int errorCount,
        double avgResponseTimeMs,
        double memoryUsageMb,
        int activeContainers,
        int executionsPerMinute,
        double successRate,
        double errorRate,
        double healthScore
) {
}
