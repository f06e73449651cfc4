package io.agentflow.observability;

public final class HealthScores {
    private HealthScores() {
    }

    /**
     * Composite 0..100 score: {@code 0.5*successRate + 0.3*max(0, 100 - avgMs/100) + 0.2*(100 - errorRate)}.
     * Rates are percentages.
     */
    public static double compute(double successRate, double avgExecutionTimeMs, double errorRate) {
        double latency = Math.max(0.0, 100.0 - (avgExecutionTimeMs / 100.0));
        double raw = 0.5 * successRate + 0.3 * latency + 0.2 * (100.0 - errorRate);
        return clamp(raw);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }
}
