package io.agentflow.model;

/**
 * Outcome of one agent run inside a container. Immutable once produced.
 */
public record ExecutionResult(
        boolean success,
        String output,
        String error,
        long executionTimeMs,
        double memoryUsedMb,
        boolean timedOut,
        boolean memoryExceeded
) {
    public static ExecutionResult ok(String output, long executionTimeMs, double memoryUsedMb) {
        return new ExecutionResult(true, output, null, executionTimeMs, memoryUsedMb, false, false);
    }

    public static ExecutionResult fail(String error, long executionTimeMs, double memoryUsedMb) {
        return new ExecutionResult(false, null, error, executionTimeMs, memoryUsedMb, false, false);
    }

    public static ExecutionResult timeout(long timeoutMs, long executionTimeMs) {
        return new ExecutionResult(false, null, "Execution timeout after " + timeoutMs + "ms",
                executionTimeMs, 0.0, true, false);
    }

    public static ExecutionResult memoryExceeded(double usedMb, int limitMb, long executionTimeMs) {
        return new ExecutionResult(false, null,
                "Memory limit exceeded: used " + Math.round(usedMb) + "MB of " + limitMb + "MB",
                executionTimeMs, usedMb, false, true);
    }
}
