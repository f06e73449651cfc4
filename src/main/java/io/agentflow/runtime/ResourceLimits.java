package io.agentflow.runtime;

import io.agentflow.model.SubscriptionTier;

public record ResourceLimits(int maxConcurrentAgents, int maxMemoryMb, int maxExecutionTimeSeconds) {
    public ResourceLimits {
        if (maxConcurrentAgents < 1 || maxMemoryMb < 1 || maxExecutionTimeSeconds < 1) {
            throw new IllegalArgumentException("resource limits must be positive");
        }
    }

    public static ResourceLimits forTier(SubscriptionTier tier) {
        if (tier == null) {
            return new ResourceLimits(1, 128, 30);
        }
        switch (tier) {
            case FREE:
                return new ResourceLimits(2, 256, 60);
            case PRO:
                return new ResourceLimits(10, 1024, 300);
            case ENTERPRISE:
                return new ResourceLimits(50, 4096, 1800);
            default:
                return new ResourceLimits(1, 128, 30);
        }
    }

    public long maxExecutionTimeMs() {
        return maxExecutionTimeSeconds * 1000L;
    }

    /**
     * Memory granted to a container when the agent declares none.
     */
    public int defaultContainerMemoryMb() {
        return Math.max(1, Math.min(256, maxMemoryMb / 4));
    }
}
