package io.agentflow.runtime;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Limits for one invocation. {@code onAbandoned} receives a future that completes once agent code
 * abandoned at the deadline has really returned; in-process isolators cannot stop a thread that
 * ignores interrupts.
 */
public record ExecutionLimits(long timeoutMs, int memoryLimitMb, long memorySampleIntervalMs,
                              Consumer<CompletableFuture<Void>> onAbandoned) {
    public ExecutionLimits {
        if (timeoutMs < 1L) {
            throw new IllegalArgumentException("timeoutMs must be >= 1");
        }
        if (memoryLimitMb < 1) {
            throw new IllegalArgumentException("memoryLimitMb must be >= 1");
        }
        memorySampleIntervalMs = Math.max(1L, memorySampleIntervalMs);
        if (onAbandoned == null) {
            onAbandoned = exited -> {
            };
        }
    }

    public ExecutionLimits(long timeoutMs, int memoryLimitMb, long memorySampleIntervalMs) {
        this(timeoutMs, memoryLimitMb, memorySampleIntervalMs, null);
    }
}
