package io.agentflow.runtime;

import io.agentflow.model.QueueStatus;
import io.agentflow.storage.ExecutionQueue;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;

/**
 * Waits for a queue item to reach a terminal status. In-process transitions wake waiters
 * immediately; the store is re-read every poll interval for transitions made elsewhere.
 */
public final class CompletionWaiter implements ExecutionQueue.TransitionListener {
    private final ExecutionQueue queue;
    private final LongSupplier pollIntervalMs;
    private final ConcurrentHashMap<String, Set<CompletableFuture<QueueStatus>>> waiters = new ConcurrentHashMap<>();

    public CompletionWaiter(ExecutionQueue queue, LongSupplier pollIntervalMs) {
        this.queue = queue;
        this.pollIntervalMs = pollIntervalMs;
        queue.addListener(this);
    }

    @Override
    public void onTransition(String itemId, QueueStatus status) {
        if (!status.isTerminal()) {
            return;
        }
        Set<CompletableFuture<QueueStatus>> pending = waiters.get(itemId);
        if (pending == null) {
            return;
        }
        for (CompletableFuture<QueueStatus> f : pending) {
            f.complete(status);
        }
    }

    public CompletionOutcome await(String itemId, long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        CompletableFuture<QueueStatus> signal = new CompletableFuture<>();
        Set<CompletableFuture<QueueStatus>> set = waiters.computeIfAbsent(itemId, k -> ConcurrentHashMap.newKeySet());
        set.add(signal);
        try {
            while (true) {
                Optional<ExecutionQueue.QueueItemStatus> current = queue.getQueueItemStatus(itemId);
                if (current.isEmpty()) {
                    return CompletionOutcome.failure("Queue item not found", null);
                }
                ExecutionQueue.QueueItemStatus s = current.get();
                if (s.status() == QueueStatus.COMPLETED) {
                    return new CompletionOutcome(true, s.result(), null, s.status());
                }
                if (s.status() == QueueStatus.FAILED) {
                    return CompletionOutcome.failure(s.lastError() == null ? "Execution failed" : s.lastError(), s.status());
                }
                if (s.status() == QueueStatus.CANCELLED) {
                    return CompletionOutcome.failure("Execution cancelled", s.status());
                }
                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0L) {
                    return CompletionOutcome.failure("Execution timed out", s.status());
                }
                long waitNanos = Math.min(remainingNanos, TimeUnit.MILLISECONDS.toNanos(Math.max(1L, pollIntervalMs.getAsLong())));
                try {
                    signal.get(waitNanos, TimeUnit.NANOSECONDS);
                } catch (TimeoutException ignored) {
                    // Poll the store again.
                } catch (ExecutionException e) {
                    return CompletionOutcome.failure("Completion signal failed: " + e.getCause(), s.status());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return CompletionOutcome.failure("Interrupted while waiting", s.status());
                }
            }
        } finally {
            set.remove(signal);
            waiters.computeIfPresent(itemId, (k, v) -> v.isEmpty() ? null : v);
        }
    }

    int waiterCount() {
        int n = 0;
        for (Set<CompletableFuture<QueueStatus>> s : waiters.values()) {
            n += s.size();
        }
        return n;
    }

    public record CompletionOutcome(boolean success, String result, String error, QueueStatus status) {
        static CompletionOutcome failure(String error, QueueStatus status) {
            return new CompletionOutcome(false, null, error, status);
        }
    }
}
