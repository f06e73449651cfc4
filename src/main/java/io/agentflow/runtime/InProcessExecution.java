package io.agentflow.runtime;

import io.agentflow.agent.Agent;
import io.agentflow.agent.AgentContext;
import io.agentflow.agent.AgentResult;
import io.agentflow.model.ExecutionResult;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs an agent on an executor thread and returns at the deadline whether or not the agent
 * cooperates. A timed-out task is interrupted and abandoned; its thread is a daemon. The caller
 * learns through {@link ExecutionLimits#onAbandoned()} when the abandoned code actually returns.
 */
final class InProcessExecution {
    private static final int PENDING = 0;
    private static final int ENTERED = 1;
    private static final int ABANDONED = 2;

    private InProcessExecution() {
    }

    static ExecutionResult run(ExecutorService executor, Agent agent, AgentContext context, ExecutionLimits limits, boolean sampleMemory) {
        AtomicReference<Thread> runner = new AtomicReference<>();
        AtomicLong baseline = new AtomicLong(-1L);
        AtomicInteger state = new AtomicInteger(PENDING);
        CompletableFuture<Void> exited = new CompletableFuture<>();
        Callable<AgentResult> task = () -> {
            if (!state.compareAndSet(PENDING, ENTERED)) {
                return null;
            }
            try {
                Thread current = Thread.currentThread();
                baseline.set(MemoryProbe.allocatedBytes(current));
                runner.set(current);
                return agent.execute(context);
            } finally {
                exited.complete(null);
            }
        };
        long started = System.nanoTime();
        long deadline = started + TimeUnit.MILLISECONDS.toNanos(limits.timeoutMs());
        Future<AgentResult> future = executor.submit(task);
        double peakMb = 0.0;
        while (true) {
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0L) {
                abandon(future, state, exited, limits);
                return ExecutionResult.timeout(limits.timeoutMs(), elapsedMs(started));
            }
            long waitNanos = sampleMemory
                    ? Math.min(remainingNanos, TimeUnit.MILLISECONDS.toNanos(limits.memorySampleIntervalMs()))
                    : remainingNanos;
            try {
                AgentResult result = future.get(waitNanos, TimeUnit.NANOSECONDS);
                double usedMb = sampleMemory ? Math.max(peakMb, sampleMb(runner.get(), baseline.get())) : 0.0;
                return toExecutionResult(result, elapsedMs(started), usedMb);
            } catch (TimeoutException e) {
                if (sampleMemory) {
                    peakMb = Math.max(peakMb, sampleMb(runner.get(), baseline.get()));
                    if (peakMb > limits.memoryLimitMb()) {
                        abandon(future, state, exited, limits);
                        return ExecutionResult.memoryExceeded(peakMb, limits.memoryLimitMb(), elapsedMs(started));
                    }
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof OutOfMemoryError) {
                    return ExecutionResult.memoryExceeded(peakMb, limits.memoryLimitMb(), elapsedMs(started));
                }
                return ExecutionResult.fail(describe(cause), elapsedMs(started), peakMb);
            } catch (InterruptedException e) {
                abandon(future, state, exited, limits);
                Thread.currentThread().interrupt();
                return ExecutionResult.fail("execution interrupted", elapsedMs(started), peakMb);
            }
        }
    }

    private static void abandon(Future<AgentResult> future, AtomicInteger state, CompletableFuture<Void> exited,
                                ExecutionLimits limits) {
        future.cancel(true);
        if (state.compareAndSet(PENDING, ABANDONED)) {
            // never started, so nothing is left running
            exited.complete(null);
        }
        limits.onAbandoned().accept(exited);
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static ExecutionResult toExecutionResult(AgentResult result, long elapsedMs, double usedMb) {
        if (result == null) {
            return ExecutionResult.fail("agent returned no result", elapsedMs, usedMb);
        }
        if (result.success()) {
            return ExecutionResult.ok(result.output(), elapsedMs, usedMb);
        }
        return ExecutionResult.fail(result.error() == null ? "agent reported failure" : result.error(), elapsedMs, usedMb);
    }

    private static double sampleMb(Thread thread, long baselineBytes) {
        if (thread == null || baselineBytes < 0L) {
            return 0.0;
        }
        long now = MemoryProbe.allocatedBytes(thread);
        return now < 0L ? 0.0 : MemoryProbe.toMb(now - baselineBytes);
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return t.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
