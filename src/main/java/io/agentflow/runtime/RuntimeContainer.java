package io.agentflow.runtime;

import io.agentflow.agent.Agent;
import io.agentflow.agent.AgentContext;
import io.agentflow.model.ContainerStatus;
import io.agentflow.model.ExecutionResult;
import io.agentflow.observability.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded execution context for one agent in one organization. A container runs one execution at
 * a time; an ERROR container is recycled on the next acquire.
 */
public final class RuntimeContainer {
    private static final Logger log = LoggerFactory.getLogger(RuntimeContainer.class);
    private static final double SUCCESS_BONUS = 5.0;
    private static final double ERROR_DECAY = 0.8;
    private static final double TIMEOUT_DECAY = 0.7;

    private final String containerId;
    private final String agentId;
    private final String organizationId;
    private final int memoryLimitMb;
    private final MetricsCollector metrics;
    private final long createdAtMs;

    private ContainerStatus status = ContainerStatus.IDLE;
    private int executionCount;
    private int errorCount;
    private double healthScore = 100.0;
    private double lastMemoryUsageMb;
    private String lastError;
    private long lastUsedAtMs;

    RuntimeContainer(String containerId, String agentId, String organizationId, int memoryLimitMb,
                     MetricsCollector metrics, long createdAtMs) {
        this.containerId = containerId;
        this.agentId = agentId;
        this.organizationId = organizationId;
        this.memoryLimitMb = memoryLimitMb;
        this.metrics = metrics;
        this.createdAtMs = createdAtMs;
        this.lastUsedAtMs = createdAtMs;
    }

    public String containerId() {
        return containerId;
    }

    public String agentId() {
        return agentId;
    }

    public String organizationId() {
        return organizationId;
    }

    public int memoryLimitMb() {
        return memoryLimitMb;
    }

    public synchronized ContainerStatus status() {
        return status;
    }

    public synchronized int executionCount() {
        return executionCount;
    }

    public synchronized int errorCount() {
        return errorCount;
    }

    public synchronized double healthScore() {
        return healthScore;
    }

    public synchronized double lastMemoryUsageMb() {
        return lastMemoryUsageMb;
    }

    public synchronized String lastError() {
        return lastError;
    }

    public synchronized boolean isHealthy() {
        if (status == ContainerStatus.ERROR) {
            return false;
        }
        return executionCount == 0 || (double) errorCount / executionCount < 0.5;
    }

    synchronized boolean tryAcquire() {
        if (status == ContainerStatus.IDLE || status == ContainerStatus.ERROR) {
            status = ContainerStatus.RUNNING;
            return true;
        }
        return false;
    }

    synchronized void stop() {
        status = ContainerStatus.STOPPED;
    }

    /**
     * Runs one execution. The caller must hold the container via {@link #tryAcquire()}.
     */
    ExecutionResult execute(Agent agent, AgentContext context, Isolator isolator, ExecutionLimits limits, long nowMs) {
        ExecutionResult result;
        try {
            result = isolator.run(agent, context, limits);
        } catch (RuntimeException e) {
            log.error("isolator {} failed for container {}: {}", isolator.tier(), containerId, e.getMessage());
            result = ExecutionResult.fail("isolation failure: " + e.getMessage(), 0L, 0.0);
        }
        synchronized (this) {
            executionCount++;
            lastUsedAtMs = nowMs;
            lastMemoryUsageMb = result.memoryUsedMb();
            if (result.success()) {
                healthScore = Math.min(100.0, healthScore + SUCCESS_BONUS);
                lastError = null;
                status = status == ContainerStatus.STOPPED ? ContainerStatus.STOPPED : ContainerStatus.IDLE;
            } else {
                errorCount++;
                lastError = result.error();
                boolean hard = result.timedOut() || result.memoryExceeded();
                healthScore = healthScore * (hard ? TIMEOUT_DECAY : ERROR_DECAY);
                if (status != ContainerStatus.STOPPED) {
                    status = hard ? ContainerStatus.ERROR : ContainerStatus.IDLE;
                }
            }
        }
        if (result.timedOut()) {
            metrics.recordContainerTimeout(containerId, agentId, context.executionId(), limits.timeoutMs());
        } else if (!result.success()) {
            metrics.recordContainerError(containerId, agentId, context.executionId(), result.error());
        }
        metrics.recordContainerExecution(containerId, agentId, context.executionId(), result.success(),
                result.executionTimeMs(), result.memoryUsedMb(), result.error());
        return result;
    }

    public synchronized ContainerView view() {
        return new ContainerView(containerId, agentId, status, executionCount, errorCount, healthScore,
                memoryLimitMb, lastMemoryUsageMb, lastError, createdAtMs, lastUsedAtMs);
    }

    public record ContainerView(
            String containerId,
            String agentId,
            ContainerStatus status,
            int executionCount,
            int errorCount,
            double healthScore,
            int memoryLimitMb,
            double lastMemoryUsageMb,
            String lastError,
            long createdAtMs,
            long lastUsedAtMs
    ) {
    }
}
