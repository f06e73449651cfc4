package io.agentflow.runtime;

import io.agentflow.agent.Agent;
import io.agentflow.agent.AgentContext;
import io.agentflow.error.ExecutionRuntimeException;
import io.agentflow.error.ResourceExhaustedException;
import io.agentflow.model.AgentDescriptor;
import io.agentflow.model.ContainerStatus;
import io.agentflow.model.ExecutionResult;
import io.agentflow.model.RuntimeStatus;
import io.agentflow.model.SubscriptionTier;
import io.agentflow.observability.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToIntFunction;

/**
 * Per-organization execution environment: containers, a memory pool, and the tier's concurrency
 * and time limits. Capacity is checked before an execution starts and always returned after.
 */
public final class OrganizationRuntime {
    private static final Logger log = LoggerFactory.getLogger(OrganizationRuntime.class);
    public static final String DEFAULT_POOL = "default";

    private final String organizationId;
    private final String runtimeId;
    private final SubscriptionTier tier;
    private final ResourceLimits limits;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final ToIntFunction<String> queueDepth;
    private final Map<String, MemoryPool> memoryPools;
    private final ConcurrentHashMap<String, RuntimeContainer> containers = new ConcurrentHashMap<>();
    private final AtomicInteger runningExecutions = new AtomicInteger();
    private final AtomicLong lastActivityMs;
    private final long createdAtMs;
    private volatile RuntimeStatus status = RuntimeStatus.ACTIVE;

    OrganizationRuntime(String organizationId, SubscriptionTier tier, MetricsCollector metrics, Clock clock,
                        ToIntFunction<String> queueDepth) {
        this.organizationId = organizationId;
        this.tier = tier == null ? SubscriptionTier.UNKNOWN : tier;
        this.limits = ResourceLimits.forTier(this.tier);
        this.metrics = metrics;
        this.clock = clock;
        this.queueDepth = queueDepth;
        this.createdAtMs = clock.millis();
        this.lastActivityMs = new AtomicLong(createdAtMs);
        this.runtimeId = "runtime_" + organizationId + "_" + createdAtMs;
        Map<String, MemoryPool> pools = new LinkedHashMap<>();
        pools.put(DEFAULT_POOL, new MemoryPool(DEFAULT_POOL, limits.maxMemoryMb()));
        this.memoryPools = Collections.unmodifiableMap(pools);
    }

    public String organizationId() {
        return organizationId;
    }

    public String runtimeId() {
        return runtimeId;
    }

    public SubscriptionTier tier() {
        return tier;
    }

    public ResourceLimits limits() {
        return limits;
    }

    public RuntimeStatus status() {
        return status;
    }

    public MemoryPool memoryPool() {
        return memoryPools.get(DEFAULT_POOL);
    }

    public int runningExecutions() {
        return runningExecutions.get();
    }

    /**
     * Memory a container for this agent is granted: the declared amount, or the tier default.
     */
    public int containerMemoryMb(AgentDescriptor descriptor) {
        return descriptor.memoryMb() > 0 ? descriptor.memoryMb() : limits.defaultContainerMemoryMb();
    }

    public long effectiveTimeoutMs(AgentDescriptor descriptor) {
        long declared = descriptor.timeoutMs() > 0L ? descriptor.timeoutMs() : limits.maxExecutionTimeMs();
        return Math.min(declared, limits.maxExecutionTimeMs());
    }

    /**
     * Runs the agent in a container of this runtime.
     *
     * @throws ResourceExhaustedException when the runtime is not active, the concurrency limit is
     *                                    reached, or the memory pool cannot fit the container
     * @throws ExecutionRuntimeException  when the agent needs more memory than the tier allows
     */
    public ExecutionResult executeAgent(AgentDescriptor descriptor, Agent agent, AgentContext context,
                                        Isolator isolator, long memorySampleIntervalMs) {
        if (status != RuntimeStatus.ACTIVE) {
            throw new ResourceExhaustedException("Runtime " + runtimeId + " is " + status.name().toLowerCase());
        }
        MemoryPool pool = memoryPool();
        int memoryMb = containerMemoryMb(descriptor);
        if (memoryMb > pool.maxMemoryMb()) {
            throw new ExecutionRuntimeException("Agent " + descriptor.id() + " requires " + memoryMb
                    + "MB but the " + tier.name().toLowerCase() + " tier allows " + pool.maxMemoryMb() + "MB");
        }
        if (runningExecutions.incrementAndGet() > limits.maxConcurrentAgents()) {
            runningExecutions.decrementAndGet();
            throw new ResourceExhaustedException("Concurrent execution limit reached for " + organizationId
                    + " (" + limits.maxConcurrentAgents() + ")");
        }
        boolean allocated = false;
        AtomicReference<CompletableFuture<Void>> lingering = new AtomicReference<>();
        RuntimeContainer container = null;
        try {
            if (!pool.tryAllocate(memoryMb)) {
                throw new ResourceExhaustedException("Memory pool exhausted for " + organizationId + ": need "
                        + memoryMb + "MB, available " + pool.availableMemoryMb() + "MB");
            }
            allocated = true;
            container = acquireContainer(descriptor.id(), memoryMb);
            long now = clock.millis();
            lastActivityMs.set(now);
            ExecutionLimits executionLimits = new ExecutionLimits(effectiveTimeoutMs(descriptor), memoryMb,
                    memorySampleIntervalMs, lingering::set);
            return container.execute(agent, context, isolator, executionLimits, now);
        } finally {
            if (allocated) {
                releaseWhenExited(pool, memoryMb, lingering.get(), descriptor.id());
            }
            runningExecutions.decrementAndGet();
            lastActivityMs.set(clock.millis());
        }
    }

    /**
     * Memory of abandoned agent code stays allocated until that code returns.
     */
    private void releaseWhenExited(MemoryPool pool, int memoryMb, CompletableFuture<Void> stillRunning, String agentId) {
        if (stillRunning == null || stillRunning.isDone()) {
            pool.release(memoryMb);
            return;
        }
        log.warn("abandoned execution still running org={} agent={}; holding {}MB until it returns",
                organizationId, agentId, memoryMb);
        stillRunning.whenComplete((ignored, error) -> pool.release(memoryMb));
    }

    public double getHealthScore() {
        double sum = 0.0;
        int n = 0;
        for (RuntimeContainer c : containers.values()) {
            if (c.status() == ContainerStatus.STOPPED) {
                continue;
            }
            sum += c.healthScore();
            n++;
        }
        return n == 0 ? 100.0 : sum / n;
    }

    public void pause() {
        if (status == RuntimeStatus.ACTIVE) {
            status = RuntimeStatus.PAUSED;
            log.info("runtime paused org={} runtime={}", organizationId, runtimeId);
        }
    }

    public void resume() {
        if (status == RuntimeStatus.PAUSED) {
            status = RuntimeStatus.ACTIVE;
            log.info("runtime resumed org={} runtime={}", organizationId, runtimeId);
        }
    }

    public void shutdown() {
        status = RuntimeStatus.SHUTDOWN;
        for (RuntimeContainer c : containers.values()) {
            c.stop();
        }
        log.info("runtime shut down org={} runtime={}", organizationId, runtimeId);
    }

    public List<RuntimeContainer.ContainerView> containers() {
        List<RuntimeContainer.ContainerView> out = new ArrayList<>();
        for (RuntimeContainer c : containers.values()) {
            out.add(c.view());
        }
        return out;
    }

    public RuntimeStatusView statusView() {
        MemoryPool pool = memoryPool();
        int active = 0;
        for (RuntimeContainer c : containers.values()) {
            if (c.status() == ContainerStatus.RUNNING) {
                active++;
            }
        }
        double percent = pool.usedMemoryMb() * 100.0 / pool.maxMemoryMb();
        return new RuntimeStatusView(organizationId, runtimeId, tier, status, limits, active, containers.size(),
                runningExecutions.get(), pool.usedMemoryMb(), pool.maxMemoryMb(), percent, getHealthScore(),
                createdAtMs, lastActivityMs.get());
    }

    MetricsCollector.RuntimeGauges gauges() {
        RuntimeStatusView view = statusView();
        int depth = queueDepth == null ? 0 : queueDepth.applyAsInt(organizationId);
        return new MetricsCollector.RuntimeGauges(view.status(), view.activeContainers(), view.memoryUsageMb(),
                view.memoryLimitMb(), view.runningExecutions(), limits.maxConcurrentAgents(), depth);
    }

    private RuntimeContainer acquireContainer(String agentId, int memoryMb) {
        for (RuntimeContainer c : containers.values()) {
            if (c.agentId().equals(agentId) && c.memoryLimitMb() == memoryMb && c.tryAcquire()) {
                return c;
            }
        }
        String id = "ctr_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        RuntimeContainer created = new RuntimeContainer(id, agentId, organizationId, memoryMb, metrics, clock.millis());
        created.tryAcquire();
        containers.put(id, created);
        log.debug("container created org={} agent={} container={}", organizationId, agentId, id);
        return created;
    }

    public record RuntimeStatusView(
            String organizationId,
            String runtimeId,
            SubscriptionTier tier,
            RuntimeStatus status,
            ResourceLimits limits,
            int activeContainers,
            int totalContainers,
            int runningExecutions,
            int memoryUsageMb,
            int memoryLimitMb,
            double memoryPercent,
            double healthScore,
            long createdAtMs,
            long lastActivityMs
    ) {
    }
}
