package io.agentflow.runtime;

import io.agentflow.agent.AgentContext;
import io.agentflow.agent.AgentRegistry;
import io.agentflow.config.EngineSettings;
import io.agentflow.integration.TenantDirectory;
import io.agentflow.model.AgentDescriptor;
import io.agentflow.model.ExecutionResult;
import io.agentflow.model.IsolationTier;
import io.agentflow.model.QueueItem;
import io.agentflow.model.SubscriptionTier;
import io.agentflow.observability.MetricsCollector;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Executes claimed queue items inside the owning organization's runtime under the isolation tier
 * chosen for the agent.
 */
public final class RuntimeIntegratedExecutionEngine implements AutoCloseable {
    private final AgentRegistry agents;
    private final OrganizationRuntimeRegistry runtimes;
    private final TenantDirectory tenants;
    private final MetricsCollector metrics;
    private final Map<IsolationTier, Isolator> isolators;
    private final Supplier<EngineSettings> settings;
    private final Clock clock;

    public RuntimeIntegratedExecutionEngine(AgentRegistry agents, OrganizationRuntimeRegistry runtimes, TenantDirectory tenants,
                                            MetricsCollector metrics, Map<IsolationTier, Isolator> isolators,
                                            Supplier<EngineSettings> settings, Clock clock) {
        for (IsolationTier tier : IsolationTier.values()) {
            if (!isolators.containsKey(tier)) {
                throw new IllegalArgumentException("missing isolator for tier " + tier);
            }
        }
        this.agents = agents;
        this.runtimes = runtimes;
        this.tenants = tenants;
        this.metrics = metrics;
        this.isolators = new EnumMap<>(isolators);
        this.settings = settings;
        this.clock = clock;
    }

    public static Map<IsolationTier, Isolator> defaultIsolators() {
        Map<IsolationTier, Isolator> out = new EnumMap<>(IsolationTier.class);
        out.put(IsolationTier.BASIC, new BasicIsolator());
        out.put(IsolationTier.ENHANCED, new EnhancedIsolator());
        out.put(IsolationTier.STRICT, new StrictIsolator());
        return out;
    }

    /**
     * Enterprise organizations always run strict; otherwise the agent type decides.
     */
    public IsolationTier determineIsolationTier(AgentDescriptor descriptor, String organizationId) {
        if (tenants.subscriptionTier(organizationId) == SubscriptionTier.ENTERPRISE) {
            return IsolationTier.STRICT;
        }
        return descriptor.type().defaultTier();
    }

    public ExecutionResult execute(QueueItem item) {
        AgentRegistry.Registration registration = agents.require(item.agentId());
        AgentDescriptor descriptor = registration.descriptor();
        IsolationTier tier = determineIsolationTier(descriptor, item.organizationId());
        AgentContext context = new AgentContext(item.id(), item.agentId(), item.ownerId(), item.organizationId(),
                item.payload(), item.retryCount() + 1);
        OrganizationRuntime runtime = runtimes.getOrganizationRuntime(item.organizationId());
        ExecutionResult result = runtime.executeAgent(descriptor, registration.agent(), context, isolators.get(tier),
                settings.get().memorySampleIntervalMs());
        metrics.recordExecution(new MetricsCollector.ExecutionMetric(item.id(), runtime.runtimeId(), item.organizationId(),
                item.agentId(), result.success(), result.executionTimeMs(), result.memoryUsedMb(), result.timedOut(),
                clock.millis(), result.error()));
        return result;
    }

    @Override
    public void close() {
        for (Isolator isolator : isolators.values()) {
            isolator.close();
        }
    }
}
