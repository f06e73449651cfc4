package io.agentflow.runtime;

import io.agentflow.agent.Agent;
import io.agentflow.agent.AgentContext;
import io.agentflow.integration.TenantDirectory;
import io.agentflow.model.AgentDescriptor;
import io.agentflow.model.ExecutionResult;
import io.agentflow.observability.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToIntFunction;

/**
 * One {@link OrganizationRuntime} per organization, created on first use with the limits of the
 * organization's subscription tier.
 */
public final class OrganizationRuntimeRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OrganizationRuntimeRegistry.class);
    static final double MEMORY_WARNING_PERCENT = 90.0;
    static final double HEALTH_WARNING_SCORE = 50.0;

    private final ConcurrentHashMap<String, OrganizationRuntime> runtimes = new ConcurrentHashMap<>();
    private final TenantDirectory tenants;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final ToIntFunction<String> queueDepth;

    public OrganizationRuntimeRegistry(TenantDirectory tenants, MetricsCollector metrics, Clock clock, ToIntFunction<String> queueDepth) {
        this.tenants = tenants;
        this.metrics = metrics;
        this.clock = clock;
        this.queueDepth = queueDepth;
    }

    public OrganizationRuntime getOrganizationRuntime(String organizationId) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId cannot be empty");
        }
        return runtimes.computeIfAbsent(organizationId, org -> {
            OrganizationRuntime runtime = new OrganizationRuntime(org, tenants.subscriptionTier(org), metrics, clock, queueDepth);
            metrics.registerRuntime(runtime.runtimeId(), org, runtime::gauges);
            log.info("runtime created org={} tier={} runtime={}", org, runtime.tier(), runtime.runtimeId());
            return runtime;
        });
    }

    public Optional<OrganizationRuntime> find(String organizationId) {
        return Optional.ofNullable(runtimes.get(organizationId));
    }

    public ExecutionResult executeAgent(String organizationId, AgentDescriptor descriptor, Agent agent, AgentContext context,
                                        Isolator isolator, long memorySampleIntervalMs) {
        return getOrganizationRuntime(organizationId).executeAgent(descriptor, agent, context, isolator, memorySampleIntervalMs);
    }

    public List<OrganizationRuntime.RuntimeStatusView> getRuntimeStatus() {
        List<OrganizationRuntime.RuntimeStatusView> out = new ArrayList<>();
        for (OrganizationRuntime runtime : runtimes.values()) {
            out.add(runtime.statusView());
        }
        out.sort(Comparator.comparing(OrganizationRuntime.RuntimeStatusView::organizationId));
        return out;
    }

    /**
     * Warnings for runtimes near their memory ceiling or with degraded container health.
     */
    public List<String> healthCheck() {
        List<String> warnings = new ArrayList<>();
        for (OrganizationRuntime.RuntimeStatusView view : getRuntimeStatus()) {
            if (view.memoryPercent() > MEMORY_WARNING_PERCENT) {
                String w = String.format("runtime %s memory usage %.1f%% of %dMB", view.runtimeId(), view.memoryPercent(), view.memoryLimitMb());
                log.warn(w);
                warnings.add(w);
            }
            if (view.healthScore() < HEALTH_WARNING_SCORE) {
                String w = String.format("runtime %s health score %.1f", view.runtimeId(), view.healthScore());
                log.warn(w);
                warnings.add(w);
            }
        }
        return warnings;
    }

    public void shutdown() {
        for (OrganizationRuntime runtime : runtimes.values()) {
            runtime.shutdown();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
