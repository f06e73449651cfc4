package io.agentflow.engine;

import io.agentflow.agent.AgentRegistry;
import io.agentflow.agent.EchoAgent;
import io.agentflow.agent.FailAgent;
import io.agentflow.config.AgentFlowConfig;
import io.agentflow.config.EngineSettings;
import io.agentflow.config.SettingsManager;
import io.agentflow.integration.FailureAlertSink;
import io.agentflow.integration.InMemoryPurchaseLedger;
import io.agentflow.integration.LoggingFailureAlertSink;
import io.agentflow.integration.LoggingNotificationSink;
import io.agentflow.integration.NotificationSink;
import io.agentflow.integration.PurchaseLedger;
import io.agentflow.integration.StaticTenantDirectory;
import io.agentflow.integration.TenantDirectory;
import io.agentflow.model.AgentDescriptor;
import io.agentflow.model.AgentType;
import io.agentflow.model.IsolationTier;
import io.agentflow.model.MetricSnapshot;
import io.agentflow.model.QueueSource;
import io.agentflow.observability.AuditLogger;
import io.agentflow.observability.FailureAlertMonitor;
import io.agentflow.observability.MetricsCollector;
import io.agentflow.observability.PrometheusFormatter;
import io.agentflow.runtime.CompletionWaiter;
import io.agentflow.runtime.ExecutionDispatcher;
import io.agentflow.runtime.Isolator;
import io.agentflow.runtime.OrganizationRuntime;
import io.agentflow.runtime.OrganizationRuntimeRegistry;
import io.agentflow.runtime.RuntimeIntegratedExecutionEngine;
import io.agentflow.scheduler.AgentController;
import io.agentflow.scheduler.ExecutionScheduler;
import io.agentflow.storage.AgentStateStore;
import io.agentflow.storage.Database;
import io.agentflow.storage.ExecutionQueue;
import io.agentflow.storage.MetricsStore;
import io.agentflow.storage.ScheduleStore;
import io.agentflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires the engine together and owns its lifecycle: {@link #init()} prepares storage and settings,
 * {@link #start()} launches the dispatch workers and the periodic metrics pass, {@link #close()}
 * stops both and flushes the metrics store.
 */
public final class AgentFlowEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentFlowEngine.class);
    private static final long SETTINGS_RELOAD_INTERVAL_MS = 10_000L;

    private final AgentFlowConfig config;
    private final Clock clock;
    private final AgentRegistry agents;
    private final Database database;
    private final ExecutionQueue queue;
    private final ScheduleStore scheduleStore;
    private final AgentStateStore agentState;
    private final AuditLogger audit;
    private final SettingsManager settings;
    private final MetricsCollector metrics;
    private final OrganizationRuntimeRegistry runtimes;
    private final RuntimeIntegratedExecutionEngine executionEngine;
    private final CompletionWaiter waiter;
    private final FailureAlertMonitor failureAlerts;
    private final ExecutionDispatcher dispatcher;
    private final ExecutionScheduler scheduler;
    private final AgentController agentController;
    private final FailureAlertSink alertSink;
    private final TenantDirectory tenants;
    private ScheduledExecutorService maintenance;
    private boolean closed;

    public AgentFlowEngine(AgentFlowConfig config, AgentRegistry agents, Collaborators collaborators, Clock clock) {
        this.config = config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.agents = agents;
        this.tenants = collaborators.tenants();
        this.database = new Database(config);
        this.queue = new ExecutionQueue(database);
        this.scheduleStore = new ScheduleStore(database);
        this.agentState = new AgentStateStore(database);
        this.audit = new AuditLogger(config.auditFile());
        this.settings = collaborators.settings() != null
                ? collaborators.settings()
                : new SettingsManager(config.settingsFile(), audit);
        this.metrics = new MetricsCollector(new MetricsStore(database), this.clock);
        this.runtimes = new OrganizationRuntimeRegistry(collaborators.tenants(), metrics, this.clock,
                org -> queue.pendingDepthByOrganization().getOrDefault(org, 0));
        Map<IsolationTier, Isolator> isolators = collaborators.isolators() != null
                ? collaborators.isolators()
                : RuntimeIntegratedExecutionEngine.defaultIsolators();
        this.executionEngine = new RuntimeIntegratedExecutionEngine(agents, runtimes, collaborators.tenants(), metrics,
                isolators, settings::current, this.clock);
        this.waiter = new CompletionWaiter(queue, () -> settings.current().completionPollIntervalMs());
        this.alertSink = collaborators.failureAlerts();
        this.failureAlerts = new FailureAlertMonitor(this::onFailureAlert, settings::current);
        this.dispatcher = new ExecutionDispatcher(queue, executionEngine, runtimes, failureAlerts, audit, settings::current, this.clock);
        this.scheduler = new ExecutionScheduler(scheduleStore, queue, agentState, agents, collaborators.purchases(),
                collaborators.tenants(), waiter, collaborators.notifications(), audit, settings::current, this.clock);
        this.agentController = new AgentController(agentState, scheduler, queue, scheduleStore, audit, settings::current, this.clock);
    }

    /**
     * Engine over a data root with the file-backed collaborators and the built-in agents plus
     * whatever {@code agents/agents.json} declares.
     */
    public static AgentFlowEngine open(AgentFlowConfig config) {
        AgentRegistry registry = new AgentRegistry();
        registry.register(new AgentDescriptor(EchoAgent.ID, "Echo", "system", AgentType.SIMPLE,
                AgentFlowConfig.DEFAULT_AGENT_MEMORY_MB, AgentFlowConfig.DEFAULT_AGENT_TIMEOUT_MS), new EchoAgent());
        registry.register(new AgentDescriptor(FailAgent.ID, "Fail", "system", AgentType.SIMPLE,
                AgentFlowConfig.DEFAULT_AGENT_MEMORY_MB, AgentFlowConfig.DEFAULT_AGENT_TIMEOUT_MS), new FailAgent());
        AgentFlowEngine engine = new AgentFlowEngine(config, registry, Collaborators.fromConfig(config), Clock.systemUTC());
        engine.init();
        EngineSettings s = engine.settings.current();
        registry.loadDefinitions(config.agentsFile(), s.defaultAgentMemoryMb(), s.defaultAgentTimeoutMs());
        return engine;
    }

    public void init() {
        database.init();
        settings.reload(true);
    }

    public synchronized void start() {
        if (maintenance != null) {
            return;
        }
        dispatcher.start();
        maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentflow-maintenance");
            t.setDaemon(true);
            return t;
        });
        long interval = settings.current().metricsIntervalMs();
        maintenance.scheduleWithFixedDelay(this::runMaintenance, interval, interval, TimeUnit.MILLISECONDS);
        log.info("engine started root={}", config.rootDir());
    }

    /**
     * One maintenance tick: settings reload check, metric snapshots, runtime health warnings.
     */
    public void runMaintenance() {
        try {
            settings.maybeReload(SETTINGS_RELOAD_INTERVAL_MS);
            metrics.calculateAll();
            runtimes.healthCheck();
        } catch (RuntimeException e) {
            log.error("maintenance tick failed: {}", e.getMessage());
        }
    }

    public String triggerManual(String agentId, String ownerId, String payload, int maxRetries) {
        scheduler.requirePermission(agentId, ownerId);
        String id = queue.enqueue(new ExecutionQueue.EnqueueRequest(
                tenantOrganization(ownerId), agentId, ownerId, settings.current().manualPriority(),
                payload, Math.max(0, maxRetries), QueueSource.MANUAL, null), clock.millis());
        auditEnqueue(id, ownerId, agentId, QueueSource.MANUAL);
        return id;
    }

    /**
     * Enqueues a webhook-triggered execution. Signature and rate checks happen before this call.
     */
    public String triggerWebhook(String agentId, String ownerId, String method, Map<String, String> headers,
                                 String body, Map<String, String> query) {
        agents.require(agentId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("method", method);
        payload.put("headers", headers == null ? Map.of() : headers);
        payload.put("body", body);
        payload.put("query", query == null ? Map.of() : query);
        payload.put("triggered_by", "webhook");
        String id = queue.enqueue(new ExecutionQueue.EnqueueRequest(
                tenantOrganization(ownerId), agentId, ownerId, settings.current().webhookPriority(),
                Jsons.toCompactJson(payload), 0, QueueSource.WEBHOOK, null), clock.millis());
        auditEnqueue(id, ownerId, agentId, QueueSource.WEBHOOK);
        return id;
    }

    public CompletionWaiter.CompletionOutcome awaitCompletion(String queueItemId, long timeoutMs) {
        return waiter.await(queueItemId, timeoutMs);
    }

    public Optional<ExecutionQueue.QueueItemStatus> getQueueItemStatus(String queueItemId) {
        return queue.getQueueItemStatus(queueItemId);
    }

    public boolean cancel(String queueItemId) {
        boolean cancelled = queue.cancel(queueItemId, clock.millis());
        if (cancelled) {
            audit.log(AuditLogger.AuditEvent.of("execution.cancel", "system", "execution/" + queueItemId, "cancelled", Map.of()));
        }
        return cancelled;
    }

    public MetricsCollector.DashboardMetrics getDashboardMetrics() {
        return metrics.getDashboardMetrics();
    }

    public List<MetricSnapshot> getRuntimeMetricsHistory(String runtimeId, long startMs, long endMs) {
        return metrics.getRuntimeMetricsHistory(runtimeId, startMs, endMs);
    }

    public List<OrganizationRuntime.RuntimeStatusView> getRuntimeStatus() {
        return runtimes.getRuntimeStatus();
    }

    public String prometheusMetrics() {
        return PrometheusFormatter.format(metrics.getDashboardMetrics(), runtimes.getRuntimeStatus(), queue.statusCounts(),
                queue.claimConflictCount());
    }

    public AuditLogger.IntegrityOutcome verifyAuditIntegrity() {
        return audit.verify();
    }

    public SettingsManager.ReloadOutcome reloadSettings() {
        return settings.reload(true);
    }

    public AgentFlowConfig config() {
        return config;
    }

    public AgentRegistry agents() {
        return agents;
    }

    public ExecutionQueue queue() {
        return queue;
    }

    public ScheduleStore scheduleStore() {
        return scheduleStore;
    }

    public ExecutionScheduler scheduler() {
        return scheduler;
    }

    public AgentController agentController() {
        return agentController;
    }

    public ExecutionDispatcher dispatcher() {
        return dispatcher;
    }

    public OrganizationRuntimeRegistry runtimes() {
        return runtimes;
    }

    public MetricsCollector metrics() {
        return metrics;
    }

    public EngineSettings settings() {
        return settings.current();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (maintenance != null) {
            maintenance.shutdownNow();
        }
        dispatcher.close();
        try {
            metrics.close();
        } finally {
            executionEngine.close();
            runtimes.close();
        }
        log.info("engine closed root={}", config.rootDir());
    }

    private void onFailureAlert(FailureAlertSink.FailureAlert alert) {
        audit.log(AuditLogger.AuditEvent.of("agent.failure_alert", "system", "agent/" + alert.agentId(), "raised", Map.of(
                "failure_count", alert.failureCount(),
                "window_minutes", alert.windowMinutes())));
        alertSink.agentFailing(alert);
        if (settings.current().autoDisableOnFailureAlert()) {
            int disabled = scheduler.disableSchedulesForAgent(alert.agentId());
            log.warn("auto-disabled {} schedules of failing agent {}", disabled, alert.agentId());
        }
    }

    private String tenantOrganization(String ownerId) {
        return tenants.organizationOf(ownerId);
    }

    private void auditEnqueue(String id, String ownerId, String agentId, QueueSource source) {
        audit.log(AuditLogger.AuditEvent.of("execution.enqueue", ownerId, "execution/" + id, "pending", Map.of(
                "agent_id", agentId,
                "source", source.dbValue())));
    }

    /**
     * External collaborators. {@code settings} and {@code isolators} may be null to use the
     * file-backed settings and the default isolation tiers.
     */
    public record Collaborators(
            PurchaseLedger purchases,
            TenantDirectory tenants,
            NotificationSink notifications,
            FailureAlertSink failureAlerts,
            SettingsManager settings,
            Map<IsolationTier, Isolator> isolators
    ) {
        public static Collaborators fromConfig(AgentFlowConfig config) {
            return new Collaborators(
                    InMemoryPurchaseLedger.fromFile(config.purchasesFile()),
                    StaticTenantDirectory.fromFile(config.tenantsFile()),
                    new LoggingNotificationSink(),
                    new LoggingFailureAlertSink(),
                    null,
                    null);
        }
    }
}
