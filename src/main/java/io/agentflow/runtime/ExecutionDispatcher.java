package io.agentflow.runtime;

import io.agentflow.config.EngineSettings;
import io.agentflow.error.AgentFlowException;
import io.agentflow.error.InfrastructureException;
import io.agentflow.model.ExecutionResult;
import io.agentflow.model.QueueItem;
import io.agentflow.observability.AuditLogger;
import io.agentflow.observability.FailureAlertMonitor;
import io.agentflow.storage.ExecutionQueue;
import io.agentflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Claims queue items and runs them through the execution engine. Each organization gets its own
 * worker threads, as many as its tier allows concurrent agents.
 */
public final class ExecutionDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final ExecutionQueue queue;
    private final RuntimeIntegratedExecutionEngine engine;
    private final OrganizationRuntimeRegistry runtimes;
    private final FailureAlertMonitor alerts;
    private final AuditLogger audit;
    private final Supplier<EngineSettings> settings;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ConcurrentHashMap<String, ExecutorService> workerPools = new ConcurrentHashMap<>();
    private ScheduledExecutorService coordinator;

    public ExecutionDispatcher(ExecutionQueue queue, RuntimeIntegratedExecutionEngine engine, OrganizationRuntimeRegistry runtimes,
                               FailureAlertMonitor alerts, AuditLogger audit, Supplier<EngineSettings> settings, Clock clock) {
        this.queue = queue;
        this.engine = engine;
        this.runtimes = runtimes;
        this.alerts = alerts;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Claims and runs at most one item of the organization.
     */
    public WorkerOutcome runOnce(String organizationId, String workerId) {
        Optional<QueueItem> claimed = queue.claim(organizationId, workerId, clock.millis());
        if (claimed.isEmpty()) {
            return WorkerOutcome.idle(organizationId);
        }
        return process(claimed.get(), workerId);
    }

    /**
     * Runs items of the organization until nothing is claimable.
     */
    public List<WorkerOutcome> drain(String organizationId, String workerId) {
        List<WorkerOutcome> out = new ArrayList<>();
        while (true) {
            WorkerOutcome outcome = runOnce(organizationId, workerId);
            if (!outcome.processed()) {
                return out;
            }
            out.add(outcome);
        }
    }

    /**
     * One pass over every organization with claimable work.
     */
    public List<WorkerOutcome> drainAll(String workerId) {
        List<WorkerOutcome> out = new ArrayList<>();
        for (String org : queue.organizationsWithPending(clock.millis())) {
            out.addAll(drain(org, workerId));
        }
        return out;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        coordinator = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentflow-dispatch-coordinator");
            t.setDaemon(true);
            return t;
        });
        long poll = settings.get().workerPollIntervalMs();
        coordinator.scheduleWithFixedDelay(this::discoverOrganizations, 0L, poll, TimeUnit.MILLISECONDS);
        log.info("dispatcher started pollMs={}", poll);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public synchronized void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        coordinator.shutdownNow();
        for (ExecutorService pool : workerPools.values()) {
            pool.shutdown();
        }
        for (Map.Entry<String, ExecutorService> e : workerPools.entrySet()) {
            try {
                if (!e.getValue().awaitTermination(5, TimeUnit.SECONDS)) {
                    e.getValue().shutdownNow();
                }
            } catch (InterruptedException ie) {
                e.getValue().shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        workerPools.clear();
        log.info("dispatcher stopped");
    }

    private void discoverOrganizations() {
        try {
            for (String org : queue.organizationsWithPending(clock.millis())) {
                workerPools.computeIfAbsent(org, this::startWorkers);
            }
        } catch (InfrastructureException e) {
            log.error("dispatcher discovery failed: {}", e.getMessage());
        }
    }

    private ExecutorService startWorkers(String organizationId) {
        int workers = runtimes.getOrganizationRuntime(organizationId).limits().maxConcurrentAgents();
        ExecutorService pool = Executors.newFixedThreadPool(workers, InProcessExecution.daemonThreads("agentflow-worker-" + organizationId));
        for (int i = 0; i < workers; i++) {
            String workerId = "worker-" + organizationId + "-" + (i + 1);
            pool.submit(() -> workerLoop(organizationId, workerId));
        }
        log.info("workers started org={} count={}", organizationId, workers);
        return pool;
    }

    private void workerLoop(String organizationId, String workerId) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            WorkerOutcome outcome;
            try {
                outcome = runOnce(organizationId, workerId);
            } catch (RuntimeException e) {
                log.error("worker {} iteration failed: {}", workerId, e.getMessage());
                outcome = WorkerOutcome.idle(organizationId);
            }
            if (!outcome.processed()) {
                try {
                    Thread.sleep(settings.get().workerPollIntervalMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private WorkerOutcome process(QueueItem item, String workerId) {
        EngineSettings s = settings.get();
        try {
            ExecutionResult result = engine.execute(item);
            long now = clock.millis();
            if (result.success()) {
                queue.complete(item.id(), resultJson(result), now);
                audit("execution.complete", workerId, item, "completed", Map.of("execution_ms", result.executionTimeMs()));
                return new WorkerOutcome(true, item.organizationId(), item.id(), "completed", null);
            }
            ExecutionQueue.FailureResolution resolution = queue.fail(item.id(), result.error(), s.retryBackoffMs(), now);
            alerts.recordFailure(item.agentId(), result.error(), now);
            audit("execution.fail", workerId, item, resolution.outcome().name().toLowerCase(),
                    Map.of("error", String.valueOf(result.error()), "retry_count", resolution.retryCount()));
            return new WorkerOutcome(true, item.organizationId(), item.id(), outcomeMessage(resolution), result.error());
        } catch (AgentFlowException e) {
            if (!e.kind().retryable() || e.kind().countsAgainstRetries()) {
                return failCounted(item, workerId, e, s);
            }
            log.warn("execution deferred id={} kind={} reason={}", item.id(), e.kind(), e.getMessage());
            try {
                queue.release(item.id(), e.getMessage(), s.resourceRetryDelayMs(), clock.millis());
            } catch (InfrastructureException releaseError) {
                log.error("release of deferred execution failed id={}: {}", item.id(), releaseError.getMessage());
            }
            return new WorkerOutcome(true, item.organizationId(), item.id(), "deferred", e.getMessage());
        } catch (RuntimeException e) {
            return failCounted(item, workerId, e, s);
        }
    }

    private WorkerOutcome failCounted(QueueItem item, String workerId, RuntimeException e, EngineSettings s) {
        long now = clock.millis();
        String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        ExecutionQueue.FailureResolution resolution = queue.fail(item.id(), error, s.retryBackoffMs(), now);
        alerts.recordFailure(item.agentId(), error, now);
        audit("execution.fail", workerId, item, resolution.outcome().name().toLowerCase(), Map.of("error", error));
        return new WorkerOutcome(true, item.organizationId(), item.id(), outcomeMessage(resolution), error);
    }

    static String resultJson(ExecutionResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("output", result.output());
        body.put("execution_time_ms", result.executionTimeMs());
        body.put("memory_used_mb", result.memoryUsedMb());
        return Jsons.toCompactJson(body);
    }

    private static String outcomeMessage(ExecutionQueue.FailureResolution resolution) {
        switch (resolution.outcome()) {
            case RETRY_SCHEDULED:
                return "retry_scheduled";
            case FAILED:
                return "failed";
            default:
                return "not_active";
        }
    }

    private void audit(String action, String workerId, QueueItem item, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>(details);
        row.put("agent_id", item.agentId());
        row.put("organization_id", item.organizationId());
        try {
            audit.log(AuditLogger.AuditEvent.of(action, workerId, "execution/" + item.id(), result, row));
        } catch (RuntimeException e) {
            log.error("audit write failed for {}: {}", item.id(), e.getMessage());
        }
    }

    public record WorkerOutcome(boolean processed, String organizationId, String executionId, String message, String error) {
        static WorkerOutcome idle(String organizationId) {
            return new WorkerOutcome(false, organizationId, null, "No claimable executions", null);
        }
    }
}
