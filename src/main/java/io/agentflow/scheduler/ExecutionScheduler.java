package io.agentflow.scheduler;

import io.agentflow.agent.AgentRegistry;
import io.agentflow.config.EngineSettings;
import io.agentflow.error.NotFoundException;
import io.agentflow.error.PermissionDeniedException;
import io.agentflow.integration.NotificationSink;
import io.agentflow.integration.PurchaseLedger;
import io.agentflow.integration.TenantDirectory;
import io.agentflow.model.AgentDescriptor;
import io.agentflow.model.NotificationPreferences;
import io.agentflow.model.QueueSource;
import io.agentflow.model.Schedule;
import io.agentflow.model.ScheduleConfig;
import io.agentflow.model.ScheduleType;
import io.agentflow.model.ScheduleUpdate;
import io.agentflow.model.ScheduledExecution;
import io.agentflow.model.ScheduledExecutionStatus;
import io.agentflow.observability.AuditLogger;
import io.agentflow.runtime.CompletionWaiter;
import io.agentflow.storage.AgentStateStore;
import io.agentflow.storage.ExecutionQueue;
import io.agentflow.storage.ScheduleStore;
import io.agentflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Turns schedules into concrete scheduled executions and feeds due ones into the execution queue.
 * The scheduler only produces queue items; agent code runs on the dispatcher's workers.
 */
public final class ExecutionScheduler {
    private static final Logger log = LoggerFactory.getLogger(ExecutionScheduler.class);

    private final ScheduleStore store;
    private final ExecutionQueue queue;
    private final AgentStateStore agentState;
    private final AgentRegistry agents;
    private final PurchaseLedger purchases;
    private final TenantDirectory tenants;
    private final CompletionWaiter waiter;
    private final NotificationSink notifications;
    private final AuditLogger audit;
    private final Supplier<EngineSettings> settings;
    private final Clock clock;

    public ExecutionScheduler(ScheduleStore store, ExecutionQueue queue, AgentStateStore agentState, AgentRegistry agents,
                              PurchaseLedger purchases, TenantDirectory tenants, CompletionWaiter waiter,
                              NotificationSink notifications, AuditLogger audit, Supplier<EngineSettings> settings, Clock clock) {
        this.store = store;
        this.queue = queue;
        this.agentState = agentState;
        this.agents = agents;
        this.purchases = purchases;
        this.tenants = tenants;
        this.waiter = waiter;
        this.notifications = notifications;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * The caller may schedule or control an agent it developed or holds an active purchase for.
     *
     * @throws NotFoundException         when the agent is not in the catalog
     * @throws PermissionDeniedException when the caller neither owns nor purchased the agent
     */
    public AgentDescriptor requirePermission(String agentId, String ownerId) {
        AgentDescriptor descriptor = agents.findDescriptor(agentId)
                .orElseThrow(() -> new NotFoundException("Agent not found: " + agentId));
        if (ownerId != null && ownerId.equals(descriptor.developerId())) {
            return descriptor;
        }
        if (ownerId != null && purchases.hasActivePurchase(ownerId, agentId)) {
            return descriptor;
        }
        throw new PermissionDeniedException("Owner " + ownerId + " has no access to agent " + agentId);
    }

    public CreateOutcome createSchedule(ScheduleConfig config) {
        EngineSettings s = settings.get();
        ScheduleConfig normalized = normalize(config, s);
        ScheduleValidator.validate(normalized, s.minIntervalMinutes(), cron(s));
        requirePermission(normalized.agentId(), normalized.ownerId());

        long now = clock.millis();
        Schedule schedule = new Schedule("sched_" + UUID.randomUUID(), normalized, now, now);
        store.insertSchedule(schedule);
        int generated = schedule.enabled() ? generateScheduledExecutions(schedule.id()) : 0;
        audit("schedule.create", normalized.ownerId(), schedule.id(), "created", Map.of(
                "agent_id", normalized.agentId(),
                "schedule_type", normalized.scheduleType().wireName(),
                "generated", generated));
        log.info("schedule created id={} agent={} type={} generated={}", schedule.id(), normalized.agentId(),
                normalized.scheduleType().wireName(), generated);
        return new CreateOutcome(schedule, generated);
    }

    /**
     * Materializes scheduled executions for the look-ahead window. Executions already waiting in
     * the window count against the daily maximum, so repeated calls never exceed it.
     *
     * @return number of executions created by this call
     */
    public int generateScheduledExecutions(String scheduleId) {
        Schedule schedule = store.findSchedule(scheduleId)
                .orElseThrow(() -> new NotFoundException("Schedule not found: " + scheduleId));
        ScheduleConfig config = schedule.config();
        if (!config.enabled() || config.scheduleType() == ScheduleType.WEBHOOK_TRIGGER) {
            return 0;
        }
        EngineSettings s = settings.get();
        long now = clock.millis();
        long horizon = now + TimeUnit.HOURS.toMillis(s.lookAheadHours());
        List<ScheduledExecution> waiting = store.listScheduledInWindow(scheduleId, 0L, horizon);
        int remaining = config.maxExecutionsPerDay() - waiting.size();
        if (remaining <= 0) {
            return 0;
        }
        long cursor = now;
        for (ScheduledExecution e : waiting) {
            cursor = Math.max(cursor, e.scheduledForMs());
        }

        List<Long> fireTimes = new ArrayList<>();
        if (config.scheduleType() == ScheduleType.INTERVAL) {
            long step = TimeUnit.MINUTES.toMillis(config.intervalMinutes());
            for (long t = cursor + step; t <= horizon && fireTimes.size() < remaining; t += step) {
                fireTimes.add(t);
            }
        } else {
            ZoneId zone = ZoneId.of(config.timezone());
            for (Instant t : cron(s).upcoming(config.cronExpression(), zone, Instant.ofEpochMilli(cursor),
                    Instant.ofEpochMilli(horizon), remaining)) {
                fireTimes.add(t.toEpochMilli());
            }
        }
        if (fireTimes.isEmpty()) {
            return 0;
        }
        List<ScheduledExecution> planned = new ArrayList<>(fireTimes.size());
        for (long t : fireTimes) {
            planned.add(ScheduledExecution.planned("sexec_" + UUID.randomUUID(), scheduleId, config.agentId(), config.ownerId(), t));
        }
        store.insertExecutions(planned, now);
        log.debug("materialized {} executions for schedule {}", planned.size(), scheduleId);
        return planned.size();
    }

    public UpdateOutcome updateSchedule(String scheduleId, String ownerId, ScheduleUpdate update) {
        Schedule current = store.findScheduleForOwner(scheduleId, ownerId)
                .orElseThrow(() -> new NotFoundException("Schedule not found: " + scheduleId));
        EngineSettings s = settings.get();
        ScheduleConfig before = current.config();
        ScheduleConfig after = apply(before, update);
        ScheduleValidator.validate(after, s.minIntervalMinutes(), cron(s));

        long now = clock.millis();
        Schedule updated = current.withConfig(after, now);
        if (!store.updateSchedule(updated)) {
            throw new NotFoundException("Schedule not found: " + scheduleId);
        }
        int skipped = 0;
        int cancelled = 0;
        int generated = 0;
        if (before.enabled() && !after.enabled()) {
            skipped = store.skipScheduled(scheduleId, now);
            cancelled = queue.cancelPendingForSchedule(scheduleId, now).size();
        } else if (!before.enabled() && after.enabled()) {
            generated = generateScheduledExecutions(scheduleId);
        } else if (after.enabled() && timingChanged(before, after)) {
            skipped = store.skipScheduled(scheduleId, now);
            generated = generateScheduledExecutions(scheduleId);
        }
        audit("schedule.update", ownerId, scheduleId, "updated", Map.of(
                "enabled", after.enabled(),
                "skipped", skipped,
                "cancelled_queue_items", cancelled,
                "generated", generated));
        log.info("schedule updated id={} enabled={} skipped={} cancelled={} generated={}",
                scheduleId, after.enabled(), skipped, cancelled, generated);
        return new UpdateOutcome(updated, skipped, cancelled, generated);
    }

    /**
     * Reconciliation pass over due executions. Every due execution is enqueued first, then each
     * is awaited in turn with the full completion timeout, counted from the start of its own wait.
     * A failure in one execution never aborts the batch.
     */
    public ProcessOutcome processScheduledExecutions() {
        EngineSettings s = settings.get();
        long now = clock.millis();
        List<ScheduleStore.DueExecution> due = store.listDue(now, s.reconcileBatchSize());
        List<ExecutionReport> reports = new ArrayList<>();
        List<InFlight> inFlight = new ArrayList<>();
        int failed = 0;

        for (ScheduleStore.DueExecution d : due) {
            try {
                if (agentState.isStopped(d.agentId())) {
                    reports.add(new ExecutionReport(d.id(), null, "deferred", "Agent is stopped"));
                    continue;
                }
                Schedule schedule = store.findSchedule(d.scheduleId())
                        .orElseThrow(() -> new NotFoundException("Schedule not found: " + d.scheduleId()));
                long startedAt = clock.millis();
                if (!store.markExecuting(d.id(), startedAt)) {
                    continue;
                }
                String queueItemId = enqueueScheduled(d, schedule, s, startedAt);
                store.attachQueueItem(d.id(), queueItemId, startedAt);
                inFlight.add(new InFlight(d, schedule, queueItemId, startedAt));
            } catch (RuntimeException e) {
                failed++;
                String error = messageOf(e);
                log.error("dispatch of scheduled execution {} failed: {}", d.id(), error);
                recordDispatchFailure(d.id(), error);
                reports.add(new ExecutionReport(d.id(), null, ScheduledExecutionStatus.FAILED.dbValue(), error));
            }
        }

        int successful = 0;
        for (InFlight f : inFlight) {
            try {
                CompletionWaiter.CompletionOutcome outcome = waiter.await(f.queueItemId, s.completionTimeoutMs());
                long finishedAt = clock.millis();
                store.markFinished(f.due.id(), outcome.success(), outcome.result(), finishedAt - f.startedAtMs,
                        outcome.error(), finishedAt);
                if (outcome.success()) {
                    successful++;
                } else {
                    failed++;
                }
                reports.add(new ExecutionReport(f.due.id(), f.queueItemId,
                        (outcome.success() ? ScheduledExecutionStatus.COMPLETED : ScheduledExecutionStatus.FAILED).dbValue(),
                        outcome.error()));
                notifyOutcome(f.schedule, outcome.success(), outcome.error());
            } catch (RuntimeException e) {
                failed++;
                String error = messageOf(e);
                log.error("completion of scheduled execution {} failed: {}", f.due.id(), error);
                reports.add(new ExecutionReport(f.due.id(), f.queueItemId, ScheduledExecutionStatus.FAILED.dbValue(), error));
            }
        }
        int processed = successful + failed;
        if (processed > 0) {
            log.info("scheduled pass processed={} successful={} failed={}", processed, successful, failed);
        }
        return new ProcessOutcome(processed, successful, failed, reports);
    }

    public ScheduleStatus getScheduleStatus(String scheduleId, String ownerId) {
        Schedule schedule = store.findScheduleForOwner(scheduleId, ownerId)
                .orElseThrow(() -> new NotFoundException("Schedule not found: " + scheduleId));
        Map<ScheduledExecutionStatus, Integer> counts = store.statusCounts(scheduleId);
        int total = 0;
        for (int n : counts.values()) {
            total += n;
        }
        int completed = counts.get(ScheduledExecutionStatus.COMPLETED);
        double successRate = total == 0 ? 0.0 : completed * 100.0 / total;
        Long nextRun = store.listScheduledInWindow(scheduleId, clock.millis(), Long.MAX_VALUE).stream()
                .findFirst().map(ScheduledExecution::scheduledForMs).orElse(null);
        return new ScheduleStatus(schedule, total, completed,
                counts.get(ScheduledExecutionStatus.FAILED),
                counts.get(ScheduledExecutionStatus.SKIPPED),
                counts.get(ScheduledExecutionStatus.SCHEDULED) + counts.get(ScheduledExecutionStatus.EXECUTING),
                successRate, nextRun);
    }

    public List<Schedule> listSchedules(String agentId) {
        return store.listSchedulesForAgent(agentId);
    }

    /**
     * Disables every enabled schedule of the agent on behalf of its owner.
     *
     * @return number of schedules disabled
     */
    public int disableSchedulesForAgent(String agentId) {
        int disabled = 0;
        for (Schedule schedule : store.listSchedulesForAgent(agentId)) {
            if (schedule.enabled()) {
                updateSchedule(schedule.id(), schedule.config().ownerId(), ScheduleUpdate.enabled(false));
                disabled++;
            }
        }
        return disabled;
    }

    private void recordDispatchFailure(String executionId, String error) {
        try {
            long now = clock.millis();
            store.markExecuting(executionId, now);
            store.markFinished(executionId, false, null, 0L, error, now);
        } catch (RuntimeException e) {
            log.error("could not record failure of scheduled execution {}: {}", executionId, e.getMessage());
        }
    }

    private String enqueueScheduled(ScheduleStore.DueExecution d, Schedule schedule, EngineSettings s, long nowMs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("scheduled", true);
        payload.put("schedule_execution_id", d.id());
        payload.put("schedule_id", d.scheduleId());
        payload.put("scheduled_for", Instant.ofEpochMilli(d.scheduledForMs()).toString());
        payload.put("triggered_by", "scheduler");
        int maxRetries = schedule.config().retryOnFailure() ? s.scheduledMaxRetries() : 0;
        return queue.enqueue(new ExecutionQueue.EnqueueRequest(
                tenants.organizationOf(d.ownerId()),
                d.agentId(),
                d.ownerId(),
                s.scheduledPriority(),
                Jsons.toCompactJson(payload),
                maxRetries,
                QueueSource.SCHEDULED,
                d.id()
        ), nowMs);
    }

    private void notifyOutcome(Schedule schedule, boolean success, String error) {
        NotificationPreferences prefs = schedule.config().notificationPreferences();
        if (prefs == null || !prefs.matches(success)) {
            return;
        }
        String agentId = schedule.config().agentId();
        String agentName = agents.findDescriptor(agentId).map(AgentDescriptor::name).orElse(agentId);
        try {
            notifications.notify(new NotificationSink.Notification(
                    schedule.config().ownerId(),
                    success ? "scheduled_execution_success" : "scheduled_execution_failure",
                    success,
                    agentId,
                    agentName,
                    error,
                    prefs.email(),
                    prefs.webhook()));
        } catch (RuntimeException e) {
            log.error("notification delivery failed schedule={}: {}", schedule.id(), e.getMessage());
        }
    }

    private NextOccurrence cron(EngineSettings s) {
        return NextOccurrence.forStrategy(s.cronStrategy());
    }

    private static ScheduleConfig normalize(ScheduleConfig c, EngineSettings s) {
        if (c == null) {
            return null;
        }
        return new ScheduleConfig(
                c.agentId(),
                c.ownerId(),
                c.scheduleType(),
                c.intervalMinutes(),
                c.cronExpression(),
                c.webhookEndpoint(),
                c.timezone() == null || c.timezone().isBlank() ? "UTC" : c.timezone().trim(),
                c.enabled(),
                c.maxExecutionsPerDay() == null ? s.defaultMaxExecutionsPerDay() : c.maxExecutionsPerDay(),
                c.retryOnFailure(),
                c.notificationPreferences() == null ? NotificationPreferences.defaults() : c.notificationPreferences());
    }

    private static ScheduleConfig apply(ScheduleConfig c, ScheduleUpdate u) {
        if (u == null) {
            return c;
        }
        return new ScheduleConfig(
                c.agentId(),
                c.ownerId(),
                c.scheduleType(),
                u.intervalMinutes() != null ? u.intervalMinutes() : c.intervalMinutes(),
                u.cronExpression() != null ? u.cronExpression() : c.cronExpression(),
                u.webhookEndpoint() != null ? u.webhookEndpoint() : c.webhookEndpoint(),
                u.timezone() != null ? u.timezone() : c.timezone(),
                u.enabled() != null ? u.enabled() : c.enabled(),
                u.maxExecutionsPerDay() != null ? u.maxExecutionsPerDay() : c.maxExecutionsPerDay(),
                u.retryOnFailure() != null ? u.retryOnFailure() : c.retryOnFailure(),
                u.notificationPreferences() != null ? u.notificationPreferences() : c.notificationPreferences());
    }

    private static boolean timingChanged(ScheduleConfig a, ScheduleConfig b) {
        return !Objects.equals(a.intervalMinutes(), b.intervalMinutes())
                || !Objects.equals(a.cronExpression(), b.cronExpression())
                || !Objects.equals(a.timezone(), b.timezone())
                || !Objects.equals(a.maxExecutionsPerDay(), b.maxExecutionsPerDay());
    }

    private void audit(String action, String actor, String scheduleId, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        try {
            audit.log(AuditLogger.AuditEvent.of(action, actor, "schedule/" + scheduleId, result, details));
        } catch (RuntimeException e) {
            log.error("audit write failed for schedule {}: {}", scheduleId, e.getMessage());
        }
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static final class InFlight {
        final ScheduleStore.DueExecution due;
        final Schedule schedule;
        final String queueItemId;
        final long startedAtMs;

        InFlight(ScheduleStore.DueExecution due, Schedule schedule, String queueItemId, long startedAtMs) {
            this.due = due;
            this.schedule = schedule;
            this.queueItemId = queueItemId;
            this.startedAtMs = startedAtMs;
        }
    }

    public record CreateOutcome(Schedule schedule, int generatedExecutions) {
    }

    public record UpdateOutcome(Schedule schedule, int skippedExecutions, int cancelledQueueItems, int generatedExecutions) {
    }

    public record ExecutionReport(String scheduledExecutionId, String queueItemId, String status, String error) {
    }

    public record ProcessOutcome(int processed, int successful, int failed, List<ExecutionReport> results) {
    }

    public record ScheduleStatus(
            Schedule schedule,
            int total,
            int completed,
            int failed,
            int skipped,
            int pending,
            double successRate,
            Long nextRunMs
    ) {
    }
}
