package io.agentflow.scheduler;

import io.agentflow.config.EngineSettings;
import io.agentflow.model.QueueItem;
import io.agentflow.model.QueueStatus;
import io.agentflow.model.Schedule;
import io.agentflow.model.ScheduleConfig;
import io.agentflow.model.ScheduleType;
import io.agentflow.model.ScheduleUpdate;
import io.agentflow.observability.AuditLogger;
import io.agentflow.storage.AgentStateStore;
import io.agentflow.storage.ExecutionQueue;
import io.agentflow.storage.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Manual start/stop of an agent. A stopped agent's pending queue items are cancelled and its due
 * scheduled executions stay undispatched until it is started again.
 */
public final class AgentController {
    private static final Logger log = LoggerFactory.getLogger(AgentController.class);
    static final int DEFAULT_AUTO_INTERVAL_MINUTES = 60;
    static final int RECENT_LIMIT = 5;

    private final AgentStateStore state;
    private final ExecutionScheduler scheduler;
    private final ExecutionQueue queue;
    private final ScheduleStore schedules;
    private final AuditLogger audit;
    private final Supplier<EngineSettings> settings;
    private final Clock clock;

    public AgentController(AgentStateStore state, ExecutionScheduler scheduler, ExecutionQueue queue, ScheduleStore schedules,
                           AuditLogger audit, Supplier<EngineSettings> settings, Clock clock) {
        this.state = state;
        this.scheduler = scheduler;
        this.queue = queue;
        this.schedules = schedules;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
    }

    public AgentStatus startAgent(String agentId, String ownerId, boolean autoSchedule, Integer intervalMinutes) {
        scheduler.requirePermission(agentId, ownerId);
        int interval = intervalMinutes == null ? DEFAULT_AUTO_INTERVAL_MINUTES : intervalMinutes;
        String scheduleId = null;
        if (autoSchedule) {
            scheduleId = reusableSchedule(agentId, ownerId)
                    .map(existing -> scheduler.updateSchedule(existing.id(), ownerId,
                            new ScheduleUpdate(interval, null, null, null, true, null, null, null)).schedule().id())
                    .orElseGet(() -> scheduler.createSchedule(ScheduleConfig.interval(agentId, ownerId, interval,
                            settings.get().defaultMaxExecutionsPerDay())).schedule().id());
        }
        state.markStarted(agentId, ownerId, autoSchedule, interval, scheduleId, clock.millis());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("auto_schedule", autoSchedule);
        details.put("interval_minutes", interval);
        details.put("schedule_id", scheduleId == null ? "" : scheduleId);
        audit("agent.start", ownerId, agentId, "running", details);
        log.info("agent started id={} owner={} autoSchedule={}", agentId, ownerId, autoSchedule);
        return getAgentStatus(agentId, ownerId);
    }

    public StopOutcome stopAgent(String agentId, String ownerId) {
        scheduler.requirePermission(agentId, ownerId);
        long now = clock.millis();
        state.markStopped(agentId, ownerId, now);
        List<String> cancelled = queue.cancelPendingForAgent(agentId, now);
        audit("agent.stop", ownerId, agentId, "stopped", Map.of("cancelled", cancelled.size()));
        log.info("agent stopped id={} cancelledPending={}", agentId, cancelled.size());
        return new StopOutcome(agentId, false, cancelled);
    }

    public AgentStatus getAgentStatus(String agentId, String ownerId) {
        scheduler.requirePermission(agentId, ownerId);
        AgentStateStore.AgentState s = state.find(agentId).orElse(null);
        boolean running = s == null || s.running();
        return new AgentStatus(
                agentId,
                running,
                s != null && s.autoSchedule(),
                s == null ? null : s.scheduleIntervalMinutes(),
                queue.countForAgent(agentId, QueueStatus.PENDING),
                schedules.nextScheduledRun(agentId, clock.millis()).orElse(null),
                queue.recentForAgent(agentId, RECENT_LIMIT),
                s == null ? null : s.lastStartedAtMs(),
                s == null ? null : s.lastStoppedAtMs());
    }

    /**
     * The interval schedule an earlier auto-scheduled start created, if the owner still has it.
     */
    private Optional<Schedule> reusableSchedule(String agentId, String ownerId) {
        return state.find(agentId)
                .map(AgentStateStore.AgentState::scheduleId)
                .flatMap(id -> schedules.findScheduleForOwner(id, ownerId))
                .filter(existing -> existing.config().scheduleType() == ScheduleType.INTERVAL);
    }

    private void audit(String action, String actor, String agentId, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        try {
            audit.log(AuditLogger.AuditEvent.of(action, actor, "agent/" + agentId, result, details));
        } catch (RuntimeException e) {
            log.error("audit write failed for agent {}: {}", agentId, e.getMessage());
        }
    }

    public record StopOutcome(String agentId, boolean running, List<String> cancelledQueueItems) {
    }

    public record AgentStatus(
            String agentId,
            boolean running,
            boolean autoSchedule,
            Integer scheduleIntervalMinutes,
            int pendingExecutions,
            Long nextScheduledRunMs,
            List<QueueItem> recentExecutions,
            Long lastStartedAtMs,
            Long lastStoppedAtMs
    ) {
    }
}
