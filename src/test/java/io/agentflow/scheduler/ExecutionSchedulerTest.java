package io.agentflow.scheduler;

import io.agentflow.Fixtures;
import io.agentflow.agent.AgentRegistry;
import io.agentflow.agent.EchoAgent;
import io.agentflow.agent.FailAgent;
import io.agentflow.config.AgentFlowConfig;
import io.agentflow.config.EngineSettings;
import io.agentflow.error.NotFoundException;
import io.agentflow.error.PermissionDeniedException;
import io.agentflow.error.ValidationException;
import io.agentflow.integration.InMemoryPurchaseLedger;
import io.agentflow.integration.NotificationSink;
import io.agentflow.integration.StaticTenantDirectory;
import io.agentflow.model.AgentDescriptor;
import io.agentflow.model.AgentType;
import io.agentflow.model.NotificationPreferences;
import io.agentflow.model.QueueItem;
import io.agentflow.model.QueueStatus;
import io.agentflow.model.ScheduleConfig;
import io.agentflow.model.ScheduleType;
import io.agentflow.model.ScheduleUpdate;
import io.agentflow.model.ScheduledExecution;
import io.agentflow.model.ScheduledExecutionStatus;
import io.agentflow.observability.AuditLogger;
import io.agentflow.runtime.CompletionWaiter;
import io.agentflow.storage.AgentStateStore;
import io.agentflow.storage.Database;
import io.agentflow.storage.ExecutionQueue;
import io.agentflow.storage.ScheduleStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

final class ExecutionSchedulerTest {
    private static final long START = Instant.parse("2026-03-02T10:00:00Z").toEpochMilli();
    private static final long FIVE_MINUTES = TimeUnit.MINUTES.toMillis(5);

    @Test
    void intervalScheduleGeneratesExactlyMaxExecutionsSpacedByInterval() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-interval-");
        try {
            Harness h = new Harness(root);
            ExecutionScheduler.CreateOutcome created = h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 5, 3));

            Assertions.assertEquals(3, created.generatedExecutions());
            List<ScheduledExecution> planned = h.store.listExecutions(created.schedule().id(), ScheduledExecutionStatus.SCHEDULED);
            Assertions.assertEquals(3, planned.size());
            Assertions.assertEquals(START + FIVE_MINUTES, planned.get(0).scheduledForMs());
            Assertions.assertEquals(START + 2 * FIVE_MINUTES, planned.get(1).scheduledForMs());
            Assertions.assertEquals(START + 3 * FIVE_MINUTES, planned.get(2).scheduledForMs());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void regeneratingDoesNotExceedDailyMaximum() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-idempotent-");
        try {
            Harness h = new Harness(root);
            String id = h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 5, 3)).schedule().id();

            Assertions.assertEquals(0, h.scheduler.generateScheduledExecutions(id));
            Assertions.assertEquals(0, h.scheduler.generateScheduledExecutions(id));
            Assertions.assertEquals(3, h.store.listExecutions(id, ScheduledExecutionStatus.SCHEDULED).size());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void intervalBelowMinimumIsRejected() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-min-interval-");
        try {
            Harness h = new Harness(root);
            ValidationException tooShort = Assertions.assertThrows(ValidationException.class,
                    () -> h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 4, 3)));
            Assertions.assertEquals("Minimum interval is 5 minutes to prevent abuse", tooShort.getMessage());

            ValidationException zero = Assertions.assertThrows(ValidationException.class,
                    () -> h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 0, 3)));
            Assertions.assertEquals("Interval must be at least 1 minute", zero.getMessage());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void webhookScheduleRequiresEndpointAndGeneratesNothing() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-webhook-");
        try {
            Harness h = new Harness(root);
            ScheduleConfig missing = new ScheduleConfig("echo", "dev-1", ScheduleType.WEBHOOK_TRIGGER, null, null, null,
                    "UTC", true, 10, false, NotificationPreferences.defaults());
            ValidationException e = Assertions.assertThrows(ValidationException.class, () -> h.scheduler.createSchedule(missing));
            Assertions.assertEquals("Webhook endpoint is required for webhook triggers", e.getMessage());

            ScheduleConfig ok = new ScheduleConfig("echo", "dev-1", ScheduleType.WEBHOOK_TRIGGER, null, null, "/hooks/echo",
                    "UTC", true, 10, false, NotificationPreferences.defaults());
            Assertions.assertEquals(0, h.scheduler.createSchedule(ok).generatedExecutions());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void cronScheduleFiresOnMatchingMinutes() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-cron-");
        try {
            Harness h = new Harness(root);
            ExecutionScheduler.CreateOutcome created = h.scheduler.createSchedule(ScheduleConfig.cron("echo", "dev-1", "*/30 * * * *", 3));

            List<ScheduledExecution> planned = h.store.listExecutions(created.schedule().id(), ScheduledExecutionStatus.SCHEDULED);
            Assertions.assertEquals(3, planned.size());
            long previous = START;
            for (ScheduledExecution e : planned) {
                ZonedDateTime at = Instant.ofEpochMilli(e.scheduledForMs()).atZone(ZoneOffset.UTC);
                Assertions.assertEquals(0, at.getMinute() % 30);
                Assertions.assertEquals(0, at.getSecond());
                Assertions.assertTrue(e.scheduledForMs() > previous);
                previous = e.scheduledForMs();
            }

            Assertions.assertThrows(ValidationException.class,
                    () -> h.scheduler.createSchedule(ScheduleConfig.cron("echo", "dev-1", "0 9 * *", 3)));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void disableSkipsPlannedExecutionsAndEnableGeneratesFreshBatch() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-toggle-");
        try {
            Harness h = new Harness(root);
            String id = h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 5, 3)).schedule().id();
            List<ScheduledExecution> original = h.store.listExecutions(id, ScheduledExecutionStatus.SCHEDULED);

            ExecutionScheduler.UpdateOutcome disabled = h.scheduler.updateSchedule(id, "dev-1", ScheduleUpdate.enabled(false));
            Assertions.assertEquals(3, disabled.skippedExecutions());
            Assertions.assertFalse(disabled.schedule().enabled());
            Assertions.assertTrue(h.store.listExecutions(id, ScheduledExecutionStatus.SCHEDULED).isEmpty());

            ExecutionScheduler.UpdateOutcome enabled = h.scheduler.updateSchedule(id, "dev-1", ScheduleUpdate.enabled(true));
            Assertions.assertEquals(3, enabled.generatedExecutions());

            List<ScheduledExecution> skipped = h.store.listExecutions(id, ScheduledExecutionStatus.SKIPPED);
            List<ScheduledExecution> fresh = h.store.listExecutions(id, ScheduledExecutionStatus.SCHEDULED);
            Assertions.assertEquals(3, skipped.size());
            Assertions.assertEquals(3, fresh.size());
            for (ScheduledExecution old : original) {
                Assertions.assertTrue(skipped.stream().anyMatch(s -> s.id().equals(old.id())));
                Assertions.assertTrue(fresh.stream().noneMatch(f -> f.id().equals(old.id())));
            }

            ExecutionScheduler.ScheduleStatus status = h.scheduler.getScheduleStatus(id, "dev-1");
            Assertions.assertEquals(6, status.total());
            Assertions.assertEquals(3, status.skipped());
            Assertions.assertEquals(3, status.pending());
            Assertions.assertEquals(Long.valueOf(START + FIVE_MINUTES), status.nextRunMs());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void timingChangeReplacesPlannedExecutions() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-retime-");
        try {
            Harness h = new Harness(root);
            String id = h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 5, 3)).schedule().id();

            ExecutionScheduler.UpdateOutcome outcome = h.scheduler.updateSchedule(id, "dev-1",
                    new ScheduleUpdate(10, null, null, null, null, null, null, null));
            Assertions.assertEquals(3, outcome.skippedExecutions());
            Assertions.assertEquals(3, outcome.generatedExecutions());
            List<ScheduledExecution> fresh = h.store.listExecutions(id, ScheduledExecutionStatus.SCHEDULED);
            Assertions.assertEquals(START + 2 * FIVE_MINUTES, fresh.get(0).scheduledForMs());

            Assertions.assertThrows(NotFoundException.class,
                    () -> h.scheduler.updateSchedule(id, "someone-else", ScheduleUpdate.enabled(false)));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void onlyDeveloperOrPurchaserMaySchedule() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-permission-");
        try {
            Harness h = new Harness(root);
            Assertions.assertThrows(PermissionDeniedException.class,
                    () -> h.scheduler.createSchedule(ScheduleConfig.interval("echo", "stranger", 5, 3)));
            Assertions.assertThrows(NotFoundException.class,
                    () -> h.scheduler.createSchedule(ScheduleConfig.interval("missing", "dev-1", 5, 3)));

            h.purchases.grant("buyer", "echo");
            Assertions.assertEquals(3, h.scheduler.createSchedule(ScheduleConfig.interval("echo", "buyer", 5, 3)).generatedExecutions());
            h.purchases.revoke("buyer", "echo");
            Assertions.assertThrows(PermissionDeniedException.class, () -> h.scheduler.requirePermission("echo", "buyer"));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void processingDispatchesDueExecutionsAndRecordsOutcomes() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-process-");
        Harness h = new Harness(root);
        try {
            ScheduleConfig echo = ScheduleConfig.interval("echo", "dev-1", 5, 2);
            ScheduleConfig fail = ScheduleConfig.interval("fail", "dev-1", 5, 2)
                    .withNotificationPreferences(new NotificationPreferences(false, true, true, false));
            String echoId = h.scheduler.createSchedule(echo).schedule().id();
            String failId = h.scheduler.createSchedule(fail).schedule().id();

            h.startWorker();
            h.clock.advanceMillis(FIVE_MINUTES + 1_000L);
            ExecutionScheduler.ProcessOutcome outcome = h.scheduler.processScheduledExecutions();

            Assertions.assertEquals(2, outcome.processed());
            Assertions.assertEquals(1, outcome.successful());
            Assertions.assertEquals(1, outcome.failed());

            ExecutionScheduler.ScheduleStatus echoStatus = h.scheduler.getScheduleStatus(echoId, "dev-1");
            Assertions.assertEquals(1, echoStatus.completed());
            Assertions.assertEquals(1, echoStatus.pending());
            ScheduledExecution done = h.store.listExecutions(echoId, ScheduledExecutionStatus.COMPLETED).get(0);
            Assertions.assertNotNull(done.queueItemId());
            Assertions.assertEquals(QueueStatus.COMPLETED, h.queue.getQueueItemStatus(done.queueItemId()).orElseThrow().status());
            QueueItem item = h.queue.find(done.queueItemId()).orElseThrow();
            Assertions.assertEquals(5, item.priority());
            Assertions.assertEquals(0, item.maxRetries());
            Assertions.assertTrue(item.payload().contains("\"scheduled\":true"));

            ScheduledExecution failed = h.store.listExecutions(failId, ScheduledExecutionStatus.FAILED).get(0);
            Assertions.assertEquals("agent failed", failed.errorMessage());
            Assertions.assertEquals(1, h.notifications.size());
            Assertions.assertFalse(h.notifications.get(0).success());
            Assertions.assertEquals("scheduled_execution_failure", h.notifications.get(0).eventType());

            Assertions.assertEquals(0, h.scheduler.processScheduledExecutions().processed());
        } finally {
            h.stopWorker();
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void stoppedAgentExecutionsStayScheduled() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-stopped-");
        try {
            Harness h = new Harness(root);
            String id = h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 5, 2)).schedule().id();
            h.agentState.markStopped("echo", "dev-1", h.clock.millis());

            h.clock.advanceMillis(FIVE_MINUTES + 1_000L);
            ExecutionScheduler.ProcessOutcome outcome = h.scheduler.processScheduledExecutions();
            Assertions.assertEquals(0, outcome.processed());
            Assertions.assertTrue(outcome.results().isEmpty());
            Assertions.assertEquals(2, h.store.listExecutions(id, ScheduledExecutionStatus.SCHEDULED).size());
            Assertions.assertEquals(0, h.queue.countForAgent("echo", QueueStatus.PENDING));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void stoppedAgentBacklogDoesNotStarveOtherSchedules() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-backlog-");
        Harness h = new Harness(root);
        try {
            String echoId = h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 5, 60)).schedule().id();
            h.agentState.markStopped("echo", "dev-1", h.clock.millis());
            h.clock.advanceMillis(TimeUnit.HOURS.toMillis(5) + 1_000L);
            Assertions.assertTrue(h.store.listDue(h.clock.millis(), 1_000).isEmpty());

            String failId = h.scheduler.createSchedule(ScheduleConfig.interval("fail", "dev-1", 5, 1)).schedule().id();
            h.clock.advanceMillis(FIVE_MINUTES + 1_000L);

            h.startWorker();
            ExecutionScheduler.ProcessOutcome outcome = h.scheduler.processScheduledExecutions();
            Assertions.assertEquals(1, outcome.processed());
            Assertions.assertEquals(1, outcome.results().size());
            Assertions.assertEquals(0, h.store.listExecutions(failId, ScheduledExecutionStatus.SCHEDULED).size());
            Assertions.assertEquals(1, h.store.listExecutions(failId, ScheduledExecutionStatus.FAILED).size());
            Assertions.assertEquals(60, h.store.listExecutions(echoId, ScheduledExecutionStatus.SCHEDULED).size());
        } finally {
            h.stopWorker();
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void eachExecutionGetsFullCompletionBudget() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-budget-");
        Harness h = new Harness(root, Fixtures.withCompletionTimeout(Fixtures.fastSettings(), 1_000L));
        try {
            String first = h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 5, 1)).schedule().id();
            String second = h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 5, 1)).schedule().id();
            h.clock.advanceMillis(FIVE_MINUTES + 1_000L);

            // one item at a time, 700ms each: the second finishes 1400ms after dispatch
            h.startWorker(700L);
            ExecutionScheduler.ProcessOutcome outcome = h.scheduler.processScheduledExecutions();
            Assertions.assertEquals(2, outcome.successful(), String.valueOf(outcome.results()));
            Assertions.assertEquals(1, h.store.listExecutions(first, ScheduledExecutionStatus.COMPLETED).size());
            Assertions.assertEquals(1, h.store.listExecutions(second, ScheduledExecutionStatus.COMPLETED).size());
        } finally {
            h.stopWorker();
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void waitTimeoutMarksScheduledExecutionFailed() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-wait-timeout-");
        try {
            Harness h = new Harness(root, Fixtures.withCompletionTimeout(Fixtures.fastSettings(), 100L));
            String id = h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 5, 1)).schedule().id();

            h.clock.advanceMillis(FIVE_MINUTES + 1_000L);
            ExecutionScheduler.ProcessOutcome outcome = h.scheduler.processScheduledExecutions();
            Assertions.assertEquals(1, outcome.failed());
            Assertions.assertEquals("Execution timed out", outcome.results().get(0).error());
            Assertions.assertEquals(1, h.store.listExecutions(id, ScheduledExecutionStatus.FAILED).size());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void disablingForAgentCancelsPendingQueueItems() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-scheduler-disable-agent-");
        try {
            Harness h = new Harness(root, Fixtures.withCompletionTimeout(Fixtures.fastSettings(), 50L));
            String id = h.scheduler.createSchedule(ScheduleConfig.interval("echo", "dev-1", 5, 3)).schedule().id();
            h.clock.advanceMillis(FIVE_MINUTES + 1_000L);
            h.scheduler.processScheduledExecutions();
            Assertions.assertEquals(1, h.queue.countForAgent("echo", QueueStatus.PENDING));

            Assertions.assertEquals(1, h.scheduler.disableSchedulesForAgent("echo"));
            Assertions.assertEquals(0, h.queue.countForAgent("echo", QueueStatus.PENDING));
            Assertions.assertEquals(1, h.queue.countForAgent("echo", QueueStatus.CANCELLED));
            Assertions.assertFalse(h.scheduler.listSchedules("echo").stream().filter(s -> s.id().equals(id)).findFirst().orElseThrow().enabled());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    private static final class Harness {
        final Fixtures.MutableClock clock = new Fixtures.MutableClock(START);
        final ScheduleStore store;
        final ExecutionQueue queue;
        final AgentStateStore agentState;
        final InMemoryPurchaseLedger purchases = new InMemoryPurchaseLedger();
        final List<NotificationSink.Notification> notifications = new CopyOnWriteArrayList<>();
        final ExecutionScheduler scheduler;
        private final AtomicBoolean workerRunning = new AtomicBoolean();
        private Thread worker;

        Harness(Path root) {
            this(root, Fixtures.fastSettings());
        }

        Harness(Path root, EngineSettings settings) {
            AgentFlowConfig config = AgentFlowConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            store = new ScheduleStore(db);
            queue = new ExecutionQueue(db);
            agentState = new AgentStateStore(db);
            AgentRegistry agents = new AgentRegistry();
            agents.register(new AgentDescriptor(EchoAgent.ID, "Echo", "dev-1", AgentType.SIMPLE, 64, 30_000L), new EchoAgent());
            agents.register(new AgentDescriptor(FailAgent.ID, "Fail", "dev-1", AgentType.SIMPLE, 64, 30_000L), new FailAgent());
            StaticTenantDirectory tenants = new StaticTenantDirectory().assign("dev-1", "org-1").assign("buyer", "org-2");
            CompletionWaiter waiter = new CompletionWaiter(queue, settings::completionPollIntervalMs);
            scheduler = new ExecutionScheduler(store, queue, agentState, agents, purchases, tenants, waiter,
                    notifications::add, new AuditLogger(config.auditFile()), () -> settings, clock);
        }

        void startWorker() {
            startWorker(0L);
        }

        void startWorker(long workMillis) {
            workerRunning.set(true);
            worker = new Thread(() -> {
                while (workerRunning.get()) {
                    Optional<QueueItem> item = queue.claim("org-1", "test-worker", clock.millis());
                    if (item.isEmpty()) {
                        try {
                            Thread.sleep(10L);
                        } catch (InterruptedException e) {
                            return;
                        }
                        continue;
                    }
                    if (workMillis > 0L) {
                        try {
                            Thread.sleep(workMillis);
                        } catch (InterruptedException e) {
                            return;
                        }
                    }
                    if (FailAgent.ID.equals(item.get().agentId())) {
                        queue.fail(item.get().id(), "agent failed", 0L, clock.millis());
                    } else {
                        queue.complete(item.get().id(), "{\"ok\":true}", clock.millis());
                    }
                }
            }, "scheduler-test-worker");
            worker.setDaemon(true);
            worker.start();
        }

        void stopWorker() throws InterruptedException {
            workerRunning.set(false);
            if (worker != null) {
                worker.interrupt();
                worker.join(5_000L);
            }
        }
    }
}
