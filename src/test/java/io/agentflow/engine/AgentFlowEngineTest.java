package io.agentflow.engine;

import io.agentflow.Fixtures;
import io.agentflow.agent.AgentRegistry;
import io.agentflow.agent.EchoAgent;
import io.agentflow.agent.FailAgent;
import io.agentflow.config.AgentFlowConfig;
import io.agentflow.config.EngineSettings;
import io.agentflow.config.SettingsManager;
import io.agentflow.error.NotFoundException;
import io.agentflow.error.PermissionDeniedException;
import io.agentflow.integration.FailureAlertSink;
import io.agentflow.integration.InMemoryPurchaseLedger;
import io.agentflow.integration.NotificationSink;
import io.agentflow.integration.StaticTenantDirectory;
import io.agentflow.model.AgentDescriptor;
import io.agentflow.model.AgentType;
import io.agentflow.model.QueueStatus;
import io.agentflow.model.Schedule;
import io.agentflow.model.ScheduleConfig;
import io.agentflow.model.ScheduleUpdate;
import io.agentflow.model.SubscriptionTier;
import io.agentflow.runtime.CompletionWaiter;
import io.agentflow.runtime.ExecutionDispatcher;
import io.agentflow.scheduler.AgentController;
import io.agentflow.storage.ExecutionQueue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

final class AgentFlowEngineTest {

    @Test
    void manualTriggerCompletesThroughBackgroundWorkers() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-engine-manual-");
        Harness h = new Harness(root, Fixtures.fastSettings());
        try (AgentFlowEngine engine = h.engine) {
            engine.start();
            String id = engine.triggerManual(EchoAgent.ID, "dev-1", "{\"n\":1}", 0);

            CompletionWaiter.CompletionOutcome outcome = engine.awaitCompletion(id, 10_000L);
            Assertions.assertTrue(outcome.success(), outcome.error());
            Assertions.assertEquals(QueueStatus.COMPLETED, outcome.status());
            Assertions.assertTrue(outcome.result().contains("received"), outcome.result());

            Assertions.assertEquals("org-1", engine.queue().find(id).orElseThrow().organizationId());
            Assertions.assertTrue(engine.verifyAuditIntegrity().ok());
            String exposition = engine.prometheusMetrics();
            Assertions.assertTrue(exposition.contains("agentflow_queue_items{status=\"completed\"} 1"), exposition);
            Assertions.assertEquals(1, engine.getRuntimeStatus().size());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void triggersCheckCatalogAndPermission() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-engine-perm-");
        Harness h = new Harness(root, Fixtures.fastSettings());
        try (AgentFlowEngine engine = h.engine) {
            Assertions.assertThrows(PermissionDeniedException.class,
                    () -> engine.triggerManual(EchoAgent.ID, "stranger", "{}", 0));
            Assertions.assertThrows(NotFoundException.class,
                    () -> engine.triggerManual("missing", "dev-1", "{}", 0));
            Assertions.assertThrows(NotFoundException.class,
                    () -> engine.triggerWebhook("missing", "buyer", "POST", Map.of(), "{}", Map.of()));

            h.purchases.grant("buyer", EchoAgent.ID);
            String id = engine.triggerManual(EchoAgent.ID, "buyer", "{}", 0);
            Assertions.assertEquals("org-2", engine.queue().find(id).orElseThrow().organizationId());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void webhookPayloadCarriesRequestAndRunsAheadOfScheduledWork() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-engine-webhook-");
        Harness h = new Harness(root, Fixtures.fastSettings());
        try (AgentFlowEngine engine = h.engine) {
            String webhook = engine.triggerWebhook(EchoAgent.ID, "dev-1", "POST",
                    Map.of("X-Signature", "abc"), "{\"event\":\"push\"}", Map.of("ref", "main"));

            ExecutionDispatcher.WorkerOutcome outcome = engine.dispatcher().runOnce("org-1", "w1");
            Assertions.assertEquals(webhook, outcome.executionId());
            Assertions.assertEquals("completed", outcome.message());
            String result = engine.getQueueItemStatus(webhook).orElseThrow().result();
            Assertions.assertTrue(result.contains("triggered_by"), result);
            Assertions.assertTrue(result.contains("push"), result);
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void cancelledItemSurfacesAsFailureToWaiters() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-engine-cancel-");
        Harness h = new Harness(root, Fixtures.fastSettings());
        try (AgentFlowEngine engine = h.engine) {
            String id = engine.triggerManual(EchoAgent.ID, "dev-1", "{}", 0);
            Assertions.assertTrue(engine.cancel(id));
            Assertions.assertFalse(engine.cancel(id));

            CompletionWaiter.CompletionOutcome outcome = engine.awaitCompletion(id, 1_000L);
            Assertions.assertFalse(outcome.success());
            Assertions.assertEquals("Execution cancelled", outcome.error());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void stoppingAnAgentCancelsPendingWorkUntilStarted() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-engine-stop-");
        Harness h = new Harness(root, Fixtures.fastSettings());
        try (AgentFlowEngine engine = h.engine) {
            AgentController controller = engine.agentController();
            Assertions.assertTrue(controller.getAgentStatus(EchoAgent.ID, "dev-1").running());

            engine.triggerManual(EchoAgent.ID, "dev-1", "{}", 0);
            engine.triggerManual(EchoAgent.ID, "dev-1", "{}", 0);
            AgentController.StopOutcome stopped = controller.stopAgent(EchoAgent.ID, "dev-1");
            Assertions.assertEquals(2, stopped.cancelledQueueItems().size());

            AgentController.AgentStatus status = controller.getAgentStatus(EchoAgent.ID, "dev-1");
            Assertions.assertFalse(status.running());
            Assertions.assertEquals(0, status.pendingExecutions());
            Assertions.assertNotNull(status.lastStoppedAtMs());

            AgentController.AgentStatus restarted = controller.startAgent(EchoAgent.ID, "dev-1", true, 10);
            Assertions.assertTrue(restarted.running());
            Assertions.assertTrue(restarted.autoSchedule());
            Assertions.assertEquals(10, restarted.scheduleIntervalMinutes());
            Assertions.assertNotNull(restarted.nextScheduledRunMs());
            Assertions.assertEquals(1, engine.scheduler().listSchedules(EchoAgent.ID).size());

            Assertions.assertThrows(PermissionDeniedException.class,
                    () -> controller.stopAgent(EchoAgent.ID, "stranger"));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void restartingWithAutoScheduleReusesItsSchedule() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-engine-restart-");
        Harness h = new Harness(root, Fixtures.fastSettings());
        try (AgentFlowEngine engine = h.engine) {
            AgentController controller = engine.agentController();
            controller.startAgent(EchoAgent.ID, "dev-1", true, 10);
            String scheduleId = engine.scheduler().listSchedules(EchoAgent.ID).get(0).id();

            controller.startAgent(EchoAgent.ID, "dev-1", true, 10);
            Assertions.assertEquals(1, engine.scheduler().listSchedules(EchoAgent.ID).size());

            controller.stopAgent(EchoAgent.ID, "dev-1");
            AgentController.AgentStatus restarted = controller.startAgent(EchoAgent.ID, "dev-1", true, 20);
            List<Schedule> schedules = engine.scheduler().listSchedules(EchoAgent.ID);
            Assertions.assertEquals(1, schedules.size());
            Assertions.assertEquals(scheduleId, schedules.get(0).id());
            Assertions.assertEquals(Integer.valueOf(20), schedules.get(0).config().intervalMinutes());
            Assertions.assertEquals(20, restarted.scheduleIntervalMinutes());

            engine.scheduler().updateSchedule(scheduleId, "dev-1", ScheduleUpdate.enabled(false));
            controller.startAgent(EchoAgent.ID, "dev-1", true, 20);
            Assertions.assertTrue(engine.scheduler().listSchedules(EchoAgent.ID).get(0).enabled());
            Assertions.assertEquals(1, engine.scheduler().listSchedules(EchoAgent.ID).size());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void pausedRuntimeDefersWithoutSpendingRetries() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-engine-defer-");
        Harness h = new Harness(root, Fixtures.fastSettings());
        try (AgentFlowEngine engine = h.engine) {
            String id = engine.triggerManual(EchoAgent.ID, "dev-1", "{}", 0);
            engine.runtimes().getOrganizationRuntime("org-1").pause();

            ExecutionDispatcher.WorkerOutcome outcome = engine.dispatcher().runOnce("org-1", "w1");
            Assertions.assertEquals("deferred", outcome.message());
            ExecutionQueue.QueueItemStatus status = engine.getQueueItemStatus(id).orElseThrow();
            Assertions.assertEquals(QueueStatus.PENDING, status.status());
            Assertions.assertEquals(0, status.retryCount());

            engine.runtimes().getOrganizationRuntime("org-1").resume();
            Thread.sleep(50L);
            Assertions.assertEquals("completed", engine.dispatcher().runOnce("org-1", "w1").message());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void failedExecutionIsRetriedUntilMaxRetries() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-engine-retry-");
        Harness h = new Harness(root, Fixtures.fastSettings());
        try (AgentFlowEngine engine = h.engine) {
            String id = engine.triggerManual(FailAgent.ID, "dev-1", "{}", 2);

            List<ExecutionDispatcher.WorkerOutcome> outcomes = engine.dispatcher().drain("org-1", "w1");
            Assertions.assertEquals(List.of("retry_scheduled", "failed"),
                    outcomes.stream().map(ExecutionDispatcher.WorkerOutcome::message).toList());
            ExecutionQueue.QueueItemStatus status = engine.getQueueItemStatus(id).orElseThrow();
            Assertions.assertEquals(QueueStatus.FAILED, status.status());
            Assertions.assertEquals(2, status.retryCount());
            Assertions.assertEquals("intentional failure from fail agent", status.lastError());
            Assertions.assertTrue(h.alerts.isEmpty());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void repeatedFailuresRaiseAlertAndDisableSchedules() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-engine-alert-");
        EngineSettings settings = Fixtures.withAlerts(Fixtures.fastSettings(), 2, true);
        Harness h = new Harness(root, settings);
        try (AgentFlowEngine engine = h.engine) {
            engine.scheduler().createSchedule(ScheduleConfig.interval(FailAgent.ID, "dev-1", 30, 10));
            Assertions.assertTrue(engine.scheduler().listSchedules(FailAgent.ID).get(0).enabled());

            engine.triggerManual(FailAgent.ID, "dev-1", "{}", 0);
            engine.triggerManual(FailAgent.ID, "dev-1", "{}", 0);
            List<ExecutionDispatcher.WorkerOutcome> outcomes = engine.dispatcher().drain("org-1", "w1");
            Assertions.assertEquals(2, outcomes.size());
            Assertions.assertTrue(outcomes.stream().allMatch(o -> "failed".equals(o.message())));

            Assertions.assertEquals(1, h.alerts.size());
            Assertions.assertEquals(FailAgent.ID, h.alerts.get(0).agentId());
            Assertions.assertFalse(engine.scheduler().listSchedules(FailAgent.ID).get(0).enabled());
            Assertions.assertEquals(2L, engine.getDashboardMetrics().totalErrors());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    private static final class Harness {
        final InMemoryPurchaseLedger purchases = new InMemoryPurchaseLedger();
        final List<NotificationSink.Notification> notifications = new CopyOnWriteArrayList<>();
        final List<FailureAlertSink.FailureAlert> alerts = new CopyOnWriteArrayList<>();
        final AgentFlowEngine engine;

        Harness(Path root, EngineSettings settings) {
            AgentRegistry registry = new AgentRegistry();
            registry.register(new AgentDescriptor(EchoAgent.ID, "Echo", "dev-1", AgentType.SIMPLE, 64, 5_000L), new EchoAgent());
            registry.register(new AgentDescriptor(FailAgent.ID, "Fail", "dev-1", AgentType.SIMPLE, 64, 5_000L), new FailAgent());
            StaticTenantDirectory tenants = new StaticTenantDirectory()
                    .assign("dev-1", "org-1")
                    .assign("buyer", "org-2")
                    .setTier("org-1", SubscriptionTier.PRO)
                    .setTier("org-2", SubscriptionTier.FREE);
            AgentFlowEngine.Collaborators collaborators = new AgentFlowEngine.Collaborators(
                    purchases, tenants, notifications::add, alerts::add, SettingsManager.fixed(settings), null);
            engine = new AgentFlowEngine(AgentFlowConfig.fromRoot(root.toString()), registry, collaborators, Clock.systemUTC());
            engine.init();
        }
    }
}
