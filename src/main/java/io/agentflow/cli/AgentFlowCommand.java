package io.agentflow.cli;

import io.agentflow.config.AgentFlowConfig;
import io.agentflow.config.SettingsManager;
import io.agentflow.engine.AgentFlowEngine;
import io.agentflow.model.MetricSnapshot;
import io.agentflow.model.NotificationPreferences;
import io.agentflow.model.ScheduleConfig;
import io.agentflow.model.ScheduleType;
import io.agentflow.model.ScheduleUpdate;
import io.agentflow.observability.AuditLogger;
import io.agentflow.runtime.CompletionWaiter;
import io.agentflow.runtime.ExecutionDispatcher;
import io.agentflow.scheduler.AgentController;
import io.agentflow.scheduler.ExecutionScheduler;
import io.agentflow.storage.ExecutionQueue;
import io.agentflow.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "agentflow",
        mixinStandardHelpOptions = true,
        description = "AgentFlow scheduling and execution engine CLI",
        subcommands = {
                AgentFlowCommand.InitCommand.class,
                AgentFlowCommand.ScheduleCreateCommand.class,
                AgentFlowCommand.ScheduleUpdateCommand.class,
                AgentFlowCommand.ScheduleStatusCommand.class,
                AgentFlowCommand.ProcessScheduledCommand.class,
                AgentFlowCommand.EnqueueCommand.class,
                AgentFlowCommand.WebhookCommand.class,
                AgentFlowCommand.QueueItemCommand.class,
                AgentFlowCommand.CancelCommand.class,
                AgentFlowCommand.WorkerCommand.class,
                AgentFlowCommand.AgentStartCommand.class,
                AgentFlowCommand.AgentStopCommand.class,
                AgentFlowCommand.AgentStatusCommand.class,
                AgentFlowCommand.RuntimeStatusCommand.class,
                AgentFlowCommand.DashboardCommand.class,
                AgentFlowCommand.MetricsCommand.class,
                AgentFlowCommand.MetricsHistoryCommand.class,
                AgentFlowCommand.ReloadSettingsCommand.class,
                AgentFlowCommand.AuditVerifyCommand.class
        }
)
public final class AgentFlowCommand implements Runnable {
    @Option(names = {"--root"}, description = "Engine data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | schedule-create | schedule-update | schedule-status | process-scheduled | enqueue | webhook | queue-item | cancel | worker | agent-start | agent-stop | agent-status | runtime-status | dashboard | metrics | metrics-history | reload-settings | audit-verify");
    }

    AgentFlowEngine engine() {
        return AgentFlowEngine.open(AgentFlowConfig.fromRoot(root));
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                System.out.println("Initialized AgentFlow at: " + engine.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "schedule-create", description = "Create a schedule and generate its upcoming executions")
    static final class ScheduleCreateCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--owner"}, required = true, description = "Owner user id")
        String owner;

        @Option(names = {"--type"}, defaultValue = "interval", description = "interval|cron|webhook_trigger")
        String type;

        @Option(names = {"--interval"}, description = "Interval in minutes")
        Integer interval;

        @Option(names = {"--cron"}, description = "Five-field cron expression")
        String cron;

        @Option(names = {"--webhook"}, description = "Webhook endpoint for webhook_trigger schedules")
        String webhook;

        @Option(names = {"--timezone"}, defaultValue = "UTC", description = "IANA timezone for cron evaluation")
        String timezone;

        @Option(names = {"--max-per-day"}, description = "Max executions within the look-ahead window")
        Integer maxPerDay;

        @Option(names = {"--retry-on-failure"}, defaultValue = "false", description = "Retry failed scheduled runs")
        boolean retryOnFailure;

        @Option(names = {"--disabled"}, defaultValue = "false", description = "Create the schedule disabled")
        boolean disabled;

        @Option(names = {"--notify-success"}, defaultValue = "false", description = "Notify the owner on success as well")
        boolean notifySuccess;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                ScheduleConfig config = new ScheduleConfig(agent, owner, ScheduleType.fromString(type), interval, cron, webhook,
                        timezone, !disabled, maxPerDay, retryOnFailure,
                        new NotificationPreferences(notifySuccess, true, true, false));
                ExecutionScheduler.CreateOutcome outcome = engine.scheduler().createSchedule(config);
                System.out.println(Jsons.toJson(outcome));
            }
            return 0;
        }
    }

    @Command(name = "schedule-update", description = "Update, enable or disable a schedule")
    static final class ScheduleUpdateCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Parameters(index = "0", description = "Schedule id")
        String scheduleId;

        @Option(names = {"--owner"}, required = true, description = "Owner user id")
        String owner;

        @Option(names = {"--interval"}, description = "New interval in minutes")
        Integer interval;

        @Option(names = {"--cron"}, description = "New cron expression")
        String cron;

        @Option(names = {"--timezone"}, description = "New timezone")
        String timezone;

        @Option(names = {"--enabled"}, arity = "1", description = "true|false")
        Boolean enabled;

        @Option(names = {"--max-per-day"}, description = "New max executions within the look-ahead window")
        Integer maxPerDay;

        @Option(names = {"--retry-on-failure"}, arity = "1", description = "true|false")
        Boolean retryOnFailure;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                ScheduleUpdate update = new ScheduleUpdate(interval, cron, null, timezone, enabled, maxPerDay, retryOnFailure, null);
                ExecutionScheduler.UpdateOutcome outcome = engine.scheduler().updateSchedule(scheduleId, owner, update);
                System.out.println(Jsons.toJson(outcome));
            }
            return 0;
        }
    }

    @Command(name = "schedule-status", description = "Show schedule counters and next run")
    static final class ScheduleStatusCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Parameters(index = "0", description = "Schedule id")
        String scheduleId;

        @Option(names = {"--owner"}, required = true, description = "Owner user id")
        String owner;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                System.out.println(Jsons.toJson(engine.scheduler().getScheduleStatus(scheduleId, owner)));
            }
            return 0;
        }
    }

    @Command(name = "process-scheduled", description = "Dispatch due scheduled executions and wait for their outcome")
    static final class ProcessScheduledCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                engine.dispatcher().start();
                ExecutionScheduler.ProcessOutcome outcome = engine.scheduler().processScheduledExecutions();
                System.out.println(Jsons.toJson(outcome));
            }
            return 0;
        }
    }

    @Command(name = "enqueue", description = "Enqueue a manual execution")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--owner"}, required = true, description = "Requesting user id")
        String owner;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "JSON payload")
        String payload;

        @Option(names = {"--max-retries"}, defaultValue = "0", description = "Retries after the first failed attempt")
        int maxRetries;

        @Option(names = {"--wait-ms"}, defaultValue = "0", description = "Run workers and wait up to this long for the result")
        long waitMs;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                String id = engine.triggerManual(agent, owner, payload, maxRetries);
                return printOrAwait(engine, id, waitMs);
            }
        }
    }

    @Command(name = "webhook", description = "Enqueue a webhook-triggered execution")
    static final class WebhookCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--owner"}, required = true, description = "Owner user id")
        String owner;

        @Option(names = {"--method"}, defaultValue = "POST", description = "HTTP method of the inbound request")
        String method;

        @Option(names = {"--header"}, description = "Header as name=value")
        Map<String, String> headers;

        @Option(names = {"--query"}, description = "Query parameter as name=value")
        Map<String, String> query;

        @Option(names = {"--body"}, defaultValue = "", description = "Request body")
        String body;

        @Option(names = {"--wait-ms"}, defaultValue = "0", description = "Run workers and wait up to this long for the result")
        long waitMs;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                String id = engine.triggerWebhook(agent, owner, method, headers, body, query);
                return printOrAwait(engine, id, waitMs);
            }
        }
    }

    @Command(name = "queue-item", description = "Query queue item status by id")
    static final class QueueItemCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Parameters(index = "0", description = "Queue item id")
        String itemId;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                Optional<ExecutionQueue.QueueItemStatus> status = engine.getQueueItemStatus(itemId);
                if (status.isEmpty()) {
                    System.out.println("{\"error\":\"queue item not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(status.get()));
            }
            return 0;
        }
    }

    @Command(name = "cancel", description = "Cancel a pending queue item")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Parameters(index = "0", description = "Queue item id")
        String itemId;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                boolean cancelled = engine.cancel(itemId);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("id", itemId);
                out.put("cancelled", cancelled);
                System.out.println(Jsons.toJson(out));
                return cancelled ? 0 : 1;
            }
        }
    }

    @Command(name = "worker", description = "Run dispatch workers, optionally with the scheduler tick")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Drain currently claimable items and exit")
        boolean once;

        @Option(names = {"--worker-id"}, defaultValue = "worker-local", description = "Worker identity")
        String workerId;

        @Option(names = {"--interval-ms"}, defaultValue = "60000", description = "Scheduler tick interval in ms")
        long intervalMs;

        @Option(names = {"--scheduler"}, defaultValue = "true", arity = "1",
                description = "Also process due scheduled executions each tick")
        boolean scheduler;

        @Override
        public Integer call() throws Exception {
            try (AgentFlowEngine engine = parent.engine()) {
                if (once) {
                    List<ExecutionDispatcher.WorkerOutcome> results = engine.dispatcher().drainAll(workerId);
                    System.out.println(Jsons.toJson(results));
                    return 0;
                }
                AtomicBoolean running = new AtomicBoolean(true);
                Thread main = Thread.currentThread();
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    running.set(false);
                    main.interrupt();
                }, "agentflow-shutdown-hook"));

                engine.start();
                while (running.get()) {
                    if (scheduler) {
                        ExecutionScheduler.ProcessOutcome outcome = engine.scheduler().processScheduledExecutions();
                        if (outcome.processed() > 0) {
                            System.out.println(Jsons.toJson(outcome));
                        }
                    }
                    try {
                        Thread.sleep(intervalMs);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
            return 0;
        }
    }

    @Command(name = "agent-start", description = "Mark an agent running, optionally with an interval schedule")
    static final class AgentStartCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Parameters(index = "0", description = "Agent id")
        String agentId;

        @Option(names = {"--owner"}, required = true, description = "Owner user id")
        String owner;

        @Option(names = {"--auto-schedule"}, defaultValue = "false", description = "Create an interval schedule")
        boolean autoSchedule;

        @Option(names = {"--interval"}, description = "Auto-schedule interval in minutes")
        Integer interval;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                AgentController.AgentStatus status = engine.agentController().startAgent(agentId, owner, autoSchedule, interval);
                System.out.println(Jsons.toJson(status));
            }
            return 0;
        }
    }

    @Command(name = "agent-stop", description = "Stop an agent and cancel its pending queue items")
    static final class AgentStopCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Parameters(index = "0", description = "Agent id")
        String agentId;

        @Option(names = {"--owner"}, required = true, description = "Owner user id")
        String owner;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                System.out.println(Jsons.toJson(engine.agentController().stopAgent(agentId, owner)));
            }
            return 0;
        }
    }

    @Command(name = "agent-status", description = "Show agent run state, schedule and recent executions")
    static final class AgentStatusCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Parameters(index = "0", description = "Agent id")
        String agentId;

        @Option(names = {"--owner"}, required = true, description = "Owner user id")
        String owner;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                System.out.println(Jsons.toJson(engine.agentController().getAgentStatus(agentId, owner)));
            }
            return 0;
        }
    }

    @Command(name = "runtime-status", description = "Show organization runtimes known to this process")
    static final class RuntimeStatusCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                System.out.println(Jsons.toJson(engine.getRuntimeStatus()));
            }
            return 0;
        }
    }

    @Command(name = "dashboard", description = "Aggregate dashboard metrics")
    static final class DashboardCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                System.out.println(Jsons.toJson(engine.getDashboardMetrics()));
            }
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus text exposition")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                System.out.print(engine.prometheusMetrics());
            }
            return 0;
        }
    }

    @Command(name = "metrics-history", description = "Persisted metric snapshots of a runtime")
    static final class MetricsHistoryCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Parameters(index = "0", description = "Runtime id")
        String runtimeId;

        @Option(names = {"--since-minutes"}, defaultValue = "60", description = "Window length ending now")
        long sinceMinutes;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                long end = Instant.now().toEpochMilli();
                List<MetricSnapshot> history = engine.getRuntimeMetricsHistory(runtimeId, end - sinceMinutes * 60_000L, end);
                System.out.println(Jsons.toJson(history));
            }
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Force reload of agentflow-settings.json")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                SettingsManager.ReloadOutcome outcome = engine.reloadSettings();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("reload", outcome);
                out.put("settings", engine.settings());
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AgentFlowCommand parent;

        @Override
        public Integer call() {
            try (AgentFlowEngine engine = parent.engine()) {
                AuditLogger.IntegrityOutcome out = engine.verifyAuditIntegrity();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    private static int printOrAwait(AgentFlowEngine engine, String id, long waitMs) {
        if (waitMs <= 0) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("id", id);
            out.put("status", "pending");
            System.out.println(Jsons.toJson(out));
            return 0;
        }
        engine.dispatcher().start();
        CompletionWaiter.CompletionOutcome outcome = engine.awaitCompletion(id, waitMs);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", id);
        out.put("outcome", outcome);
        System.out.println(Jsons.toJson(out));
        return outcome.success() ? 0 : 1;
    }
}
