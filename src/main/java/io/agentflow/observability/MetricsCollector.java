package io.agentflow.observability;

import com.fasterxml.jackson.annotation.JsonValue;
import io.agentflow.error.InfrastructureException;
import io.agentflow.error.NotFoundException;
import io.agentflow.model.MetricSnapshot;
import io.agentflow.model.RuntimeStatus;
import io.agentflow.storage.MetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Collects execution and container metrics per runtime and derives health snapshots and the
 * dashboard view. Snapshots are kept in a bounded ring per runtime and written through to the
 * {@link MetricsStore} when one is attached.
 */
public final class MetricsCollector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    public static final int SNAPSHOT_CAPACITY = 60;
    static final int CONTAINER_BUFFER_MAX = 100;
    static final int CONTAINER_BUFFER_KEEP = 50;
    static final int AGENT_WINDOW = 100;
    static final int TOP_AGENT_LIMIT = 5;
    private static final long MINUTE_MS = 60_000L;
    private static final long HOUR_MS = 3_600_000L;
    private static final long EXECUTION_RETENTION_MS = 2 * HOUR_MS;

    private final MetricsStore store;
    private final Clock clock;
    private final ConcurrentHashMap<String, RuntimeEntry> runtimes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Deque<ContainerEvent>> containerEvents = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Deque<ExecutionMetric>> agentExecutions = new ConcurrentHashMap<>();
    private final AtomicLong totalExecutions = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();
    private volatile boolean closed;

    public MetricsCollector(MetricsStore store, Clock clock) {
        this.store = store;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public static MetricsCollector inMemory(Clock clock) {
        return new MetricsCollector(null, clock);
    }

    public void registerRuntime(String runtimeId, String organizationId, Supplier<RuntimeGauges> gauges) {
        RuntimeEntry entry = runtimes.computeIfAbsent(runtimeId, id -> new RuntimeEntry(id, organizationId));
        entry.gauges = gauges;
    }

    public void recordExecution(ExecutionMetric metric) {
        if (closed) {
            log.debug("metrics collector closed; dropping execution {}", metric.executionId());
            return;
        }
        totalExecutions.incrementAndGet();
        if (!metric.success()) {
            totalErrors.incrementAndGet();
        }
        RuntimeEntry entry = runtimes.computeIfAbsent(metric.runtimeId(), id -> new RuntimeEntry(id, metric.organizationId()));
        synchronized (entry) {
            entry.executions.addLast(metric);
            prune(entry.executions, metric.timestampMs() - EXECUTION_RETENTION_MS);
        }
        Deque<ExecutionMetric> perAgent = agentExecutions.computeIfAbsent(metric.agentId(), id -> new ArrayDeque<>());
        synchronized (perAgent) {
            perAgent.addLast(metric);
            while (perAgent.size() > AGENT_WINDOW) {
                perAgent.removeFirst();
            }
        }
    }

    public void recordContainerExecution(String containerId, String agentId, String executionId, boolean success,
                                         long executionTimeMs, double memoryUsedMb, String error) {
        appendContainerEvent(new ContainerEvent(containerId, agentId, executionId, "execution", success,
                executionTimeMs, memoryUsedMb, error, clock.millis()));
    }

    public void recordContainerTimeout(String containerId, String agentId, String executionId, long timeoutMs) {
        appendContainerEvent(new ContainerEvent(containerId, agentId, executionId, "timeout", false,
                timeoutMs, 0.0, "Execution timeout after " + timeoutMs + "ms", clock.millis()));
    }

    public void recordContainerError(String containerId, String agentId, String executionId, String error) {
        appendContainerEvent(new ContainerEvent(containerId, agentId, executionId, "error", false,
                0L, 0.0, error, clock.millis()));
    }

    public List<ContainerEvent> containerEvents(String containerId) {
        Deque<ContainerEvent> events = containerEvents.get(containerId);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public RuntimeMetrics calculateRuntimeMetrics(String runtimeId) {
        RuntimeEntry entry = runtimes.get(runtimeId);
        if (entry == null) {
            throw new NotFoundException("Runtime not found: " + runtimeId);
        }
        long now = clock.millis();
        RuntimeGauges gauges = entry.gauges();
        WindowStats hour;
        int perMinute;
        synchronized (entry) {
            prune(entry.executions, now - EXECUTION_RETENTION_MS);
            hour = WindowStats.of(entry.executions, now - HOUR_MS, now);
            perMinute = WindowStats.of(entry.executions, now - MINUTE_MS, now).count;
        }
        double successRate = hour.successRate();
        double errorRate = hour.errorRate();
        double avg = hour.avgExecutionTimeMs();
        double health = HealthScores.compute(successRate, avg, errorRate);
        double memoryUtilization = gauges.memoryLimitMb() <= 0 ? 0.0 : gauges.memoryUsageMb() * 100.0 / gauges.memoryLimitMb();

        MetricSnapshot snapshot = new MetricSnapshot(runtimeId, now, hour.count, hour.errors, avg,
                gauges.memoryUsageMb(), gauges.activeContainers(), perMinute, successRate, errorRate, health);
        List<MetricSnapshot> history;
        synchronized (entry) {
            entry.snapshots.addLast(snapshot);
            while (entry.snapshots.size() > SNAPSHOT_CAPACITY) {
                entry.snapshots.removeFirst();
            }
            history = List.copyOf(entry.snapshots);
        }
        persist(entry.organizationId, snapshot);
        RuntimeMetrics metrics = new RuntimeMetrics(runtimeId, entry.organizationId, gauges.currentExecutions(),
                gauges.queueLength(), perMinute, avg, errorRate, successRate, memoryUtilization, health, now, history);
        entry.latest = metrics;
        return metrics;
    }

    public List<RuntimeMetrics> calculateAll() {
        List<RuntimeMetrics> out = new ArrayList<>();
        for (String runtimeId : runtimes.keySet()) {
            out.add(calculateRuntimeMetrics(runtimeId));
        }
        return out;
    }

    public Optional<RuntimeMetrics> latest(String runtimeId) {
        RuntimeEntry entry = runtimes.get(runtimeId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.latest);
    }

    /**
     * Snapshots for a runtime between two instants, inclusive. Reads the store when attached,
     * otherwise the in-memory ring.
     */
    public List<MetricSnapshot> getRuntimeMetricsHistory(String runtimeId, long startMs, long endMs) {
        if (store != null) {
            return store.history(runtimeId, startMs, endMs);
        }
        RuntimeEntry entry = runtimes.get(runtimeId);
        if (entry == null) {
            return List.of();
        }
        List<MetricSnapshot> out = new ArrayList<>();
        synchronized (entry) {
            for (MetricSnapshot s : entry.snapshots) {
                if (s.timestampMs() >= startMs && s.timestampMs() <= endMs) {
                    out.add(s);
                }
            }
        }
        return out;
    }

    public DashboardMetrics getDashboardMetrics() {
        long now = clock.millis();
        int activeRuntimes = 0;
        int queueDepth = 0;
        int activeContainers = 0;
        int capacity = 0;
        double memoryUsage = 0.0;
        WindowStats currentHour = WindowStats.empty();
        WindowStats previousHour = WindowStats.empty();
        Map<String, OrganizationMetrics> organizations = new LinkedHashMap<>();
        for (RuntimeEntry entry : runtimes.values()) {
            RuntimeGauges gauges = entry.gauges();
            if (gauges.status() == RuntimeStatus.ACTIVE) {
                activeRuntimes++;
            }
            queueDepth += gauges.queueLength();
            activeContainers += gauges.activeContainers();
            capacity += gauges.maxConcurrent();
            memoryUsage += gauges.memoryUsageMb();
            WindowStats hour;
            WindowStats previous;
            synchronized (entry) {
                hour = WindowStats.of(entry.executions, now - HOUR_MS, now);
                previous = WindowStats.of(entry.executions, now - 2 * HOUR_MS, now - HOUR_MS - 1);
            }
            currentHour = currentHour.plus(hour);
            previousHour = previousHour.plus(previous);
            double health = entry.latest != null
                    ? entry.latest.healthScore()
                    : HealthScores.compute(hour.successRate(), hour.avgExecutionTimeMs(), hour.errorRate());
            organizations.put(entry.organizationId, new OrganizationMetrics(entry.organizationId, entry.runtimeId,
                    hour.count, hour.errorRate(), hour.avgExecutionTimeMs(), gauges.memoryUsageMb(),
                    gauges.activeContainers(), health));
        }

        List<AgentPerformance> performances = new ArrayList<>();
        List<AgentIssue> issues = new ArrayList<>();
        for (Map.Entry<String, Deque<ExecutionMetric>> e : agentExecutions.entrySet()) {
            List<ExecutionMetric> window;
            synchronized (e.getValue()) {
                window = List.copyOf(e.getValue());
            }
            if (window.isEmpty()) {
                continue;
            }
            AgentPerformance perf = AgentPerformance.of(e.getKey(), window);
            performances.add(perf);
            issues.addAll(detectIssues(perf, window));
        }
        List<AgentPerformance> top = new ArrayList<>();
        for (AgentPerformance p : performances) {
            if (p.successRate() >= 90.0) {
                top.add(p);
            }
        }
        top.sort(Comparator.comparingDouble(AgentPerformance::successRate).reversed()
                .thenComparingDouble(AgentPerformance::avgExecutionTimeMs)
                .thenComparing(AgentPerformance::agentId));
        if (top.size() > TOP_AGENT_LIMIT) {
            top = new ArrayList<>(top.subList(0, TOP_AGENT_LIMIT));
        }
        issues.sort(Comparator.comparing(AgentIssue::severity).reversed().thenComparing(AgentIssue::agentId));

        Trends trends = new Trends(
                trend(currentHour.count, previousHour.count),
                trend(currentHour.errorRate(), previousHour.errorRate()),
                trend(currentHour.avgExecutionTimeMs(), previousHour.avgExecutionTimeMs()));
        double utilization = capacity == 0 ? 0.0 : activeContainers * 100.0 / capacity;
        return new DashboardMetrics(now, totalExecutions.get(), totalErrors.get(), activeRuntimes, queueDepth,
                currentHour.errorRate(), currentHour.avgExecutionTimeMs(), memoryUsage, utilization,
                organizations, top, issues, trends);
    }

    public long totalExecutions() {
        return totalExecutions.get();
    }

    /**
     * Takes a final snapshot of every runtime and stops accepting new samples.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        try {
            calculateAll();
        } finally {
            closed = true;
        }
    }

    static List<AgentIssue> detectIssues(AgentPerformance perf, List<ExecutionMetric> window) {
        List<AgentIssue> out = new ArrayList<>();
        if (perf.executions() >= 5 && perf.errorRate() >= 20.0) {
            double rate = perf.errorRate();
            Severity severity = rate >= 75.0 ? Severity.CRITICAL : rate >= 50.0 ? Severity.HIGH : rate >= 30.0 ? Severity.MEDIUM : Severity.LOW;
            out.add(new AgentIssue(perf.agentId(), IssueType.HIGH_ERROR_RATE, severity,
                    String.format("error rate %.1f%% over %d executions", rate, perf.executions()), rate));
        }
        if (perf.avgExecutionTimeMs() >= 30_000.0) {
            double avg = perf.avgExecutionTimeMs();
            Severity severity = avg >= 120_000.0 ? Severity.HIGH : avg >= 60_000.0 ? Severity.MEDIUM : Severity.LOW;
            out.add(new AgentIssue(perf.agentId(), IssueType.SLOW_PERFORMANCE, severity,
                    String.format("average execution time %.0fms", avg), avg));
        }
        if (perf.executions() >= 5) {
            double timeoutRate = perf.timeouts() * 100.0 / perf.executions();
            if (timeoutRate >= 10.0) {
                out.add(new AgentIssue(perf.agentId(), IssueType.TIMEOUT_FREQUENT,
                        timeoutRate >= 50.0 ? Severity.HIGH : Severity.MEDIUM,
                        String.format("%.1f%% of executions timed out", timeoutRate), timeoutRate));
            }
        }
        List<Double> memory = new ArrayList<>();
        for (ExecutionMetric m : window) {
            if (m.success() && m.memoryUsedMb() > 0.0) {
                memory.add(m.memoryUsedMb());
            }
        }
        if (memory.size() >= 5) {
            List<Double> tail = memory.subList(memory.size() - 5, memory.size());
            boolean increasing = true;
            for (int i = 1; i < tail.size(); i++) {
                if (tail.get(i) <= tail.get(i - 1)) {
                    increasing = false;
                    break;
                }
            }
            if (increasing && tail.get(tail.size() - 1) >= 2.0 * tail.get(0)) {
                out.add(new AgentIssue(perf.agentId(), IssueType.MEMORY_LEAK, Severity.MEDIUM,
                        String.format("memory grew from %.1fMB to %.1fMB", tail.get(0), tail.get(tail.size() - 1)),
                        tail.get(tail.size() - 1)));
            }
        }
        return out;
    }

    static String trend(double current, double previous) {
        if (previous <= 0.0) {
            return current > 0.0 ? "up" : "stable";
        }
        double ratio = current / previous;
        if (ratio > 1.1) {
            return "up";
        }
        if (ratio < 0.9) {
            return "down";
        }
        return "stable";
    }

    private void appendContainerEvent(ContainerEvent event) {
        if (closed) {
            return;
        }
        Deque<ContainerEvent> events = containerEvents.computeIfAbsent(event.containerId(), id -> new ArrayDeque<>());
        synchronized (events) {
            events.addLast(event);
            if (events.size() > CONTAINER_BUFFER_MAX) {
                while (events.size() > CONTAINER_BUFFER_KEEP) {
                    events.removeFirst();
                }
            }
        }
    }

    private void persist(String organizationId, MetricSnapshot snapshot) {
        if (store == null || closed) {
            return;
        }
        try {
            store.insertSnapshot(organizationId, snapshot);
        } catch (InfrastructureException e) {
            log.error("metrics snapshot persist failed runtime={}: {}", snapshot.runtimeId(), e.getMessage());
        }
    }

    private static void prune(Deque<ExecutionMetric> executions, long cutoffMs) {
        while (!executions.isEmpty() && executions.peekFirst().timestampMs() < cutoffMs) {
            executions.removeFirst();
        }
    }

    private static final class RuntimeEntry {
        final String runtimeId;
        final String organizationId;
        final Deque<ExecutionMetric> executions = new ArrayDeque<>();
        final Deque<MetricSnapshot> snapshots = new ArrayDeque<>();
        volatile Supplier<RuntimeGauges> gauges;
        volatile RuntimeMetrics latest;

        RuntimeEntry(String runtimeId, String organizationId) {
            this.runtimeId = runtimeId;
            this.organizationId = organizationId;
        }

        RuntimeGauges gauges() {
            Supplier<RuntimeGauges> supplier = gauges;
            if (supplier == null) {
                return RuntimeGauges.empty();
            }
            RuntimeGauges value = supplier.get();
            return value == null ? RuntimeGauges.empty() : value;
        }
    }

    private static final class WindowStats {
        final int count;
        final int errors;
        final long totalTimeMs;

        private WindowStats(int count, int errors, long totalTimeMs) {
            this.count = count;
            this.errors = errors;
            this.totalTimeMs = totalTimeMs;
        }

        static WindowStats empty() {
            return new WindowStats(0, 0, 0L);
        }

        static WindowStats of(Deque<ExecutionMetric> executions, long fromMs, long toMs) {
            int count = 0;
            int errors = 0;
            long total = 0L;
            for (ExecutionMetric m : executions) {
                if (m.timestampMs() < fromMs || m.timestampMs() > toMs) {
                    continue;
                }
                count++;
                total += m.executionTimeMs();
                if (!m.success()) {
                    errors++;
                }
            }
            return new WindowStats(count, errors, total);
        }

        WindowStats plus(WindowStats other) {
            return new WindowStats(count + other.count, errors + other.errors, totalTimeMs + other.totalTimeMs);
        }

        double successRate() {
            return count == 0 ? 100.0 : (count - errors) * 100.0 / count;
        }

        double errorRate() {
            return count == 0 ? 0.0 : errors * 100.0 / count;
        }

        double avgExecutionTimeMs() {
            return count == 0 ? 0.0 : (double) totalTimeMs / count;
        }
    }

    public record ExecutionMetric(
            String executionId,
            String runtimeId,
            String organizationId,
            String agentId,
            boolean success,
            long executionTimeMs,
            double memoryUsedMb,
            boolean timedOut,
            long timestampMs,
            String error
    ) {
    }

    public record ContainerEvent(
            String containerId,
            String agentId,
            String executionId,
            String kind,
            boolean success,
            long executionTimeMs,
            double memoryUsedMb,
            String error,
            long timestampMs
    ) {
    }

    public record RuntimeGauges(
            RuntimeStatus status,
            int activeContainers,
            double memoryUsageMb,
            int memoryLimitMb,
            int currentExecutions,
            int maxConcurrent,
            int queueLength
    ) {
        public static RuntimeGauges empty() {
            return new RuntimeGauges(RuntimeStatus.ACTIVE, 0, 0.0, 0, 0, 0, 0);
        }
    }

    public record RuntimeMetrics(
            String runtimeId,
            String organizationId,
            int currentExecutions,
            int queueLength,
            int executionsPerMinute,
            double avgExecutionTimeMs,
            double errorRate,
            double successRate,
            double memoryUtilization,
            double healthScore,
            long lastUpdatedMs,
            List<MetricSnapshot> historicalData
    ) {
    }

    public record OrganizationMetrics(
            String organizationId,
            String runtimeId,
            int executionsLastHour,
            double errorRate,
            double avgExecutionTimeMs,
            double memoryUsageMb,
            int activeContainers,
            double healthScore
    ) {
    }

    public record AgentPerformance(
            String agentId,
            int executions,
            double successRate,
            double errorRate,
            double avgExecutionTimeMs,
            int timeouts
    ) {
        static AgentPerformance of(String agentId, List<ExecutionMetric> window) {
            int errors = 0;
            int timeouts = 0;
            long total = 0L;
            for (ExecutionMetric m : window) {
                total += m.executionTimeMs();
                if (!m.success()) {
                    errors++;
                }
                if (m.timedOut()) {
                    timeouts++;
                }
            }
            int n = window.size();
            return new AgentPerformance(agentId, n, (n - errors) * 100.0 / n, errors * 100.0 / n, (double) total / n, timeouts);
        }
    }

    public enum IssueType {
        HIGH_ERROR_RATE,
        SLOW_PERFORMANCE,
        MEMORY_LEAK,
        TIMEOUT_FREQUENT;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public record AgentIssue(String agentId, IssueType issueType, Severity severity, String description, double value) {
    }

    public record Trends(String executionTrend, String errorTrend, String performanceTrend) {
    }

    public record DashboardMetrics(
            long generatedAtMs,
            long totalExecutions,
            long totalErrors,
            int activeRuntimes,
            int currentQueueDepth,
            double overallErrorRate,
            double avgExecutionTimeMs,
            double totalMemoryUsageMb,
            double containerUtilization,
            Map<String, OrganizationMetrics> organizationMetrics,
            List<AgentPerformance> topPerformingAgents,
            List<AgentIssue> problematicAgents,
            Trends trends
    ) {
    }
}
