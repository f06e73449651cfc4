package io.agentflow.observability;

import io.agentflow.config.EngineSettings;
import io.agentflow.integration.FailureAlertSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Counts execution failures per agent over a sliding window and raises one alert per window
 * once the threshold is crossed.
 */
public final class FailureAlertMonitor {
    private static final Logger log = LoggerFactory.getLogger(FailureAlertMonitor.class);

    private final FailureAlertSink sink;
    private final Supplier<EngineSettings> settings;
    private final Map<String, Deque<Long>> failures = new HashMap<>();
    private final Map<String, Long> lastAlertMs = new HashMap<>();

    public FailureAlertMonitor(FailureAlertSink sink, Supplier<EngineSettings> settings) {
        this.sink = sink;
        this.settings = settings;
    }

    /**
     * @return true when this failure raised an alert
     */
    public boolean recordFailure(String agentId, String error, long nowMs) {
        EngineSettings s = settings.get();
        long windowMs = s.failureAlertWindowMinutes() * 60_000L;
        FailureAlertSink.FailureAlert alert = null;
        synchronized (this) {
            Deque<Long> times = failures.computeIfAbsent(agentId, k -> new ArrayDeque<>());
            times.addLast(nowMs);
            prune(times, nowMs - windowMs);
            Long last = lastAlertMs.get(agentId);
            if (times.size() >= s.failureAlertThreshold() && (last == null || nowMs - last >= windowMs)) {
                lastAlertMs.put(agentId, nowMs);
                alert = new FailureAlertSink.FailureAlert(agentId, times.size(), s.failureAlertWindowMinutes(), error, nowMs);
            }
        }
        if (alert == null) {
            return false;
        }
        try {
            sink.agentFailing(alert);
        } catch (RuntimeException e) {
            log.error("failure alert delivery failed agent={}: {}", agentId, e.getMessage());
        }
        return true;
    }

    public synchronized int recentFailures(String agentId, long nowMs) {
        Deque<Long> times = failures.get(agentId);
        if (times == null) {
            return 0;
        }
        prune(times, nowMs - settings.get().failureAlertWindowMinutes() * 60_000L);
        return times.size();
    }

    private static void prune(Deque<Long> times, long cutoffMs) {
        while (!times.isEmpty() && times.peekFirst() < cutoffMs) {
            times.removeFirst();
        }
    }
}
