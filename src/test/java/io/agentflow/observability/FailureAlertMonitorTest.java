package io.agentflow.observability;

import io.agentflow.Fixtures;
import io.agentflow.config.EngineSettings;
import io.agentflow.integration.FailureAlertSink;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class FailureAlertMonitorTest {

    @Test
    void alertsOncePerWindowAfterThreshold() {
        EngineSettings settings = Fixtures.withAlerts(Fixtures.fastSettings(), 3, false);
        List<FailureAlertSink.FailureAlert> alerts = new ArrayList<>();
        FailureAlertMonitor monitor = new FailureAlertMonitor(alerts::add, () -> settings);
        long windowMs = settings.failureAlertWindowMinutes() * 60_000L;

        Assertions.assertFalse(monitor.recordFailure("flaky", "e1", 1_000L));
        Assertions.assertFalse(monitor.recordFailure("flaky", "e2", 2_000L));
        Assertions.assertTrue(monitor.recordFailure("flaky", "e3", 3_000L));
        Assertions.assertFalse(monitor.recordFailure("flaky", "e4", 4_000L));

        Assertions.assertEquals(1, alerts.size());
        FailureAlertSink.FailureAlert alert = alerts.get(0);
        Assertions.assertEquals("flaky", alert.agentId());
        Assertions.assertEquals(3, alert.failureCount());
        Assertions.assertEquals("e3", alert.lastError());

        Assertions.assertFalse(monitor.recordFailure("other", "x", 4_000L));
        Assertions.assertEquals(4, monitor.recentFailures("flaky", 4_000L));
        Assertions.assertEquals(0, monitor.recentFailures("flaky", 4_001L + windowMs));
    }

    @Test
    void failuresOutsideWindowDoNotCount() {
        EngineSettings settings = Fixtures.withAlerts(Fixtures.fastSettings(), 2, false);
        List<FailureAlertSink.FailureAlert> alerts = new ArrayList<>();
        FailureAlertMonitor monitor = new FailureAlertMonitor(alerts::add, () -> settings);
        long windowMs = settings.failureAlertWindowMinutes() * 60_000L;

        Assertions.assertFalse(monitor.recordFailure("slow-burn", "a", 0L));
        Assertions.assertFalse(monitor.recordFailure("slow-burn", "b", windowMs + 1L));
        Assertions.assertTrue(monitor.recordFailure("slow-burn", "c", windowMs + 2L));
        Assertions.assertEquals(1, alerts.size());
    }

    @Test
    void sinkFailureStillReportsAlert() {
        EngineSettings settings = Fixtures.withAlerts(Fixtures.fastSettings(), 1, false);
        FailureAlertMonitor monitor = new FailureAlertMonitor(alert -> {
            throw new IllegalStateException("pager offline");
        }, () -> settings);
        Assertions.assertTrue(monitor.recordFailure("agent", "boom", 10L));
    }
}
