package io.agentflow;

import io.agentflow.config.EngineSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

public final class Fixtures {
    private Fixtures() {
    }

    /**
     * Defaults with short waits so dispatch-and-wait paths finish quickly in tests.
     */
    public static EngineSettings fastSettings() {
        EngineSettings d = EngineSettings.defaults();
        return new EngineSettings(
                d.minIntervalMinutes(),
                d.lookAheadHours(),
                d.defaultMaxExecutionsPerDay(),
                d.reconcileBatchSize(),
                5_000L,
                20L,
                d.scheduledPriority(),
                d.webhookPriority(),
                d.manualPriority(),
                d.scheduledMaxRetries(),
                0L,
                20L,
                10L,
                d.defaultAgentMemoryMb(),
                d.defaultAgentTimeoutMs(),
                10L,
                d.failureAlertThreshold(),
                d.failureAlertWindowMinutes(),
                false,
                d.metricsIntervalMs(),
                EngineSettings.CRON_QUARTZ);
    }

    public static EngineSettings withAlerts(EngineSettings s, int threshold, boolean autoDisable) {
        return new EngineSettings(
                s.minIntervalMinutes(),
                s.lookAheadHours(),
                s.defaultMaxExecutionsPerDay(),
                s.reconcileBatchSize(),
                s.completionTimeoutMs(),
                s.completionPollIntervalMs(),
                s.scheduledPriority(),
                s.webhookPriority(),
                s.manualPriority(),
                s.scheduledMaxRetries(),
                s.retryBackoffMs(),
                s.resourceRetryDelayMs(),
                s.workerPollIntervalMs(),
                s.defaultAgentMemoryMb(),
                s.defaultAgentTimeoutMs(),
                s.memorySampleIntervalMs(),
                threshold,
                s.failureAlertWindowMinutes(),
                autoDisable,
                s.metricsIntervalMs(),
                s.cronStrategy());
    }

    public static EngineSettings withCompletionTimeout(EngineSettings s, long completionTimeoutMs) {
        return new EngineSettings(
                s.minIntervalMinutes(),
                s.lookAheadHours(),
                s.defaultMaxExecutionsPerDay(),
                s.reconcileBatchSize(),
                completionTimeoutMs,
                s.completionPollIntervalMs(),
                s.scheduledPriority(),
                s.webhookPriority(),
                s.manualPriority(),
                s.scheduledMaxRetries(),
                s.retryBackoffMs(),
                s.resourceRetryDelayMs(),
                s.workerPollIntervalMs(),
                s.defaultAgentMemoryMb(),
                s.defaultAgentTimeoutMs(),
                s.memorySampleIntervalMs(),
                s.failureAlertThreshold(),
                s.failureAlertWindowMinutes(),
                s.autoDisableOnFailureAlert(),
                s.metricsIntervalMs(),
                s.cronStrategy());
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    /**
     * UTC clock whose instant tests move by hand.
     */
    public static final class MutableClock extends Clock {
        private final AtomicLong millis;

        public MutableClock(long startMillis) {
            this.millis = new AtomicLong(startMillis);
        }

        public void advanceMillis(long delta) {
            millis.addAndGet(delta);
        }

        public void setMillis(long value) {
            millis.set(value);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis.get());
        }

        @Override
        public long millis() {
            return millis.get();
        }
    }
}
