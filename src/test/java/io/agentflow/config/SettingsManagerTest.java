package io.agentflow.config;

import io.agentflow.Fixtures;
import io.agentflow.observability.AuditLogger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

final class SettingsManagerTest {

    @Test
    void missingFileResolvesToDefaults() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-settings-defaults-");
        try {
            SettingsManager manager = new SettingsManager(root.resolve("agentflow-settings.json"), null);
            SettingsManager.ReloadOutcome outcome = manager.reload(true);

            Assertions.assertFalse(outcome.fileExists());
            Assertions.assertEquals("defaults", outcome.source());
            Assertions.assertEquals(EngineSettings.defaults(), manager.current());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void changedFileIsReloadedAndAudited() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-settings-reload-");
        try {
            AgentFlowConfig config = AgentFlowConfig.fromRoot(root.toString());
            Path file = config.settingsFile();
            AuditLogger audit = new AuditLogger(config.auditFile());
            SettingsManager manager = new SettingsManager(file, audit);
            manager.reload(true);

            Files.writeString(file, """
                    {
                      "minIntervalMinutes": 15,
                      "failureAlertThreshold": 3,
                      "cronStrategy": "PLACEHOLDER",
                      "unknownField": true
                    }
                    """, StandardCharsets.UTF_8);
            SettingsManager.ReloadOutcome outcome = manager.reload(false);

            Assertions.assertTrue(outcome.changed());
            Assertions.assertEquals("file", outcome.source());
            Assertions.assertEquals(List.of("minIntervalMinutes", "failureAlertThreshold", "cronStrategy"), outcome.changedFields());
            Assertions.assertEquals(15, manager.current().minIntervalMinutes());
            Assertions.assertEquals(EngineSettings.CRON_PLACEHOLDER, manager.current().cronStrategy());
            Assertions.assertTrue(Files.readString(config.auditFile()).contains("\"settings.reload\""));

            SettingsManager.ReloadOutcome again = manager.reload(false);
            Assertions.assertFalse(again.changed());
            Assertions.assertEquals("unchanged", again.source());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void intervalFloorCannotBeLoweredAndUnknownCronStrategyIsIgnored() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-settings-floor-");
        try {
            Path file = root.resolve("agentflow-settings.json");
            Files.writeString(file, "{\"minIntervalMinutes\": 1, \"cronStrategy\": \"bogus\", \"scheduledMaxRetries\": -4}",
                    StandardCharsets.UTF_8);
            SettingsManager manager = new SettingsManager(file, null);
            manager.reload(true);

            Assertions.assertEquals(AgentFlowConfig.DEFAULT_MIN_INTERVAL_MINUTES, manager.current().minIntervalMinutes());
            Assertions.assertEquals(EngineSettings.CRON_QUARTZ, manager.current().cronStrategy());
            Assertions.assertEquals(0, manager.current().scheduledMaxRetries());

            Files.writeString(file, "{\"minIntervalMinutes\": 30}", StandardCharsets.UTF_8);
            Files.setLastModifiedTime(file, FileTime.fromMillis(Files.getLastModifiedTime(file).toMillis() + 5_000L));
            Assertions.assertTrue(manager.reload(false).changed());
            Assertions.assertEquals(30, manager.current().minIntervalMinutes());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void fixedManagerNeverReloads() {
        SettingsManager manager = SettingsManager.fixed(Fixtures.fastSettings());
        SettingsManager.ReloadOutcome outcome = manager.reload(true);
        Assertions.assertFalse(outcome.changed());
        Assertions.assertEquals("fixed", outcome.source());
        Assertions.assertEquals(20L, manager.current().completionPollIntervalMs());
    }
}
