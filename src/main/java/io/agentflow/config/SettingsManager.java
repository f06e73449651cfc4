package io.agentflow.config;

import io.agentflow.observability.AuditLogger;
import io.agentflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Holds the current {@link EngineSettings} and re-reads {@code agentflow-settings.json}
 * when its modification time changes.
 */
public final class SettingsManager {
    private static final Logger log = LoggerFactory.getLogger(SettingsManager.class);

    private final Path settingsFile;
    private final AuditLogger auditLogger;
    private volatile EngineSettings current;
    private volatile long fileMtimeMs;
    private volatile long lastCheckMs;

    public SettingsManager(Path settingsFile, AuditLogger auditLogger) {
        this.settingsFile = settingsFile;
        this.auditLogger = auditLogger;
        this.current = EngineSettings.defaults();
        this.fileMtimeMs = -1L;
        this.lastCheckMs = 0L;
    }

    public static SettingsManager fixed(EngineSettings settings) {
        SettingsManager manager = new SettingsManager(null, null);
        manager.current = settings;
        return manager;
    }

    public EngineSettings current() {
        return current;
    }

    public ReloadOutcome maybeReload(long minIntervalMs) {
        long nowMs = Instant.now().toEpochMilli();
        if ((nowMs - lastCheckMs) < Math.max(0L, minIntervalMs)) {
            return new ReloadOutcome(false, fileMtimeMs >= 0L, "throttled", List.of());
        }
        return reload(false);
    }

    public synchronized ReloadOutcome reload(boolean force) {
        lastCheckMs = Instant.now().toEpochMilli();
        if (settingsFile == null) {
            return new ReloadOutcome(false, false, "fixed", List.of());
        }
        long mtime = resolveMtimeMs(settingsFile);
        if (!force && mtime == fileMtimeMs) {
            return new ReloadOutcome(false, mtime >= 0L, "unchanged", List.of());
        }
        EngineSettings defaults = EngineSettings.defaults();
        EngineSettings previous = current;
        EngineSettings resolved;
        String source;
        if (mtime < 0L) {
            resolved = defaults;
            source = "defaults";
        } else {
            try {
                EngineSettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), EngineSettingsFile.class);
                resolved = EngineSettings.fromFile(file, defaults);
                source = "file";
            } catch (IOException e) {
                throw new RuntimeException("Failed to load engine settings: " + settingsFile, e);
            }
        }
        current = resolved;
        fileMtimeMs = mtime;
        List<String> changedFields = EngineSettings.diffFields(previous, resolved);
        boolean changed = !changedFields.isEmpty();
        if (changed) {
            log.info("Engine settings reloaded from {} ({}), changed fields {}", settingsFile, source, changedFields);
            if (auditLogger != null) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "settings.reload",
                        "system",
                        "engine/settings",
                        "reloaded",
                        Map.of(
                                "config", settingsFile.toString(),
                                "source", source,
                                "changed_fields", changedFields
                        )
                ));
            }
        }
        return new ReloadOutcome(changed, mtime >= 0L, source, changedFields);
    }

    private static long resolveMtimeMs(Path path) {
        if (!Files.exists(path)) {
            return -1L;
        }
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings mtime: " + path, e);
        }
    }

    public record ReloadOutcome(boolean changed, boolean fileExists, String source, List<String> changedFields) {
    }
}
