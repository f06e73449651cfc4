package io.agentflow.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class AgentFlowConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "agentflow-settings.json";
    public static final int DEFAULT_MIN_INTERVAL_MINUTES = 5;
    public static final int DEFAULT_LOOK_AHEAD_HOURS = 24;
    public static final int DEFAULT_MAX_EXECUTIONS_PER_DAY = 100;
    public static final int DEFAULT_RECONCILE_BATCH_SIZE = 50;
    public static final long DEFAULT_COMPLETION_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_COMPLETION_POLL_INTERVAL_MS = 2_000L;
    public static final int DEFAULT_SCHEDULED_PRIORITY = 5;
    public static final int DEFAULT_WEBHOOK_PRIORITY = 3;
    public static final int DEFAULT_MANUAL_PRIORITY = 1;
    public static final int DEFAULT_SCHEDULED_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_BACKOFF_MS = 0L;
    public static final long DEFAULT_RESOURCE_RETRY_DELAY_MS = 1_000L;
    public static final long DEFAULT_WORKER_POLL_INTERVAL_MS = 200L;
    public static final int DEFAULT_AGENT_MEMORY_MB = 64;
    public static final long DEFAULT_AGENT_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_MEMORY_SAMPLE_INTERVAL_MS = 25L;
    public static final int DEFAULT_FAILURE_ALERT_THRESHOLD = 5;
    public static final int DEFAULT_FAILURE_ALERT_WINDOW_MINUTES = 60;
    public static final long DEFAULT_METRICS_INTERVAL_MS = 60_000L;

    private final Path rootDir;

    public AgentFlowConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static AgentFlowConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new AgentFlowConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("agentflow.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path agentsDir() {
        return rootDir.resolve("agents");
    }

    public Path agentsFile() {
        return agentsDir().resolve("agents.json");
    }

    public Path purchasesFile() {
        return agentsDir().resolve("purchases.json");
    }

    public Path tenantsFile() {
        return agentsDir().resolve("tenants.json");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
