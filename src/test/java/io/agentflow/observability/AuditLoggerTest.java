package io.agentflow.observability;

import io.agentflow.Fixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class AuditLoggerTest {

    @Test
    void chainVerifiesAndSurvivesReopen() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file);
            first.log(AuditLogger.AuditEvent.of("schedule.create", "dev-1", "schedule/s1", "ok", Map.of("agent", "echo")));
            first.log(AuditLogger.AuditEvent.of("execution.enqueue", "dev-1", "queue/q1", "ok", null));
            String head = first.currentHash();

            AuditLogger reopened = new AuditLogger(file);
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("agent.stop", "dev-1", "agent/echo", "ok", Map.of()));

            AuditLogger.IntegrityOutcome outcome = reopened.verify();
            Assertions.assertTrue(outcome.ok(), outcome.reason());
            Assertions.assertEquals(3, outcome.checkedRows());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("agentflow-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file);
            audit.log(AuditLogger.AuditEvent.of("execution.cancel", "user-1", "queue/a", "ok", null));
            audit.log(AuditLogger.AuditEvent.of("execution.cancel", "user-1", "queue/b", "ok", null));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(0, lines.get(0).replace("queue/a", "queue/z"));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.IntegrityOutcome outcome = new AuditLogger(file).verify();
            Assertions.assertFalse(outcome.ok());
            Assertions.assertEquals(1, outcome.brokenLine());
            Assertions.assertEquals("hash mismatch", outcome.reason());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }
}
