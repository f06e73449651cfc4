package io.agentflow.agent;

import java.time.Duration;
import java.util.List;

/**
 * Agent backed by an external command. The payload is written to stdin, stdout is the output.
 */
public final class ScriptAgent implements Agent {
    private static final int MAX_ERROR_CHARS = 512;

    private final String id;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptAgent(String id, List<String> command, long timeoutMs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script agent id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script agent command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1L, timeoutMs);
    }

    @Override
    public String id() {
        return id;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public AgentResult execute(AgentContext context) {
        return run(context, timeoutMs);
    }

    public AgentResult run(AgentContext context, long limitMs) {
        ProcessRunner.Outcome out = ProcessRunner.run(command, context.payload(), Math.min(timeoutMs, limitMs));
        if (out.spawnError() != null) {
            return AgentResult.fail("script " + out.spawnError());
        }
        if (out.timedOut()) {
            return AgentResult.fail("script timeout after " + Duration.ofMillis(Math.min(timeoutMs, limitMs)));
        }
        if (out.exitCode() == 0) {
            return AgentResult.ok(out.output().strip());
        }
        return AgentResult.fail("script exit=" + out.exitCode() + " output=" + truncate(out.output()));
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
