package io.agentflow.runtime;

import io.agentflow.agent.Agent;
import io.agentflow.agent.AgentContext;
import io.agentflow.agent.AgentResult;
import io.agentflow.agent.ProcessRunner;
import io.agentflow.agent.ScriptAgent;
import io.agentflow.model.ExecutionResult;
import io.agentflow.model.IsolationTier;
import io.agentflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Out-of-process execution. Script agents run as their own child process; agent classes that
 * can be instantiated reflectively run in a child JVM whose heap is capped at the memory limit.
 * Either way an overrunning execution is killed, not abandoned.
 *
 * <p>Agents that cannot be launched in a child JVM (lambdas, inner classes, agents without a
 * public no-arg constructor) run on a dedicated single-use thread with memory sampling and a
 * private copy of their context.
 */
public final class StrictIsolator implements Isolator {
    private static final Logger log = LoggerFactory.getLogger(StrictIsolator.class);
    private static final int MIN_CHILD_HEAP_MB = 16;

    private final boolean childJvmEnabled;
    private final String javaExecutable;
    private final String classPath;

    public StrictIsolator() {
        this(true);
    }

    public StrictIsolator(boolean childJvmEnabled) {
        this.childJvmEnabled = childJvmEnabled;
        this.javaExecutable = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        this.classPath = System.getProperty("java.class.path", "");
    }

    @Override
    public IsolationTier tier() {
        return IsolationTier.STRICT;
    }

    @Override
    public ExecutionResult run(Agent agent, AgentContext context, ExecutionLimits limits) {
        if (agent instanceof ScriptAgent) {
            return runScript((ScriptAgent) agent, context, limits);
        }
        if (childJvmEnabled && isLaunchable(agent.getClass())) {
            return runChildJvm(agent, context, limits);
        }
        log.warn("agent {} cannot run in a child JVM; using a dedicated thread", agent.id());
        return runDedicatedThread(agent, context, limits);
    }

    static boolean isLaunchable(Class<?> type) {
        int modifiers = type.getModifiers();
        if (!Modifier.isPublic(modifiers) || Modifier.isAbstract(modifiers)) {
            return false;
        }
        if (type.isAnonymousClass() || type.isLocalClass() || type.isSynthetic()) {
            return false;
        }
        if (type.isMemberClass() && !Modifier.isStatic(modifiers)) {
            return false;
        }
        try {
            return Modifier.isPublic(type.getConstructor().getModifiers());
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private ExecutionResult runScript(ScriptAgent agent, AgentContext context, ExecutionLimits limits) {
        long started = System.nanoTime();
        AgentResult result = agent.run(context, limits.timeoutMs());
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        if (result.success()) {
            return ExecutionResult.ok(result.output(), elapsedMs, 0.0);
        }
        if (elapsedMs >= limits.timeoutMs() && result.error() != null && result.error().startsWith("script timeout")) {
            return ExecutionResult.timeout(limits.timeoutMs(), elapsedMs);
        }
        return ExecutionResult.fail(result.error(), elapsedMs, 0.0);
    }

    private ExecutionResult runChildJvm(Agent agent, AgentContext context, ExecutionLimits limits) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.add("-Xmx" + Math.max(MIN_CHILD_HEAP_MB, limits.memoryLimitMb()) + "m");
        command.add("-XX:+ExitOnOutOfMemoryError");
        command.add("-XX:TieredStopAtLevel=1");
        command.add("-cp");
        command.add(classPath);
        command.add(IsolatedAgentLauncher.class.getName());
        command.add(agent.getClass().getName());

        ProcessRunner.Outcome out = ProcessRunner.run(command, Jsons.toCompactJson(context), limits.timeoutMs());
        if (out.spawnError() != null) {
            return ExecutionResult.fail("isolated runtime " + out.spawnError(), out.elapsedMs(), 0.0);
        }
        if (out.timedOut()) {
            return ExecutionResult.timeout(limits.timeoutMs(), out.elapsedMs());
        }
        String output = out.output() == null ? "" : out.output();
        if (output.contains("OutOfMemoryError")) {
            return ExecutionResult.memoryExceeded(limits.memoryLimitMb(), limits.memoryLimitMb(), out.elapsedMs());
        }
        AgentResult result = parseResult(output);
        if (result == null) {
            return ExecutionResult.fail("isolated runtime exit=" + out.exitCode() + " produced no result", out.elapsedMs(), 0.0);
        }
        if (result.success()) {
            return ExecutionResult.ok(result.output(), out.elapsedMs(), 0.0);
        }
        return ExecutionResult.fail(result.error(), out.elapsedMs(), 0.0);
    }

    private ExecutionResult runDedicatedThread(Agent agent, AgentContext context, ExecutionLimits limits) {
        AgentContext copy = new AgentContext(context.executionId(), context.agentId(), context.ownerId(),
                context.organizationId(), context.payload() == null ? null : new String(context.payload()), context.attempt());
        ExecutorService executor = Executors.newSingleThreadExecutor(InProcessExecution.daemonThreads("agent-strict-" + context.executionId()));
        try {
            return InProcessExecution.run(executor, agent, copy, limits, MemoryProbe.supported());
        } finally {
            executor.shutdownNow();
        }
    }

    private static AgentResult parseResult(String output) {
        String[] lines = output.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i];
            if (line.startsWith(IsolatedAgentLauncher.RESULT_MARKER)) {
                try {
                    return Jsons.mapper().readValue(line.substring(IsolatedAgentLauncher.RESULT_MARKER.length()), AgentResult.class);
                } catch (Exception e) {
                    log.warn("unreadable isolated result line: {}", e.getMessage());
                    return null;
                }
            }
        }
        return null;
    }
}
