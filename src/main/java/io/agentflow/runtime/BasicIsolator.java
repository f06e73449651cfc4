package io.agentflow.runtime;

import io.agentflow.agent.Agent;
import io.agentflow.agent.AgentContext;
import io.agentflow.model.ExecutionResult;
import io.agentflow.model.IsolationTier;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Direct execution on a shared pool. Only the wall-clock limit is enforced.
 */
public final class BasicIsolator implements Isolator {
    private final ExecutorService executor = Executors.newCachedThreadPool(InProcessExecution.daemonThreads("agent-basic"));

    @Override
    public IsolationTier tier() {
        return IsolationTier.BASIC;
    }

    @Override
    public ExecutionResult run(Agent agent, AgentContext context, ExecutionLimits limits) {
        return InProcessExecution.run(executor, agent, context, limits, false);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
