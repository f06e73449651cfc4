package io.agentflow.runtime;

import io.agentflow.agent.Agent;
import io.agentflow.agent.AgentContext;
import io.agentflow.model.ExecutionResult;
import io.agentflow.model.IsolationTier;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Shared-pool execution with timing and per-thread allocation sampling. A run whose sampled
 * allocation crosses the memory limit is aborted.
 */
public final class EnhancedIsolator implements Isolator {
    private final ExecutorService executor = Executors.newCachedThreadPool(InProcessExecution.daemonThreads("agent-enhanced"));

    @Override
    public IsolationTier tier() {
        return IsolationTier.ENHANCED;
    }

    @Override
    public ExecutionResult run(Agent agent, AgentContext context, ExecutionLimits limits) {
        return InProcessExecution.run(executor, agent, context, limits, MemoryProbe.supported());
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
