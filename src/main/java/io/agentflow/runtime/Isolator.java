package io.agentflow.runtime;

import io.agentflow.agent.Agent;
import io.agentflow.agent.AgentContext;
import io.agentflow.model.ExecutionResult;
import io.agentflow.model.IsolationTier;

/**
 * Executes one agent invocation under a wall-clock and memory limit. Implementations never
 * throw for agent failures: every outcome, including timeouts, is reported as a result.
 */
public interface Isolator extends AutoCloseable {
    IsolationTier tier();

    ExecutionResult run(Agent agent, AgentContext context, ExecutionLimits limits);

    @Override
    default void close() {
    }
}
