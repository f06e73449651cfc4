/**
 * AgentFlow source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentflow.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentflow.cli.AgentFlowCommand} maps commands to engine APIs.</li>
 *   <li>{@code io.agentflow.engine.AgentFlowEngine} wires storage, scheduler, runtimes and dispatch.</li>
 *   <li>{@code io.agentflow.storage.ExecutionQueue} is the durable source of truth for queued work.</li>
 * </ul>
 */
package io.agentflow;
