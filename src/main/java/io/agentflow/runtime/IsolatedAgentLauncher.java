package io.agentflow.runtime;

import io.agentflow.agent.Agent;
import io.agentflow.agent.AgentContext;
import io.agentflow.agent.AgentResult;
import io.agentflow.util.Jsons;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Entry point of the child JVM used by {@link StrictIsolator}. Reads an {@link AgentContext} as
 * JSON from stdin, runs the named agent class, and prints one result line to stdout.
 */
public final class IsolatedAgentLauncher {
    static final String RESULT_MARKER = "AGENTFLOW_RESULT ";

    private IsolatedAgentLauncher() {
    }

    public static void main(String[] args) throws IOException {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        if (args.length != 1) {
            out.println(RESULT_MARKER + Jsons.toCompactJson(AgentResult.fail("usage: IsolatedAgentLauncher <agent-class>")));
            System.exit(2);
            return;
        }
        String input = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        AgentResult result;
        try {
            AgentContext context = Jsons.mapper().readValue(input, AgentContext.class);
            Class<?> type = Class.forName(args[0]);
            Agent agent = (Agent) type.getConstructor().newInstance();
            result = agent.execute(context);
            if (result == null) {
                result = AgentResult.fail("agent returned no result");
            }
        } catch (Exception e) {
            result = AgentResult.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        out.println(RESULT_MARKER + Jsons.toCompactJson(result));
        out.flush();
        System.exit(0);
    }
}
