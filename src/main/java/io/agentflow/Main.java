package io.agentflow;

import io.agentflow.cli.AgentFlowCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AgentFlowCommand()).execute(args);
        System.exit(code);
    }
}
