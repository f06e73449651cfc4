package io.agentflow.agent;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentflow.util.Jsons;

import java.time.Instant;

public final class EchoAgent implements Agent {
    public static final String ID = "echo";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public AgentResult execute(AgentContext context) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("agent", ID);
        out.put("timestamp", Instant.now().toString());
        out.put("executionId", context.executionId());
        out.put("organizationId", context.organizationId());
        out.set("received", Jsons.readTree(context.payload()));
        return AgentResult.ok(Jsons.toCompactJson(out));
    }
}
