package io.agentflow.agent;

import io.agentflow.error.NotFoundException;
import io.agentflow.model.AgentDescriptor;
import io.agentflow.model.AgentType;
import io.agentflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class AgentRegistry {
    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, Registration> agents = new ConcurrentHashMap<>();

    public void register(AgentDescriptor descriptor, Agent agent) {
        if (!descriptor.id().equals(agent.id())) {
            throw new IllegalArgumentException("descriptor id " + descriptor.id() + " does not match agent id " + agent.id());
        }
        agents.put(descriptor.id(), new Registration(descriptor, agent));
    }

    public Optional<Registration> find(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(agentId));
    }

    public Optional<AgentDescriptor> findDescriptor(String agentId) {
        return find(agentId).map(Registration::descriptor);
    }

    public Registration require(String agentId) {
        return find(agentId).orElseThrow(() -> new NotFoundException("Agent not found: " + agentId));
    }

    public Collection<String> listAgentIds() {
        return agents.keySet();
    }

    /**
     * Registers the agents declared in {@code agents/agents.json}. Returns the number loaded.
     * Invalid entries are skipped and logged.
     */
    public int loadDefinitions(Path file, int defaultMemoryMb, long defaultTimeoutMs) {
        if (file == null || !Files.exists(file)) {
            return 0;
        }
        DefinitionsFile defs;
        try {
            defs = Jsons.mapper().readValue(file.toFile(), DefinitionsFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load agent definitions: " + file, e);
        }
        if (defs == null || defs.agents() == null) {
            return 0;
        }
        int loaded = 0;
        for (Definition def : defs.agents()) {
            if (def == null || def.id() == null || def.id().isBlank()) {
                log.warn("Skipping agent definition without id in {}", file);
                continue;
            }
            try {
                long timeoutMs = def.timeoutMs() == null ? defaultTimeoutMs : def.timeoutMs();
                AgentDescriptor descriptor = new AgentDescriptor(
                        def.id(),
                        def.name(),
                        def.developerId(),
                        AgentType.fromString(def.type()),
                        def.memoryMb() == null ? defaultMemoryMb : def.memoryMb(),
                        timeoutMs
                );
                register(descriptor, instantiate(def, timeoutMs));
                loaded++;
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid agent definition {}: {}", def.id(), e.getMessage());
            }
        }
        log.info("Loaded {} agent definitions from {}", loaded, file);
        return loaded;
    }

    private static Agent instantiate(Definition def, long timeoutMs) {
        String kind = def.kind() == null ? "script" : def.kind().trim().toLowerCase();
        switch (kind) {
            case "echo":
                return new NamedAgent(def.id(), new EchoAgent());
            case "fail":
                return new NamedAgent(def.id(), new FailAgent());
            case "script":
                return new ScriptAgent(def.id(), def.command(), timeoutMs);
            default:
                throw new IllegalArgumentException("unknown agent kind: " + def.kind());
        }
    }

    public record Registration(AgentDescriptor descriptor, Agent agent) {
    }

    public record DefinitionsFile(List<Definition> agents) {
    }

    public record Definition(
            String id,
            String name,
            String developerId,
            String type,
            String kind,
            Integer memoryMb,
            Long timeoutMs,
            List<String> command
    ) {
    }

    /**
     * Re-exposes a built-in behaviour under a catalog id.
     */
    private static final class NamedAgent implements Agent {
        private final String id;
        private final Agent delegate;

        NamedAgent(String id, Agent delegate) {
            this.id = id;
            this.delegate = delegate;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public AgentResult execute(AgentContext context) throws Exception {
            return delegate.execute(context);
        }
    }
}
