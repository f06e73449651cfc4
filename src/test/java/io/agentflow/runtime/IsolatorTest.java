package io.agentflow.runtime;

import io.agentflow.agent.Agent;
import io.agentflow.agent.AgentContext;
import io.agentflow.agent.AgentResult;
import io.agentflow.agent.EchoAgent;
import io.agentflow.agent.FailAgent;
import io.agentflow.agent.ScriptAgent;
import io.agentflow.model.ExecutionResult;
import io.agentflow.model.IsolationTier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

final class IsolatorTest {

    @Test
    void busyAgentIsCutOffAtTimeoutNotAtCompletion() {
        try (BasicIsolator isolator = new BasicIsolator()) {
            long started = System.nanoTime();
            ExecutionResult result = isolator.run(new BusyAgent(5_000L), context("{}"), new ExecutionLimits(100L, 64, 10L));
            long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

            Assertions.assertFalse(result.success());
            Assertions.assertTrue(result.timedOut());
            Assertions.assertTrue(result.error().toLowerCase(Locale.ROOT).contains("timeout"), result.error());
            Assertions.assertTrue(elapsedMs < 2_000L, "returned after " + elapsedMs + "ms");
        }
    }

    @Test
    void exceptionsAndFailedResultsBecomeFailures() {
        try (BasicIsolator isolator = new BasicIsolator()) {
            ExecutionLimits limits = new ExecutionLimits(2_000L, 64, 10L);

            ExecutionResult thrown = isolator.run(new ThrowingAgent(), context("{}"), limits);
            Assertions.assertFalse(thrown.success());
            Assertions.assertEquals("IllegalStateException: broken agent", thrown.error());

            ExecutionResult failed = isolator.run(new FailAgent(), context("{}"), limits);
            Assertions.assertFalse(failed.success());
            Assertions.assertEquals("intentional failure from fail agent", failed.error());
            Assertions.assertFalse(failed.timedOut());
        }
    }

    @Test
    void enhancedIsolatorAbortsRunsThatAllocatePastTheLimit() {
        Assumptions.assumeTrue(MemoryProbe.supported(), "thread allocation accounting unavailable");
        try (EnhancedIsolator isolator = new EnhancedIsolator()) {
            ExecutionResult result = isolator.run(new AllocatingAgent(), context("{}"), new ExecutionLimits(10_000L, 8, 5L));

            Assertions.assertFalse(result.success());
            Assertions.assertTrue(result.memoryExceeded(), result.error());
            Assertions.assertTrue(result.error().startsWith("Memory limit exceeded"), result.error());
        }
    }

    @Test
    void enhancedIsolatorReportsMemoryOnSuccess() {
        try (EnhancedIsolator isolator = new EnhancedIsolator()) {
            ExecutionResult result = isolator.run(new EchoAgent(), context("{\"x\":1}"), new ExecutionLimits(5_000L, 64, 5L));
            Assertions.assertTrue(result.success(), result.error());
            Assertions.assertTrue(result.output().contains("\"received\":{\"x\":1}"));
            Assertions.assertTrue(result.memoryUsedMb() >= 0.0);
        }
    }

    @Test
    void strictIsolatorRunsLaunchableAgentInChildJvm() {
        StrictIsolator isolator = new StrictIsolator();
        Assertions.assertEquals(IsolationTier.STRICT, isolator.tier());
        Assertions.assertTrue(StrictIsolator.isLaunchable(EchoAgent.class));

        ExecutionResult result = isolator.run(new EchoAgent(), context("{\"hello\":\"child\"}"), new ExecutionLimits(30_000L, 64, 10L));
        Assertions.assertTrue(result.success(), result.error());
        Assertions.assertTrue(result.output().contains("\"hello\":\"child\""), result.output());
    }

    @Test
    void strictIsolatorFallsBackToDedicatedThreadForNonLaunchableAgents() {
        Assertions.assertFalse(StrictIsolator.isLaunchable(BusyAgent.class));
        Agent lambdaLike = new Agent() {
            @Override
            public String id() {
                return "anon";
            }

            @Override
            public AgentResult execute(AgentContext context) {
                return AgentResult.ok("attempt=" + context.attempt());
            }
        };
        Assertions.assertFalse(StrictIsolator.isLaunchable(lambdaLike.getClass()));

        ExecutionResult result = new StrictIsolator().run(lambdaLike, context("{}"), new ExecutionLimits(2_000L, 64, 10L));
        Assertions.assertTrue(result.success(), result.error());
        Assertions.assertEquals("attempt=1", result.output());

        ExecutionResult busy = new StrictIsolator(false).run(new BusyAgent(5_000L), context("{}"), new ExecutionLimits(100L, 64, 10L));
        Assertions.assertTrue(busy.timedOut());
    }

    @Test
    void strictIsolatorKillsOverrunningScript() {
        Assumptions.assumeFalse(System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"));
        ScriptAgent sleeper = new ScriptAgent("sleeper", List.of("sleep", "5"), 30_000L);

        long started = System.nanoTime();
        ExecutionResult result = new StrictIsolator().run(sleeper, context("{}"), new ExecutionLimits(200L, 64, 10L));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        Assertions.assertFalse(result.success());
        Assertions.assertTrue(result.timedOut(), result.error());
        Assertions.assertTrue(elapsedMs < 3_000L, "returned after " + elapsedMs + "ms");
    }

    private static AgentContext context(String payload) {
        return new AgentContext("exec-test", "agent-test", "user-1", "org-1", payload, 1);
    }

    static final class BusyAgent implements Agent {
        private final long spinMs;

        BusyAgent(long spinMs) {
            this.spinMs = spinMs;
        }

        @Override
        public String id() {
            return "busy";
        }

        @Override
        public AgentResult execute(AgentContext context) {
            long until = System.nanoTime() + spinMs * 1_000_000L;
            long counter = 0L;
            while (System.nanoTime() < until) {
                counter++;
            }
            return AgentResult.ok(Long.toString(counter));
        }
    }

    static final class ThrowingAgent implements Agent {
        @Override
        public String id() {
            return "throwing";
        }

        @Override
        public AgentResult execute(AgentContext context) {
            throw new IllegalStateException("broken agent");
        }
    }

    static final class AllocatingAgent implements Agent {
        @Override
        public String id() {
            return "allocating";
        }

        @Override
        public AgentResult execute(AgentContext context) throws InterruptedException {
            List<byte[]> retained = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                retained.add(new byte[256 * 1024]);
                Thread.sleep(2L);
            }
            return AgentResult.ok("allocated " + retained.size());
        }
    }
}
