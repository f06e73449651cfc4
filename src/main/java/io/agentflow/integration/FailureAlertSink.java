package io.agentflow.integration;

/**
 * Receives repeated-failure alerts. Whether to disable the agent is decided by the receiver.
 */
public interface FailureAlertSink {
    void agentFailing(FailureAlert alert);

    record FailureAlert(
            String agentId,
            int failureCount,
            int windowMinutes,
            String lastError,
            long raisedAtMs
    ) {
    }
}
