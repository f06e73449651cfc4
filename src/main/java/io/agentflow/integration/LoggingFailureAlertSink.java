package io.agentflow.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingFailureAlertSink implements FailureAlertSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingFailureAlertSink.class);

    @Override
    public void agentFailing(FailureAlert alert) {
        log.warn("Agent {} failed {} times in the last {} minutes, last error: {}",
                alert.agentId(), alert.failureCount(), alert.windowMinutes(), alert.lastError());
    }
}
