package io.agentflow.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingNotificationSink implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notify(Notification n) {
        if (n.success()) {
            log.info("Notify {}: {} of agent {} succeeded", n.ownerId(), n.eventType(), n.agentName());
        } else {
            log.info("Notify {}: {} of agent {} failed: {}", n.ownerId(), n.eventType(), n.agentName(), n.error());
        }
    }
}
