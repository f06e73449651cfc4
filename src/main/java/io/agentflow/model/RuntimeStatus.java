package io.agentflow.model;

public enum RuntimeStatus {
    ACTIVE,
    PAUSED,
    SHUTDOWN
}
