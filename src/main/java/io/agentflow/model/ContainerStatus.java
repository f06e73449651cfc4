package io.agentflow.model;

public enum ContainerStatus {
    IDLE,
    RUNNING,
    ERROR,
    STOPPED
}
