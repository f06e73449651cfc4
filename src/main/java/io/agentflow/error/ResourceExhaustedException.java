package io.agentflow.error;

public final class ResourceExhaustedException extends AgentFlowException {
    public ResourceExhaustedException(String message) {
        super(ErrorKind.RESOURCE_EXHAUSTED, message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(ErrorKind.RESOURCE_EXHAUSTED, message, cause);
    }
}
