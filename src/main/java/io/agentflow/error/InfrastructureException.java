package io.agentflow.error;

public final class InfrastructureException extends AgentFlowException {
    public InfrastructureException(String message) {
        super(ErrorKind.INFRASTRUCTURE, message);
    }

    public InfrastructureException(String message, Throwable cause) {
        super(ErrorKind.INFRASTRUCTURE, message, cause);
    }
}
