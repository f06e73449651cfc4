package io.agentflow.error;

public final class PermissionDeniedException extends AgentFlowException {
    public PermissionDeniedException(String message) {
        super(ErrorKind.PERMISSION, message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(ErrorKind.PERMISSION, message, cause);
    }
}
