package io.agentflow.error;

public class AgentFlowException extends RuntimeException {
    private final ErrorKind kind;

    public AgentFlowException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AgentFlowException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
