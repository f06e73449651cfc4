package io.agentflow.error;

public final class ExecutionRuntimeException extends AgentFlowException {
    public ExecutionRuntimeException(String message) {
        super(ErrorKind.EXECUTION_RUNTIME, message);
    }

    public ExecutionRuntimeException(String message, Throwable cause) {
        super(ErrorKind.EXECUTION_RUNTIME, message, cause);
    }
}
