package io.agentflow.error;

/**
 * Classification of engine failures. {@code retryable} says whether the work may be attempted
 * again, {@code countsAgainstRetries} whether doing so consumes an attempt from {@code max_retries}.
 */
public enum ErrorKind {
    VALIDATION(false, false),
    PERMISSION(false, false),
    NOT_FOUND(false, false),
    EXECUTION_RUNTIME(true, true),
    RESOURCE_EXHAUSTED(true, false),
    INFRASTRUCTURE(true, false);

    private final boolean retryable;
    private final boolean countsAgainstRetries;

    ErrorKind(boolean retryable, boolean countsAgainstRetries) {
        this.retryable = retryable;
        this.countsAgainstRetries = countsAgainstRetries;
    }

    public boolean retryable() {
        return retryable;
    }

    public boolean countsAgainstRetries() {
        return countsAgainstRetries;
    }
}
