package com.example.cronengine.exception;

public class ExecutionTimeoutException extends CronEngineException {
    private final long timeoutMs;

    public ExecutionTimeoutException(long timeoutMs) {
        super("Job execution timed out after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
