package com.example.cronengine.exception;

public class UnknownTaskException extends CronEngineException {
    private final String taskIdentifier;

    public UnknownTaskException(String taskIdentifier) {
        super("Unknown task function: " + taskIdentifier);
        this.taskIdentifier = taskIdentifier;
    }

    public String getTaskIdentifier() {
        return taskIdentifier;
    }
}
