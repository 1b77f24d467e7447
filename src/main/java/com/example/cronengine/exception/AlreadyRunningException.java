package com.example.cronengine.exception;

public class AlreadyRunningException extends CronEngineException {

    public AlreadyRunningException(Long jobId) {
        super("Cron job is already running: id=" + jobId);
    }
}
