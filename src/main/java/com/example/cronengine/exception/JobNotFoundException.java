package com.example.cronengine.exception;

public class JobNotFoundException extends CronEngineException {

    public JobNotFoundException(Long jobId) {
        super("Cron job not found: id=" + jobId);
    }
}
