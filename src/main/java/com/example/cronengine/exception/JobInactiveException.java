package com.example.cronengine.exception;

public class JobInactiveException extends CronEngineException {

    public JobInactiveException(Long jobId) {
        super("Cannot execute inactive cron job: id=" + jobId);
    }
}
