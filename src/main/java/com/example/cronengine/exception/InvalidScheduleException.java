package com.example.cronengine.exception;

public class InvalidScheduleException extends CronEngineException {
    private final String schedule;

    public InvalidScheduleException(String schedule, String reason) {
        super("Invalid cron schedule '" + schedule + "': " + reason);
        this.schedule = schedule;
    }

    public String getSchedule() {
        return schedule;
    }
}
