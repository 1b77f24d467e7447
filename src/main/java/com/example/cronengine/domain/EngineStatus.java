package com.example.cronengine.domain;

import lombok.Value;

import java.util.Set;

@Value
public class EngineStatus {
    Set<Long> scheduledJobIds;
    Set<Long> runningJobIds;

    public int getTotalJobs() {
        return scheduledJobIds.size();
    }

    public int getRunningJobs() {
        return runningJobIds.size();
    }
}
