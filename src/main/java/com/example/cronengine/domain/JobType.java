package com.example.cronengine.domain;

public enum JobType {
    CLEANUP,
    BACKUP,
    ANALYTICS,
    MAINTENANCE,
    NOTIFICATION,
    SYNC,
    OTHER
}
