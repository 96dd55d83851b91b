package com.gocomet.tripsafety.notification.model;

public enum JobStatus {
    QUEUED,
    IN_FLIGHT,
    RETRYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
