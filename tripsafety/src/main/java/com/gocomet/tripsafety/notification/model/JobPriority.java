package com.gocomet.tripsafety.notification.model;

/**
 * Claim order of queued jobs. The rank is persisted so the worker can sort in SQL.
 */
public enum JobPriority {
    CRITICAL(0),
    HIGH(1),
    NORMAL(2),
    LOW(3);

    private final int rank;

    JobPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
