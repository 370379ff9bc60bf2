package com.yerin.syncwatch.domain;

public enum JobStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    // PENDING -> RUNNING -> {SUCCEEDED|FAILED|CANCELLED}, PENDING -> CANCELLED
    public boolean canMoveTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }
}
