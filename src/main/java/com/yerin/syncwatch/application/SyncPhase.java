package com.yerin.syncwatch.application;

public enum SyncPhase {
    FETCH,
    DETECT,
    PERSIST,
    ANALYZE;

    public String label() {
        return name().toLowerCase();
    }
}
