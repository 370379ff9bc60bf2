package com.yerin.syncwatch.domain;

public enum LoopStatus {
    STOPPED,
    RUNNING,
    HEALTHY,
    ERROR,
    STALE
}
