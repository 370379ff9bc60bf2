package com.yerin.syncwatch.application;

import com.yerin.syncwatch.domain.SyncSource;
import lombok.Getter;

@Getter
public class SyncException extends RuntimeException {

    private final SyncSource source;
    private final SyncPhase phase;

    public SyncException(SyncSource source, SyncPhase phase, String message, Throwable cause) {
        super(source.key() + " sync failed during " + phase.label() + ": " + message, cause);
        this.source = source;
        this.phase = phase;
    }
}
