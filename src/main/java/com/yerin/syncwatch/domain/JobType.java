package com.yerin.syncwatch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum JobType {
    DWS_SYNC("dws_sync", SyncSource.DWS),
    TREASURY_SYNC("treasury_sync", SyncSource.TREASURY),
    CORRELATION_ANALYSIS("correlation_analysis", SyncSource.CORRELATION);

    private final String tag;
    private final SyncSource source;

    JobType(String tag, SyncSource source) {
        this.tag = tag;
        this.source = source;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public SyncSource source() {
        return source;
    }

    public static Optional<JobType> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.tag.equalsIgnoreCase(tag.trim()) || t.name().equalsIgnoreCase(tag.trim()))
                .findFirst();
    }

    public static JobType forSource(SyncSource source) {
        return Arrays.stream(values())
                .filter(t -> t.source == source)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("no job type for source=" + source));
    }
}
