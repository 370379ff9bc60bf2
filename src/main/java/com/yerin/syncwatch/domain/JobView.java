package com.yerin.syncwatch.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobView(
        String id,
        JobType type,
        String source,
        JobStatus status,
        int priority,
        int progress,
        String progressMessage,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String errorMessage,
        String errorPhase,
        Map<String, Object> result,
        int retryCount,
        int maxRetries,
        String retryOf,
        String worker,
        Map<String, Object> params
) {}
