package com.yerin.syncwatch.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceHealthView(
        String loop,
        LoopStatus status,
        Instant lastSuccess,
        Instant lastAttempt,
        int consecutiveErrors,
        long totalErrors,
        String lastError,
        Instant since
) {}
