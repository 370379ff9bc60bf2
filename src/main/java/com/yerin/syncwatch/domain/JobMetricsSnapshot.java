package com.yerin.syncwatch.domain;

import java.time.Instant;

/**
 * 작업 이력에서 매번 다시 계산되는 처리 지표.
 */
public record JobMetricsSnapshot(
        boolean running,
        long totalProcessed,
        long succeeded,
        long failed,
        long cancelled,
        double successRate,
        double averageProcessingSeconds,
        int queueDepth,
        int activeWorkers,
        int maxWorkers,
        int activeJobs,
        int retainedJobs,
        Instant lastActivity,
        Instant currentTime
) {}
