package com.yerin.syncwatch.scheduler;

import com.yerin.syncwatch.domain.SourceHealthView;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SchedulerStatus(
        boolean running,
        Instant startedAt,
        long uptimeSeconds,
        Map<String, SourceHealthView> health,
        Map<String, Instant> nextRuns,
        Map<String, Integer> errorCounts,
        long totalErrors,
        List<String> activeLoops,
        Map<String, Object> config,
        Instant currentTime
) {}
