package com.yerin.syncwatch.infra;

import com.yerin.syncwatch.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Slf4j
@Component
@RequiredArgsConstructor
public class JobTimeoutReaper {

    private final JobWorkerPool pool;
    private final SyncProperties properties;

    @Scheduled(fixedDelayString = "${syncwatch.worker.sweep-interval:PT5M}",
            initialDelayString = "${syncwatch.worker.sweep-interval:PT5M}")
    public void reapStuck() {
        int cancelled = pool.cancelStuck(Instant.now(), properties.getWorker().getJobTimeout());
        if (cancelled > 0) {
            log.warn("[Reaper] cancelled stuck jobs count={}", cancelled);
        }
    }

    @Scheduled(fixedDelayString = "${syncwatch.worker.cleanup-interval:PT1H}",
            initialDelayString = "${syncwatch.worker.cleanup-interval:PT1H}")
    public void cleanup() {
        SyncProperties.Worker worker = properties.getWorker();
        pool.evictCompleted(Instant.now(), worker.getRetention(), worker.getHistoryLimit());
    }
}
