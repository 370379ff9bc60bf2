package com.yerin.syncwatch.service;

import com.yerin.syncwatch.domain.JobStatus;
import com.yerin.syncwatch.domain.JobType;
import com.yerin.syncwatch.domain.JobView;
import com.yerin.syncwatch.domain.SyncSource;
import com.yerin.syncwatch.dto.response.SyncTriggerResult;
import com.yerin.syncwatch.global.exception.AppException;
import com.yerin.syncwatch.global.exception.code.SyncErrorCode;
import com.yerin.syncwatch.infra.JobWorkerPool;
import com.yerin.syncwatch.notification.NotificationHub;
import com.yerin.syncwatch.scheduler.SchedulerStatus;
import com.yerin.syncwatch.scheduler.SyncScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 스케줄러 제어와 수동 동기화의 진입점.
 * 수동 동기화는 풀에 제출되는 일회성 작업이라 루프와 겹쳐도 소스별 잠금으로 직렬화된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncOrchestrator {

    public static final String ALL = "all";
    private static final Map<String, Object> MANUAL = Map.of("trigger", "manual");

    private final SyncScheduler scheduler;
    private final JobWorkerPool pool;
    private final NotificationHub hub;

    public SchedulerStatus startScheduler() {
        scheduler.start();
        return scheduler.status();
    }

    public SchedulerStatus stopScheduler() {
        scheduler.stop();
        return scheduler.status();
    }

    public SchedulerStatus schedulerStatus() {
        return scheduler.status();
    }

    public Map<String, Object> updateSchedulerConfig(Map<String, Object> changes) {
        if (changes == null || changes.isEmpty()) {
            throw new AppException(SyncErrorCode.INVALID_SCHEDULER_CONFIG.withDetail("변경할 설정이 없습니다."));
        }
        try {
            return scheduler.updateConfig(changes);
        } catch (IllegalArgumentException e) {
            throw new AppException(SyncErrorCode.INVALID_SCHEDULER_CONFIG.withDetail(e.getMessage()), e);
        }
    }

    public SyncTriggerResult triggerSync(String source, Integer priority) {
        Map<String, String> jobs = submit(source, priority);
        log.info("[Sync] manual sync submitted source={}, jobs={}", source, jobs);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("source", source);
        data.put("jobs", jobs);
        hub.notifySystemEvent("manual_sync_triggered", data);
        return SyncTriggerResult.submitted(source, jobs, Instant.now());
    }

    /**
     * 선택한 소스의 작업을 제출하고 모두 끝날 때까지 기다린다.
     * 첫 번째 실패 소스의 메시지와 단계를 결과에 담는다.
     */
    public SyncTriggerResult triggerSyncAndWait(String source, Integer priority, Duration timeout)
            throws InterruptedException {
        Instant triggeredAt = Instant.now();
        Map<String, String> jobs = submit(source, priority);
        long deadline = System.nanoTime() + timeout.toNanos();

        Map<String, Object> results = new LinkedHashMap<>();
        String error = null, failedSource = null, phase = null;
        for (Map.Entry<String, String> e : jobs.entrySet()) {
            JobView done = await(e.getValue(), deadline);
            if (done == null) {
                results.put(e.getKey(), "timeout");
                if (error == null) {
                    error = "timed out waiting for job " + e.getValue();
                    failedSource = e.getKey();
                }
                continue;
            }
            if (done.status() == JobStatus.SUCCEEDED) {
                results.put(e.getKey(), done.result());
            } else {
                results.put(e.getKey(), done.status().name().toLowerCase());
                if (error == null) {
                    error = done.errorMessage();
                    failedSource = e.getKey();
                    phase = done.errorPhase();
                }
            }
        }

        String status = error == null ? SyncTriggerResult.SUCCESS : SyncTriggerResult.ERROR;
        log.info("[Sync] manual sync finished source={}, status={}, failedSource={}, phase={}",
                source, status, failedSource, phase);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("source", source);
        data.put("status", status);
        data.put("jobs", jobs);
        hub.notifySystemEvent("manual_sync_triggered", data);
        return new SyncTriggerResult(status, source, jobs, results, error, failedSource, phase, triggeredAt);
    }

    private Map<String, String> submit(String source, Integer priority) {
        List<SyncSource> selected = resolve(source);
        if (selected.size() == SyncSource.values().length) {
            return pool.submitFullSync(priority, MANUAL);
        }
        Map<String, String> jobs = new LinkedHashMap<>();
        for (SyncSource s : selected) {
            String id = pool.submit(JobType.forSource(s), s.key(), MANUAL, priority);
            jobs.put(s.key(), id);
        }
        return jobs;
    }

    private JobView await(String jobId, long deadlineNanos) throws InterruptedException {
        CompletableFuture<JobView> future = pool.completion(jobId).orElse(null);
        if (future == null) return pool.status(jobId).orElse(null);
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return null;
        } catch (ExecutionException e) {
            throw new IllegalStateException("job completion failed jobId=" + jobId, e.getCause());
        }
    }

    static List<SyncSource> resolve(String source) {
        if (source == null || source.isBlank() || ALL.equalsIgnoreCase(source)) {
            return Arrays.asList(SyncSource.values());
        }
        return SyncSource.fromKey(source.toLowerCase())
                .map(List::of)
                .orElseThrow(() -> new AppException(
                        SyncErrorCode.INVALID_SOURCE.withDetail("알 수 없는 동기화 소스입니다: " + source)));
    }
}
