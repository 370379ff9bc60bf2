package com.yerin.syncwatch.scheduler;

import com.yerin.syncwatch.config.SyncProperties;
import com.yerin.syncwatch.domain.JobStatus;
import com.yerin.syncwatch.domain.JobType;
import com.yerin.syncwatch.domain.JobView;
import com.yerin.syncwatch.domain.SourceHealth;
import com.yerin.syncwatch.domain.SourceHealthView;
import com.yerin.syncwatch.domain.SyncSource;
import com.yerin.syncwatch.infra.Backoff;
import com.yerin.syncwatch.infra.JobWorkerPool;
import com.yerin.syncwatch.notification.NotificationHub;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 소스마다 독립된 폴링 루프와 헬스 모니터, 유지보수 루프를 돌린다.
 * 한 루프의 실패는 그 루프의 상태와 대기 시간에만 영향을 준다.
 */
@Slf4j
@Component
public class SyncScheduler {

    public static final String HEALTH_MONITOR = "health_monitor";
    public static final String MAINTENANCE = "maintenance";
    static final Duration ERROR_RESET_AFTER = Duration.ofHours(2);

    private final JobWorkerPool pool;
    private final NotificationHub hub;
    private final SchedulerSettings settings;
    private final boolean autoStart;

    private final Map<SyncSource, SourceLoop> sourceLoops = new ConcurrentHashMap<>();
    private final Map<String, Future<?>> serviceLoops = new ConcurrentHashMap<>();

    private volatile boolean running;
    private volatile Instant startedAt;
    private ExecutorService loopExecutor;

    private record SourceLoop(Future<?> task, SourceHealth health) {}

    public SyncScheduler(JobWorkerPool pool, NotificationHub hub, SyncProperties properties) {
        this.pool = pool;
        this.hub = hub;
        this.settings = new SchedulerSettings(properties.getScheduler());
        this.autoStart = properties.getScheduler().isAutoStart();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (autoStart) start();
    }

    public synchronized boolean start() {
        if (running) {
            log.warn("[Scheduler] already running");
            return false;
        }
        running = true;
        startedAt = Instant.now();
        loopExecutor = Executors.newCachedThreadPool();
        for (SyncSource source : SyncSource.values()) {
            startSourceLoop(source, startedAt);
        }
        serviceLoops.put(HEALTH_MONITOR, loopExecutor.submit(
                () -> serviceLoop(HEALTH_MONITOR, true, settings::getHealthCheckInterval, this::checkHealth)));
        serviceLoops.put(MAINTENANCE, loopExecutor.submit(
                () -> serviceLoop(MAINTENANCE, false, settings::getMaintenanceInterval, this::runMaintenance)));

        List<String> loops = activeLoops();
        log.info("[Scheduler] started loops={}", loops);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("timestamp", startedAt.toString());
        data.put("tasks", loops);
        hub.notifySystemEvent("scheduler_started", data);
        return true;
    }

    @PreDestroy
    public synchronized boolean stop() {
        if (!running) return false;
        running = false;
        sourceLoops.values().forEach(loop -> {
            loop.task().cancel(true);
            loop.health().markStopped();
        });
        serviceLoops.values().forEach(task -> task.cancel(true));
        loopExecutor.shutdownNow();
        try {
            if (!loopExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Scheduler] loops did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        sourceLoops.clear();
        serviceLoops.clear();
        log.info("[Scheduler] stopped");
        hub.notifySystemEvent("scheduler_stopped", Map.of("timestamp", Instant.now().toString()));
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    public SchedulerSettings settings() {
        return settings;
    }

    public SchedulerStatus status() {
        Instant now = Instant.now();
        Instant since = startedAt;
        boolean on = running;

        Map<String, SourceHealthView> health = new LinkedHashMap<>();
        Map<String, Instant> nextRuns = new LinkedHashMap<>();
        Map<String, Integer> errorCounts = new LinkedHashMap<>();
        long totalErrors = 0;
        for (SyncSource source : SyncSource.values()) {
            SourceLoop loop = sourceLoops.get(source);
            SourceHealthView view = loop != null
                    ? loop.health().view()
                    : new SourceHealth(source.key(), null).view();
            health.put(source.key(), view);
            errorCounts.put(source.key(), view.consecutiveErrors());
            totalErrors += view.totalErrors();
            if (view.lastSuccess() != null) {
                nextRuns.put(source.key(), view.lastSuccess().plus(settings.interval(source)));
            }
        }
        long uptime = on && since != null ? Duration.between(since, now).toSeconds() : 0;
        return new SchedulerStatus(on, on ? since : null, uptime, health, nextRuns, errorCounts, totalErrors,
                activeLoops(), settings.toMap(), now);
    }

    /** @throws IllegalArgumentException 설정 키나 값이 잘못된 경우 */
    public Map<String, Object> updateConfig(Map<String, ?> changes) {
        settings.update(changes);
        log.info("[Scheduler] config updated changes={}", changes);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("newConfig", changes);
        data.put("timestamp", Instant.now().toString());
        hub.notifySystemEvent("scheduler_config_updated", data);
        return settings.toMap();
    }

    /**
     * 마지막 성공(한 번도 없으면 루프 시작) 이후 주기의 두 배가 지난 루프를 STALE 로 표시하고
     * 상태 요약을 모든 연결에 보낸다.
     */
    public void checkHealth(Instant now) {
        for (Map.Entry<SyncSource, SourceLoop> e : sourceLoops.entrySet()) {
            SyncSource source = e.getKey();
            SourceLoop loop = e.getValue();
            if (loop.task().isDone()) {
                log.warn("[Scheduler] loop task is not alive loop={}", source.key());
            }
            Duration limit = settings.interval(source).multipliedBy(2);
            Duration quiet = Duration.between(loop.health().lastProgressMark(), now);
            if (quiet.compareTo(limit) > 0) {
                loop.health().markStale();
                log.warn("[Scheduler] loop is stale loop={}, sinceLastSuccess={}s", source.key(), quiet.toSeconds());
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        sourceLoops.forEach((source, loop) -> data.put(source.key(), loop.health().view()));
        Instant since = startedAt;
        data.put("uptimeSeconds", since == null ? 0 : Duration.between(since, now).toSeconds());
        data.put("timestamp", now.toString());
        hub.notifySystemEvent("scheduler_health_update", data);
    }

    /**
     * 2시간 넘게 성공이 없던 루프의 연속 실패 횟수를 먼저 비우고,
     * 그 뒤에도 retry_attempts 를 넘었거나 태스크가 죽은 소스 루프를 새 카운터로 다시 띄운다.
     * @return 재시작한 루프 수
     */
    public int runMaintenance(Instant now) {
        int restarted = 0;
        Instant idleCutoff = now.minus(ERROR_RESET_AFTER);
        for (SyncSource source : SyncSource.values()) {
            SourceLoop loop = sourceLoops.get(source);
            if (loop == null) continue;
            if (loop.health().resetErrorsIfIdleSince(idleCutoff)) {
                log.info("[Scheduler] error count reset loop={}, idle over {}h", source.key(), ERROR_RESET_AFTER.toHours());
            }
            int errors = loop.health().consecutiveErrors();
            boolean dead = loop.task().isDone();
            if (dead || errors > settings.getRetryAttempts()) {
                log.warn("[Scheduler] restarting loop={}, consecutiveErrors={}, dead={}", source.key(), errors, dead);
                if (restart(source, now)) restarted++;
            }
        }
        log.info("[Scheduler] maintenance done restarted={}", restarted);
        return restarted;
    }

    private synchronized boolean restart(SyncSource source, Instant now) {
        if (!running) return false;
        SourceLoop old = sourceLoops.get(source);
        if (old != null) old.task().cancel(true);
        startSourceLoop(source, now);
        log.info("[Scheduler] restarted loop={}", source.key());
        return true;
    }

    private void startSourceLoop(SyncSource source, Instant now) {
        SourceHealth health = new SourceHealth(source.key(), now);
        health.markRunning(now);
        Future<?> task = loopExecutor.submit(() -> sourceLoop(source, health));
        sourceLoops.put(source, new SourceLoop(task, health));
    }

    private void sourceLoop(SyncSource source, SourceHealth health) {
        log.info("[Scheduler] loop started loop={}", source.key());
        while (running && !Thread.currentThread().isInterrupted()) {
            health.markRunning(Instant.now());
            Duration wait;
            try {
                JobView job = runOnce(source);
                if (job.status() == JobStatus.SUCCEEDED) {
                    health.recordSuccess(Instant.now());
                    wait = settings.interval(source);
                    log.info("[Scheduler] sync ok loop={}, jobId={}, next in {}s", source.key(), job.id(), wait.toSeconds());
                } else {
                    wait = onFailure(source, health, describe(job), job.errorPhase());
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                wait = onFailure(source, health, e.toString(), null);
            }

            try {
                TimeUnit.MILLISECONDS.sleep(Math.max(1, wait.toMillis()));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Scheduler] loop exited loop={}", source.key());
    }

    private JobView runOnce(SyncSource source) throws InterruptedException {
        String jobId = pool.submit(JobType.forSource(source), source.key(),
                Map.of("trigger", "scheduled"), settings.getLoopJobPriority());
        CompletableFuture<JobView> done = pool.completion(jobId)
                .orElseThrow(() -> new IllegalStateException("submitted job vanished jobId=" + jobId));
        try {
            return done.get();
        } catch (InterruptedException ie) {
            pool.cancel(jobId);
            throw ie;
        } catch (ExecutionException e) {
            throw new IllegalStateException("job completion failed jobId=" + jobId, e.getCause());
        }
    }

    private Duration onFailure(SyncSource source, SourceHealth health, String error, String phase) {
        int consecutive = health.recordFailure(error);
        Duration wait = Backoff.delay(consecutive, settings.getBackoffBase(), settings.getBackoffCap());
        log.error("[Scheduler] sync failed loop={}, consecutiveErrors={}, retryIn={}s, err={}",
                source.key(), consecutive, wait.toSeconds(), error);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", source.key());
        if (phase != null) details.put("phase", phase);
        details.put("consecutiveErrors", consecutive);
        details.put("retryInSeconds", wait.toSeconds());
        hub.notifySystemError("sync_failed", error, details);
        return wait;
    }

    private void serviceLoop(String name, boolean runFirst, Supplier<Duration> interval, Consumer<Instant> body) {
        boolean first = true;
        while (running && !Thread.currentThread().isInterrupted()) {
            if (!first || !runFirst) {
                try {
                    TimeUnit.MILLISECONDS.sleep(Math.max(1, interval.get().toMillis()));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            first = false;
            if (!running) break;
            try {
                body.accept(Instant.now());
            } catch (RuntimeException e) {
                log.error("[Scheduler] {} tick failed err={}", name, e.toString());
            }
        }
    }

    private List<String> activeLoops() {
        List<String> out = new ArrayList<>();
        Map<SyncSource, SourceLoop> ordered = new EnumMap<>(SyncSource.class);
        ordered.putAll(sourceLoops);
        ordered.forEach((source, loop) -> {
            if (!loop.task().isDone()) out.add(source.key());
        });
        serviceLoops.forEach((name, task) -> {
            if (!task.isDone()) out.add(name);
        });
        return out;
    }

    private static String describe(JobView job) {
        String message = Objects.requireNonNullElse(job.errorMessage(), "no error message");
        return "job " + job.status().name().toLowerCase() + ": " + message;
    }
}
