package com.yerin.syncwatch.infra;

import com.yerin.syncwatch.application.JobContext;
import com.yerin.syncwatch.application.JobHandler;
import com.yerin.syncwatch.application.JobHandlerRegistry;
import com.yerin.syncwatch.application.SyncException;
import com.yerin.syncwatch.config.SyncProperties;
import com.yerin.syncwatch.domain.ChangeEvent;
import com.yerin.syncwatch.domain.Job;
import com.yerin.syncwatch.domain.JobMetricsSnapshot;
import com.yerin.syncwatch.domain.JobStatus;
import com.yerin.syncwatch.domain.JobType;
import com.yerin.syncwatch.domain.JobView;
import com.yerin.syncwatch.domain.SyncwatchMetrics;
import com.yerin.syncwatch.notification.NotificationHub;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 우선순위 큐 + 고정 크기 워커 풀.
 * 우선순위 값이 작을수록 먼저, 같으면 제출 순서대로 꺼낸다.
 * 실패한 작업을 스스로 재시도하지 않는다. 재시도는 retry() 로만 일어난다.
 */
@Slf4j
@Component
public class JobWorkerPool {

    static final Comparator<Job> DISPATCH_ORDER =
            Comparator.comparingInt(Job::getPriority).thenComparingLong(Job::getSequence);

    private final JobHandlerRegistry registry;
    private final NotificationHub hub;
    private final SyncwatchMetrics metrics;
    private final SyncProperties.Worker config;

    private final PriorityBlockingQueue<Job> queue = new PriorityBlockingQueue<>(64, DISPATCH_ORDER);
    // pending + running
    private final Map<String, Job> active = new ConcurrentHashMap<>();
    private final Map<String, Job> completed = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger busyWorkers = new AtomicInteger();

    private volatile boolean running;
    private ExecutorService workers;

    public JobWorkerPool(JobHandlerRegistry registry, NotificationHub hub,
                         SyncwatchMetrics metrics, SyncProperties properties) {
        this.registry = registry;
        this.hub = hub;
        this.metrics = metrics;
        this.config = properties.getWorker();
        metrics.gauge("syncwatch_queue_depth", "pending jobs waiting for a worker", this::queueDepth);
        metrics.gauge("syncwatch_active_workers", "workers currently running a handler", this::activeWorkers);
    }

    @PostConstruct
    public synchronized void start() {
        if (running) return;
        running = true;
        int concurrency = Math.max(1, config.getConcurrency());
        workers = Executors.newFixedThreadPool(concurrency);
        for (int i = 0; i < concurrency; i++) {
            final String worker = WorkerId.worker(i);
            workers.submit(() -> workLoop(worker));
        }
        log.info("[Worker] started {} workers", concurrency);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) return;
        running = false;
        Instant now = Instant.now();
        for (Job job : List.copyOf(active.values())) {
            if (job.markCancelled("worker pool shutdown", now)) {
                queue.remove(job);
                finish(job);
            }
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Worker] workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Worker] stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public String submit(JobType type, String source, Map<String, Object> params, Integer priority) {
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .source(source)
                .params(params)
                .priority(priority != null ? priority : config.getDefaultPriority())
                .sequence(sequence.incrementAndGet())
                .maxRetries(config.getMaxRetries())
                .createdAt(Instant.now())
                .build();
        enqueue(job);
        log.info("[Worker] submitted jobId={}, type={}, priority={}", job.getId(), type.tag(), job.getPriority());
        broadcast(job, "submitted");
        return job.getId();
    }

    /**
     * 모든 소스를 한 번에 동기화한다. correlation 은 앞선 소스 뒤에 돌도록 priority+1 로 제출한다.
     * @return 소스 키별 작업 id (dws, treasury, correlation 순)
     */
    public Map<String, String> submitFullSync(Integer priority, Map<String, Object> params) {
        int base = priority != null ? priority : config.getDefaultPriority();
        Map<String, String> ids = new LinkedHashMap<>();
        for (JobType type : JobType.values()) {
            int p = type == JobType.CORRELATION_ANALYSIS ? base + 1 : base;
            ids.put(type.source().key(), submit(type, type.source().key(), params, p));
        }
        return ids;
    }

    public Optional<JobView> status(String jobId) {
        return find(jobId).map(Job::view);
    }

    public Optional<CompletableFuture<JobView>> completion(String jobId) {
        return find(jobId).map(Job::completion);
    }

    /** 실행 중, 대기(큐 순서), 완료(최근 순) 순으로 돌려준다. */
    public List<JobView> listRecent(int limit) {
        if (limit <= 0) return List.of();
        List<Job> running = new ArrayList<>();
        List<Job> pending = new ArrayList<>();
        for (Job job : active.values()) {
            if (job.getStatus() == JobStatus.RUNNING) running.add(job);
            else if (job.getStatus() == JobStatus.PENDING) pending.add(job);
        }
        running.sort(Comparator.comparing(Job::getStartedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        pending.sort(DISPATCH_ORDER);

        List<Job> done = new ArrayList<>(completed.values());
        done.sort(Comparator.comparing(Job::getCompletedAt, Comparator.nullsLast(Comparator.reverseOrder())));

        List<JobView> out = new ArrayList<>(Math.min(limit, active.size() + done.size()));
        for (List<Job> group : List.of(running, pending, done)) {
            for (Job job : group) {
                if (out.size() >= limit) return out;
                out.add(job.view());
            }
        }
        return out;
    }

    /**
     * 대기/실행 중인 작업만 취소할 수 있다. 실행 중인 핸들러는 끊지 않고,
     * 핸들러가 다음 체크포인트에서 취소를 보거나 끝난 뒤 결과가 버려진다.
     */
    public boolean cancel(String jobId) {
        Job job = active.get(jobId);
        if (job == null) return false;
        if (!job.markCancelled("cancelled by request", Instant.now())) return false;
        queue.remove(job);
        finish(job);
        metrics.incCancelled();
        log.info("[Worker] cancelled jobId={}", jobId);
        broadcast(job, "cancelled");
        return true;
    }

    /** 재시도 한도 안의 FAILED 작업을 새 PENDING 작업으로 다시 제출한다. 같은 작업은 한 번만 재시도된다. */
    public Optional<String> retry(String jobId) {
        // FAILED 가 보인 직후에는 아직 active 에 남아 있을 수 있다
        Job failed = find(jobId).orElse(null);
        String newId = UUID.randomUUID().toString();
        if (failed == null || !failed.claimRetry(newId)) return Optional.empty();

        Job next = failed.resubmission(newId, sequence.incrementAndGet(), Instant.now());
        enqueue(next);
        log.info("[Worker] retried jobId={} as newJobId={}, retryCount={}", jobId, next.getId(), next.getRetryCount());
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("type", next.getType().tag());
        changes.put("retryOf", jobId);
        changes.put("retryCount", next.getRetryCount());
        hub.notifyChange(ChangeEvent.job(next.getId(), "retried", changes));
        return Optional.of(next.getId());
    }

    public JobMetricsSnapshot metrics() {
        long succeeded = 0, failed = 0, cancelled = 0;
        double totalSeconds = 0;
        int timed = 0;
        Instant lastActivity = null;
        for (Job job : completed.values()) {
            switch (job.getStatus()) {
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
                default -> { }
            }
            if (job.getStartedAt() != null && job.getCompletedAt() != null) {
                totalSeconds += job.elapsed(job.getCompletedAt()).toMillis() / 1000.0;
                timed++;
            }
            lastActivity = latest(lastActivity, job.getCompletedAt());
        }
        for (Job job : active.values()) {
            lastActivity = latest(lastActivity, job.getCreatedAt());
        }
        long processed = succeeded + failed + cancelled;
        double successRate = processed == 0 ? 0.0 : round2(succeeded * 100.0 / processed);
        double average = timed == 0 ? 0.0 : round2(totalSeconds / timed);
        return new JobMetricsSnapshot(running, processed, succeeded, failed, cancelled, successRate, average,
                queueDepth(), activeWorkers(), Math.max(1, config.getConcurrency()),
                active.size(), completed.size(), lastActivity, Instant.now());
    }

    /** RUNNING 상태로 timeout 을 넘긴 작업을 취소한다. @return 취소한 수 */
    public int cancelStuck(Instant now, Duration timeout) {
        int cancelled = 0;
        for (Job job : List.copyOf(active.values())) {
            if (job.getStatus() != JobStatus.RUNNING || job.elapsed(now).compareTo(timeout) <= 0) continue;
            if (!job.markCancelled("timed out after " + timeout.toSeconds() + "s", now)) continue;
            finish(job);
            cancelled++;
            metrics.incCancelled();
            log.warn("[Worker] stuck job cancelled jobId={}, type={}, worker={}, elapsed={}s",
                    job.getId(), job.getType().tag(), job.getWorker(), job.elapsed(now).toSeconds());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("jobId", job.getId());
            details.put("type", job.getType().tag());
            details.put("timeoutSeconds", timeout.toSeconds());
            hub.notifySystemError("job_timeout", "job exceeded the execution time limit", details);
            broadcast(job, "cancelled");
        }
        return cancelled;
    }

    /** 보존 기간이 지난 완료 작업을 지우고, 남은 것도 limit 개로 자른다. @return 지운 수 */
    public int evictCompleted(Instant now, Duration retention, int limit) {
        Instant cutoff = now.minus(retention);
        int removed = 0;
        for (Job job : List.copyOf(completed.values())) {
            Instant at = job.getCompletedAt();
            if (at != null && at.isBefore(cutoff) && completed.remove(job.getId(), job)) removed++;
        }
        int overflow = completed.size() - Math.max(0, limit);
        if (overflow > 0) {
            List<Job> oldest = new ArrayList<>(completed.values());
            oldest.sort(Comparator.comparing(Job::getCompletedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
            for (Job job : oldest.subList(0, overflow)) {
                if (completed.remove(job.getId(), job)) removed++;
            }
        }
        if (removed > 0) {
            log.info("[Worker] evicted completed jobs removed={}, retained={}", removed, completed.size());
        }
        return removed;
    }

    public int queueDepth() {
        return queue.size();
    }

    public int activeWorkers() {
        return busyWorkers.get();
    }

    private void workLoop(String worker) {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Job job = queue.poll(config.getPollTimeout().toMillis(), TimeUnit.MILLISECONDS);
                if (job != null) execute(job, worker);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("[Worker] loop error worker={}, err={}", worker, e.toString());
            }
        }
        log.debug("[Worker] exit worker={}", worker);
    }

    void execute(Job job, String worker) throws InterruptedException {
        if (!job.markRunning(worker, Instant.now())) {
            // 큐에서 꺼내기 직전에 취소됨
            finish(job);
            return;
        }
        busyWorkers.incrementAndGet();
        log.info("[Worker] start jobId={}, type={}, worker={}", job.getId(), job.getType().tag(), worker);
        long start = System.nanoTime();
        try {
            JobHandler handler = registry.get(job.getType());
            if (handler == null) throw new IllegalStateException("No handler for type=" + job.getType().tag());
            Map<String, Object> result = handler.handle(new JobContext(job));
            if (job.markSucceeded(result, Instant.now())) {
                metrics.incSucceeded();
                log.info("[Worker] succeeded jobId={}, elapsed={}ms", job.getId(), job.elapsed(Instant.now()).toMillis());
                broadcast(job, "completed");
            } else {
                log.info("[Worker] result discarded jobId={}, status={}", job.getId(), job.getStatus());
            }
        } catch (InterruptedException ie) {
            if (job.markCancelled("worker interrupted", Instant.now())) {
                metrics.incCancelled();
                broadcast(job, "cancelled");
            }
            throw ie;
        } catch (Exception e) {
            fail(job, e);
        } finally {
            metrics.handlerTimer(job.getType()).record(Duration.ofNanos(System.nanoTime() - start));
            busyWorkers.decrementAndGet();
            finish(job);
        }
    }

    private void fail(Job job, Exception e) {
        String message = Objects.requireNonNullElse(e.getMessage(), e.getClass().getSimpleName());
        String phase = e instanceof SyncException se ? se.getPhase().label() : null;
        if (!job.markFailed(message, phase, Instant.now())) {
            log.info("[Worker] failure after cancel ignored jobId={}, err={}", job.getId(), e.toString());
            return;
        }
        metrics.incFailed();
        log.error("[Worker] failed jobId={}, type={}, phase={}, err={}", job.getId(), job.getType().tag(), phase, e.toString());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("jobId", job.getId());
        details.put("type", job.getType().tag());
        details.put("source", job.getSource());
        if (phase != null) details.put("phase", phase);
        hub.notifySystemError("job_failed", message, details);
        broadcast(job, "completed");
    }

    private void enqueue(Job job) {
        active.put(job.getId(), job);
        queue.offer(job);
        metrics.incSubmitted();
    }

    private void finish(Job job) {
        completed.put(job.getId(), job);
        active.remove(job.getId(), job);
    }

    private Optional<Job> find(String jobId) {
        if (jobId == null) return Optional.empty();
        Job job = active.get(jobId);
        return Optional.ofNullable(job != null ? job : completed.get(jobId));
    }

    private void broadcast(Job job, String changeType) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("type", job.getType().tag());
        changes.put("source", job.getSource());
        changes.put("status", job.getStatus().name().toLowerCase());
        changes.put("priority", job.getPriority());
        if (job.getErrorMessage() != null) changes.put("error", job.getErrorMessage());
        hub.notifyChange(ChangeEvent.job(job.getId(), changeType, changes));
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
