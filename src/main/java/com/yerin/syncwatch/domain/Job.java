package com.yerin.syncwatch.domain;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 워커 풀에서 실행되는 작업 한 건.
 * 상태는 앞으로만 이동하고, 재시도는 기존 기록을 바꾸지 않고 새 Job 을 만든다.
 */
@Getter
public class Job {

    private final String id;
    private final JobType type;
    private final String source;
    private final Map<String, Object> params;
    private final int priority;
    private final long sequence;
    private final int retryCount;
    private final int maxRetries;
    private final String retryOf;
    private final Instant createdAt;

    private volatile JobStatus status;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile int progress;
    private volatile String progressMessage;
    private volatile String errorMessage;
    private volatile String errorPhase;
    private volatile Map<String, Object> result;
    private volatile String worker;
    // 이 작업을 재시도해 만든 새 작업 id. 한 번 정해지면 다시 재시도할 수 없다.
    private volatile String retriedAs;

    @Getter(AccessLevel.NONE)
    private final CompletableFuture<JobView> completion = new CompletableFuture<>();

    @Builder
    private Job(String id, JobType type, String source, Map<String, Object> params, int priority,
                long sequence, int retryCount, int maxRetries, String retryOf, Instant createdAt) {
        this.id = id;
        this.type = type;
        this.source = source != null ? source : type.source().key();
        this.params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.priority = priority;
        this.sequence = sequence;
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
        this.retryOf = retryOf;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.status = JobStatus.PENDING;
    }

    public synchronized boolean markRunning(String worker, Instant now) {
        if (!status.canMoveTo(JobStatus.RUNNING)) return false;
        this.status = JobStatus.RUNNING;
        this.worker = worker;
        this.startedAt = now;
        this.progress = 0;
        return true;
    }

    public synchronized boolean markSucceeded(Map<String, Object> result, Instant now) {
        if (!status.canMoveTo(JobStatus.SUCCEEDED)) return false;
        this.status = JobStatus.SUCCEEDED;
        this.result = result;
        this.progress = 100;
        this.completedAt = now;
        completion.complete(view());
        return true;
    }

    public synchronized boolean markFailed(String errorMessage, String errorPhase, Instant now) {
        if (!status.canMoveTo(JobStatus.FAILED)) return false;
        this.status = JobStatus.FAILED;
        this.errorMessage = errorMessage;
        this.errorPhase = errorPhase;
        this.completedAt = now;
        completion.complete(view());
        return true;
    }

    public synchronized boolean markCancelled(String reason, Instant now) {
        if (!status.canMoveTo(JobStatus.CANCELLED)) return false;
        this.status = JobStatus.CANCELLED;
        this.errorMessage = reason;
        this.completedAt = now;
        completion.complete(view());
        return true;
    }

    public synchronized void reportProgress(int percent, String message) {
        if (status != JobStatus.RUNNING) return;
        this.progress = Math.max(this.progress, Math.min(100, Math.max(0, percent)));
        if (message != null) this.progressMessage = message;
    }

    public boolean isCancelled() {
        return status == JobStatus.CANCELLED;
    }

    public boolean canRetry() {
        return status == JobStatus.FAILED && retryCount < maxRetries && retriedAs == null;
    }

    /** 재시도 권한을 한 번만 내준다. 동시에 불려도 하나만 true. */
    public synchronized boolean claimRetry(String newId) {
        if (!canRetry()) return false;
        this.retriedAs = newId;
        return true;
    }

    public Job resubmission(String newId, long sequence, Instant now) {
        return Job.builder()
                .id(newId)
                .type(type)
                .source(source)
                .params(params)
                .priority(priority)
                .sequence(sequence)
                .retryCount(retryCount + 1)
                .maxRetries(maxRetries)
                .retryOf(id)
                .createdAt(now)
                .build();
    }

    public Duration elapsed(Instant now) {
        if (startedAt == null) return Duration.ZERO;
        Instant end = completedAt != null ? completedAt : now;
        return Duration.between(startedAt, end);
    }

    public CompletableFuture<JobView> completion() {
        return completion.copy();
    }

    public JobView view() {
        return new JobView(id, type, source, status, priority, progress, progressMessage,
                createdAt, startedAt, completedAt, errorMessage, errorPhase, result,
                retryCount, maxRetries, retryOf, worker, params);
    }
}
