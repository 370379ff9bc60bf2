package com.yerin.syncwatch.domain;

import java.time.Instant;

/**
 * 폴링 루프 하나의 상태. 소유 루프만 성공/실패를 기록하고,
 * 헬스 모니터는 STALE 표시만 한다.
 */
public class SourceHealth {

    private final String loop;
    private final Instant since;

    private LoopStatus status = LoopStatus.STOPPED;
    private Instant lastSuccess;
    private Instant lastAttempt;
    private int consecutiveErrors;
    private long totalErrors;
    private String lastError;

    public SourceHealth(String loop, Instant since) {
        this.loop = loop;
        this.since = since;
    }

    public synchronized void markRunning(Instant now) {
        this.status = LoopStatus.RUNNING;
        this.lastAttempt = now;
    }

    public synchronized void recordSuccess(Instant now) {
        this.status = LoopStatus.HEALTHY;
        this.lastSuccess = now;
        this.consecutiveErrors = 0;
        this.lastError = null;
    }

    /** @return 이번 실패를 포함한 연속 실패 횟수 */
    public synchronized int recordFailure(String error) {
        this.status = LoopStatus.ERROR;
        this.consecutiveErrors++;
        this.totalErrors++;
        this.lastError = error;
        return consecutiveErrors;
    }

    public synchronized void markStale() {
        if (status != LoopStatus.STOPPED) this.status = LoopStatus.STALE;
    }

    public synchronized void markStopped() {
        this.status = LoopStatus.STOPPED;
    }

    /**
     * 마지막 성공이 cutoff 보다 오래됐으면 연속 실패 횟수를 0 으로 되돌린다. 한 번도 성공하지 않은 루프는 그대로 둔다.
     * @return 되돌렸으면 true
     */
    public synchronized boolean resetErrorsIfIdleSince(Instant cutoff) {
        if (lastSuccess == null || !lastSuccess.isBefore(cutoff) || consecutiveErrors == 0) return false;
        this.consecutiveErrors = 0;
        return true;
    }

    public synchronized int consecutiveErrors() {
        return consecutiveErrors;
    }

    /** 마지막 성공 시각, 한 번도 성공하지 못했다면 루프 시작 시각 */
    public synchronized Instant lastProgressMark() {
        return lastSuccess != null ? lastSuccess : since;
    }

    public synchronized SourceHealthView view() {
        return new SourceHealthView(loop, status, lastSuccess, lastAttempt, consecutiveErrors,
                totalErrors, lastError, since);
    }
}
