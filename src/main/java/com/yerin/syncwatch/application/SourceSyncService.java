package com.yerin.syncwatch.application;

import com.yerin.syncwatch.domain.ChangeDetector;
import com.yerin.syncwatch.domain.ChangeEvent;
import com.yerin.syncwatch.domain.ChangeSet;
import com.yerin.syncwatch.domain.SourceRecord;
import com.yerin.syncwatch.domain.SyncSource;
import com.yerin.syncwatch.domain.SyncwatchMetrics;
import com.yerin.syncwatch.notification.NotificationHub;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * fetch → 변경 감지 → 저장 → 알림 파이프라인.
 * 같은 소스의 동기화는 루프에서 왔든 수동 트리거에서 왔든 한 번에 하나만 돈다.
 */
@Slf4j
@Service
public class SourceSyncService {

    public static final String CORRELATION_ENTITY = "correlation_analysis";

    private final Map<SyncSource, SourceClient> clients = new EnumMap<>(SyncSource.class);
    private final Map<SyncSource, ReentrantLock> locks = new EnumMap<>(SyncSource.class);
    private final Map<SyncSource, String> lastPayloadFingerprints = new ConcurrentHashMap<>();

    private final RecordStore recordStore;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final NotificationHub notificationHub;
    private final SyncwatchMetrics metrics;

    public SourceSyncService(List<SourceClient> sourceClients,
                             RecordStore recordStore,
                             CorrelationAnalyzer correlationAnalyzer,
                             NotificationHub notificationHub,
                             SyncwatchMetrics metrics) {
        for (SourceClient c : sourceClients) {
            if (!c.source().isNetworked()) {
                throw new IllegalStateException("source client registered for local source=" + c.source().key());
            }
            clients.put(c.source(), c);
        }
        for (SyncSource s : SyncSource.values()) {
            locks.put(s, new ReentrantLock(true));
        }
        this.recordStore = recordStore;
        this.correlationAnalyzer = correlationAnalyzer;
        this.notificationHub = notificationHub;
        this.metrics = metrics;
    }

    public SyncResult sync(SyncSource source, ProgressListener progress) throws InterruptedException {
        ReentrantLock lock = locks.get(source);
        if (lock.isLocked()) {
            log.info("[Sync] waiting for in-flight sync source={}", source.key());
        }
        lock.lockInterruptibly();
        long start = System.nanoTime();
        try {
            return source.isNetworked() ? pipeline(source, progress) : correlate(progress);
        } finally {
            metrics.syncTimer(source).record(Duration.ofNanos(System.nanoTime() - start));
            lock.unlock();
        }
    }

    private SyncResult pipeline(SyncSource source, ProgressListener progress) {
        SourceClient client = clients.get(source);
        if (client == null) {
            throw new SyncException(source, SyncPhase.FETCH, "no source client configured", null);
        }

        progress.onProgress(10, "Fetching " + source.key() + " data");
        List<SourceRecord> records;
        try {
            records = client.fetch(progress);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException(source, SyncPhase.FETCH, "interrupted", e);
        } catch (Exception e) {
            throw new SyncException(source, SyncPhase.FETCH, String.valueOf(e.getMessage()), e);
        }
        if (records == null) records = List.of();

        progress.onProgress(40, "Calculating content hashes for change detection");
        String payloadFingerprint = payloadFingerprint(source, records);
        if (payloadFingerprint.equals(lastPayloadFingerprints.get(source))) {
            int skipped = (int) records.stream().filter(r -> r == null || !r.isWellFormed()).count();
            log.info("[Sync] no changes detected source={}, records={}", source.key(), records.size());
            progress.onProgress(95, "No changes detected");
            return new SyncResult(source, records.size(), 0, 0, records.size() - skipped, skipped,
                    true, Map.of(), Instant.now());
        }

        progress.onProgress(60, "Processing data changes");
        List<ChangeEvent> events = new ArrayList<>();
        int created = 0, updated = 0, unchanged = 0, skipped = 0;
        boolean interrupted = false;
        try {
            for (SourceRecord record : records) {
                if (progress.isCancelled()) {
                    log.info("[Sync] cancellation observed source={}, processed={}", source.key(),
                            created + updated + unchanged + skipped);
                    interrupted = true;
                    break;
                }
                if (record == null || !record.isWellFormed()) {
                    skipped++;
                    log.warn("[Sync] skip malformed record source={}, record={}", source.key(), record);
                    continue;
                }

                Optional<StoredRecord> existing = findExisting(source, record);
                String fingerprint;
                ChangeSet changeSet;
                try {
                    fingerprint = ChangeDetector.fingerprint(record.fields());
                    if (existing.isPresent() && fingerprint.equals(existing.get().fingerprint())) {
                        unchanged++;
                        continue;
                    }
                    changeSet = ChangeDetector.diff(existing.map(StoredRecord::fields).orElse(Map.of()),
                            record.fields());
                } catch (RuntimeException e) {
                    throw new SyncException(source, SyncPhase.DETECT, String.valueOf(e.getMessage()), e);
                }

                ChangeEvent event;
                if (existing.isEmpty()) {
                    event = new ChangeEvent(record.entityType(), record.externalId(), ChangeEvent.CREATED,
                            record.fields(), null, source.key(), Instant.now());
                    created++;
                } else if (changeSet.isEmpty()) {
                    // 지문만 달라진 경우(정규화 규칙 변경 등): 지문만 갱신하고 알리지 않는다
                    persist(source, record, fingerprint, null);
                    unchanged++;
                    continue;
                } else {
                    event = new ChangeEvent(record.entityType(), record.externalId(), ChangeEvent.UPDATED,
                            changeSet.changedFields(), changeSet.oldValues(), source.key(), Instant.now());
                    updated++;
                }
                persist(source, record, fingerprint, event);
                events.add(event);
            }
        } finally {
            // 저장에 성공한 변경은 중간에 실패했더라도 알린다
            progress.onProgress(85, "Sending real-time notifications");
            events.forEach(notificationHub::notifyChange);
        }

        if (!interrupted) {
            lastPayloadFingerprints.put(source, payloadFingerprint);
        }
        log.info("[Sync] done source={}, fetched={}, created={}, updated={}, unchanged={}, skipped={}",
                source.key(), records.size(), created, updated, unchanged, skipped);
        progress.onProgress(95, source.key() + " data polling completed");
        return new SyncResult(source, records.size(), created, updated, unchanged, skipped,
                false, Map.of(), Instant.now());
    }

    private SyncResult correlate(ProgressListener progress) {
        progress.onProgress(10, "Running correlation analysis");
        Map<String, Object> summary;
        try {
            summary = correlationAnalyzer.analyze(progress);
        } catch (RuntimeException e) {
            throw new SyncException(SyncSource.CORRELATION, SyncPhase.ANALYZE, String.valueOf(e.getMessage()), e);
        }
        progress.onProgress(90, "Sending correlation update");
        notificationHub.notifyChange(ChangeEvent.of(CORRELATION_ENTITY, "summary", "bulk_analysis",
                summary, SyncSource.CORRELATION.key()));
        return new SyncResult(SyncSource.CORRELATION, 0, 0, 0, 0, 0, false, summary, Instant.now());
    }

    private Optional<StoredRecord> findExisting(SyncSource source, SourceRecord record) {
        try {
            return recordStore.findExisting(record.entityType(), record.externalId());
        } catch (RuntimeException e) {
            throw new SyncException(source, SyncPhase.PERSIST, String.valueOf(e.getMessage()), e);
        }
    }

    private void persist(SyncSource source, SourceRecord record, String fingerprint, ChangeEvent event) {
        try {
            recordStore.upsert(record, fingerprint, source.key());
            if (event != null) recordStore.appendAuditLog(event);
        } catch (RuntimeException e) {
            throw new SyncException(source, SyncPhase.PERSIST, String.valueOf(e.getMessage()), e);
        }
    }

    private static String payloadFingerprint(SyncSource source, List<SourceRecord> records) {
        List<Object> rows = new ArrayList<>(records.size());
        for (SourceRecord r : records) {
            if (r == null) {
                rows.add(null);
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("entityType", r.entityType());
            row.put("externalId", r.externalId());
            row.put("fields", r.fields());
            rows.add(row);
        }
        return ChangeDetector.fingerprint(Map.of("source", source.key(), "records", rows));
    }
}
