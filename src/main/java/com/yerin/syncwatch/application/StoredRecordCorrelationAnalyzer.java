package com.yerin.syncwatch.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 저장된 레코드를 엔티티 타입별로 다시 집계한다.
 * 점수 계산 같은 도메인 분석은 이 인터페이스 뒤에 붙인다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoredRecordCorrelationAnalyzer implements CorrelationAnalyzer {

    private final RecordStore recordStore;

    @Override
    public Map<String, Object> analyze(ProgressListener progress) {
        progress.onProgress(30, "Loading persisted records");
        Map<String, Long> counts = recordStore.countByEntityType();

        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalRecords", total);
        summary.put("entityTypes", counts.size());
        summary.put("recordsByEntityType", counts);
        summary.put("analyzedAt", Instant.now().toString());

        log.info("[Correlation] analyzed totalRecords={}, entityTypes={}", total, counts.size());
        progress.onProgress(80, "Correlation analysis computed");
        return summary;
    }
}
