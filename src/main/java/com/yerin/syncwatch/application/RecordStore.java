package com.yerin.syncwatch.application;

import com.yerin.syncwatch.domain.ChangeEvent;
import com.yerin.syncwatch.domain.SourceRecord;

import java.util.Map;
import java.util.Optional;

/**
 * 저장소 경계. 코어는 변경이 감지된 뒤에만 이 인터페이스를 호출한다.
 */
public interface RecordStore {
    Optional<StoredRecord> findExisting(String entityType, String externalId);

    void upsert(SourceRecord record, String fingerprint, String source);

    void appendAuditLog(ChangeEvent entry);

    Map<String, Long> countByEntityType();
}
