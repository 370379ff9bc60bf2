package com.yerin.syncwatch.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.syncwatch.application.RecordStore;
import com.yerin.syncwatch.application.StoredRecord;
import com.yerin.syncwatch.domain.ChangeEvent;
import com.yerin.syncwatch.domain.DataChangeLog;
import com.yerin.syncwatch.domain.SourceRecord;
import com.yerin.syncwatch.domain.TrackedRecord;
import com.yerin.syncwatch.repository.DataChangeLogRepository;
import com.yerin.syncwatch.repository.TrackedRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaRecordStore implements RecordStore {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};

    private final TrackedRecordRepository recordRepository;
    private final DataChangeLogRepository changeLogRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredRecord> findExisting(String entityType, String externalId) {
        return recordRepository.findByEntityTypeAndExternalId(entityType, externalId)
                .map(r -> new StoredRecord(r.getEntityType(), r.getExternalId(), r.getFingerprint(),
                        readFields(r.getFieldsJson())));
    }

    @Override
    @Transactional
    public void upsert(SourceRecord record, String fingerprint, String source) {
        TrackedRecord row = recordRepository
                .findByEntityTypeAndExternalId(record.entityType(), record.externalId())
                .orElseGet(() -> TrackedRecord.builder()
                        .entityType(record.entityType())
                        .externalId(record.externalId())
                        .build());
        row.setSource(source);
        row.setFingerprint(fingerprint);
        row.setFieldsJson(writeJson(record.fields()));
        recordRepository.save(row);
    }

    @Override
    @Transactional
    public void appendAuditLog(ChangeEvent entry) {
        changeLogRepository.save(DataChangeLog.builder()
                .entityType(entry.entityType())
                .entityId(entry.entityId())
                .changeType(entry.changeType())
                .fieldChanges(writeJson(entry.changes()))
                .oldValues(entry.oldValues() == null ? null : writeJson(entry.oldValues()))
                .source(entry.source())
                .ts(entry.timestamp())
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Long> countByEntityType() {
        List<Object[]> rows = recordRepository.countGroupedByEntityType();
        Map<String, Long> out = new TreeMap<>();
        for (Object[] row : rows) {
            out.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        return out;
    }

    private Map<String, Object> readFields(String json) {
        try {
            return objectMapper.readValue(json, FIELDS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stored fields are not valid JSON", e);
        }
    }

    private String writeJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("record fields are not serializable", e);
        }
    }
}
