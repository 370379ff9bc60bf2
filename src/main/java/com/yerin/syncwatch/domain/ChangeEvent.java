package com.yerin.syncwatch.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * 구독자에게 전달되는 변경 이벤트. 저장소의 원본 데이터가 아니라 파생 값이다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChangeEvent(
        String entityType,
        String entityId,
        String changeType,
        Map<String, Object> changes,
        Map<String, Object> oldValues,
        String source,
        Instant timestamp
) {
    public static final String CREATED = "created";
    public static final String UPDATED = "updated";

    public static final String JOB_ENTITY = "etl_job";

    public ChangeEvent {
        changes = changes == null ? Map.of() : changes;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ChangeEvent of(String entityType, String entityId, String changeType,
                                 Map<String, Object> changes, String source) {
        return new ChangeEvent(entityType, entityId, changeType, changes, null, source, Instant.now());
    }

    public static ChangeEvent job(String jobId, String changeType, Map<String, Object> changes) {
        return new ChangeEvent(JOB_ENTITY, jobId, changeType, changes, null, "job_pool", Instant.now());
    }

    public String subscriptionKey() {
        return entityType + ":" + entityId;
    }
}
