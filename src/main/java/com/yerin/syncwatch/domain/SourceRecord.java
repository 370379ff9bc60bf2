package com.yerin.syncwatch.domain;

import java.util.Map;

/**
 * 소스 클라이언트가 돌려주는 구조화된 레코드.
 */
public record SourceRecord(String entityType, String externalId, Map<String, Object> fields) {

    public boolean isWellFormed() {
        return entityType != null && !entityType.isBlank()
                && externalId != null && !externalId.isBlank()
                && fields != null;
    }
}
