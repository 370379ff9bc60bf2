package com.yerin.syncwatch.domain;

import java.util.Map;

public record ChangeSet(Map<String, Object> changedFields, Map<String, Object> oldValues) {

    public boolean isEmpty() {
        return changedFields.isEmpty();
    }
}
