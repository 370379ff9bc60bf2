package com.yerin.syncwatch.application;

import java.util.Map;

public record StoredRecord(String entityType, String externalId, String fingerprint, Map<String, Object> fields) {}
