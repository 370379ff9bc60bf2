package com.yerin.syncwatch.notification;

/**
 * 구독 범위: 전체, 엔티티 타입 전체, 또는 특정 엔티티 하나.
 */
public record Subscription(String scope, String entityId) {

    public static final String ALL = "all";

    public static Subscription of(String scope, String entityId) {
        String s = (scope == null || scope.isBlank()) ? ALL : scope.trim();
        String id = (entityId == null || entityId.isBlank()) ? null : entityId.trim();
        return new Subscription(s, ALL.equalsIgnoreCase(s) ? null : id);
    }

    public boolean isAll() {
        return ALL.equalsIgnoreCase(scope);
    }

    public String key() {
        if (isAll()) return ALL;
        return entityId == null ? scope : scope + ":" + entityId;
    }
}
