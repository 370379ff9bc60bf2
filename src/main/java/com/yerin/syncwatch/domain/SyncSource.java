package com.yerin.syncwatch.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * 주기적으로 동기화되는 데이터 소스.
 * CORRELATION 은 외부 호출 없이 이미 저장된 데이터만 다시 계산한다.
 */
public enum SyncSource {
    DWS("dws", true),
    TREASURY("treasury", true),
    CORRELATION("correlation", false);

    private final String key;
    private final boolean networked;

    SyncSource(String key, boolean networked) {
        this.key = key;
        this.networked = networked;
    }

    public String key() {
        return key;
    }

    public boolean isNetworked() {
        return networked;
    }

    public static Optional<SyncSource> fromKey(String key) {
        if (key == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.key.equalsIgnoreCase(key.trim()))
                .findFirst();
    }
}
