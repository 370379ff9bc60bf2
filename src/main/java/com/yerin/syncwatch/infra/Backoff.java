package com.yerin.syncwatch.infra;

import java.time.Duration;

/**
 * 연속 실패 k 번 뒤의 대기 시간: base * 2^(k-1), cap 으로 상한.
 * k 가 0 이하(직전 실행 성공)면 base 를 돌려준다.
 */
public final class Backoff {
    private Backoff() {}

    public static Duration delay(int consecutiveErrors, Duration base, Duration cap) {
        if (base.compareTo(cap) >= 0) return cap;
        int exponent = Math.max(0, consecutiveErrors - 1);
        // 2^exponent 가 long 범위를 넘기 전에 cap 에 닿는다
        if (exponent >= 62) return cap;
        long baseMillis = base.toMillis();
        long factor = 1L << exponent;
        if (baseMillis > cap.toMillis() / factor) return cap;
        return Duration.ofMillis(baseMillis * factor);
    }
}
