package com.yerin.syncwatch.scheduler;

import com.yerin.syncwatch.config.SyncProperties;
import com.yerin.syncwatch.domain.SyncSource;
import lombok.Getter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 실행 중에 바꿀 수 있는 스케줄러 설정. 시간 값은 초 단위로 주고받는다.
 * 루프는 매 대기마다 값을 다시 읽으므로 변경은 다음 tick 부터 반영된다.
 */
@Getter
public class SchedulerSettings {

    public static final String DWS_POLLING_INTERVAL = "dws_polling_interval";
    public static final String TREASURY_POLLING_INTERVAL = "treasury_polling_interval";
    public static final String CORRELATION_INTERVAL = "correlation_interval";
    public static final String HEALTH_CHECK_INTERVAL = "health_check_interval";
    public static final String MAINTENANCE_INTERVAL = "maintenance_interval";
    public static final String RETRY_ATTEMPTS = "retry_attempts";
    public static final String RETRY_DELAY = "retry_delay";
    public static final String MAX_RETRY_DELAY = "max_retry_delay";

    // 시간 값 상한. 2배 한 값을 밀리초로 바꿔도 넘치지 않는다.
    static final long MAX_SECONDS = Duration.ofDays(30).toSeconds();

    static final Set<String> KEYS = Set.of(DWS_POLLING_INTERVAL, TREASURY_POLLING_INTERVAL, CORRELATION_INTERVAL,
            HEALTH_CHECK_INTERVAL, MAINTENANCE_INTERVAL, RETRY_ATTEMPTS, RETRY_DELAY, MAX_RETRY_DELAY);

    private volatile Duration dwsPollingInterval;
    private volatile Duration treasuryPollingInterval;
    private volatile Duration correlationInterval;
    private volatile Duration healthCheckInterval;
    private volatile Duration maintenanceInterval;
    private volatile int retryAttempts;
    private volatile Duration backoffBase;
    private volatile Duration backoffCap;
    private final int loopJobPriority;

    public SchedulerSettings(SyncProperties.Scheduler p) {
        this.dwsPollingInterval = p.getDwsPollingInterval();
        this.treasuryPollingInterval = p.getTreasuryPollingInterval();
        this.correlationInterval = p.getCorrelationInterval();
        this.healthCheckInterval = p.getHealthCheckInterval();
        this.maintenanceInterval = p.getMaintenanceInterval();
        this.retryAttempts = p.getRetryAttempts();
        this.backoffBase = p.getBackoffBase();
        this.backoffCap = p.getBackoffCap();
        this.loopJobPriority = p.getLoopJobPriority();
    }

    public Duration interval(SyncSource source) {
        return switch (source) {
            case DWS -> dwsPollingInterval;
            case TREASURY -> treasuryPollingInterval;
            case CORRELATION -> correlationInterval;
        };
    }

    /**
     * 모든 키와 값을 먼저 검증하고, 하나라도 틀리면 아무것도 바꾸지 않는다.
     * @throws IllegalArgumentException 모르는 키, 숫자가 아닌 값, 0 이하이거나 상한(30일)을 넘는 값
     */
    public synchronized void update(Map<String, ?> changes) {
        List<String> unknown = changes.keySet().stream().filter(k -> !KEYS.contains(k)).sorted().toList();
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Invalid configuration keys: " + unknown);
        }
        Map<String, Long> parsed = new LinkedHashMap<>();
        changes.forEach((key, value) -> parsed.put(key, positive(key, value)));

        long base = parsed.getOrDefault(RETRY_DELAY, backoffBase.toSeconds());
        long cap = parsed.getOrDefault(MAX_RETRY_DELAY, backoffCap.toSeconds());
        if (base > cap) {
            throw new IllegalArgumentException(RETRY_DELAY + " must not exceed " + MAX_RETRY_DELAY);
        }

        parsed.forEach((key, v) -> {
            switch (key) {
                case DWS_POLLING_INTERVAL -> dwsPollingInterval = Duration.ofSeconds(v);
                case TREASURY_POLLING_INTERVAL -> treasuryPollingInterval = Duration.ofSeconds(v);
                case CORRELATION_INTERVAL -> correlationInterval = Duration.ofSeconds(v);
                case HEALTH_CHECK_INTERVAL -> healthCheckInterval = Duration.ofSeconds(v);
                case MAINTENANCE_INTERVAL -> maintenanceInterval = Duration.ofSeconds(v);
                case RETRY_ATTEMPTS -> retryAttempts = Math.toIntExact(v);
                case RETRY_DELAY -> backoffBase = Duration.ofSeconds(v);
                case MAX_RETRY_DELAY -> backoffCap = Duration.ofSeconds(v);
                default -> throw new IllegalStateException("unhandled key " + key);
            }
        });
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(DWS_POLLING_INTERVAL, dwsPollingInterval.toSeconds());
        out.put(TREASURY_POLLING_INTERVAL, treasuryPollingInterval.toSeconds());
        out.put(CORRELATION_INTERVAL, correlationInterval.toSeconds());
        out.put(HEALTH_CHECK_INTERVAL, healthCheckInterval.toSeconds());
        out.put(MAINTENANCE_INTERVAL, maintenanceInterval.toSeconds());
        out.put(RETRY_ATTEMPTS, retryAttempts);
        out.put(RETRY_DELAY, backoffBase.toSeconds());
        out.put(MAX_RETRY_DELAY, backoffCap.toSeconds());
        return out;
    }

    private static long positive(String key, Object value) {
        long v;
        if (value instanceof Number n) {
            v = n.longValue();
        } else if (value instanceof String s) {
            try {
                v = Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number of seconds", e);
            }
        } else {
            throw new IllegalArgumentException(key + " must be a number of seconds");
        }
        if (v <= 0) throw new IllegalArgumentException(key + " must be positive");
        if (RETRY_ATTEMPTS.equals(key)) {
            if (v > Integer.MAX_VALUE) throw new IllegalArgumentException(key + " is too large");
        } else if (v > MAX_SECONDS) {
            throw new IllegalArgumentException(key + " must not exceed " + MAX_SECONDS + " seconds");
        }
        return v;
    }
}
