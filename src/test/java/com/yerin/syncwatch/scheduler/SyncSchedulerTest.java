package com.yerin.syncwatch.scheduler;

import com.yerin.syncwatch.config.SyncProperties;
import com.yerin.syncwatch.domain.JobStatus;
import com.yerin.syncwatch.domain.JobType;
import com.yerin.syncwatch.domain.JobView;
import com.yerin.syncwatch.domain.LoopStatus;
import com.yerin.syncwatch.infra.JobWorkerPool;
import com.yerin.syncwatch.notification.NotificationHub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("동기화 스케줄러 루프 테스트")
class SyncSchedulerTest {

    private final JobWorkerPool pool = mock(JobWorkerPool.class);
    private final NotificationHub hub = mock(NotificationHub.class);
    private final AtomicReference<JobStatus> outcome = new AtomicReference<>(JobStatus.SUCCEEDED);
    private final SyncProperties properties = new SyncProperties();

    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        SyncProperties.Scheduler s = properties.getScheduler();
        s.setDwsPollingInterval(Duration.ofMillis(20));
        s.setTreasuryPollingInterval(Duration.ofMillis(20));
        s.setCorrelationInterval(Duration.ofMillis(20));
        s.setHealthCheckInterval(Duration.ofHours(1));
        s.setMaintenanceInterval(Duration.ofHours(1));
        s.setBackoffBase(Duration.ofMillis(10));
        s.setBackoffCap(Duration.ofMillis(40));
        s.setRetryAttempts(2);

        when(pool.submit(any(JobType.class), anyString(), anyMap(), any()))
                .thenAnswer(inv -> UUID.randomUUID().toString());
        when(pool.completion(anyString())).thenAnswer(inv ->
                Optional.of(CompletableFuture.completedFuture(view(inv.getArgument(0), outcome.get()))));
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) scheduler.stop();
    }

    @Test
    @DisplayName("start/stop 은 멱등이고 시작/중지 이벤트를 한 번씩만 보낸다")
    void start_and_stop_are_idempotent() {
        scheduler = new SyncScheduler(pool, hub, properties);

        assertThat(scheduler.start()).isTrue();
        assertThat(scheduler.start()).isFalse();
        assertThat(scheduler.isRunning()).isTrue();
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() ->
                assertThat(scheduler.status().activeLoops())
                        .contains("dws", "treasury", "correlation", SyncScheduler.HEALTH_MONITOR, SyncScheduler.MAINTENANCE));

        assertThat(scheduler.stop()).isTrue();
        assertThat(scheduler.stop()).isFalse();
        assertThat(scheduler.status().running()).isFalse();
        assertThat(scheduler.status().activeLoops()).isEmpty();
        verify(hub, times(1)).notifySystemEvent(eq("scheduler_started"), anyMap());
        verify(hub, times(1)).notifySystemEvent(eq("scheduler_stopped"), anyMap());
    }

    @Test
    @DisplayName("성공한 루프는 lastSuccess 와 다음 실행 시각을 채우고, 예약 트리거로 잡을 낸다")
    void successful_loop_updates_health() {
        scheduler = new SyncScheduler(pool, hub, properties);

        scheduler.start();

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
            SchedulerStatus status = scheduler.status();
            assertThat(status.health().get("dws").lastSuccess()).isNotNull();
            assertThat(status.nextRuns()).containsKey("dws");
            assertThat(status.errorCounts()).containsEntry("dws", 0);
        });
        verify(pool, atLeastOnce()).submit(eq(JobType.DWS_SYNC), eq("dws"), eq(Map.of("trigger", "scheduled")), eq(5));
    }

    @Test
    @DisplayName("실패가 이어지면 연속 실패 수가 늘고 sync_failed 오류를 보낸다. 성공하면 0 으로 돌아온다")
    void failures_back_off_and_recover() {
        // given
        outcome.set(JobStatus.FAILED);
        scheduler = new SyncScheduler(pool, hub, properties);

        // when
        scheduler.start();

        // then
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() ->
                assertThat(scheduler.status().errorCounts().get("treasury")).isGreaterThanOrEqualTo(2));
        assertThat(scheduler.status().health().get("treasury").lastError()).contains("job failed");
        verify(hub, atLeast(2)).notifySystemError(eq("sync_failed"), anyString(),
                argThat(d -> "treasury".equals(d.get("source")) && d.containsKey("retryInSeconds")));

        outcome.set(JobStatus.SUCCEEDED);
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() -> {
            SchedulerStatus status = scheduler.status();
            assertThat(status.errorCounts().get("treasury")).isZero();
            assertThat(status.health().get("treasury").status()).isIn(LoopStatus.HEALTHY, LoopStatus.RUNNING);
            assertThat(status.health().get("treasury").totalErrors()).isGreaterThanOrEqualTo(2);
        });
    }

    @Test
    @DisplayName("한 소스의 실패는 다른 소스 루프에 영향을 주지 않는다")
    void failure_is_isolated_per_source() {
        when(pool.submit(eq(JobType.TREASURY_SYNC), anyString(), anyMap(), any())).thenThrow(new IllegalStateException("boom"));
        scheduler = new SyncScheduler(pool, hub, properties);

        scheduler.start();

        await().atMost(Duration.ofSeconds(3)).untilAsserted(() -> {
            SchedulerStatus status = scheduler.status();
            assertThat(status.errorCounts().get("treasury")).isGreaterThanOrEqualTo(1);
            assertThat(status.health().get("dws").lastSuccess()).isNotNull();
            assertThat(status.health().get("correlation").lastSuccess()).isNotNull();
        });
    }

    @Test
    @DisplayName("유지보수는 연속 실패가 retry_attempts 를 넘은 루프를 새 카운터로 다시 띄운다")
    void maintenance_restarts_failing_loops() {
        // given
        outcome.set(JobStatus.FAILED);
        scheduler = new SyncScheduler(pool, hub, properties);
        scheduler.start();
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() ->
                assertThat(scheduler.status().errorCounts().values()).allMatch(c -> c > 2));

        // when
        Instant at = Instant.now();
        int restarted = scheduler.runMaintenance(at);

        // then
        assertThat(restarted).isEqualTo(3);
        assertThat(scheduler.status().health().values()).allMatch(h -> at.equals(h.since()));

        outcome.set(JobStatus.SUCCEEDED);
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() ->
                assertThat(scheduler.status().errorCounts().values()).containsOnly(0));
        assertThat(scheduler.runMaintenance(Instant.now())).isZero();
    }

    @Test
    @DisplayName("유지보수는 2시간 넘게 성공이 없던 루프의 연속 실패를 먼저 비우므로 재시작하지 않는다")
    void maintenance_clears_errors_of_long_idle_loops() {
        // given: 한 번 성공한 뒤 계속 실패
        scheduler = new SyncScheduler(pool, hub, properties);
        scheduler.start();
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() ->
                assertThat(scheduler.status().health().values()).allMatch(h -> h.lastSuccess() != null));
        outcome.set(JobStatus.FAILED);
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() ->
                assertThat(scheduler.status().errorCounts().values()).allMatch(c -> c > 2));

        // when
        Instant later = Instant.now().plus(Duration.ofHours(3));
        int restarted = scheduler.runMaintenance(later);

        // then
        assertThat(restarted).isZero();
        assertThat(scheduler.status().health().values()).noneMatch(h -> later.equals(h.since()));
    }

    @Test
    @DisplayName("마지막 성공 후 주기의 두 배가 지나면 STALE 로 표시하고 헬스 이벤트를 보낸다")
    void health_check_marks_stale_loops() {
        // given
        SyncProperties.Scheduler s = properties.getScheduler();
        s.setDwsPollingInterval(Duration.ofHours(1));
        s.setTreasuryPollingInterval(Duration.ofHours(1));
        s.setCorrelationInterval(Duration.ofHours(4));
        scheduler = new SyncScheduler(pool, hub, properties);
        scheduler.start();
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() ->
                assertThat(scheduler.status().health().values()).allMatch(h -> h.lastSuccess() != null));

        // when
        scheduler.checkHealth(Instant.now().plus(Duration.ofHours(3)));

        // then
        SchedulerStatus status = scheduler.status();
        assertThat(status.health().get("dws").status()).isEqualTo(LoopStatus.STALE);
        assertThat(status.health().get("treasury").status()).isEqualTo(LoopStatus.STALE);
        assertThat(status.health().get("correlation").status()).isEqualTo(LoopStatus.HEALTHY);
        verify(hub, atLeast(2)).notifySystemEvent(eq("scheduler_health_update"), anyMap());
    }

    @Test
    @DisplayName("설정 변경은 모르는 키가 하나라도 있으면 아무것도 바꾸지 않는다")
    void update_config_rejects_unknown_keys_atomically() {
        scheduler = new SyncScheduler(pool, hub, properties);
        Map<String, Object> before = scheduler.settings().toMap();

        assertThatThrownBy(() -> scheduler.updateConfig(Map.of("dws_polling_interval", 60, "bogus", 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bogus");

        assertThat(scheduler.settings().toMap()).isEqualTo(before);
        verify(hub, never()).notifySystemEvent(eq("scheduler_config_updated"), anyMap());
    }

    @Test
    @DisplayName("올바른 설정 변경은 반영되고 scheduler_config_updated 를 보낸다")
    void update_config_applies_and_broadcasts() {
        scheduler = new SyncScheduler(pool, hub, properties);

        Map<String, Object> config = scheduler.updateConfig(Map.of("dws_polling_interval", 900));

        assertThat(config).containsEntry("dws_polling_interval", 900L);
        verify(hub).notifySystemEvent(eq("scheduler_config_updated"),
                argThat(d -> d.get("newConfig") instanceof Map<?, ?> m && m.containsKey("dws_polling_interval")));
    }

    @Test
    @DisplayName("멈춘 스케줄러 상태는 running=false 와 STOPPED 헬스를 보여준다")
    void status_when_stopped() {
        scheduler = new SyncScheduler(pool, hub, properties);

        SchedulerStatus status = scheduler.status();

        assertThat(status.running()).isFalse();
        assertThat(status.startedAt()).isNull();
        assertThat(status.uptimeSeconds()).isZero();
        assertThat(status.health()).containsOnlyKeys("dws", "treasury", "correlation");
        assertThat(status.health().get("dws").status()).isEqualTo(LoopStatus.STOPPED);
        assertThat(status.config()).containsKey("retry_attempts");
    }

    private static JobView view(String id, JobStatus status) {
        Instant now = Instant.now();
        boolean failed = status == JobStatus.FAILED;
        return new JobView(id, JobType.DWS_SYNC, "dws", status, 5, 100, null, now, now, now,
                failed ? "upstream 503" : null, failed ? "fetch" : null, Map.of(), 0, 3, null, "w-0", Map.of());
    }
}
