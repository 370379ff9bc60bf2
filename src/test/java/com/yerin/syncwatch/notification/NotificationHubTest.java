package com.yerin.syncwatch.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.syncwatch.config.SyncProperties;
import com.yerin.syncwatch.domain.BrokerPort;
import com.yerin.syncwatch.domain.ChangeEvent;
import com.yerin.syncwatch.domain.SyncwatchMetrics;
import com.yerin.syncwatch.support.RecordingConnection;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("알림 허브 팬아웃 테스트")
class NotificationHubTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final BrokerPort broker = mock(BrokerPort.class);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final SyncProperties properties = new SyncProperties();

    private NotificationHub hub;

    @BeforeEach
    void setUp() {
        hub = new NotificationHub(broker, objectMapper, properties, new SyncwatchMetrics(registry), "node-a");
    }

    @Test
    @DisplayName("project:P1 변경은 전체 구독자와 P1 구독자에게만 간다")
    void change_reaches_only_interested_subscribers() throws Exception {
        // given
        RecordingConnection s1 = connect("s1");
        RecordingConnection s2 = connect("s2");
        RecordingConnection s3 = connect("s3");
        hub.subscribe("s1", Subscription.ALL, null);
        hub.subscribe("s2", "project", "P1");
        hub.subscribe("s3", "project", "P2");

        // when
        int delivered = hub.notifyChange(projectChange("P1"));

        // then
        assertThat(delivered).isEqualTo(2);
        assertThat(s1.received()).hasSize(1);
        assertThat(s2.received()).hasSize(1);
        assertThat(s3.received()).isEmpty();
        Map<?, ?> payload = objectMapper.readValue(s2.received().get(0), Map.class);
        assertThat(payload.get("type")).isEqualTo(NotificationMessage.DATA_UPDATE);
        assertThat(payload.get("entityId")).isEqualTo("P1");
    }

    @Test
    @DisplayName("엔티티 타입 구독은 그 타입의 모든 엔티티 변경을 받는다")
    void entity_type_subscription_matches_every_entity() {
        RecordingConnection s = connect("s");
        hub.subscribe("s", "project", null);

        hub.notifyChange(projectChange("P1"));
        hub.notifyChange(projectChange("P2"));
        hub.notifyChange(ChangeEvent.of("municipality", "M1", ChangeEvent.CREATED, Map.of(), "treasury"));

        assertThat(s.received()).hasSize(2);
    }

    @Test
    @DisplayName("구독이 없는 연결은 변경 알림을 받지 않는다")
    void unsubscribed_connection_gets_nothing() {
        RecordingConnection s = connect("s");

        hub.notifyChange(projectChange("P1"));

        assertThat(s.received()).isEmpty();
    }

    @Test
    @DisplayName("전송에 실패한 연결은 끊기고, 다른 구독자 전달은 막지 않는다")
    void broken_connection_is_dropped_without_blocking_others() {
        // given
        RecordingConnection s1 = RecordingConnection.broken("s1");
        hub.connect(s1);
        RecordingConnection s2 = connect("s2");
        hub.subscribe("s1", Subscription.ALL, null);
        hub.subscribe("s2", Subscription.ALL, null);

        // when
        int delivered = hub.notifyChange(projectChange("P1"));

        // then
        assertThat(delivered).isEqualTo(1);
        assertThat(s2.received()).hasSize(1);
        assertThat(s1.isClosed()).isTrue();
        assertThat(hub.connectionCount()).isEqualTo(1);
        assertThat(hub.subscriptionsOf("s1")).isEmpty();
        assertThat(registry.get("syncwatch_notifications_dropped_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("시스템 이벤트와 오류는 구독과 상관없이 모든 연결에 간다")
    void system_messages_reach_everyone() throws Exception {
        RecordingConnection s1 = connect("s1");
        RecordingConnection s2 = connect("s2");
        hub.subscribe("s2", "project", "P2");

        hub.notifySystemEvent("scheduler_started", Map.of("sources", 3));
        hub.notifySystemError("sync_failed", "dws sync failed during fetch: timeout", Map.of("source", "dws"));

        assertThat(s1.received()).hasSize(2);
        assertThat(s2.received()).hasSize(2);
        Map<?, ?> error = objectMapper.readValue(s1.received().get(1), Map.class);
        assertThat(error.get("type")).isEqualTo(NotificationMessage.SYSTEM_ERROR);
        assertThat(error.get("errorType")).isEqualTo("sync_failed");
    }

    @Test
    @DisplayName("변경은 change 채널, 시스템 메시지는 system 채널로 발행된다")
    void publishes_to_broker_channels() {
        hub.notifyChange(projectChange("P1"));
        hub.notifySystemEvent("scheduler_stopped", Map.of());

        verify(broker).publish(eq("project_changes"), contains("\"origin\":\"node-a\""));
        verify(broker).publish(eq("system_notifications"), contains("scheduler_stopped"));
    }

    @Test
    @DisplayName("브로커 발행이 실패해도 로컬 전달은 계속된다")
    void broker_failure_is_swallowed() {
        doThrow(new IllegalStateException("redis down")).when(broker).publish(anyString(), anyString());
        RecordingConnection s = connect("s");
        hub.subscribe("s", Subscription.ALL, null);

        int delivered = hub.notifyChange(projectChange("P1"));

        assertThat(delivered).isEqualTo(1);
        assertThat(s.received()).hasSize(1);
    }

    @Test
    @DisplayName("브로커가 꺼져 있으면 발행하지 않는다")
    void disabled_broker_is_not_called() {
        properties.getBroker().setEnabled(false);

        hub.notifyChange(projectChange("P1"));

        verifyNoInteractions(broker);
    }

    @Test
    @DisplayName("원격 메시지는 로컬 구독자에게 전달하고, 자기 자신이 보낸 메시지는 버린다")
    void deliver_remote_skips_own_origin() {
        RecordingConnection s = connect("s");
        hub.subscribe("s", "project", "P1");

        int own = hub.deliverRemote(NotificationMessage.dataUpdate(projectChange("P1"), "node-a"));
        int other = hub.deliverRemote(NotificationMessage.dataUpdate(projectChange("P1"), "node-b"));
        int otherUnrelated = hub.deliverRemote(NotificationMessage.dataUpdate(projectChange("P9"), "node-b"));

        assertThat(own).isZero();
        assertThat(other).isEqualTo(1);
        assertThat(otherUnrelated).isZero();
        assertThat(s.received()).hasSize(1);
        verifyNoInteractions(broker);
    }

    @Test
    @DisplayName("구독은 누적되고, 모르는 연결 구독은 false")
    void subscriptions_accumulate() {
        connect("s");

        hub.subscribe("s", "project", "P1");
        hub.subscribe("s", "municipality", "M1");
        hub.subscribe("s", "project", "P1");

        assertThat(hub.subscriptionsOf("s")).containsExactlyInAnyOrder("project:P1", "municipality:M1");
        assertThat(hub.subscribe("ghost", "project", "P1")).isFalse();
    }

    @Test
    @DisplayName("연결 해제는 여러 번 호출해도 안전하다")
    void disconnect_is_idempotent() {
        RecordingConnection s = connect("s");

        hub.disconnect("s");
        hub.disconnect("s");
        hub.disconnect("never-connected");

        assertThat(s.isClosed()).isTrue();
        assertThat(hub.connectionCount()).isZero();
    }

    @Test
    @DisplayName("sendTo 는 지정한 연결 하나에만 보낸다")
    void send_to_single_connection() {
        RecordingConnection s1 = connect("s1");
        RecordingConnection s2 = connect("s2");

        boolean sent = hub.sendTo("s1", NotificationMessage.subscriptionConfirmed(Subscription.of("project", "P1")));

        assertThat(sent).isTrue();
        assertThat(s1.received()).hasSize(1);
        assertThat(s2.received()).isEmpty();
        assertThat(hub.sendTo("ghost", NotificationMessage.systemEvent("x", Map.of(), null))).isFalse();
    }

    private RecordingConnection connect(String id) {
        RecordingConnection c = new RecordingConnection(id);
        hub.connect(c);
        return c;
    }

    private static ChangeEvent projectChange(String id) {
        return new ChangeEvent("project", id, ChangeEvent.UPDATED, Map.of("progress", 50),
                Map.of("progress", 40), "dws", Instant.parse("2026-01-01T00:00:00Z"));
    }
}
