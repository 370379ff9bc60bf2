package com.yerin.syncwatch.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.syncwatch.notification.NotificationHub;
import com.yerin.syncwatch.notification.NotificationMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.DefaultMessage;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("브로커 리스너 테스트")
class RedisBrokerListenerTest {

    NotificationHub hub = mock(NotificationHub.class);
    RedisBrokerListener sut = new RedisBrokerListener(hub, new ObjectMapper().findAndRegisterModules());

    @Test
    @DisplayName("받은 메시지를 역직렬화해서 허브의 원격 전달로 넘긴다")
    void forwards_to_hub() {
        sut.onMessage(message("system_notifications",
                "{\"type\":\"system_event\",\"eventType\":\"scheduler_started\",\"origin\":\"node-b\",\"timestamp\":\"2026-01-01T00:00:00Z\"}"),
                null);

        verify(hub).deliverRemote(argThat((NotificationMessage m) ->
                "scheduler_started".equals(m.eventType()) && "node-b".equals(m.origin())));
    }

    @Test
    @DisplayName("읽을 수 없는 메시지는 버리고 예외를 던지지 않는다")
    void drops_unreadable_message() {
        assertThatCode(() -> sut.onMessage(message("project_changes", "{not json"), null))
                .doesNotThrowAnyException();

        verifyNoInteractions(hub);
    }

    private static DefaultMessage message(String channel, String body) {
        return new DefaultMessage(channel.getBytes(StandardCharsets.UTF_8), body.getBytes(StandardCharsets.UTF_8));
    }
}
