package com.yerin.syncwatch.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("WebSocket 구독 프로토콜 테스트")
class SubscriptionWebSocketHandlerTest {

    private final NotificationHub hub = mock(NotificationHub.class);
    private final WebSocketSession session = mock(WebSocketSession.class);
    private SubscriptionWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new SubscriptionWebSocketHandler(hub, new ObjectMapper());
        when(session.getId()).thenReturn("ws-1");
        when(session.isOpen()).thenReturn(true);
        when(hub.subscribe(anyString(), any(Subscription.class))).thenReturn(true);
    }

    @Test
    @DisplayName("프로젝트 엔드포인트 연결은 등록만 하고 자동 구독은 하지 않는다")
    void project_endpoint_connects_without_subscription() {
        when(session.getUri()).thenReturn(URI.create("ws://localhost/ws/projects"));

        handler.afterConnectionEstablished(session);

        verify(hub).connect(argThat(c -> "ws-1".equals(c.id())));
        verify(hub, never()).subscribe(anyString(), any(Subscription.class));
    }

    @Test
    @DisplayName("지자체 엔드포인트 연결은 해당 지자체에 자동 구독하고 확인을 보낸다")
    void municipality_endpoint_auto_subscribes() {
        when(session.getUri()).thenReturn(URI.create("ws://localhost/ws/municipalities/11010"));

        handler.afterConnectionEstablished(session);

        verify(hub).subscribe("ws-1", new Subscription("municipality", "11010"));
        verify(hub).sendTo(eq("ws-1"), argThat(m -> NotificationMessage.SUBSCRIPTION_CONFIRMED.equals(m.type())
                && "11010".equals(m.entityId())));
    }

    @Test
    @DisplayName("subscribe 메시지는 scope/entityId 로 구독하고 확인을 보낸다")
    void subscribe_message() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\",\"scope\":\"project\",\"entityId\":\"P1\"}"));

        verify(hub).subscribe("ws-1", new Subscription("project", "P1"));
        verify(hub).sendTo(eq("ws-1"), argThat(m -> NotificationMessage.SUBSCRIPTION_CONFIRMED.equals(m.type())));
    }

    @Test
    @DisplayName("snake_case 필드와 entity_type 도 받아들인다")
    void subscribe_message_with_snake_case() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\",\"entity_type\":\"municipality\",\"entity_id\":\"M7\"}"));

        verify(hub).subscribe("ws-1", new Subscription("municipality", "M7"));
    }

    @Test
    @DisplayName("scope 가 없으면 전체 구독")
    void subscribe_without_scope_means_all() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\"}"));

        ArgumentCaptor<Subscription> captor = ArgumentCaptor.forClass(Subscription.class);
        verify(hub).subscribe(eq("ws-1"), captor.capture());
        assertThat(captor.getValue().isAll()).isTrue();
    }

    @Test
    @DisplayName("JSON 이 아닌 메시지에는 invalid_message 오류를 돌려준다")
    void invalid_json_gets_error() throws Exception {
        handler.handleTextMessage(session, new TextMessage("not json"));

        verify(hub).sendTo(eq("ws-1"), argThat(m -> NotificationMessage.SYSTEM_ERROR.equals(m.type())
                && "invalid_message".equals(m.errorType())));
        verify(hub, never()).subscribe(anyString(), any(Subscription.class));
    }

    @Test
    @DisplayName("모르는 action 은 무시한다")
    void unknown_action_is_ignored() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"ping\"}"));

        verify(hub, never()).subscribe(anyString(), any(Subscription.class));
        verify(hub, never()).sendTo(anyString(), any());
    }

    @Test
    @DisplayName("연결 종료와 전송 오류는 모두 허브에서 연결을 뗀다")
    void close_and_transport_error_disconnect() {
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);
        handler.handleTransportError(session, new java.io.EOFException());

        verify(hub, times(2)).disconnect("ws-1");
    }

    @Test
    @DisplayName("지자체 경로 파싱")
    void municipality_id_parsing() {
        assertThat(SubscriptionWebSocketHandler.municipalityId(URI.create("ws://h/ws/municipalities/42"))).contains("42");
        assertThat(SubscriptionWebSocketHandler.municipalityId(URI.create("ws://h/ws/municipalities/42/"))).contains("42");
        assertThat(SubscriptionWebSocketHandler.municipalityId(URI.create("ws://h/ws/municipalities/"))).isEmpty();
        assertThat(SubscriptionWebSocketHandler.municipalityId(URI.create("ws://h/ws/projects"))).isEmpty();
        assertThat(SubscriptionWebSocketHandler.municipalityId(null)).isEmpty();
    }
}
