package com.yerin.syncwatch.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.Optional;

/**
 * 라이브 연결 프로토콜.
 * 클라이언트는 {"action":"subscribe","scope":"project","entityId":"P1"} 를 보내고,
 * data_update / system_event / system_error / subscription_confirmed 메시지를 받는다.
 * /ws/municipalities/{id} 로 붙으면 해당 지자체에 자동 구독된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriptionWebSocketHandler extends TextWebSocketHandler {

    static final String MUNICIPALITY_PATH = "/ws/municipalities/";
    static final String MUNICIPALITY_SCOPE = "municipality";

    private final NotificationHub hub;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        hub.connect(new WebSocketSubscriberConnection(session));
        municipalityId(session.getUri())
                .ifPresent(id -> subscribeAndConfirm(session.getId(), Subscription.of(MUNICIPALITY_SCOPE, id)));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            hub.sendTo(session.getId(), NotificationMessage.systemError(
                    "invalid_message", "message is not valid JSON", null, null));
            return;
        }

        String action = node.path("action").asText("");
        if (!"subscribe".equalsIgnoreCase(action)) {
            log.debug("[WebSocket] ignore action={}, id={}", action, session.getId());
            return;
        }
        String scope = firstText(node, "scope", "entityType", "entity_type");
        String entityId = firstText(node, "entityId", "entity_id");
        subscribeAndConfirm(session.getId(), Subscription.of(scope, entityId));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WebSocket] transport error id={}, err={}", session.getId(), exception.toString());
        hub.disconnect(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.disconnect(session.getId());
    }

    private void subscribeAndConfirm(String connectionId, Subscription subscription) {
        if (hub.subscribe(connectionId, subscription)) {
            hub.sendTo(connectionId, NotificationMessage.subscriptionConfirmed(subscription));
        }
    }

    static Optional<String> municipalityId(URI uri) {
        if (uri == null || uri.getPath() == null) return Optional.empty();
        String path = uri.getPath();
        int idx = path.indexOf(MUNICIPALITY_PATH);
        if (idx < 0) return Optional.empty();
        String id = path.substring(idx + MUNICIPALITY_PATH.length());
        if (id.endsWith("/")) id = id.substring(0, id.length() - 1);
        return id.isBlank() || id.contains("/") ? Optional.empty() : Optional.of(id);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (v != null && !v.isNull() && !v.asText().isBlank()) return v.asText();
        }
        return null;
    }
}
