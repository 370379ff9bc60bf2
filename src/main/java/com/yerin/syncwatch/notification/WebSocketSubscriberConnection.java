package com.yerin.syncwatch.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

@Slf4j
public class WebSocketSubscriberConnection implements SubscriberConnection {

    private static final int SEND_TIME_LIMIT_MILLIS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    public WebSocketSubscriberConnection(WebSocketSession session) {
        // 여러 스레드(워커, 스케줄러 루프, 브로커 리스너)가 동시에 보내므로 세션을 감싼다
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MILLIS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String text) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("session closed id=" + session.getId());
        }
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close() {
        if (!session.isOpen()) return;
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("[Fanout] close failed id={}, err={}", session.getId(), e.toString());
        }
    }
}
