package com.yerin.syncwatch.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.syncwatch.notification.NotificationHub;
import com.yerin.syncwatch.notification.NotificationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;

import java.nio.charset.StandardCharsets;

/**
 * 브로커 채널을 구독해서 다른 인스턴스가 보낸 메시지를 로컬 구독자에게 다시 전달한다.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisBrokerListener implements MessageListener {

    private final NotificationHub hub;
    private final ObjectMapper objectMapper;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            NotificationMessage parsed = objectMapper.readValue(body, NotificationMessage.class);
            int delivered = hub.deliverRemote(parsed);
            log.debug("[Broker] received channel={}, type={}, delivered={}", channel, parsed.type(), delivered);
        } catch (JsonProcessingException e) {
            log.warn("[Broker] unreadable message channel={}, err={}", channel, e.getOriginalMessage());
        }
    }
}
