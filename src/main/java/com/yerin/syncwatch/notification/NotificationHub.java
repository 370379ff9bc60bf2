package com.yerin.syncwatch.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.syncwatch.config.SyncProperties;
import com.yerin.syncwatch.domain.BrokerPort;
import com.yerin.syncwatch.domain.ChangeEvent;
import com.yerin.syncwatch.domain.SyncwatchMetrics;
import com.yerin.syncwatch.infra.WorkerId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 라이브 연결과 구독을 관리하고 변경 이벤트를 관심 있는 구독자에게 밀어준다.
 * 브로커 발행은 best-effort 이고, 실패해도 로컬 전달은 계속된다.
 */
@Slf4j
@Component
public class NotificationHub {

    private final Map<String, SubscriberConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> subscriptions = new ConcurrentHashMap<>();

    private final BrokerPort broker;
    private final ObjectMapper objectMapper;
    private final SyncProperties.Broker brokerConfig;
    private final SyncwatchMetrics metrics;
    private final String origin;

    @Autowired
    public NotificationHub(BrokerPort broker, ObjectMapper objectMapper,
                           SyncProperties properties, SyncwatchMetrics metrics) {
        this(broker, objectMapper, properties, metrics, WorkerId.instance());
    }

    NotificationHub(BrokerPort broker, ObjectMapper objectMapper,
                    SyncProperties properties, SyncwatchMetrics metrics, String origin) {
        this.broker = broker;
        this.objectMapper = objectMapper;
        this.brokerConfig = properties.getBroker();
        this.metrics = metrics;
        this.origin = origin;
    }

    public void connect(SubscriberConnection connection) {
        connections.put(connection.id(), connection);
        subscriptions.put(connection.id(), ConcurrentHashMap.newKeySet());
        log.info("[Fanout] connected id={}, connections={}", connection.id(), connections.size());
    }

    public void disconnect(String connectionId) {
        subscriptions.remove(connectionId);
        SubscriberConnection removed = connections.remove(connectionId);
        if (removed == null) return;
        try {
            removed.close();
        } catch (RuntimeException e) {
            log.debug("[Fanout] close failed id={}, err={}", connectionId, e.toString());
        }
        log.info("[Fanout] disconnected id={}, connections={}", connectionId, connections.size());
    }

    /** 구독은 누적된다. 모르는 연결이면 false. */
    public boolean subscribe(String connectionId, Subscription subscription) {
        Set<String> keys = subscriptions.get(connectionId);
        if (keys == null) return false;
        keys.add(subscription.key());
        log.debug("[Fanout] subscribe id={}, key={}", connectionId, subscription.key());
        return true;
    }

    public boolean subscribe(String connectionId, String scope, String entityId) {
        return subscribe(connectionId, Subscription.of(scope, entityId));
    }

    public Set<String> subscriptionsOf(String connectionId) {
        Set<String> keys = subscriptions.get(connectionId);
        return keys == null ? Set.of() : Set.copyOf(keys);
    }

    public int connectionCount() {
        return connections.size();
    }

    public int notifyChange(ChangeEvent change) {
        NotificationMessage message = NotificationMessage.dataUpdate(change, origin);
        publish(brokerConfig.getChangeChannel(), message);
        return deliverMatching(message);
    }

    public int notifySystemEvent(String eventType, Map<String, Object> data) {
        NotificationMessage message = NotificationMessage.systemEvent(eventType, data, origin);
        publish(brokerConfig.getSystemChannel(), message);
        return deliver(message, connections.keySet());
    }

    public int notifySystemError(String errorType, String errorMessage, Map<String, Object> details) {
        NotificationMessage message = NotificationMessage.systemError(errorType, errorMessage, details, origin);
        publish(brokerConfig.getSystemChannel(), message);
        return deliver(message, connections.keySet());
    }

    /**
     * 다른 인스턴스가 브로커로 보낸 메시지를 로컬 구독자에게만 전달한다.
     * 이 인스턴스가 보낸 메시지는 이미 로컬로 전달했으므로 버린다.
     */
    public int deliverRemote(NotificationMessage message) {
        if (origin.equals(message.origin())) return 0;
        return message.isDataUpdate() ? deliverMatching(message) : deliver(message, connections.keySet());
    }

    public boolean sendTo(String connectionId, NotificationMessage message) {
        return deliver(message, List.of(connectionId)) == 1;
    }

    private int deliverMatching(NotificationMessage message) {
        Set<String> interested = Set.of(
                Subscription.ALL,
                String.valueOf(message.entityType()),
                message.entityType() + ":" + message.entityId());

        List<String> targets = new ArrayList<>();
        subscriptions.forEach((connectionId, keys) -> {
            if (keys.stream().anyMatch(interested::contains)) targets.add(connectionId);
        });
        return deliver(message, targets);
    }

    private int deliver(NotificationMessage message, Collection<String> connectionIds) {
        String json = toJson(message);
        if (json == null) return 0;

        int delivered = 0;
        List<String> dead = new ArrayList<>();
        for (String connectionId : List.copyOf(connectionIds)) {
            SubscriberConnection connection = connections.get(connectionId);
            if (connection == null) continue;
            try {
                connection.send(json);
                delivered++;
            } catch (IOException | RuntimeException e) {
                log.warn("[Fanout] delivery failed id={}, type={}, err={}", connectionId, message.type(), e.toString());
                dead.add(connectionId);
            }
        }
        for (String connectionId : dead) {
            metrics.incDropped();
            disconnect(connectionId);
        }
        return delivered;
    }

    private void publish(String channel, NotificationMessage message) {
        if (!brokerConfig.isEnabled()) return;
        String json = toJson(message);
        if (json == null) return;
        try {
            broker.publish(channel, json);
        } catch (RuntimeException e) {
            log.warn("[Broker] publish failed channel={}, type={}, err={}", channel, message.type(), e.toString());
        }
    }

    private String toJson(NotificationMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("[Fanout] serialize failed type={}, err={}", message.type(), e.toString());
            return null;
        }
    }
}
