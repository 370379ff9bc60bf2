package com.yerin.syncwatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.syncwatch.infra.RedisBrokerListener;
import com.yerin.syncwatch.notification.NotificationHub;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.util.List;

@Configuration
@Profile("!local-inmem")
public class RedisListenerConfig {

    @Bean
    public RedisBrokerListener redisBrokerListener(NotificationHub hub, ObjectMapper objectMapper) {
        return new RedisBrokerListener(hub, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory,
                                                                       RedisBrokerListener listener,
                                                                       SyncProperties properties) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        SyncProperties.Broker broker = properties.getBroker();
        if (broker.isEnabled()) {
            container.addMessageListener(listener, List.of(
                    new ChannelTopic(broker.getChangeChannel()),
                    new ChannelTopic(broker.getSystemChannel())));
        }
        return container;
    }
}
