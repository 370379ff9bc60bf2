package com.yerin.syncwatch.infra;

import com.yerin.syncwatch.domain.BrokerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@Profile("!local-inmem")
public class RedisBrokerAdapter implements BrokerPort {
    private final StringRedisTemplate redis;

    @Override
    public void publish(String channel, String payload) {
        Long receivers = redis.convertAndSend(channel, payload);
        log.debug("[Broker] PUBLISH channel={}, receivers={}", channel, receivers);
    }
}
