package com.yerin.syncwatch.infra;

import com.yerin.syncwatch.domain.BrokerPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Redis 없이 띄울 때 쓰는 브로커. 발행 내용을 로그로만 남긴다.
 */
@Slf4j
@Component
@Profile("local-inmem")
public class InMemoryBrokerAdapter implements BrokerPort {
    @Override
    public void publish(String channel, String payload) {
        log.debug("[InMemoryBroker] publish channel={}, bytes={}", channel, payload.length());
    }
}
