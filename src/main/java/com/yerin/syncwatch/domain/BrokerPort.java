package com.yerin.syncwatch.domain;

public interface BrokerPort {
    void publish(String channel, String payload);
}
