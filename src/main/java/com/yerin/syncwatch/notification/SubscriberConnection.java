package com.yerin.syncwatch.notification;

import java.io.IOException;

/**
 * 팬아웃 허브가 보는 라이브 연결. WebSocket 세션이든 테스트용 가짜든 상관없다.
 */
public interface SubscriberConnection {
    String id();

    void send(String text) throws IOException;

    void close();
}
