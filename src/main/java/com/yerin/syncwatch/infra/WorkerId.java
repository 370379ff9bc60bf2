package com.yerin.syncwatch.infra;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class WorkerId {

    private static final String INSTANCE = hostName() + "-" + UUID.randomUUID().toString().substring(0, 8);

    private WorkerId() {}

    /** 프로세스 단위 식별자. 브로커 메시지의 발신 인스턴스 표시에 쓴다. */
    public static String instance() {
        return INSTANCE;
    }

    public static String worker(int idx) {
        return INSTANCE + "-w" + idx;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "syncwatch";
        }
    }
}
