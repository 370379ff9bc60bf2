package com.yerin.syncwatch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@ConfigurationProperties(prefix = "syncwatch")
public class SyncProperties {

    private final Worker worker = new Worker();
    private final Scheduler scheduler = new Scheduler();
    private final Broker broker = new Broker();
    private final Map<String, SourceEndpoint> sources = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Worker {
        private int concurrency = 3;
        private Duration jobTimeout = Duration.ofHours(1);
        private Duration sweepInterval = Duration.ofMinutes(5);
        private Duration cleanupInterval = Duration.ofHours(1);
        private Duration retention = Duration.ofHours(24);
        private int historyLimit = 1000;
        private int maxRetries = 3;
        private int defaultPriority = 5;
        private Duration pollTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Scheduler {
        private boolean autoStart = false;
        private Duration dwsPollingInterval = Duration.ofMinutes(30);
        private Duration treasuryPollingInterval = Duration.ofHours(1);
        private Duration correlationInterval = Duration.ofHours(2);
        private Duration healthCheckInterval = Duration.ofMinutes(5);
        private Duration maintenanceInterval = Duration.ofHours(1);
        private int retryAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(300);
        private Duration backoffCap = Duration.ofSeconds(3600);
        private int loopJobPriority = 5;
    }

    @Getter
    @Setter
    public static class Broker {
        private boolean enabled = true;
        private String changeChannel = "project_changes";
        private String systemChannel = "system_notifications";
    }

    @Getter
    @Setter
    public static class SourceEndpoint {
        private String url;
        private String entityType = "project";
        private String idField = "id";
        // null 이면 응답 루트가 배열
        private String recordsField;
        private String pageParam = "page";
        private String sizeParam = "size";
        private int pageSize = 100;
        private int maxPages = 10;
        private Duration timeout = Duration.ofSeconds(30);
    }
}
