package com.yerin.syncwatch.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class SyncwatchMetrics {

    private final MeterRegistry registry;

    private final Counter jobSubmitted;
    private final Counter jobSucceeded;
    private final Counter jobFailed;
    private final Counter jobCancelled;
    private final Counter notificationsDropped;

    public SyncwatchMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobSubmitted = Counter.builder("syncwatch_jobs_submitted_total")
                .description("jobs submitted").register(registry);
        this.jobSucceeded = Counter.builder("syncwatch_jobs_succeeded_total")
                .description("jobs succeeded").register(registry);
        this.jobFailed    = Counter.builder("syncwatch_jobs_failed_total")
                .description("jobs failed (handler thrown)").register(registry);
        this.jobCancelled = Counter.builder("syncwatch_jobs_cancelled_total")
                .description("jobs cancelled (manual or timeout)").register(registry);
        this.notificationsDropped = Counter.builder("syncwatch_notifications_dropped_total")
                .description("deliveries that failed and closed the connection").register(registry);
    }

    public void incSubmitted()  { jobSubmitted.increment(); }
    public void incSucceeded()  { jobSucceeded.increment(); }
    public void incFailed()     { jobFailed.increment(); }
    public void incCancelled()  { jobCancelled.increment(); }
    public void incDropped()    { notificationsDropped.increment(); }

    // 잡 타입 태그가 붙은 타이머
    public Timer handlerTimer(JobType type) {
        return Timer.builder("syncwatch_handler_duration_seconds")
                .description("handler duration by job type")
                .tag("type", type.tag())
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }

    public void gauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(name, value).description(description).register(registry);
    }

    public Timer syncTimer(SyncSource source) {
        return Timer.builder("syncwatch_sync_duration_seconds")
                .description("source sync pipeline duration")
                .tag("source", source.key())
                .register(registry);
    }
}
