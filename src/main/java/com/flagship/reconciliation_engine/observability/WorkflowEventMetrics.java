package com.flagship.reconciliation_engine.observability;

import com.flagship.reconciliation_engine.event.WorkflowEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the workflow event log.
 *
 * Gauges read cached values that {@link MetricsScheduler} refreshes, so a
 * scrape never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowEventMetrics {

    private final WorkflowEventRepository eventRepository;
    private final MeterRegistry meterRegistry;

    @Value("${engine.events.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetteredCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("workflow_events.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished workflow events")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("workflow_events.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished workflow event in seconds")
                .register(meterRegistry);

        Gauge.builder("workflow_events.failed", deadLetteredCount, AtomicLong::get)
                .description("Number of events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        log.info("Workflow event metrics registered with Micrometer");
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = eventRepository.countUnpublished();
            backlogSize.set(unpublished);

            eventRepository.findOldestUnpublishedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestEventAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, Instant.now()).getSeconds())),
                            () -> oldestEventAgeSeconds.set(0)
                    );

            long failed = eventRepository.countDeadLettered(maxRetries);
            deadLetteredCount.set(failed);

            log.debug("Workflow event metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                    unpublished, oldestEventAgeSeconds.get(), failed);

        } catch (Exception e) {
            log.warn("Failed to refresh workflow event metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("workflow_events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("workflow_events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("workflow_events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
