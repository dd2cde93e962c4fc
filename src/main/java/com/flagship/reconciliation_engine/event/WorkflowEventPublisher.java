package com.flagship.reconciliation_engine.event;

import com.flagship.reconciliation_engine.observability.WorkflowEventMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes stored workflow events to Kafka.
 *
 * Polls with SELECT FOR UPDATE SKIP LOCKED so several instances can run.
 * Sends synchronously and keys by document id, which keeps each document's
 * events in order on one partition. Failed sends count towards
 * {@code engine.events.publisher.max-retries}; past that the event is left
 * for manual handling.
 */
@Component
@ConditionalOnProperty(name = "engine.events.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WorkflowEventPublisher {

    private final WorkflowEventService eventService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final WorkflowEventMetrics eventMetrics;

    @Value("${kafka.topic.reconciliations:reconciliation-events}")
    private String reconciliationsTopic;

    @Value("${kafka.topic.filings:filing-events}")
    private String filingsTopic;

    @Value("${engine.events.publisher.batch-size:100}")
    private int batchSize;

    @Value("${engine.events.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${engine.events.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<WorkflowEvent> events = eventService.findUnpublishedEvents(batchSize, maxRetries);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished workflow events", events.size());

            for (WorkflowEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in workflow event publisher polling loop", e);
        }
    }

    private void publishEvent(WorkflowEvent event) {
        String topic = topicFor(event.getDocumentType());
        String key = event.getDocumentId().toString();

        try {
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(topic, key, event.getPayload());
            SendResult<String, String> result = future.get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            eventService.markPublished(event.getId());
            eventMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            eventService.markFailed(event.getId(), "Interrupted while publishing");
            eventMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            eventService.markFailed(event.getId(), e.getMessage());
            eventMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), leaving it for manual handling. documentId={}",
                        event.getId(), maxRetries, event.getDocumentId());
                eventMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(DocumentType documentType) {
        return switch (documentType) {
            case RECONCILIATION -> reconciliationsTopic;
            case FILING -> filingsTopic;
        };
    }
}
