package com.flagship.reconciliation_engine.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The event log: written inside the caller's transaction, read back in order,
 * with publication and retry bookkeeping.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class WorkflowEventServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("reconciliation_engine_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("engine.events.publisher.enabled", () -> "false");
        registry.add("engine.events.publisher.max-retries", () -> "3");
    }

    @Autowired
    private WorkflowEventService eventService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private List<WorkflowEvent> recordAll(UUID documentId, String... transitions) {
        return transactionTemplate.execute(status -> {
            List<WorkflowEvent> recorded = new ArrayList<>();
            recorded.add(eventService.record(DocumentCreatedEvent.of(
                DocumentType.FILING, documentId, "CO-1", "WHT_STATEMENT/2024-03", "preparer")));
            String from = "DRAFT";
            for (String to : transitions) {
                recorded.add(eventService.record(new DocumentTransitionedEvent(UUID.randomUUID(), documentId,
                    DocumentType.FILING, from, to, to.toLowerCase(), "preparer", Instant.now())));
                from = to;
            }
            return recorded;
        });
    }

    @Test
    @DisplayName("Recording outside a transaction is refused")
    void requiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () -> eventService.record(
            DocumentCreatedEvent.of(DocumentType.FILING, UUID.randomUUID(), "CO-1", "x", "preparer")));
    }

    @Test
    @DisplayName("History is returned in the order events were written")
    void historyInOrder() {
        UUID documentId = UUID.randomUUID();
        recordAll(documentId, "PREPARED", "REVIEWED");

        List<WorkflowEvent> history = eventService.history(DocumentType.FILING, documentId);

        assertEquals(3, history.size());
        assertEquals(DocumentCreatedEvent.EVENT_TYPE, history.get(0).getEventType());
        assertTrue(history.get(1).getPayload().contains("PREPARED"));
        assertTrue(history.get(2).getPayload().contains("REVIEWED"));
        assertTrue(history.get(0).getSequenceNumber() < history.get(2).getSequenceNumber());
        assertTrue(history.stream().noneMatch(WorkflowEvent::isPublished));
    }

    @Test
    @DisplayName("Published events leave the backlog, exhausted ones stop being retried")
    void publicationBookkeeping() {
        UUID documentId = UUID.randomUUID();
        List<WorkflowEvent> recorded = recordAll(documentId, "PREPARED");
        UUID published = recorded.get(0).getId();
        UUID failing = recorded.get(1).getId();

        eventService.markPublished(published);
        for (int i = 0; i < 3; i++) {
            eventService.markFailed(failing, "broker down");
        }

        List<WorkflowEvent> backlog = eventService.findUnpublishedEvents(1000, 3);
        assertTrue(backlog.stream().noneMatch(e -> e.getDocumentId().equals(documentId)));

        List<WorkflowEvent> history = eventService.history(DocumentType.FILING, documentId);
        assertTrue(history.get(0).isPublished());
        assertEquals(3, history.get(1).getRetryCount());
        assertEquals("broker down", history.get(1).getLastError());
    }
}
