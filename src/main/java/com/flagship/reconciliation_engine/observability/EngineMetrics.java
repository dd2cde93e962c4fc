package com.flagship.reconciliation_engine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for document operations.
 *
 * Metrics exposed:
 * - documents.created: Counter of created documents, by type
 * - documents.recompute.duration: Timer for full recomputations
 * - documents.transitions: Counter of applied transitions, by type and target status
 * - documents.transitions.rejected: Counter of rejected transition requests
 * - documents.records.rejected: Counter of source record batches rejected by validation
 * - ledger.balance.fetch: Timer for ledger balance queries, by outcome
 * - ledger.postings: Counter of deposit postings, by outcome
 */
@Component
public class EngineMetrics {

    private final MeterRegistry registry;

    private final Counter recordsRejected;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.recordsRejected = Counter.builder("documents.records.rejected")
                .description("Source record batches rejected before classification")
                .register(registry);
    }

    public void recordDocumentCreated(String documentType) {
        registry.counter("documents.created",
                "document_type", sanitizeTag(documentType)
        ).increment();
    }

    public void recordRecompute(String documentType, long durationMs) {
        registry.timer("documents.recompute.duration",
                "document_type", sanitizeTag(documentType)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordTransition(String documentType, String toStatus) {
        registry.counter("documents.transitions",
                "document_type", sanitizeTag(documentType),
                "to", sanitizeTag(toStatus)
        ).increment();
    }

    public void recordTransitionRejected(String documentType, String toStatus) {
        registry.counter("documents.transitions.rejected",
                "document_type", sanitizeTag(documentType),
                "to", sanitizeTag(toStatus)
        ).increment();
    }

    public void incrementRecordsRejected() {
        recordsRejected.increment();
    }

    /**
     * Records a ledger balance query.
     *
     * @param outcome success, timeout, rejected, unavailable or unknown_account
     */
    public void recordLedgerFetch(String outcome, long durationMs) {
        Timer.builder("ledger.balance.fetch")
                .description("Time taken to fetch a ledger balance")
                .tag("outcome", sanitizeTag(outcome))
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordPosting(String status) {
        registry.counter("ledger.postings",
                "status", sanitizeTag(status)
        ).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
