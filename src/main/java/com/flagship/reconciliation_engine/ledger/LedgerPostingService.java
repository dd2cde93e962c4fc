package com.flagship.reconciliation_engine.ledger;

import com.flagship.reconciliation_engine.exception.DependencyUnavailableException;
import com.flagship.reconciliation_engine.observability.EngineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends journal entries to the ledger under the same timeout as balance queries.
 *
 * A timed-out posting may still complete on the ledger side; the posting
 * reference makes a later repost of the same entry a no-op.
 */
@Service
@Slf4j
public class LedgerPostingService {

    private final LedgerGateway ledgerGateway;
    private final Executor ledgerExecutor;
    private final Duration timeout;
    private final EngineMetrics metrics;

    public LedgerPostingService(LedgerGateway ledgerGateway,
                                @Qualifier("ledgerExecutor") Executor ledgerExecutor,
                                @Value("${engine.ledger.timeout:5s}") Duration timeout,
                                EngineMetrics metrics) {
        this.ledgerGateway = ledgerGateway;
        this.ledgerExecutor = ledgerExecutor;
        this.timeout = timeout;
        this.metrics = metrics;
    }

    /**
     * @return the ledger transaction id
     * @throws IllegalArgumentException if the ledger rejects the entry
     * @throws DependencyUnavailableException if the ledger failed or did not answer in time
     */
    public UUID post(LedgerPostingRequest request) {
        CompletableFuture<UUID> posting;
        try {
            posting = CompletableFuture.supplyAsync(() -> ledgerGateway.post(request), ledgerExecutor);
        } catch (RejectedExecutionException e) {
            metrics.recordPosting("rejected");
            throw new DependencyUnavailableException(
                "Ledger executor is saturated, cannot post " + request.getReference(), e);
        }
        try {
            UUID transactionId = posting.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            metrics.recordPosting("posted");
            return transactionId;
        } catch (TimeoutException e) {
            metrics.recordPosting("timeout");
            throw new DependencyUnavailableException(
                "Ledger did not confirm posting " + request.getReference() + " within " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordPosting("interrupted");
            throw new DependencyUnavailableException("Interrupted while posting " + request.getReference(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            metrics.recordPosting("failed");
            log.warn("Ledger posting {} failed: {}", request.getReference(), cause.getMessage());
            if (cause instanceof IllegalArgumentException) {
                throw (IllegalArgumentException) cause;
            }
            if (cause instanceof DependencyUnavailableException) {
                throw (DependencyUnavailableException) cause;
            }
            throw new DependencyUnavailableException("Ledger posting " + request.getReference() + " failed", cause);
        }
    }
}
