package com.flagship.reconciliation_engine.ledger;

import com.flagship.reconciliation_engine.common.Amounts;
import com.flagship.reconciliation_engine.exception.DependencyUnavailableException;
import com.flagship.reconciliation_engine.observability.EngineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reduces an account's posted entries up to a cutoff to a signed balance.
 *
 * Sign rule per account type:
 * ASSET, EXPENSE: debits - credits.
 * LIABILITY, EQUITY, REVENUE: credits - debits.
 *
 * The query runs on the ledger executor under {@code engine.ledger.timeout}.
 * Timeouts and ledger failures surface as {@link DependencyUnavailableException};
 * a balance of zero is never returned in their place.
 */
@Component
@Slf4j
public class LedgerBalanceFetcher {

    private final LedgerGateway ledgerGateway;
    private final Executor ledgerExecutor;
    private final Duration timeout;
    private final EngineMetrics metrics;

    public LedgerBalanceFetcher(LedgerGateway ledgerGateway,
                                @Qualifier("ledgerExecutor") Executor ledgerExecutor,
                                @Value("${engine.ledger.timeout:5s}") Duration timeout,
                                EngineMetrics metrics) {
        this.ledgerGateway = ledgerGateway;
        this.ledgerExecutor = ledgerExecutor;
        this.timeout = timeout;
        this.metrics = metrics;
    }

    /**
     * @throws IllegalArgumentException if the ledger has no such account
     * @throws DependencyUnavailableException if the ledger failed or did not answer in time
     */
    public BigDecimal fetchLedgerBalance(String accountRef, LocalDate asOfDate) {
        long start = System.currentTimeMillis();
        CompletableFuture<BigDecimal> query;
        try {
            query = CompletableFuture.supplyAsync(() -> computeBalance(accountRef, asOfDate), ledgerExecutor);
        } catch (RejectedExecutionException e) {
            metrics.recordLedgerFetch("rejected", System.currentTimeMillis() - start);
            log.warn("Ledger executor rejected balance query for {}: {}", accountRef, e.getMessage());
            throw new DependencyUnavailableException("Ledger executor is saturated, cannot query account " + accountRef, e);
        }
        try {
            BigDecimal balance = query.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            metrics.recordLedgerFetch("success", System.currentTimeMillis() - start);
            log.debug("Ledger balance for {} as of {}: {}", accountRef, asOfDate, balance);
            return balance;
        } catch (TimeoutException e) {
            query.cancel(true);
            metrics.recordLedgerFetch("timeout", System.currentTimeMillis() - start);
            log.warn("Ledger balance for {} timed out after {}", accountRef, timeout);
            throw new DependencyUnavailableException(
                "Ledger did not answer within " + timeout + " for account " + accountRef, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            query.cancel(true);
            throw new DependencyUnavailableException("Interrupted while fetching ledger balance for " + accountRef, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IllegalArgumentException) {
                metrics.recordLedgerFetch("unknown_account", System.currentTimeMillis() - start);
                throw (IllegalArgumentException) cause;
            }
            metrics.recordLedgerFetch("unavailable", System.currentTimeMillis() - start);
            log.warn("Ledger balance for {} failed: {}", accountRef, cause.getMessage());
            if (cause instanceof DependencyUnavailableException) {
                throw (DependencyUnavailableException) cause;
            }
            throw new DependencyUnavailableException("Ledger query failed for account " + accountRef, cause);
        }
    }

    private BigDecimal computeBalance(String accountRef, LocalDate asOfDate) {
        Account account = ledgerGateway.findAccount(accountRef)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountRef));

        List<PostedLine> lines = ledgerGateway.findPostedLines(accountRef, asOfDate);
        BigDecimal debits = Amounts.zero();
        BigDecimal credits = Amounts.zero();
        for (PostedLine line : lines) {
            debits = Amounts.accumulate(debits, line.getDebit());
            credits = Amounts.accumulate(credits, line.getCredit());
        }
        return Amounts.round2(account.getAccountType().signedBalance(debits, credits));
    }
}
