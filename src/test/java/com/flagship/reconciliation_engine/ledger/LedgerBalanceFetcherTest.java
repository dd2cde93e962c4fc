package com.flagship.reconciliation_engine.ledger;

import com.flagship.reconciliation_engine.exception.DependencyUnavailableException;
import com.flagship.reconciliation_engine.observability.EngineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LedgerBalanceFetcherTest {

    private static final LocalDate CUTOFF = LocalDate.of(2024, 3, 31);
    private static final Executor DIRECT = Runnable::run;

    private LedgerGateway gateway;
    private SimpleMeterRegistry registry;
    private EngineMetrics metrics;

    @BeforeEach
    void setUp() {
        gateway = mock(LedgerGateway.class);
        registry = new SimpleMeterRegistry();
        metrics = new EngineMetrics(registry);
    }

    private LedgerBalanceFetcher fetcher(Executor executor, Duration timeout) {
        return new LedgerBalanceFetcher(gateway, executor, timeout, metrics);
    }

    private void givenAccount(String number, Account.AccountType type) {
        when(gateway.findAccount(number)).thenReturn(
            Optional.of(new Account(UUID.randomUUID(), number, "Test " + number, type)));
        when(gateway.findPostedLines(eq(number), any())).thenReturn(List.of(
            PostedLine.of(EntryType.DEBIT, new BigDecimal("700.00")),
            PostedLine.of(EntryType.DEBIT, new BigDecimal("300.00")),
            PostedLine.of(EntryType.CREDIT, new BigDecimal("400.00"))));
    }

    @Test
    @DisplayName("Asset account balance is debits minus credits")
    void assetBalance() {
        givenAccount("1010", Account.AccountType.ASSET);

        BigDecimal balance = fetcher(DIRECT, Duration.ofSeconds(1)).fetchLedgerBalance("1010", CUTOFF);

        assertEquals(new BigDecimal("600.00"), balance);
        verify(gateway).findPostedLines("1010", CUTOFF);
    }

    @Test
    @DisplayName("Liability account balance is credits minus debits")
    void liabilityBalance() {
        givenAccount("2310", Account.AccountType.LIABILITY);

        BigDecimal balance = fetcher(DIRECT, Duration.ofSeconds(1)).fetchLedgerBalance("2310", CUTOFF);

        assertEquals(new BigDecimal("-600.00"), balance);
    }

    @Test
    @DisplayName("Account with no entries has a zero balance")
    void emptyAccount() {
        when(gateway.findAccount("1020")).thenReturn(
            Optional.of(new Account(UUID.randomUUID(), "1020", "Petty cash", Account.AccountType.ASSET)));
        when(gateway.findPostedLines(eq("1020"), any())).thenReturn(List.of());

        assertEquals(new BigDecimal("0.00"), fetcher(DIRECT, Duration.ofSeconds(1)).fetchLedgerBalance("1020", CUTOFF));
    }

    @Test
    @DisplayName("Unknown account is reported as such, not as unavailable")
    void unknownAccount() {
        when(gateway.findAccount("9999")).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class,
            () -> fetcher(DIRECT, Duration.ofSeconds(1)).fetchLedgerBalance("9999", CUTOFF));
    }

    @Test
    @DisplayName("Ledger that never answers times out instead of returning zero")
    void timeout() {
        Executor neverRuns = task -> { };

        DependencyUnavailableException e = assertThrows(DependencyUnavailableException.class,
            () -> fetcher(neverRuns, Duration.ofMillis(50)).fetchLedgerBalance("1010", CUTOFF));

        assertTrue(e.getMessage().contains("1010"));
        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("Ledger failure surfaces as dependency unavailable")
    void ledgerFailure() {
        when(gateway.findAccount("1010")).thenThrow(new DependencyUnavailableException("ledger down",
            new QueryTimeoutException("statement timeout")));

        assertThrows(DependencyUnavailableException.class,
            () -> fetcher(DIRECT, Duration.ofSeconds(1)).fetchLedgerBalance("1010", CUTOFF));
    }

    @Test
    @DisplayName("Saturated ledger executor surfaces as dependency unavailable")
    void executorRejects() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };

        DependencyUnavailableException e = assertThrows(DependencyUnavailableException.class,
            () -> fetcher(saturated, Duration.ofSeconds(1)).fetchLedgerBalance("1010", CUTOFF));

        assertInstanceOf(RejectedExecutionException.class, e.getCause());
        assertEquals(1, registry.get("ledger.balance.fetch").tag("outcome", "rejected").timer().count());
        verifyNoInteractions(gateway);
    }
}
