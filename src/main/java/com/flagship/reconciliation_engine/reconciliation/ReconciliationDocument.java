package com.flagship.reconciliation_engine.reconciliation;

import com.flagship.reconciliation_engine.common.FiscalYear;
import com.flagship.reconciliation_engine.common.WorkflowStamp;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Bank-to-ledger reconciliation of one account for one month.
 *
 * Immutable: every change returns a new document. Any change to inputs drops
 * the summary, so a document is only trusted after it has been recomputed.
 */
@Value
@Builder(toBuilder = true)
public class ReconciliationDocument {
    UUID id;
    String companyId;
    /** Ledger account number of the bank account. */
    String accountRef;
    YearMonth period;
    String fiscalYear;
    LocalDate reconciliationDate;

    BigDecimal openingBankBalance;
    BigDecimal closingBankBalance;
    BigDecimal openingLedgerBalance;
    /** Null until fetched from the ledger. */
    BigDecimal closingLedgerBalance;
    Instant ledgerBalanceFetchedAt;

    List<StatementLine> statementLines;
    List<AdjustmentEntry> adjustments;
    String notes;

    ReconciliationSummary summary;

    ReconciliationStatus status;
    List<WorkflowStamp> history;
    Instant createdAt;
    Instant updatedAt;
    Long version;

    public static ReconciliationDocument create(String companyId, String accountRef, YearMonth period,
                                                BigDecimal openingBankBalance, BigDecimal closingBankBalance,
                                                BigDecimal openingLedgerBalance, String actorId) {
        Instant now = Instant.now();
        return ReconciliationDocument.builder()
            .id(UUID.randomUUID())
            .companyId(Objects.requireNonNull(companyId))
            .accountRef(Objects.requireNonNull(accountRef))
            .period(Objects.requireNonNull(period))
            .fiscalYear(FiscalYear.of(period).label())
            .reconciliationDate(LocalDate.now())
            .openingBankBalance(openingBankBalance)
            .closingBankBalance(Objects.requireNonNull(closingBankBalance))
            .openingLedgerBalance(openingLedgerBalance)
            .statementLines(List.of())
            .adjustments(List.of())
            .status(ReconciliationStatus.DRAFT)
            .history(List.of(stamp(ReconciliationStatus.DRAFT, actorId, now)))
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /** Ledger cutoff: the last day of the reconciled month. */
    public LocalDate cutoffDate() {
        return period.atEndOfMonth();
    }

    public boolean isRecomputed() {
        return summary != null;
    }

    public boolean isReconciled() {
        return summary != null && summary.getBalances().isReconciled();
    }

    public ReconciliationDocument withStatementLines(List<StatementLine> lines) {
        return toBuilder().statementLines(List.copyOf(lines)).summary(null).updatedAt(Instant.now()).build();
    }

    public ReconciliationDocument withAdjustments(List<AdjustmentEntry> entries) {
        return toBuilder().adjustments(List.copyOf(entries)).summary(null).updatedAt(Instant.now()).build();
    }

    public ReconciliationDocument addStatementLines(List<StatementLine> lines) {
        List<StatementLine> all = new ArrayList<>(statementLines);
        all.addAll(lines);
        return withStatementLines(all);
    }

    public ReconciliationDocument addAdjustments(List<AdjustmentEntry> entries) {
        List<AdjustmentEntry> all = new ArrayList<>(adjustments);
        all.addAll(entries);
        return withAdjustments(all);
    }

    public ReconciliationDocument removeStatementLine(UUID lineId) {
        List<StatementLine> remaining = statementLines.stream()
            .filter(line -> !line.getId().equals(lineId))
            .toList();
        if (remaining.size() == statementLines.size()) {
            throw new IllegalArgumentException("Statement line not found: " + lineId);
        }
        return withStatementLines(remaining);
    }

    public ReconciliationDocument updateStatementLine(UUID lineId, UnaryOperator<StatementLine> change) {
        boolean found = false;
        List<StatementLine> updated = new ArrayList<>(statementLines.size());
        for (StatementLine line : statementLines) {
            if (line.getId().equals(lineId)) {
                updated.add(change.apply(line));
                found = true;
            } else {
                updated.add(line);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("Statement line not found: " + lineId);
        }
        return withStatementLines(updated);
    }

    public ReconciliationDocument removeAdjustment(UUID entryId) {
        List<AdjustmentEntry> remaining = adjustments.stream()
            .filter(entry -> !entry.getId().equals(entryId))
            .toList();
        if (remaining.size() == adjustments.size()) {
            throw new IllegalArgumentException("Adjustment not found: " + entryId);
        }
        return withAdjustments(remaining);
    }

    public ReconciliationDocument updateAdjustment(UUID entryId, UnaryOperator<AdjustmentEntry> change) {
        boolean found = false;
        List<AdjustmentEntry> updated = new ArrayList<>(adjustments.size());
        for (AdjustmentEntry entry : adjustments) {
            if (entry.getId().equals(entryId)) {
                updated.add(change.apply(entry));
                found = true;
            } else {
                updated.add(entry);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("Adjustment not found: " + entryId);
        }
        return withAdjustments(updated);
    }

    public ReconciliationDocument withClosingBankBalance(BigDecimal balance) {
        return toBuilder().closingBankBalance(Objects.requireNonNull(balance)).summary(null)
            .updatedAt(Instant.now()).build();
    }

    public ReconciliationDocument withClosingLedgerBalance(BigDecimal balance, Instant fetchedAt) {
        return toBuilder().closingLedgerBalance(Objects.requireNonNull(balance)).ledgerBalanceFetchedAt(fetchedAt)
            .summary(null).updatedAt(Instant.now()).build();
    }

    public ReconciliationDocument withNotes(String notes) {
        return toBuilder().notes(notes).updatedAt(Instant.now()).build();
    }

    public ReconciliationDocument withSummary(ReconciliationSummary summary) {
        return toBuilder().summary(summary).build();
    }

    /**
     * Moves the document to {@code target} and stamps the actor. Guards are
     * evaluated by the workflow before this is called.
     */
    public ReconciliationDocument transitionTo(ReconciliationStatus target, String actorId, Instant at) {
        List<WorkflowStamp> stamped = new ArrayList<>(history);
        stamped.add(stamp(target, actorId, at));
        return toBuilder().status(target).history(List.copyOf(stamped)).updatedAt(at).build();
    }

    private static WorkflowStamp stamp(ReconciliationStatus status, String actorId, Instant at) {
        return WorkflowStamp.builder()
            .status(status.name())
            .action(status.action())
            .actorId(actorId)
            .at(at)
            .build();
    }
}
