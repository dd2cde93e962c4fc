package com.flagship.reconciliation_engine.reconciliation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flagship.reconciliation_engine.balance.ReconciliationBalances;
import com.flagship.reconciliation_engine.common.WorkflowStamp;
import com.flagship.reconciliation_engine.config.JsonCodec;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for a reconciliation.
 *
 * Inputs are stored as columns and JSON; the derived balances are stored too,
 * as a queryable snapshot of the last recomputation. On load the summary is
 * rebuilt from the inputs, never read back from these columns.
 *
 * No setters: state changes go through {@link #updateFromDomain}.
 */
@Entity
@Table(
    name = "reconciliations",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_reconciliations_account_period",
        columnNames = {"company_id", "account_ref", "period"}),
    indexes = {
        @Index(name = "idx_reconciliations_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReconciliationEntity {

    private static final TypeReference<List<StatementLine>> LINES = new TypeReference<>() { };
    private static final TypeReference<List<AdjustmentEntry>> ADJUSTMENTS = new TypeReference<>() { };
    private static final TypeReference<List<WorkflowStamp>> HISTORY = new TypeReference<>() { };

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false, length = 64)
    private String companyId;

    @Column(name = "account_ref", nullable = false, updatable = false, length = 64)
    private String accountRef;

    @Column(name = "period", nullable = false, updatable = false, length = 7)
    private String period;

    @Column(name = "fiscal_year", nullable = false, updatable = false, length = 9)
    private String fiscalYear;

    @Column(name = "reconciliation_date", nullable = false)
    private LocalDate reconciliationDate;

    @Column(name = "opening_bank_balance", precision = 19, scale = 4)
    private BigDecimal openingBankBalance;

    @Column(name = "closing_bank_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal closingBankBalance;

    @Column(name = "opening_ledger_balance", precision = 19, scale = 4)
    private BigDecimal openingLedgerBalance;

    @Column(name = "closing_ledger_balance", precision = 19, scale = 4)
    private BigDecimal closingLedgerBalance;

    @Column(name = "ledger_balance_fetched_at")
    private Instant ledgerBalanceFetchedAt;

    @Column(name = "statement_lines", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String statementLines;

    @Column(name = "adjustments", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String adjustments;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "adjusted_bank_balance", precision = 19, scale = 4)
    private BigDecimal adjustedBankBalance;

    @Column(name = "adjusted_ledger_balance", precision = 19, scale = 4)
    private BigDecimal adjustedLedgerBalance;

    @Column(name = "variance", precision = 19, scale = 4)
    private BigDecimal variance;

    @Column(name = "is_reconciled", nullable = false)
    private boolean reconciled;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReconciliationStatus status;

    @Column(name = "history", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String history;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * The only way to create an entity. The document must have been recomputed.
     */
    static ReconciliationEntity fromDomain(ReconciliationDocument document, JsonCodec json) {
        ReconciliationEntity entity = new ReconciliationEntity();
        entity.id = document.getId();
        entity.companyId = document.getCompanyId();
        entity.accountRef = document.getAccountRef();
        entity.period = document.getPeriod().toString();
        entity.fiscalYear = document.getFiscalYear();
        entity.createdAt = document.getCreatedAt();
        entity.updateFromDomain(document, json);
        return entity;
    }

    /**
     * Copies mutable state. Identity, period and creation time never change.
     */
    void updateFromDomain(ReconciliationDocument document, JsonCodec json) {
        if (!document.isRecomputed()) {
            throw new IllegalStateException("Reconciliation " + document.getId() + " must be recomputed before saving");
        }
        this.reconciliationDate = document.getReconciliationDate();
        this.openingBankBalance = document.getOpeningBankBalance();
        this.closingBankBalance = document.getClosingBankBalance();
        this.openingLedgerBalance = document.getOpeningLedgerBalance();
        this.closingLedgerBalance = document.getClosingLedgerBalance();
        this.ledgerBalanceFetchedAt = document.getLedgerBalanceFetchedAt();
        this.statementLines = json.write(document.getStatementLines());
        this.adjustments = json.write(document.getAdjustments());
        this.notes = document.getNotes();
        this.status = document.getStatus();
        this.history = json.write(document.getHistory());
        this.updatedAt = document.getUpdatedAt();

        ReconciliationBalances balances = document.getSummary().getBalances();
        this.adjustedBankBalance = balances.getAdjustedBankBalance();
        this.adjustedLedgerBalance = balances.getAdjustedLedgerBalance();
        this.variance = balances.getVariance();
        this.reconciled = balances.isReconciled();
    }

    /**
     * Rebuilds the inputs; the caller recomputes the summary.
     */
    ReconciliationDocument toDomain(JsonCodec json) {
        return ReconciliationDocument.builder()
            .id(id)
            .companyId(companyId)
            .accountRef(accountRef)
            .period(YearMonth.parse(period))
            .fiscalYear(fiscalYear)
            .reconciliationDate(reconciliationDate)
            .openingBankBalance(openingBankBalance)
            .closingBankBalance(closingBankBalance)
            .openingLedgerBalance(openingLedgerBalance)
            .closingLedgerBalance(closingLedgerBalance)
            .ledgerBalanceFetchedAt(ledgerBalanceFetchedAt)
            .statementLines(List.copyOf(json.read(statementLines, LINES)))
            .adjustments(List.copyOf(json.read(adjustments, ADJUSTMENTS)))
            .notes(notes)
            .status(status)
            .history(List.copyOf(json.read(history, HISTORY)))
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .version(version)
            .build();
    }
}
