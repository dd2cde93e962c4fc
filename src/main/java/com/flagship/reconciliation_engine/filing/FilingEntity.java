package com.flagship.reconciliation_engine.filing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flagship.reconciliation_engine.balance.FilingTotals;
import com.flagship.reconciliation_engine.common.SourceRecord;
import com.flagship.reconciliation_engine.common.WorkflowStamp;
import com.flagship.reconciliation_engine.config.JsonCodec;
import com.flagship.reconciliation_engine.workflow.SideEffectOutcome;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for a tax filing. Totals columns are a snapshot for reporting;
 * the summary is always rebuilt from the records on load.
 */
@Entity
@Table(
    name = "filings",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_filings_company_type_period",
        columnNames = {"company_id", "filing_type", "period_year", "period_month"}),
    indexes = {
        @Index(name = "idx_filings_company_fiscal_year", columnList = "company_id, fiscal_year"),
        @Index(name = "idx_filings_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FilingEntity {

    private static final TypeReference<List<SourceRecord>> RECORDS = new TypeReference<>() { };
    private static final TypeReference<List<WorkflowStamp>> HISTORY = new TypeReference<>() { };

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false, length = 64)
    private String companyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "filing_type", nullable = false, updatable = false, length = 30)
    private FilingType filingType;

    @Column(name = "period_year", nullable = false, updatable = false)
    private int periodYear;

    @Column(name = "period_month", nullable = false, updatable = false)
    private int periodMonth;

    @Column(name = "fiscal_year", nullable = false, updatable = false, length = 9)
    private String fiscalYear;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Column(name = "records", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String records;

    @Column(name = "submission", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String submission;

    @Column(name = "posting_outcome", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String postingOutcome;

    @Column(name = "transaction_count", nullable = false)
    private int transactionCount;

    @Column(name = "total_gross", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalGross;

    @Column(name = "total_withheld", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalWithheld;

    @Column(name = "total_deposited", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalDeposited;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private FilingStatus status;

    @Column(name = "history", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String history;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

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

    static FilingEntity fromDomain(FilingDocument document, JsonCodec json) {
        FilingEntity entity = new FilingEntity();
        entity.id = document.getId();
        entity.companyId = document.getCompanyId();
        entity.filingType = document.getFilingType();
        entity.periodYear = document.getPeriod().getYear();
        entity.periodMonth = document.getPeriod().getMonth();
        entity.fiscalYear = document.getPeriod().fiscalYear().label();
        entity.dueDate = document.getPeriod().dueDate();
        entity.createdAt = document.getCreatedAt();
        entity.updateFromDomain(document, json);
        return entity;
    }

    void updateFromDomain(FilingDocument document, JsonCodec json) {
        if (!document.isRecomputed()) {
            throw new IllegalStateException("Filing " + document.getId() + " must be recomputed before saving");
        }
        this.records = json.write(document.getRecords());
        this.submission = document.getSubmission() == null ? null : json.write(document.getSubmission());
        this.postingOutcome = json.write(document.getPostingOutcome());
        this.status = document.getStatus();
        this.history = json.write(document.getHistory());
        this.notes = document.getNotes();
        this.updatedAt = document.getUpdatedAt();

        FilingTotals totals = document.getSummary().getTotals();
        this.transactionCount = totals.getTransactionCount();
        this.totalGross = totals.getGrossAmount();
        this.totalWithheld = totals.getWithheldAmount();
        this.totalDeposited = totals.getDepositedAmount();
    }

    /**
     * Narrow update used once a ledger posting completes, independent of
     * whatever else happened to the filing meanwhile.
     */
    void updatePostingOutcome(SideEffectOutcome outcome, JsonCodec json) {
        this.postingOutcome = json.write(outcome);
    }

    FilingDocument toDomain(JsonCodec json) {
        return FilingDocument.builder()
            .id(id)
            .companyId(companyId)
            .filingType(filingType)
            .period(FilingPeriod.of(periodYear, periodMonth))
            .records(List.copyOf(json.read(records, RECORDS)))
            .submission(json.read(submission, SubmissionMetadata.class))
            .postingOutcome(json.read(postingOutcome, SideEffectOutcome.class))
            .status(status)
            .history(List.copyOf(json.read(history, HISTORY)))
            .notes(notes)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .version(version)
            .build();
    }
}
