package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.common.SourceRecord;
import com.flagship.reconciliation_engine.common.WorkflowStamp;
import com.flagship.reconciliation_engine.workflow.SideEffectOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A withholding-tax statement for one company and month.
 *
 * Immutable like {@link com.flagship.reconciliation_engine.reconciliation.ReconciliationDocument}:
 * record changes drop the summary until the document is recomputed.
 */
@Value
@Builder(toBuilder = true)
public class FilingDocument {
    UUID id;
    String companyId;
    FilingType filingType;
    FilingPeriod period;

    /** Vendor payments and payroll deductions, each carrying its withheld amount. */
    List<SourceRecord> records;
    FilingSummary summary;

    SubmissionMetadata submission;
    SideEffectOutcome postingOutcome;

    FilingStatus status;
    List<WorkflowStamp> history;
    String notes;
    Instant createdAt;
    Instant updatedAt;
    Long version;

    public static FilingDocument create(String companyId, FilingType filingType, FilingPeriod period, String actorId) {
        Instant now = Instant.now();
        return FilingDocument.builder()
            .id(UUID.randomUUID())
            .companyId(Objects.requireNonNull(companyId))
            .filingType(Objects.requireNonNull(filingType))
            .period(Objects.requireNonNull(period))
            .records(List.of())
            .postingOutcome(SideEffectOutcome.notRequested())
            .status(FilingStatus.DRAFT)
            .history(List.of(stamp(FilingStatus.DRAFT, actorId, now)))
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Amount paid to the tax authority, zero until a submission carries a payment.
     */
    public BigDecimal depositedAmount() {
        if (submission == null || submission.getPayment() == null || submission.getPayment().getAmount() == null) {
            return BigDecimal.ZERO;
        }
        return submission.getPayment().getAmount();
    }

    public boolean isRecomputed() {
        return summary != null;
    }

    public FilingDocument withRecords(List<SourceRecord> updated) {
        return toBuilder().records(List.copyOf(updated)).summary(null).updatedAt(Instant.now()).build();
    }

    public FilingDocument addRecords(List<SourceRecord> added) {
        List<SourceRecord> all = new ArrayList<>(records);
        all.addAll(added);
        return withRecords(all);
    }

    public FilingDocument removeRecord(UUID recordId) {
        List<SourceRecord> remaining = records.stream()
            .filter(r -> !r.getId().equals(recordId))
            .toList();
        if (remaining.size() == records.size()) {
            throw new IllegalArgumentException("Record not found: " + recordId);
        }
        return withRecords(remaining);
    }

    public FilingDocument withSummary(FilingSummary summary) {
        return toBuilder().summary(summary).build();
    }

    public FilingDocument withSubmission(SubmissionMetadata submission) {
        return toBuilder().submission(submission).summary(null).build();
    }

    public FilingDocument withPostingOutcome(SideEffectOutcome outcome) {
        return toBuilder().postingOutcome(outcome).build();
    }

    public FilingDocument transitionTo(FilingStatus target, String actorId, Instant at) {
        List<WorkflowStamp> stamped = new ArrayList<>(history);
        stamped.add(stamp(target, actorId, at));
        return toBuilder().status(target).history(List.copyOf(stamped)).updatedAt(at).build();
    }

    private static WorkflowStamp stamp(FilingStatus status, String actorId, Instant at) {
        return WorkflowStamp.builder()
            .status(status.name())
            .action(status.action())
            .actorId(actorId)
            .at(at)
            .build();
    }
}
