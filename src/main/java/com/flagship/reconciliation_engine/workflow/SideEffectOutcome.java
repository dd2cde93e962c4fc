package com.flagship.reconciliation_engine.workflow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * What happened to a transition's ledger posting. Reported separately from the
 * status change, which stands even when the posting failed.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SideEffectOutcome {
    PostingStatus status;
    String ledgerReference;
    UUID ledgerTransactionId;
    String failureReason;
    Instant attemptedAt;

    public static SideEffectOutcome notRequested() {
        return SideEffectOutcome.builder().status(PostingStatus.NOT_REQUESTED).build();
    }

    public static SideEffectOutcome pending(String reference, Instant at) {
        return SideEffectOutcome.builder()
            .status(PostingStatus.PENDING)
            .ledgerReference(reference)
            .attemptedAt(at)
            .build();
    }

    public SideEffectOutcome posted(UUID transactionId) {
        return toBuilder().status(PostingStatus.POSTED).ledgerTransactionId(transactionId).build();
    }

    public SideEffectOutcome failed(String reason) {
        return toBuilder().status(PostingStatus.FAILED).failureReason(reason).build();
    }

    /**
     * Reported to the caller when an earlier attempt exists; never stored.
     */
    public SideEffectOutcome skipped() {
        return toBuilder().status(PostingStatus.SKIPPED_ALREADY_ATTEMPTED).build();
    }

    @JsonIgnore
    public boolean isAttempted() {
        return status == PostingStatus.PENDING || status == PostingStatus.POSTED || status == PostingStatus.FAILED;
    }
}
