package com.flagship.reconciliation_engine.reconciliation;

import com.flagship.reconciliation_engine.common.SourceRecord;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A reconciling item: deposit in transit, outstanding check, bank charge,
 * interest, returned check or error.
 *
 * Once {@code glPosted} is set the entry is already reflected in the closing
 * ledger balance and no longer adjusts the ledger side.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AdjustmentEntry {
    SourceRecord record;
    boolean glPosted;
    String journalReference;

    public static AdjustmentEntry unposted(SourceRecord record) {
        return AdjustmentEntry.builder().record(record).build();
    }

    @JsonIgnore
    public UUID getId() {
        return record.getId();
    }

    /** The share of this entry still missing from the ledger. */
    public BigDecimal unpostedAmount() {
        return glPosted ? BigDecimal.ZERO : record.getAmount();
    }

    public AdjustmentEntry markPosted(String journalReference) {
        if (glPosted) {
            throw new IllegalStateException("Adjustment " + getId() + " is already posted");
        }
        return toBuilder().glPosted(true).journalReference(journalReference).build();
    }
}
