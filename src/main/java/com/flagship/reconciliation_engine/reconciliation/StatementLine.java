package com.flagship.reconciliation_engine.reconciliation;

import com.flagship.reconciliation_engine.common.SourceRecord;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * A bank statement line and how far it has been matched to the ledger.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StatementLine {
    SourceRecord record;
    @Builder.Default
    MatchStatus matchStatus = MatchStatus.UNMATCHED;
    /** Ledger entry reference the line was matched against. */
    String matchedReference;
    String remarks;

    public static StatementLine unmatched(SourceRecord record) {
        return StatementLine.builder().record(record).build();
    }

    @JsonIgnore
    public UUID getId() {
        return record.getId();
    }
}
