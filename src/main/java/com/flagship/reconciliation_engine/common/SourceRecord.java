package com.flagship.reconciliation_engine.common;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An ingested financial fact: a bank statement line, a vendor payment,
 * a payroll deduction or a manually entered reconciling item.
 *
 * Immutable once ingested. The engine classifies and sums these records but
 * never changes them.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SourceRecord {
    UUID id;
    /** Signed, at most 2 fractional digits. */
    BigDecimal amount;
    Instant timestamp;
    String descriptor;
    /** Explicit category tag; wins over anything inferred from text. */
    String categoryTag;
    SourceOrigin origin;
    String originReference;
    /** Payee name or tax number, when the origin has one. */
    String counterparty;
    /** Tax withheld at source; only meaningful for withholding-tax records. */
    BigDecimal withheldAmount;

    public boolean hasCategoryTag() {
        return categoryTag != null && !categoryTag.isBlank();
    }

    /**
     * Text the classifier searches when no tag matches.
     */
    public String searchableText() {
        StringBuilder text = new StringBuilder();
        if (descriptor != null) {
            text.append(descriptor);
        }
        if (originReference != null) {
            text.append(' ').append(originReference);
        }
        return text.toString();
    }
}
