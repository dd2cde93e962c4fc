package com.flagship.reconciliation_engine.common;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Source record as supplied by the ingestion collaborator, before validation.
 * Amounts are still text so that non-numeric input can be reported per field.
 */
@Value
@Builder(toBuilder = true)
public class RawSourceRecord {

    static final String AMOUNT_PATTERN = "^-?\\d{1,15}(\\.\\d{1,2})?$";

    @NotBlank(message = "Amount is required")
    @Pattern(regexp = AMOUNT_PATTERN, message = "Amount must be numeric with at most 2 decimal places")
    String amount;

    @NotNull(message = "Timestamp is required")
    Instant timestamp;

    @NotBlank(message = "Descriptor is required")
    String descriptor;

    String categoryTag;

    @NotNull(message = "Origin is required")
    SourceOrigin origin;

    String originReference;

    String counterparty;

    @Pattern(regexp = AMOUNT_PATTERN, message = "Withheld amount must be numeric with at most 2 decimal places")
    String withheldAmount;
}
