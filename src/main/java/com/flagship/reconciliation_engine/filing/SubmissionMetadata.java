package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.workflow.PaymentMetadata;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * What the tax authority and the bank returned for a submitted filing.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SubmissionMetadata {
    Instant submittedAt;
    String submittedBy;
    PaymentMetadata payment;
    String acknowledgementNumber;
    Instant acknowledgedAt;
}
