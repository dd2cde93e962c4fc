package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.classification.WhtSection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Tax withheld from one payee across a fiscal year.
 */
@Value
@Builder
public class PayeeWhtTotal {
    String counterparty;
    int transactionCount;
    BigDecimal totalGross;
    BigDecimal totalWithheld;
    List<Deduction> deductions;

    @Value
    public static class Deduction {
        Instant paidAt;
        BigDecimal grossAmount;
        BigDecimal withheldAmount;
        WhtSection section;
    }
}
