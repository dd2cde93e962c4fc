package com.flagship.reconciliation_engine.balance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Grand totals of a withholding-tax filing.
 */
@Value
@Builder
public class FilingTotals {
    int transactionCount;
    BigDecimal grossAmount;
    BigDecimal withheldAmount;
    /** gross - withheld */
    BigDecimal netPayable;
    BigDecimal depositedAmount;
    /** withheld - deposited */
    BigDecimal variance;
}
