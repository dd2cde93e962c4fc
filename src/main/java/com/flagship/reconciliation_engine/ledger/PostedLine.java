package com.flagship.reconciliation_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One posted entry touching an account, as a debit/credit pair with one side zero.
 */
@Value
public class PostedLine {
    BigDecimal debit;
    BigDecimal credit;

    public static PostedLine of(EntryType type, BigDecimal amount) {
        return type == EntryType.DEBIT
            ? new PostedLine(amount, BigDecimal.ZERO)
            : new PostedLine(BigDecimal.ZERO, amount);
    }
}
