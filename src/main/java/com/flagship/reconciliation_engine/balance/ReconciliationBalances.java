package com.flagship.reconciliation_engine.balance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived balances of a bank reconciliation.
 *
 * {@code closingLedgerBalance}, {@code adjustedLedgerBalance} and {@code variance}
 * stay null until the ledger balance is known.
 */
@Value
@Builder
public class ReconciliationBalances {
    BigDecimal closingBankBalance;
    BigDecimal closingLedgerBalance;

    BigDecimal depositsInTransit;
    BigDecimal outstandingChecks;
    BigDecimal unpostedInterest;
    BigDecimal unpostedBankCharges;
    BigDecimal unpostedReturnedChecks;
    /** Bank or ledger errors awaiting correction; reported, not part of the equation. */
    BigDecimal unresolvedErrors;

    BigDecimal adjustedBankBalance;
    BigDecimal adjustedLedgerBalance;
    BigDecimal variance;
    boolean reconciled;

    public boolean isLedgerBalanceKnown() {
        return closingLedgerBalance != null;
    }
}
