package com.flagship.reconciliation_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A chart-of-accounts entry, addressed by its account number.
 */
@Value
public class Account {
    UUID id;
    String accountNumber;
    String name;
    AccountType accountType;

    public enum AccountType {
        ASSET(true),
        EXPENSE(true),
        LIABILITY(false),
        EQUITY(false),
        REVENUE(false);

        private final boolean debitNormal;

        AccountType(boolean debitNormal) {
            this.debitNormal = debitNormal;
        }

        public boolean isDebitNormal() {
            return debitNormal;
        }

        /**
         * Balance in the account's natural sign.
         * Debit-normal (ASSET, EXPENSE): debits - credits.
         * Credit-normal (LIABILITY, EQUITY, REVENUE): credits - debits.
         */
        public BigDecimal signedBalance(BigDecimal debits, BigDecimal credits) {
            return debitNormal ? debits.subtract(credits) : credits.subtract(debits);
        }
    }
}
