package com.flagship.reconciliation_engine.ledger;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.UUID;

/**
 * Opens chart-of-accounts rows for integration tests. The engine itself only
 * reads accounts.
 */
public final class LedgerTestAccounts {

    private LedgerTestAccounts() {
    }

    /**
     * Inserts the account unless one with the same number already exists.
     */
    public static void ensureAccount(JdbcTemplate jdbcTemplate, String accountNumber, String name,
                                     Account.AccountType accountType) {
        jdbcTemplate.update(
            "INSERT INTO accounts (id, account_number, name, account_type) VALUES (?, ?, ?, ?) " +
            "ON CONFLICT (account_number) DO NOTHING",
            UUID.randomUUID(), accountNumber, name, accountType.name());
    }
}
