package com.flagship.reconciliation_engine.ledger;

import com.flagship.reconciliation_engine.exception.DependencyUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link LedgerGateway} over the relational ledger tables.
 *
 * Enforces the ledger invariants on posting:
 * 1. Debits must equal credits
 * 2. Every line's account must exist
 * 3. A reference is posted at most once
 *
 * Balances are derived from entries, never stored. Only POSTED transactions count.
 */
@Service
@Slf4j
public class JdbcLedgerGateway implements LedgerGateway {

    private final JdbcTemplate jdbcTemplate;

    public JdbcLedgerGateway(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Account> findAccount(String accountRef) {
        return translate("account lookup", () -> jdbcTemplate.query(
            "SELECT id, account_number, name, account_type FROM accounts WHERE account_number = ?",
            accountRowMapper(),
            accountRef
        ).stream().findFirst());
    }

    @Override
    public List<PostedLine> findPostedLines(String accountRef, LocalDate asOf) {
        return translate("posted entries query", () -> jdbcTemplate.query(
            "SELECT e.entry_type, e.amount " +
            "FROM ledger_entries e " +
            "JOIN ledger_transactions t ON t.id = e.transaction_id " +
            "JOIN accounts a ON a.id = e.account_id " +
            "WHERE a.account_number = ? AND t.status = 'POSTED' AND t.entry_date <= ?",
            (rs, rowNum) -> PostedLine.of(EntryType.valueOf(rs.getString("entry_type")), rs.getBigDecimal("amount")),
            accountRef,
            Date.valueOf(asOf)
        ));
    }

    /**
     * Posts a journal entry.
     *
     * @throws IllegalArgumentException if the entry is not balanced or an account is unknown
     */
    @Override
    @Transactional
    public UUID post(LedgerPostingRequest request) {
        if (!request.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Transaction is not balanced: debits=%s, credits=%s",
                    request.getDebitTotal(), request.getCreditTotal()));
        }

        Optional<UUID> existing = findTransactionByReference(request.getReference());
        if (existing.isPresent()) {
            log.info("Ledger reference {} already posted as {}", request.getReference(), existing.get());
            return existing.get();
        }

        Map<String, UUID> accountIds = resolveAccounts(request);

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, reference, entry_date, description, status, created_at) " +
            "VALUES (?, ?, ?, ?, 'POSTED', CURRENT_TIMESTAMP)",
            transactionId,
            request.getReference(),
            Date.valueOf(request.getEntryDate()),
            request.getDescription()
        );

        for (LedgerPostingRequest.Line line : request.getLines()) {
            jdbcTemplate.update(
                "INSERT INTO ledger_entries (id, transaction_id, account_id, amount, entry_type, description, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
                UUID.randomUUID(),
                transactionId,
                accountIds.get(line.getAccountRef()),
                line.amount(),
                line.entryType().name(),
                line.getDescription()
            );
        }

        log.info("Posted ledger transaction {} reference={} amount={}",
            transactionId, request.getReference(), request.getDebitTotal());
        return transactionId;
    }

    private Optional<UUID> findTransactionByReference(String reference) {
        return jdbcTemplate.query(
            "SELECT id FROM ledger_transactions WHERE reference = ?",
            (rs, rowNum) -> UUID.fromString(rs.getString("id")),
            reference
        ).stream().findFirst();
    }

    private Map<String, UUID> resolveAccounts(LedgerPostingRequest request) {
        Map<String, UUID> ids = new LinkedHashMap<>();
        for (LedgerPostingRequest.Line line : request.getLines()) {
            if (ids.containsKey(line.getAccountRef())) {
                continue;
            }
            Account account = findAccount(line.getAccountRef())
                .orElseThrow(() -> new IllegalArgumentException("Account not found: " + line.getAccountRef()));
            ids.put(line.getAccountRef(), account.getId());
        }
        return ids;
    }

    private <T> T translate(String operation, Supplier<T> query) {
        try {
            return query.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
            throw new DependencyUnavailableException("Ledger " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            UUID.fromString(rs.getString("id")),
            rs.getString("account_number"),
            rs.getString("name"),
            Account.AccountType.valueOf(rs.getString("account_type"))
        );
    }
}
