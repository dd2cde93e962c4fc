package com.flagship.reconciliation_engine.ledger;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The general ledger as seen by the engine: read posted entries, post new ones.
 *
 * Implementations report infrastructure trouble as
 * {@link com.flagship.reconciliation_engine.exception.DependencyUnavailableException}.
 */
public interface LedgerGateway {

    Optional<Account> findAccount(String accountRef);

    /**
     * Posted entries on the account dated on or before {@code asOf}.
     */
    List<PostedLine> findPostedLines(String accountRef, LocalDate asOf);

    /**
     * @return the ledger transaction id; the existing one if the reference was already posted
     * @throws IllegalArgumentException if the entry is unbalanced or names an unknown account
     */
    UUID post(LedgerPostingRequest request);
}
