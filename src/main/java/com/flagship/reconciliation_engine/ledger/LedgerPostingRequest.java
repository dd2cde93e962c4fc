package com.flagship.reconciliation_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A journal entry to post: balanced lines under a unique reference.
 *
 * Invariant: sum of debits equals sum of credits.
 */
@Value
public class LedgerPostingRequest {
    /** Unique; posting the same reference twice returns the first transaction. */
    String reference;
    LocalDate entryDate;
    String description;
    List<Line> lines;

    public LedgerPostingRequest(String reference, LocalDate entryDate, String description, List<Line> lines) {
        this.reference = Objects.requireNonNull(reference);
        this.entryDate = Objects.requireNonNull(entryDate);
        this.description = description;
        this.lines = List.copyOf(lines);
    }

    public boolean isBalanced() {
        return getDebitTotal().compareTo(getCreditTotal()) == 0;
    }

    public BigDecimal getDebitTotal() {
        return lines.stream()
            .map(Line::getDebit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return lines.stream()
            .map(Line::getCredit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * One side of the entry. Exactly one of debit and credit is positive.
     */
    @Value
    public static class Line {
        String accountRef;
        BigDecimal debit;
        BigDecimal credit;
        String description;

        private Line(String accountRef, BigDecimal debit, BigDecimal credit, String description) {
            this.accountRef = Objects.requireNonNull(accountRef);
            if (debit.signum() < 0 || credit.signum() < 0 || (debit.signum() > 0) == (credit.signum() > 0)) {
                throw new IllegalArgumentException("A line must carry exactly one positive side");
            }
            this.debit = debit;
            this.credit = credit;
            this.description = description;
        }

        public static Line debit(String accountRef, BigDecimal amount, String description) {
            return new Line(accountRef, amount, BigDecimal.ZERO, description);
        }

        public static Line credit(String accountRef, BigDecimal amount, String description) {
            return new Line(accountRef, BigDecimal.ZERO, amount, description);
        }

        public EntryType entryType() {
            return debit.signum() > 0 ? EntryType.DEBIT : EntryType.CREDIT;
        }

        public BigDecimal amount() {
            return debit.signum() > 0 ? debit : credit;
        }
    }
}
