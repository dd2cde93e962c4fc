package com.flagship.reconciliation_engine.balance;

import com.flagship.reconciliation_engine.reconciliation.MatchStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Totals over the imported bank statement lines.
 */
@Value
@Builder
public class StatementSummary {
    int totalLines;
    Map<MatchStatus, Integer> linesByStatus;
    BigDecimal totalCredits;
    BigDecimal totalDebits;
    BigDecimal netMovement;
    /**
     * {@code closingBank - (openingBank + netMovement)}. Non-zero means lines are
     * missing from the import or the opening balance is wrong.
     */
    BigDecimal continuityDifference;

    public int countOf(MatchStatus status) {
        return linesByStatus.getOrDefault(status, 0);
    }
}
