package com.flagship.reconciliation_engine.balance;

import com.flagship.reconciliation_engine.aggregation.AggregationResult;
import com.flagship.reconciliation_engine.classification.ReconciliationCategory;
import com.flagship.reconciliation_engine.classification.WhtSection;
import com.flagship.reconciliation_engine.common.Amounts;
import com.flagship.reconciliation_engine.reconciliation.MatchStatus;
import com.flagship.reconciliation_engine.reconciliation.StatementLine;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.flagship.reconciliation_engine.classification.ReconciliationCategory.*;

/**
 * Derives balances from aggregated buckets.
 *
 * Reconciliation:
 * <pre>
 * adjustedBank   = CB + DIT - OC
 * adjustedLedger = CL + INT - BC - RC
 * variance       = round2(adjustedBank - adjustedLedger)
 * reconciled     = |variance| &lt; 0.01
 * </pre>
 * INT, BC and RC are the secondary sums of their buckets, which only carry
 * entries not yet posted to the ledger. Posted entries are already in CL.
 */
@Component
public class BalanceEngine {

    public ReconciliationBalances reconcile(BigDecimal closingBankBalance,
                                            BigDecimal closingLedgerBalance,
                                            AggregationResult<ReconciliationCategory> adjustments) {
        if (closingBankBalance == null) {
            throw new IllegalArgumentException("Closing bank balance is required");
        }

        BigDecimal dit = adjustments.grossOf(DEPOSITS_IN_TRANSIT);
        BigDecimal oc = adjustments.grossOf(OUTSTANDING_CHECKS);
        BigDecimal interest = adjustments.secondaryOf(INTEREST_EARNED);
        BigDecimal charges = adjustments.secondaryOf(BANK_CHARGES);
        BigDecimal returned = adjustments.secondaryOf(RETURNED_CHECKS);

        BigDecimal adjustedBank = Amounts.round2(closingBankBalance.add(dit).subtract(oc));

        ReconciliationBalances.ReconciliationBalancesBuilder balances = ReconciliationBalances.builder()
            .closingBankBalance(Amounts.round2(closingBankBalance))
            .depositsInTransit(dit)
            .outstandingChecks(oc)
            .unpostedInterest(interest)
            .unpostedBankCharges(charges)
            .unpostedReturnedChecks(returned)
            .unresolvedErrors(adjustments.grossOf(ERRORS))
            .adjustedBankBalance(adjustedBank);

        if (closingLedgerBalance == null) {
            // Unknown is not zero: without the ledger side nothing can be reconciled.
            return balances.reconciled(false).build();
        }

        BigDecimal adjustedLedger = Amounts.round2(
            closingLedgerBalance.add(interest).subtract(charges).subtract(returned));
        BigDecimal variance = Amounts.round2(adjustedBank.subtract(adjustedLedger));

        return balances
            .closingLedgerBalance(Amounts.round2(closingLedgerBalance))
            .adjustedLedgerBalance(adjustedLedger)
            .variance(variance)
            .reconciled(variance.abs().compareTo(Amounts.CENT) < 0)
            .build();
    }

    public StatementSummary summarizeStatement(BigDecimal openingBankBalance,
                                               BigDecimal closingBankBalance,
                                               List<StatementLine> lines) {
        Map<MatchStatus, Integer> byStatus = new EnumMap<>(MatchStatus.class);
        for (MatchStatus status : MatchStatus.values()) {
            byStatus.put(status, 0);
        }

        BigDecimal credits = Amounts.zero();
        BigDecimal debits = Amounts.zero();
        for (StatementLine line : lines) {
            byStatus.merge(line.getMatchStatus(), 1, Integer::sum);
            BigDecimal amount = line.getRecord().getAmount();
            if (amount.signum() >= 0) {
                credits = Amounts.accumulate(credits, amount);
            } else {
                debits = Amounts.accumulate(debits, amount.negate());
            }
        }

        BigDecimal net = credits.subtract(debits);
        BigDecimal continuity = Amounts.orZero(closingBankBalance)
            .subtract(Amounts.orZero(openingBankBalance).add(net));

        return StatementSummary.builder()
            .totalLines(lines.size())
            .linesByStatus(byStatus)
            .totalCredits(Amounts.round2(credits))
            .totalDebits(Amounts.round2(debits))
            .netMovement(Amounts.round2(net))
            .continuityDifference(Amounts.round2(continuity))
            .build();
    }

    public FilingTotals filingTotals(AggregationResult<WhtSection> sections, BigDecimal depositedAmount) {
        BigDecimal gross = sections.getGrossTotal();
        BigDecimal withheld = sections.getSecondaryTotal();
        BigDecimal deposited = Amounts.round2(depositedAmount);

        return FilingTotals.builder()
            .transactionCount(sections.getTotalCount())
            .grossAmount(gross)
            .withheldAmount(withheld)
            .netPayable(gross.subtract(withheld))
            .depositedAmount(deposited)
            .variance(withheld.subtract(deposited))
            .build();
    }
}
