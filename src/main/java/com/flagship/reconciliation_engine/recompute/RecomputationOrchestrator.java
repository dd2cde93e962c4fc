package com.flagship.reconciliation_engine.recompute;

import com.flagship.reconciliation_engine.aggregation.AggregationResult;
import com.flagship.reconciliation_engine.aggregation.Aggregator;
import com.flagship.reconciliation_engine.aggregation.CategoryBucket;
import com.flagship.reconciliation_engine.aggregation.Contribution;
import com.flagship.reconciliation_engine.balance.BalanceEngine;
import com.flagship.reconciliation_engine.balance.FilingTotals;
import com.flagship.reconciliation_engine.balance.ReconciliationBalances;
import com.flagship.reconciliation_engine.balance.StatementSummary;
import com.flagship.reconciliation_engine.classification.CategoryClassifier;
import com.flagship.reconciliation_engine.classification.CategoryKey;
import com.flagship.reconciliation_engine.classification.ReconciliationCategory;
import com.flagship.reconciliation_engine.classification.ReconciliationRuleSets;
import com.flagship.reconciliation_engine.classification.RuleSet;
import com.flagship.reconciliation_engine.classification.WhtRuleSets;
import com.flagship.reconciliation_engine.classification.WhtSection;
import com.flagship.reconciliation_engine.common.Amounts;
import com.flagship.reconciliation_engine.common.SourceRecord;
import com.flagship.reconciliation_engine.exception.RoundingInvariantViolation;
import com.flagship.reconciliation_engine.filing.FilingDocument;
import com.flagship.reconciliation_engine.filing.FilingSummary;
import com.flagship.reconciliation_engine.reconciliation.AdjustmentEntry;
import com.flagship.reconciliation_engine.reconciliation.ReconciliationDocument;
import com.flagship.reconciliation_engine.reconciliation.ReconciliationSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Rebuilds a document's derived fields from its inputs.
 *
 * Always from scratch: the previous summary is discarded, every record is
 * classified again and all sums are recomputed. After each run the totals are
 * checked against the raw records; a mismatch is a bug and is thrown as
 * {@link RoundingInvariantViolation}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecomputationOrchestrator {

    private final CategoryClassifier classifier;
    private final Aggregator aggregator;
    private final BalanceEngine balanceEngine;

    public ReconciliationDocument recompute(ReconciliationDocument document) {
        return recompute(document, ReconciliationRuleSets.DEFAULT);
    }

    public ReconciliationDocument recompute(ReconciliationDocument document, RuleSet<ReconciliationCategory> rules) {
        List<AdjustmentEntry> entries = document.getAdjustments();
        Map<UUID, ReconciliationCategory> classifications = new LinkedHashMap<>();
        List<Contribution<ReconciliationCategory>> contributions = new ArrayList<>(entries.size());

        for (AdjustmentEntry entry : entries) {
            ReconciliationCategory category = classifier.classify(entry.getRecord(), rules);
            classifications.put(entry.getId(), category);
            contributions.add(Contribution.of(category, entry.getRecord().getAmount(), entry.unpostedAmount()));
        }

        AggregationResult<ReconciliationCategory> aggregated =
            aggregator.aggregate(ReconciliationCategory.class, contributions);
        verifyTotals(document.getId(), aggregated, entries,
            e -> e.getRecord().getAmount(), AdjustmentEntry::unpostedAmount);

        ReconciliationBalances balances = balanceEngine.reconcile(
            document.getClosingBankBalance(), document.getClosingLedgerBalance(), aggregated);
        StatementSummary statement = balanceEngine.summarizeStatement(
            document.getOpeningBankBalance(), document.getClosingBankBalance(), document.getStatementLines());
        verifyBalanceEquation(document.getId(), balances);

        log.debug("Recomputed reconciliation {}: adjustments={}, variance={}, reconciled={}",
            document.getId(), entries.size(), balances.getVariance(), balances.isReconciled());

        return document.withSummary(new ReconciliationSummary(
            aggregated, Collections.unmodifiableMap(classifications), balances, statement));
    }

    public FilingDocument recompute(FilingDocument document) {
        return recompute(document, WhtRuleSets.DEFAULT);
    }

    public FilingDocument recompute(FilingDocument document, RuleSet<WhtSection> rules) {
        List<SourceRecord> records = document.getRecords();
        Map<UUID, WhtSection> classifications = new LinkedHashMap<>();
        List<Contribution<WhtSection>> contributions = new ArrayList<>(records.size());

        for (SourceRecord record : records) {
            WhtSection section = classifier.classify(record, rules);
            classifications.put(record.getId(), section);
            contributions.add(Contribution.of(section, record.getAmount(), Amounts.orZero(record.getWithheldAmount())));
        }

        AggregationResult<WhtSection> aggregated = aggregator.aggregate(WhtSection.class, contributions);
        verifyTotals(document.getId(), aggregated, records,
            SourceRecord::getAmount, r -> Amounts.orZero(r.getWithheldAmount()));

        FilingTotals totals = balanceEngine.filingTotals(aggregated, document.depositedAmount());

        log.debug("Recomputed filing {}: records={}, gross={}, withheld={}",
            document.getId(), records.size(), totals.getGrossAmount(), totals.getWithheldAmount());

        return document.withSummary(new FilingSummary(
            aggregated, Collections.unmodifiableMap(classifications), totals));
    }

    private <K extends Enum<K> & CategoryKey, R> void verifyTotals(UUID documentId,
                                                                    AggregationResult<K> result,
                                                                    List<R> records,
                                                                    Function<R, BigDecimal> gross,
                                                                    Function<R, BigDecimal> secondary) {
        BigDecimal recordGross = BigDecimal.ZERO;
        BigDecimal recordSecondary = BigDecimal.ZERO;
        for (R record : records) {
            recordGross = recordGross.add(Amounts.orZero(gross.apply(record)));
            recordSecondary = recordSecondary.add(Amounts.orZero(secondary.apply(record)));
        }

        int bucketCount = 0;
        BigDecimal bucketGross = BigDecimal.ZERO;
        BigDecimal bucketSecondary = BigDecimal.ZERO;
        for (CategoryBucket<K> bucket : result.getBuckets().values()) {
            bucketCount += bucket.getCount();
            bucketGross = bucketGross.add(bucket.getGrossSum());
            bucketSecondary = bucketSecondary.add(bucket.getSecondarySum());
        }

        if (bucketCount != records.size() || result.getTotalCount() != records.size()) {
            throw new RoundingInvariantViolation(String.format(
                "Document %s: %d records but buckets hold %d (total %d)",
                documentId, records.size(), bucketCount, result.getTotalCount()));
        }
        requireEqual(documentId, "gross", Amounts.round2(recordGross), bucketGross, result.getGrossTotal());
        requireEqual(documentId, "secondary", Amounts.round2(recordSecondary), bucketSecondary, result.getSecondaryTotal());
    }

    private void requireEqual(UUID documentId, String measure, BigDecimal recordSum,
                              BigDecimal bucketSum, BigDecimal grandTotal) {
        if (recordSum.compareTo(bucketSum) != 0 || bucketSum.compareTo(grandTotal) != 0) {
            throw new RoundingInvariantViolation(String.format(
                "Document %s: %s records=%s buckets=%s total=%s",
                documentId, measure, recordSum, bucketSum, grandTotal));
        }
    }

    private void verifyBalanceEquation(UUID documentId, ReconciliationBalances balances) {
        if (!balances.isLedgerBalanceKnown()) {
            return;
        }
        BigDecimal difference = balances.getAdjustedBankBalance().subtract(balances.getAdjustedLedgerBalance());
        if (difference.compareTo(balances.getVariance()) != 0) {
            throw new RoundingInvariantViolation(String.format(
                "Document %s: adjusted bank - adjusted ledger = %s but variance is %s",
                documentId, difference, balances.getVariance()));
        }
    }
}
