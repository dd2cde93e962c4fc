package com.flagship.reconciliation_engine.reconciliation;

import com.flagship.reconciliation_engine.aggregation.AggregationResult;
import com.flagship.reconciliation_engine.balance.ReconciliationBalances;
import com.flagship.reconciliation_engine.balance.StatementSummary;
import com.flagship.reconciliation_engine.classification.ReconciliationCategory;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Everything derived from a reconciliation's inputs. Replaced as a whole on
 * every recomputation.
 */
@Value
public class ReconciliationSummary {
    AggregationResult<ReconciliationCategory> adjustments;
    /** Category each adjustment entry was classified into, by record id. */
    Map<UUID, ReconciliationCategory> classifications;
    ReconciliationBalances balances;
    StatementSummary statement;
}
