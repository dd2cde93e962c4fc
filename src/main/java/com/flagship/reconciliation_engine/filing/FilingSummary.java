package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.aggregation.AggregationResult;
import com.flagship.reconciliation_engine.balance.FilingTotals;
import com.flagship.reconciliation_engine.classification.WhtSection;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

@Value
public class FilingSummary {
    AggregationResult<WhtSection> sections;
    Map<UUID, WhtSection> classifications;
    FilingTotals totals;
}
