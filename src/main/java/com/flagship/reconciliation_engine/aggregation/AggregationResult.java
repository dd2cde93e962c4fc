package com.flagship.reconciliation_engine.aggregation;

import com.flagship.reconciliation_engine.classification.CategoryKey;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Buckets for every key of a schema, in enum order, plus grand totals.
 *
 * Grand totals come from the same unrounded accumulators as the buckets, so
 * they are rounded once and may differ from the sum of rounded buckets only
 * when inputs carry sub-cent precision.
 */
@Value
public class AggregationResult<K extends Enum<K> & CategoryKey> {
    Class<K> keyType;
    Map<K, CategoryBucket<K>> buckets;
    int totalCount;
    BigDecimal grossTotal;
    BigDecimal secondaryTotal;

    AggregationResult(Class<K> keyType, Map<K, CategoryBucket<K>> buckets, int totalCount,
                      BigDecimal grossTotal, BigDecimal secondaryTotal) {
        this.keyType = keyType;
        this.buckets = Collections.unmodifiableMap(buckets);
        this.totalCount = totalCount;
        this.grossTotal = grossTotal;
        this.secondaryTotal = secondaryTotal;
    }

    public CategoryBucket<K> bucket(K category) {
        return buckets.get(category);
    }

    public BigDecimal grossOf(K category) {
        return bucket(category).getGrossSum();
    }

    public BigDecimal secondaryOf(K category) {
        return bucket(category).getSecondarySum();
    }

    public List<CategoryBucket<K>> nonEmptyBuckets() {
        return buckets.values().stream()
            .filter(b -> !b.isEmpty())
            .toList();
    }
}
