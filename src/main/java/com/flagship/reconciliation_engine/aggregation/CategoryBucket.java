package com.flagship.reconciliation_engine.aggregation;

import com.flagship.reconciliation_engine.classification.CategoryKey;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Count and sums of one category. Sums are exposed at 2 decimals.
 */
@Value
public class CategoryBucket<K extends Enum<K> & CategoryKey> {
    K category;
    int count;
    BigDecimal grossSum;
    BigDecimal secondarySum;

    public boolean isEmpty() {
        return count == 0;
    }
}
