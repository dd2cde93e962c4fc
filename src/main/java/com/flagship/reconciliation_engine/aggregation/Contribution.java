package com.flagship.reconciliation_engine.aggregation;

import com.flagship.reconciliation_engine.classification.CategoryKey;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What one classified record adds to its bucket.
 */
@Value
public class Contribution<K extends Enum<K> & CategoryKey> {
    K category;
    BigDecimal gross;
    /** Withheld amount, or the not-yet-posted share, depending on the schema. */
    BigDecimal secondary;

    public static <K extends Enum<K> & CategoryKey> Contribution<K> of(K category, BigDecimal gross, BigDecimal secondary) {
        return new Contribution<>(category, gross, secondary);
    }
}
