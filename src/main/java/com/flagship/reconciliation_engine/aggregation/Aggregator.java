package com.flagship.reconciliation_engine.aggregation;

import com.flagship.reconciliation_engine.classification.CategoryKey;
import com.flagship.reconciliation_engine.common.Amounts;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Folds classified contributions into per-category buckets.
 *
 * Pure and order-independent: addition is exact at the internal scale and
 * rounding happens once per exposed figure.
 */
@Component
public class Aggregator {

    public <K extends Enum<K> & CategoryKey> AggregationResult<K> aggregate(Class<K> keyType,
                                                                           List<Contribution<K>> contributions) {
        Map<K, Accumulator> running = new EnumMap<>(keyType);
        for (K key : keyType.getEnumConstants()) {
            running.put(key, new Accumulator());
        }

        Accumulator grand = new Accumulator();
        for (Contribution<K> contribution : contributions) {
            running.get(contribution.getCategory()).add(contribution);
            grand.add(contribution);
        }

        Map<K, CategoryBucket<K>> buckets = new EnumMap<>(keyType);
        running.forEach((key, acc) -> buckets.put(key, new CategoryBucket<>(
            key, acc.count, Amounts.round2(acc.gross), Amounts.round2(acc.secondary))));

        return new AggregationResult<>(keyType, buckets, grand.count,
            Amounts.round2(grand.gross), Amounts.round2(grand.secondary));
    }

    private static final class Accumulator {
        private int count;
        private BigDecimal gross = Amounts.zero();
        private BigDecimal secondary = Amounts.zero();

        void add(Contribution<?> contribution) {
            count++;
            gross = Amounts.accumulate(gross, contribution.getGross());
            secondary = Amounts.accumulate(secondary, contribution.getSecondary());
        }
    }
}
