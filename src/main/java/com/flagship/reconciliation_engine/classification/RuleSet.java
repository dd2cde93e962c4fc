package com.flagship.reconciliation_engine.classification;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * Ordered rules for one schema plus the bucket that receives everything no rule claims.
 */
@Getter
public final class RuleSet<K extends Enum<K> & CategoryKey> {

    private final Class<K> keyType;
    private final List<ClassificationRule<K>> rules;
    private final K catchAll;

    public RuleSet(Class<K> keyType, List<ClassificationRule<K>> rules, K catchAll) {
        this.keyType = Objects.requireNonNull(keyType);
        this.rules = List.copyOf(rules);
        this.catchAll = Objects.requireNonNull(catchAll, "A rule set needs a catch-all bucket");
    }
}
