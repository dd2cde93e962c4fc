package com.flagship.reconciliation_engine.classification;

/**
 * A category bucket key. Implemented by one closed enum per schema so that a
 * mistyped key cannot silently create a new bucket.
 */
public interface CategoryKey {

    /** Stable snake_case key, also the canonical explicit tag. */
    String key();
}
