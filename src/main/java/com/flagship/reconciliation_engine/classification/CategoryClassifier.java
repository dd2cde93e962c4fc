package com.flagship.reconciliation_engine.classification;

import com.flagship.reconciliation_engine.common.SourceRecord;
import org.springframework.stereotype.Component;

/**
 * Maps a source record to exactly one category.
 *
 * Two passes over the ordered rules: explicit tag first, then text. The first
 * match of a pass wins, so an explicit tag beats every text match no matter
 * where its rule sits in the order. Records nothing claims land in the
 * rule set's catch-all; no record is ever dropped.
 */
@Component
public class CategoryClassifier {

    public <K extends Enum<K> & CategoryKey> K classify(SourceRecord record, RuleSet<K> ruleSet) {
        if (record.hasCategoryTag()) {
            for (ClassificationRule<K> rule : ruleSet.getRules()) {
                if (rule.matchesTag(record.getCategoryTag())) {
                    return rule.getCategory();
                }
            }
            if (ruleSet.getCatchAll().key().equals(ClassificationRule.normalizeTag(record.getCategoryTag()))) {
                return ruleSet.getCatchAll();
            }
        }

        String text = record.searchableText();
        for (ClassificationRule<K> rule : ruleSet.getRules()) {
            if (rule.matchesText(text)) {
                return rule.getCategory();
            }
        }

        return ruleSet.getCatchAll();
    }
}
