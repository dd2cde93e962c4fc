package com.flagship.reconciliation_engine.classification;

import java.util.List;

import static com.flagship.reconciliation_engine.classification.ReconciliationCategory.*;

/**
 * Default rules for bank reconciliation items.
 *
 * Returned checks are matched before bank charges so that "returned cheque fee"
 * style descriptors are treated as returned items.
 */
public final class ReconciliationRuleSets {

    public static final RuleSet<ReconciliationCategory> DEFAULT = new RuleSet<>(
        ReconciliationCategory.class,
        List.of(
            ClassificationRule.forCategory(RETURNED_CHECKS)
                .tags("returned_check", "nsf")
                .pattern("\\breturned\\b")
                .pattern("\\bnsf\\b")
                .pattern("insufficient funds")
                .pattern("\\bbounced?\\b")
                .build(),
            ClassificationRule.forCategory(BANK_CHARGES)
                .tags("bank_charge", "charges")
                .pattern("bank charges?")
                .pattern("service charges?")
                .pattern("\\bfees?\\b")
                .pattern("\\bcommission\\b")
                .build(),
            ClassificationRule.forCategory(INTEREST_EARNED)
                .tags("interest")
                .pattern("\\binterest\\b")
                .pattern("profit on (deposit|account)")
                .build(),
            ClassificationRule.forCategory(OUTSTANDING_CHECKS)
                .tags("outstanding_check")
                .pattern("\\b(outstanding|uncleared|unpresented)\\b")
                .pattern("\\b(cheque|check|chq)\\b")
                .build(),
            ClassificationRule.forCategory(DEPOSITS_IN_TRANSIT)
                .tags("deposit_in_transit")
                .pattern("\\bin transit\\b")
                .pattern("\\bdeposits?\\b")
                .pattern("\\blodg(e)?ment\\b")
                .build()
        ),
        ERRORS
    );

    private ReconciliationRuleSets() {
    }
}
