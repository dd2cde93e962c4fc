package com.flagship.reconciliation_engine.classification;

import java.util.List;

import static com.flagship.reconciliation_engine.classification.WhtSection.*;

/**
 * Default rules for withholding-tax deductions.
 *
 * Section codes are written many ways ({@code 153(1)(a)}, {@code 153(1a)},
 * {@code 153-1a}, {@code section_153_1a}); the patterns skip any separator
 * between the digits and the clause letter.
 */
public final class WhtRuleSets {

    private static final String SEP = "[^a-z0-9]*";

    public static final RuleSet<WhtSection> DEFAULT = new RuleSet<>(
        WhtSection.class,
        List.of(
            ClassificationRule.forCategory(SECTION_153_1A)
                .tags("153(1)(a)", "153(1a)", "services")
                .pattern(section153('a'))
                .pattern("\\bservices?\\b")
                .build(),
            ClassificationRule.forCategory(SECTION_153_1B)
                .tags("153(1)(b)", "153(1b)", "supplies")
                .pattern(section153('b'))
                .pattern("\\b(supplies|supply|goods)\\b")
                .build(),
            ClassificationRule.forCategory(SECTION_153_1C)
                .tags("153(1)(c)", "153(1c)", "contracts")
                .pattern(section153('c'))
                .pattern("\\bcontract(s|or|ors)?\\b")
                .build(),
            ClassificationRule.forCategory(SECTION_233)
                .tags("233")
                .pattern("(?<![0-9])233(?![0-9])")
                .pattern("\\b(brokerage|commission)\\b")
                .build(),
            ClassificationRule.forCategory(SECTION_234)
                .tags("234")
                .pattern("(?<![0-9])234(?![0-9])")
                .pattern("\\bmotor vehicle\\b")
                .build(),
            ClassificationRule.forCategory(SECTION_235)
                .tags("235")
                .pattern("(?<![0-9])235(?![0-9])")
                .pattern("\\belectricity\\b")
                .build(),
            ClassificationRule.forCategory(SALARY)
                .tags("149", "salaries", "payroll")
                .pattern("(?<![0-9])149(?![0-9])")
                .pattern("\\b(salary|salaries|payroll)\\b")
                .build()
        ),
        OTHER
    );

    private static String section153(char clause) {
        return "(?<![0-9])153" + SEP + "1" + SEP + clause + "(?![a-z])";
    }

    private WhtRuleSets() {
    }
}
