package com.flagship.reconciliation_engine.classification;

/**
 * Withholding-tax sections a deduction can be reported under.
 */
public enum WhtSection implements CategoryKey {
    SECTION_153_1A("section_153_1a"),
    SECTION_153_1B("section_153_1b"),
    SECTION_153_1C("section_153_1c"),
    SECTION_233("section_233"),
    SECTION_234("section_234"),
    SECTION_235("section_235"),
    SALARY("salary"),
    OTHER("other");

    private final String key;

    WhtSection(String key) {
        this.key = key;
    }

    @Override
    public String key() {
        return key;
    }
}
