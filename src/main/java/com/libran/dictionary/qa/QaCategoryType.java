package com.libran.dictionary.qa;

/**
 * The seven weighted QA categories, in report order.
 */
public enum QaCategoryType {
    COLLISION("Collision Check"),
    SUFFIX_LAZINESS("Suffix/Laziness Audit"),
    COMPOUND_HYPHEN("Compound/Hyphen Review"),
    COVERAGE("Coverage Analysis"),
    RULESET("Ruleset Compliance"),
    PHRASEBOOK("Phrasebook Integration"),
    VERSIONING("Versioning Check");

    private final String displayName;

    QaCategoryType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
