package com.libran.dictionary.exclusion;

/**
 * How a term matched the registry, in lookup order.
 */
public enum MatchType {
    EXACT,
    ALIAS,
    NORMALIZED,
    NORMALIZED_ALIAS
}
