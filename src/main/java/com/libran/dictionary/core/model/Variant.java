package com.libran.dictionary.core.model;

/**
 * The two target variants of the language.
 */
public enum Variant {
    ANCIENT,
    MODERN
}
