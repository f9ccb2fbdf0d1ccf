package com.libran.dictionary.core.model;

/**
 * Severity attached to QA baseline findings and audit issues.
 */
public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
