package com.libran.dictionary.audit;

public enum AuditCheckType {
    SUSPICIOUS_PATTERNS("Suspicious Patterns"),
    ETYMOLOGICAL_ISSUES("Etymological Issues"),
    CULTURAL_ANACHRONISMS("Cultural Anachronisms"),
    MISSING_NOTES("Missing Notes");

    private final String displayName;

    AuditCheckType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
