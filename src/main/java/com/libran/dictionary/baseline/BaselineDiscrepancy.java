package com.libran.dictionary.baseline;

import com.libran.dictionary.core.model.Severity;

/**
 * A difference between a new entry and the baseline.
 *
 * @param english  English key of the new entry
 * @param kind     discrepancy kind
 * @param severity severity of the discrepancy
 * @param message  human-readable description
 */
public record BaselineDiscrepancy(String english, Kind kind, Severity severity, String message) {

    public enum Kind {
        ANCIENT_MISMATCH(Severity.HIGH),
        MODERN_MISMATCH(Severity.HIGH),
        MISSING_NOTES(Severity.MEDIUM),
        SIMILAR_ENTRIES(Severity.LOW);

        private final Severity severity;

        Kind(Severity severity) {
            this.severity = severity;
        }

        public Severity severity() {
            return severity;
        }
    }

    public static BaselineDiscrepancy of(String english, Kind kind, String message) {
        return new BaselineDiscrepancy(english, kind, kind.severity(), message);
    }
}
