package com.libran.dictionary.audit;

import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.Severity;

import java.util.Objects;

/**
 * An advisory finding. The subject is always the English key of the entry, which is what
 * the exclusion registry is consulted with.
 *
 * @param check          check that raised it
 * @param code           machine-readable code, e.g. {@code english_or_on_suffix}
 * @param severity       severity
 * @param english        English key of the entry
 * @param ancient        Ancient surface form, may be null
 * @param modern         Modern surface form, may be null
 * @param reason         what is wrong
 * @param recommendation what to do about it
 */
public record AuditIssue(
        AuditCheckType check,
        String code,
        Severity severity,
        String english,
        String ancient,
        String modern,
        String reason,
        String recommendation
) {
    public AuditIssue {
        Objects.requireNonNull(check, "check is required");
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(english, "english is required");
    }

    public static AuditIssue of(AuditCheckType check, String code, Severity severity, Entry entry,
                                String reason, String recommendation) {
        return new AuditIssue(check, code, severity, entry.getEnglish(), entry.ancientSurface(),
                entry.modernSurface(), reason, recommendation);
    }
}
