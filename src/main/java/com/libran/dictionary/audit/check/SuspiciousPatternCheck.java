package com.libran.dictionary.audit.check;

import com.libran.dictionary.audit.AuditCheck;
import com.libran.dictionary.audit.AuditCheckType;
import com.libran.dictionary.audit.AuditIssue;
import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.Severity;
import com.libran.dictionary.core.model.UnifiedDictionary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * English-like formations: an Ancient form that is the English key plus -or/-on (high),
 * and a Modern form containing the English key or ending in an English suffix (medium).
 */
public class SuspiciousPatternCheck implements AuditCheck {

    private static final List<String> ENGLISH_SUFFIXES = List.of("ing", "tion", "ness");

    @Override
    public AuditCheckType type() {
        return AuditCheckType.SUSPICIOUS_PATTERNS;
    }

    @Override
    public List<AuditIssue> inspect(UnifiedDictionary dictionary) {
        List<AuditIssue> issues = new ArrayList<>();
        for (Entry entry : dictionary.entries()) {
            String english = entry.getEnglish().toLowerCase(Locale.ROOT);
            String ancient = entry.ancientSurface();
            if (ancient != null) {
                String lower = ancient.toLowerCase(Locale.ROOT);
                if (lower.contains(english) && (lower.endsWith("or") || lower.endsWith("on"))) {
                    issues.add(AuditIssue.of(type(), "english_or_on_suffix", Severity.HIGH, entry,
                            "Ancient form \"" + ancient + "\" appears to be English + suffix",
                            "Replace with authentic donor language formation"));
                }
            }
            String modern = entry.modernSurface();
            if (modern != null) {
                String lower = modern.toLowerCase(Locale.ROOT);
                if (lower.contains(english) || ENGLISH_SUFFIXES.stream().anyMatch(lower::endsWith)) {
                    issues.add(AuditIssue.of(type(), "english_like_modern", Severity.MEDIUM, entry,
                            "Modern form \"" + modern + "\" appears English-like",
                            "Use authentic donor language phonology"));
                }
            }
        }
        return issues;
    }
}
