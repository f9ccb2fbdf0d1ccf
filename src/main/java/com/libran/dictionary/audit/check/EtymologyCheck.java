package com.libran.dictionary.audit.check;

import com.libran.dictionary.audit.AuditCheck;
import com.libran.dictionary.audit.AuditCheckType;
import com.libran.dictionary.audit.AuditIssue;
import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.Severity;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.qa.DonorLanguageHeuristics;

import java.util.ArrayList;
import java.util.List;

/**
 * Complex Ancient forms without any note (medium), and donor-language claims that the
 * forms do not bear out (low).
 */
public class EtymologyCheck implements AuditCheck {

    static final int COMPLEX_LENGTH = 8;

    @Override
    public AuditCheckType type() {
        return AuditCheckType.ETYMOLOGICAL_ISSUES;
    }

    @Override
    public List<AuditIssue> inspect(UnifiedDictionary dictionary) {
        List<AuditIssue> issues = new ArrayList<>();
        for (Entry entry : dictionary.entries()) {
            String ancient = entry.ancientSurface();
            String modern = entry.modernSurface();
            if (ancient != null && ancient.length() > COMPLEX_LENGTH && !entry.hasNotes()) {
                issues.add(AuditIssue.of(type(), "complex_no_notes", Severity.MEDIUM, entry,
                        "Complex Ancient form \"" + ancient + "\" lacks donor language notes",
                        "Add donor language explanation"));
            }
            if (!entry.hasNotes()) {
                continue;
            }
            if (ancient != null && DonorLanguageHeuristics.claimsLatin(entry.getNotes())
                    && !DonorLanguageHeuristics.hasLatinEnding(ancient)) {
                issues.add(AuditIssue.of(type(), "latin_claim_mismatch", Severity.LOW, entry,
                        "Claims Latin origin but Ancient form doesn't have Latin ending",
                        "Verify Latin claim or adjust form"));
            }
            if (modern != null && DonorLanguageHeuristics.claimsHungarian(entry.getNotes())
                    && !DonorLanguageHeuristics.hasHungarianFeatures(modern)) {
                issues.add(AuditIssue.of(type(), "hungarian_claim_mismatch", Severity.LOW, entry,
                        "Claims Hungarian origin but Modern form lacks Hungarian features",
                        "Verify Hungarian claim or adjust form"));
            }
        }
        return issues;
    }
}
