package com.libran.dictionary.qa.category;

import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.qa.CategoryResult;
import com.libran.dictionary.qa.DonorLanguageHeuristics;
import com.libran.dictionary.qa.QaCategory;
import com.libran.dictionary.qa.QaCategoryType;
import com.libran.dictionary.qa.QaIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags hyphenated forms without a cultural-grounding note and long Ancient forms
 * without donor-language evidence.
 */
public class CompoundHyphenReview implements QaCategory {

    static final double PENALTY = 2.0;
    static final int MAX_PLAIN_LENGTH = 10;

    @Override
    public QaCategoryType type() {
        return QaCategoryType.COMPOUND_HYPHEN;
    }

    @Override
    public CategoryResult evaluate(UnifiedDictionary dictionary) {
        List<QaIssue> issues = new ArrayList<>();
        for (Entry entry : dictionary.entries()) {
            String ancient = entry.ancientSurface();
            String modern = entry.modernSurface();
            boolean hyphenated = (ancient != null && ancient.contains("-")) || (modern != null && modern.contains("-"));
            if (hyphenated && !DonorLanguageHeuristics.isCulturallyGrounded(entry.getNotes())) {
                issues.add(new QaIssue(type(), "meaningless_compound", entry.getEnglish(),
                        "Hyphenated compound without cultural grounding"));
            }
            if (ancient != null && ancient.length() > MAX_PLAIN_LENGTH
                    && !DonorLanguageHeuristics.hasDonorNote(entry.getNotes())) {
                issues.add(new QaIssue(type(), "suspicious_compound", entry.getEnglish(),
                        "Long form \"" + ancient + "\" without clear donor language evidence"));
            }
        }
        return CategoryResult.penalized(type(), issues, PENALTY, issues.size() + " problematic compounds found");
    }
}
