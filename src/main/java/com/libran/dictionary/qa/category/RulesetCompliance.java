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
 * Every entry needs a donor-language note or a form that shows its donor.
 * An entry with neither raises two issues: missing etymology and missing donor anchor.
 */
public class RulesetCompliance implements QaCategory {

    static final double PENALTY = 1.0;

    @Override
    public QaCategoryType type() {
        return QaCategoryType.RULESET;
    }

    @Override
    public CategoryResult evaluate(UnifiedDictionary dictionary) {
        List<QaIssue> issues = new ArrayList<>();
        for (Entry entry : dictionary.entries()) {
            if (DonorLanguageHeuristics.hasDonorNote(entry.getNotes())
                    || DonorLanguageHeuristics.hasDonorSignature(entry)) {
                continue;
            }
            issues.add(new QaIssue(type(), "missing_etymology", entry.getEnglish(), "Missing donor language notes"));
            issues.add(new QaIssue(type(), "missing_donor_anchor", entry.getEnglish(),
                    "No clear donor language connection"));
        }
        return CategoryResult.penalized(type(), issues, PENALTY, issues.size() + " compliance issues found");
    }
}
