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
 * English keys naming modern-world technology, institutions, materials or foods.
 * One high-severity issue per entry, listing every matched term.
 */
public class AnachronismCheck implements AuditCheck {

    public static final List<String> ANACHRONISTIC_TERMS = List.of(
            "computer", "internet", "phone", "television", "radio", "electricity",
            "democracy", "republic", "capitalism", "psychology", "biology",
            "university", "hospital", "library", "bank", "insurance",
            "plastic", "rubber", "aluminum", "steel", "concrete",
            "chocolate", "coffee", "tea", "sugar", "tobacco");

    @Override
    public AuditCheckType type() {
        return AuditCheckType.CULTURAL_ANACHRONISMS;
    }

    @Override
    public List<AuditIssue> inspect(UnifiedDictionary dictionary) {
        List<AuditIssue> issues = new ArrayList<>();
        for (Entry entry : dictionary.entries()) {
            String english = entry.getEnglish().toLowerCase(Locale.ROOT);
            List<String> matched = ANACHRONISTIC_TERMS.stream().filter(english::contains).toList();
            if (!matched.isEmpty()) {
                issues.add(AuditIssue.of(type(), "cultural_anachronism", Severity.HIGH, entry,
                        "\"" + entry.getEnglish() + "\" may be culturally anachronistic (" + String.join(", ", matched) + ")",
                        "Verify cultural appropriateness"));
            }
        }
        return issues;
    }
}
