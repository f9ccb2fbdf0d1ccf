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
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Flags Ancient forms built as English plus a Latin-looking suffix, and English-looking
 * Modern forms with no donor-language note.
 */
public class SuffixLazinessAudit implements QaCategory {

    static final double PENALTY = 1.5;

    private static final Pattern LAZY_ANCIENT_SUFFIX = Pattern.compile("(or|on|um|us)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENGLISH_LIKE_MODERN = Pattern.compile("^[a-z]+(or|on|um)$", Pattern.CASE_INSENSITIVE);

    @Override
    public QaCategoryType type() {
        return QaCategoryType.SUFFIX_LAZINESS;
    }

    @Override
    public CategoryResult evaluate(UnifiedDictionary dictionary) {
        List<QaIssue> issues = new ArrayList<>();
        for (Entry entry : dictionary.entries()) {
            if (isLazyAncient(entry)) {
                issues.add(new QaIssue(type(), "lazy_ancient", entry.getEnglish(),
                        "Ancient form \"" + entry.ancientSurface() + "\" appears to be English + suffix"));
            }
            String modern = entry.modernSurface();
            if (modern != null && ENGLISH_LIKE_MODERN.matcher(modern).matches()
                    && !DonorLanguageHeuristics.hasDonorNote(entry.getNotes())) {
                issues.add(new QaIssue(type(), "english_like_modern", entry.getEnglish(),
                        "Modern form \"" + modern + "\" appears English-like without donor language notes"));
            }
        }
        return CategoryResult.penalized(type(), issues, PENALTY, issues.size() + " lazy formations found");
    }

    static boolean isLazyAncient(Entry entry) {
        String ancient = entry.ancientSurface();
        return ancient != null
                && LAZY_ANCIENT_SUFFIX.matcher(ancient).find()
                && ancient.toLowerCase(Locale.ROOT).contains(entry.getEnglish().toLowerCase(Locale.ROOT));
    }
}
