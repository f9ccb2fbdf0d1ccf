package com.libran.dictionary.qa.category;

import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.qa.CategoryResult;
import com.libran.dictionary.qa.QaCategory;
import com.libran.dictionary.qa.QaCategoryType;
import com.libran.dictionary.qa.QaIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks that essential phrasebook vocabulary is covered. An English key covers a phrase
 * when it contains it, ignoring case. Score is the covered fraction times 100.
 */
public class PhrasebookIntegration implements QaCategory {

    public static final List<String> ESSENTIAL_PHRASES = List.of(
            "I am", "you are", "he is", "she is",
            "good", "bad", "big", "small",
            "house", "water", "food", "fire",
            "walk", "run", "see", "hear");

    private final List<String> phrases;

    public PhrasebookIntegration() {
        this(ESSENTIAL_PHRASES);
    }

    public PhrasebookIntegration(List<String> phrases) {
        if (phrases.isEmpty()) {
            throw new IllegalArgumentException("phrases must not be empty");
        }
        this.phrases = List.copyOf(phrases);
    }

    @Override
    public QaCategoryType type() {
        return QaCategoryType.PHRASEBOOK;
    }

    @Override
    public CategoryResult evaluate(UnifiedDictionary dictionary) {
        List<String> keys = dictionary.entries().stream()
                .map(Entry::getEnglish)
                .map(e -> e.toLowerCase(Locale.ROOT))
                .toList();
        List<QaIssue> issues = new ArrayList<>();
        int covered = 0;
        for (String phrase : phrases) {
            String needle = phrase.toLowerCase(Locale.ROOT);
            if (keys.stream().anyMatch(k -> k.contains(needle))) {
                covered++;
            } else {
                issues.add(new QaIssue(type(), "missing_phrase_coverage", phrase, "Add essential vocabulary"));
            }
        }
        double score = covered * 100.0 / phrases.size();
        return new CategoryResult(type(), score, issues,
                covered + "/" + phrases.size() + " essential phrases covered");
    }
}
