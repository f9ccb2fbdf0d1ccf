package com.libran.dictionary.qa.category;

import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.qa.CategoryResult;
import com.libran.dictionary.qa.QaCategory;
import com.libran.dictionary.qa.QaCategoryType;
import com.libran.dictionary.qa.QaIssue;
import com.libran.dictionary.qa.WordClass;
import com.libran.dictionary.qa.WordClassifier;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks the balance of word classes: at least 15% verbs and at most 70% nouns.
 * Each missed target costs 10 points.
 */
public class CoverageAnalysis implements QaCategory {

    static final double PENALTY = 10.0;
    static final double MIN_VERB_RATIO = 0.15;
    static final double MAX_NOUN_RATIO = 0.70;

    private final WordClassifier classifier;

    public CoverageAnalysis() {
        this(new WordClassifier());
    }

    public CoverageAnalysis(WordClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
    }

    @Override
    public QaCategoryType type() {
        return QaCategoryType.COVERAGE;
    }

    @Override
    public CategoryResult evaluate(UnifiedDictionary dictionary) {
        Map<WordClass, Integer> counts = countClasses(dictionary);
        int total = dictionary.size();
        double verbRatio = total == 0 ? 0 : (double) counts.get(WordClass.VERB) / total;
        double nounRatio = total == 0 ? 0 : (double) counts.get(WordClass.NOUN) / total;

        List<QaIssue> issues = new ArrayList<>();
        if (verbRatio < MIN_VERB_RATIO) {
            issues.add(new QaIssue(type(), "low_verb_coverage", "verbs",
                    String.format("Verb ratio %.2f below %.2f, increase verb coverage", verbRatio, MIN_VERB_RATIO)));
        }
        if (nounRatio > MAX_NOUN_RATIO) {
            issues.add(new QaIssue(type(), "high_noun_ratio", "nouns",
                    String.format("Noun ratio %.2f above %.2f, balance with more non-nouns", nounRatio, MAX_NOUN_RATIO)));
        }
        String summary = counts.get(WordClass.VERB) + " verbs, " + counts.get(WordClass.NOUN) + " nouns, "
                + counts.get(WordClass.ADJECTIVE) + " adjectives, " + counts.get(WordClass.OTHER) + " other";
        return CategoryResult.penalized(type(), issues, PENALTY, summary);
    }

    public Map<WordClass, Integer> countClasses(UnifiedDictionary dictionary) {
        Map<WordClass, Integer> counts = new EnumMap<>(WordClass.class);
        for (WordClass wordClass : WordClass.values()) {
            counts.put(wordClass, 0);
        }
        for (Entry entry : dictionary.entries()) {
            counts.merge(classifier.classify(entry.getEnglish()), 1, Integer::sum);
        }
        return counts;
    }
}
