package com.libran.dictionary.qa;

import com.libran.dictionary.baseline.BaselineDiscrepancy;
import com.libran.dictionary.baseline.BaselineIndex;
import com.libran.dictionary.baseline.EntryConsistency;
import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.Severity;
import com.libran.dictionary.core.model.UnifiedDictionary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Compares a dictionary with the baseline release. High findings cost 5 points, medium 2,
 * low 1; more than 80% of keys found in the baseline earns 5 bonus points.
 */
public class BaselineConsistencyCheck {

    static final double HIGH_PENALTY = 5;
    static final double MEDIUM_PENALTY = 2;
    static final double LOW_PENALTY = 1;
    static final double COVERAGE_BONUS = 5;
    static final double BONUS_COVERAGE_PERCENT = 80;

    private final BaselineIndex baseline;

    public BaselineConsistencyCheck(BaselineIndex baseline) {
        this.baseline = Objects.requireNonNull(baseline, "baseline is required");
    }

    public BaselineConsistencyResult evaluate(UnifiedDictionary dictionary) {
        List<BaselineDiscrepancy> discrepancies = new ArrayList<>();
        int matches = 0;
        for (Entry entry : dictionary.entries()) {
            EntryConsistency check = baseline.checkConsistency(entry);
            if (check.hasReference()) {
                matches++;
            }
            discrepancies.addAll(check.discrepancies());
        }

        int total = dictionary.size();
        double coverage = total > 0 ? matches * 100.0 / total : 0;
        double score = 100;
        for (BaselineDiscrepancy d : discrepancies) {
            score -= penalty(d.severity());
        }
        if (coverage > BONUS_COVERAGE_PERCENT) {
            score += COVERAGE_BONUS;
        }
        score = Math.max(0, Math.min(100, score));

        String summary = String.format(Locale.ROOT, "%d/%d entries (%.1f%%) match baseline reference",
                matches, total, coverage);
        return new BaselineConsistencyResult(score, discrepancies, matches, total, coverage, summary);
    }

    private static double penalty(Severity severity) {
        return switch (severity) {
            case HIGH -> HIGH_PENALTY;
            case MEDIUM -> MEDIUM_PENALTY;
            case LOW -> LOW_PENALTY;
        };
    }
}
