package com.libran.dictionary.qa;

import java.util.List;
import java.util.Objects;

/**
 * Result of one QA category.
 *
 * @param category the category
 * @param score    score in [0, 100]
 * @param issues   issues found, in discovery order
 * @param summary  one-line summary
 */
public record CategoryResult(QaCategoryType category, double score, List<QaIssue> issues, String summary) {
    public CategoryResult {
        Objects.requireNonNull(category, "category is required");
        if (Double.isNaN(score) || score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within [0, 100], got " + score);
        }
        issues = issues != null ? List.copyOf(issues) : List.of();
        summary = summary != null ? summary : "";
    }

    /**
     * Score after deducting a fixed penalty per issue, floored at zero.
     */
    public static CategoryResult penalized(QaCategoryType category, List<QaIssue> issues, double penaltyPerIssue,
                                           String summary) {
        double score = Math.max(0, 100 - issues.size() * penaltyPerIssue);
        return new CategoryResult(category, score, issues, summary);
    }

    public int issueCount() {
        return issues.size();
    }
}
