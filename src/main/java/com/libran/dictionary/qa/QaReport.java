package com.libran.dictionary.qa;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable QA outcome for one dictionary snapshot.
 *
 * @param version      version of the scored dictionary
 * @param totalEntries number of entries scored
 * @param categories   category results in {@link QaCategoryType} order
 * @param overallScore weighted overall score in [0, 100]
 * @param threshold    gate threshold the score was compared with
 * @param passed       gate decision
 * @param baseline     baseline consistency result, null when no baseline was supplied
 * @param generatedAt  when the report was produced
 */
public record QaReport(
        String version,
        int totalEntries,
        List<CategoryResult> categories,
        int overallScore,
        int threshold,
        boolean passed,
        BaselineConsistencyResult baseline,
        Instant generatedAt
) {
    public QaReport {
        categories = categories != null ? List.copyOf(categories) : List.of();
    }

    public Optional<CategoryResult> category(QaCategoryType type) {
        return categories.stream().filter(c -> c.category() == type).findFirst();
    }

    public Optional<BaselineConsistencyResult> baselineResult() {
        return Optional.ofNullable(baseline);
    }

    public int totalIssues() {
        return categories.stream().mapToInt(CategoryResult::issueCount).sum();
    }

    public List<QaIssue> allIssues() {
        return categories.stream().flatMap(c -> c.issues().stream()).toList();
    }

    /**
     * Issue counts of the categories that have issues, highest count first. This is the
     * order in which remediation should proceed.
     */
    public Map<QaCategoryType, Integer> issueCountsByCategory() {
        Map<QaCategoryType, Integer> ranked = new LinkedHashMap<>();
        categories.stream()
                .filter(c -> c.issueCount() > 0)
                .sorted(Comparator.comparingInt(CategoryResult::issueCount).reversed()
                        .thenComparing(CategoryResult::category))
                .forEach(c -> ranked.put(c.category(), c.issueCount()));
        return ranked;
    }
}
