package com.libran.dictionary.qa;

import com.libran.dictionary.baseline.BaselineDiscrepancy;
import com.libran.dictionary.core.model.Severity;

import java.util.List;

/**
 * Outcome of the baseline consistency check. Reported next to the weighted categories but
 * never part of the overall score.
 *
 * @param score            score in [0, 100]
 * @param discrepancies    all findings, in entry order
 * @param baselineMatches  entries whose English key exists in the baseline
 * @param totalChecked     entries checked
 * @param coveragePercent  baselineMatches / totalChecked * 100
 * @param summary          one-line summary
 */
public record BaselineConsistencyResult(
        double score,
        List<BaselineDiscrepancy> discrepancies,
        int baselineMatches,
        int totalChecked,
        double coveragePercent,
        String summary
) {
    public BaselineConsistencyResult {
        discrepancies = discrepancies != null ? List.copyOf(discrepancies) : List.of();
    }

    public long count(Severity severity) {
        return discrepancies.stream().filter(d -> d.severity() == severity).count();
    }
}
