package com.libran.dictionary.audit;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable audit outcome. Informational only; it never affects the QA gate.
 *
 * @param version      version of the audited dictionary
 * @param totalEntries number of entries audited
 * @param results      per-check results in {@link AuditCheckType} order
 * @param suppressions issues removed by the exclusion registry
 * @param score        max(0, 100 - 0.5 * total issues)
 * @param generatedAt  when the report was produced
 */
public record AuditReport(
        String version,
        int totalEntries,
        List<AuditCheckResult> results,
        List<Suppression> suppressions,
        double score,
        Instant generatedAt
) {
    public AuditReport {
        results = results != null ? List.copyOf(results) : List.of();
        suppressions = suppressions != null ? List.copyOf(suppressions) : List.of();
    }

    public int totalIssues() {
        return results.stream().mapToInt(AuditCheckResult::issueCount).sum();
    }

    public List<AuditIssue> allIssues() {
        return results.stream().flatMap(r -> r.issues().stream()).toList();
    }

    public Optional<AuditCheckResult> result(AuditCheckType check) {
        return results.stream().filter(r -> r.check() == check).findFirst();
    }
}
