package com.libran.dictionary.audit;

import java.util.List;
import java.util.Objects;

/**
 * Issues that survived exclusion filtering for one check.
 */
public record AuditCheckResult(AuditCheckType check, List<AuditIssue> issues, String summary) {
    public AuditCheckResult {
        Objects.requireNonNull(check, "check is required");
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public int issueCount() {
        return issues.size();
    }
}
