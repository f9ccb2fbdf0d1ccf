package com.libran.dictionary.api;

import com.libran.dictionary.audit.AuditReport;
import com.libran.dictionary.events.PipelineEvent;
import com.libran.dictionary.lifecycle.LifecycleManifest;
import com.libran.dictionary.merge.MergeResult;
import com.libran.dictionary.qa.QaCategoryType;
import com.libran.dictionary.qa.QaReport;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a pipeline run produced.
 *
 * @param runId        id of the run
 * @param outcome      passed or needs remediation
 * @param manifest     final lifecycle manifest
 * @param merge        merge outcome, including skipped fragments
 * @param qaReport     QA report
 * @param auditReport  audit report, null when QA failed
 * @param artifactPath unified dictionary file, null when no output directory was configured
 * @param reportFiles  report files written during the run
 * @param events       events recorded during the run
 */
public record PipelineResult(
        String runId,
        PipelineOutcome outcome,
        LifecycleManifest manifest,
        MergeResult merge,
        QaReport qaReport,
        AuditReport auditReport,
        Path artifactPath,
        List<Path> reportFiles,
        List<PipelineEvent> events
) {
    public PipelineResult {
        reportFiles = reportFiles != null ? List.copyOf(reportFiles) : List.of();
        events = events != null ? List.copyOf(events) : List.of();
    }

    public boolean passed() {
        return outcome == PipelineOutcome.PASSED;
    }

    public Optional<AuditReport> audit() {
        return Optional.ofNullable(auditReport);
    }

    public Optional<Path> artifact() {
        return Optional.ofNullable(artifactPath);
    }

    /**
     * QA issue counts per category, most issues first. Empty categories are left out.
     */
    public Map<QaCategoryType, Integer> rankedIssues() {
        return qaReport.issueCountsByCategory();
    }

    /**
     * One-line summary for console output.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(outcome).append(": ")
                .append(merge.totalEntries()).append(" entries from ")
                .append(merge.consumed().size()).append(" fragment(s), ")
                .append(merge.duplicatesRemoved()).append(" duplicate(s) removed; QA ")
                .append(qaReport.overallScore()).append('/').append(qaReport.threshold());
        if (auditReport != null) {
            sb.append("; audit ").append(auditReport.score())
                    .append(" (").append(auditReport.totalIssues()).append(" issue(s), ")
                    .append(auditReport.suppressions().size()).append(" suppressed)");
        }
        sb.append("; lifecycle ").append(manifest.state());
        return sb.toString();
    }
}
