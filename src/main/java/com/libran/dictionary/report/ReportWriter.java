package com.libran.dictionary.report;

import com.libran.dictionary.audit.AuditReport;
import com.libran.dictionary.events.PipelineEventLog;
import com.libran.dictionary.events.PipelineEventType;
import com.libran.dictionary.qa.QaReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persists QA and audit reports into the recent directory of a reports root.
 *
 * <p>A failure to write is a reporting error: it is logged and recorded as a
 * {@code REPORT_FAILED} event, and the method returns an empty list. Files of the set written
 * before the failure are removed again. A failure never propagates, so it cannot change a
 * gate decision that has already been made.</p>
 */
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);
    private static final String ACTOR = "report-writer";

    static final String QA_PREFIX = "qa-report-";
    static final String AUDIT_PREFIX = "audit-report-";
    static final String AUDIT_DETAIL_PREFIX = "audit-detailed-";

    private final Path reportsRoot;
    private final ReportRetentionPolicy policy;
    private final QaReportRenderer qaRenderer;
    private final AuditReportRenderer auditRenderer;
    private final PipelineEventLog events;
    private final Clock clock;

    public ReportWriter(Path reportsRoot, PipelineEventLog events) {
        this(reportsRoot, ReportRetentionPolicy.defaults(), new QaReportRenderer(), new AuditReportRenderer(),
                events, Clock.systemUTC());
    }

    public ReportWriter(Path reportsRoot, ReportRetentionPolicy policy, QaReportRenderer qaRenderer,
                        AuditReportRenderer auditRenderer, PipelineEventLog events, Clock clock) {
        this.reportsRoot = Objects.requireNonNull(reportsRoot, "reportsRoot is required");
        this.policy = policy != null ? policy : ReportRetentionPolicy.defaults();
        this.qaRenderer = qaRenderer;
        this.auditRenderer = auditRenderer;
        this.events = events != null ? events : new PipelineEventLog();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Writes {@code qa-report-<timestamp>.json} and {@code .csv}.
     *
     * @return the written files, empty if writing failed
     */
    public List<Path> writeQa(QaReport report) {
        String ts = ReportTimestamps.format(timestampOf(report.generatedAt()));
        Map<String, Renderer> files = new LinkedHashMap<>();
        files.put(QA_PREFIX + ts + ".json", () -> qaRenderer.toJson(report));
        files.put(QA_PREFIX + ts + ".csv", () -> qaRenderer.toCsv(report));
        return write("qa", files);
    }

    /**
     * Writes {@code audit-report-<timestamp>.json}, {@code .csv} and
     * {@code audit-detailed-<timestamp>.txt}.
     *
     * @return the written files, empty if writing failed
     */
    public List<Path> writeAudit(AuditReport report) {
        String ts = ReportTimestamps.format(timestampOf(report.generatedAt()));
        Map<String, Renderer> files = new LinkedHashMap<>();
        files.put(AUDIT_PREFIX + ts + ".json", () -> auditRenderer.toJson(report));
        files.put(AUDIT_PREFIX + ts + ".csv", () -> auditRenderer.toCsv(report));
        files.put(AUDIT_DETAIL_PREFIX + ts + ".txt", () -> auditRenderer.toText(report));
        return write("audit", files);
    }

    public Path recentDirectory() {
        return reportsRoot.resolve(policy.recentDir());
    }

    public Path reportsRoot() {
        return reportsRoot;
    }

    private List<Path> write(String kind, Map<String, Renderer> files) {
        Path dir = recentDirectory();
        List<Path> written = new ArrayList<>(files.size());
        try {
            Files.createDirectories(dir);
            for (Map.Entry<String, Renderer> file : files.entrySet()) {
                Path target = dir.resolve(file.getKey());
                Files.writeString(target, file.getValue().render(), StandardCharsets.UTF_8);
                written.add(target);
            }
        } catch (IOException | UncheckedIOException e) {
            List<String> leftOver = removePartial(written);
            log.error("report.writeFailed kind={} dir={} removed={} error={}",
                    kind, dir, written.size() - leftOver.size(), e.getMessage());
            events.record(PipelineEventType.REPORT_FAILED, kind, ACTOR, Map.of(
                    "directory", dir.toString(),
                    "leftOver", leftOver,
                    "error", String.valueOf(e.getMessage())));
            return List.of();
        }
        events.record(PipelineEventType.REPORT_WRITTEN, kind, ACTOR, Map.of(
                "files", written.stream().map(p -> p.getFileName().toString()).toList()));
        log.info("report.written kind={} files={}", kind, written.size());
        return List.copyOf(written);
    }

    /**
     * Deletes the files of an incomplete set so retention never sees a partial set.
     *
     * @return names of the files that could not be deleted
     */
    private List<String> removePartial(List<Path> written) {
        List<String> leftOver = new ArrayList<>();
        for (Path file : written) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("report.cleanupFailed file={} error={}", file, e.getMessage());
                leftOver.add(file.getFileName().toString());
            }
        }
        return leftOver;
    }

    private Instant timestampOf(Instant generatedAt) {
        return generatedAt != null ? generatedAt : clock.instant();
    }

    @FunctionalInterface
    private interface Renderer {
        String render();
    }
}
