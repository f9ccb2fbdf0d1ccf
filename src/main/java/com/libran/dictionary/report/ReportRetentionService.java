package com.libran.dictionary.report;

import com.libran.dictionary.events.PipelineEventLog;
import com.libran.dictionary.events.PipelineEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Applies a {@link ReportRetentionPolicy} to a reports directory.
 *
 * <p>Report files are grouped into sets by kind ({@code qa} or {@code audit}) and the
 * timestamp in their name. Per kind, the newest {@code keepRecent} sets stay in the recent
 * directory and older sets are moved to the archive directory. Failures are logged and
 * counted, never thrown.</p>
 */
public class ReportRetentionService {
    private static final Logger log = LoggerFactory.getLogger(ReportRetentionService.class);

    private final PipelineEventLog events;

    public ReportRetentionService(PipelineEventLog events) {
        this.events = events != null ? events : new PipelineEventLog();
    }

    public ReportRetentionResult apply(Path reportsRoot, ReportRetentionPolicy policy) {
        Path recent = reportsRoot.resolve(policy.recentDir());
        if (!Files.isDirectory(recent)) {
            return ReportRetentionResult.empty();
        }

        // kind -> timestamp -> files, newest timestamp first
        Map<String, TreeMap<String, List<Path>>> sets = new TreeMap<>();
        try (Stream<Path> files = Files.list(recent)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                String name = file.getFileName().toString();
                Optional<String> kind = kindOf(name);
                Optional<String> timestamp = ReportTimestamps.extract(name);
                if (kind.isPresent() && timestamp.isPresent()) {
                    sets.computeIfAbsent(kind.get(), k -> new TreeMap<>(Comparator.reverseOrder()))
                            .computeIfAbsent(timestamp.get(), t -> new ArrayList<>())
                            .add(file);
                }
            });
        } catch (IOException e) {
            log.warn("retention.listFailed dir={} error={}", recent, e.getMessage());
            return new ReportRetentionResult(0, 0, 1);
        }

        Path archive = reportsRoot.resolve(policy.archiveDir());
        int kept = 0;
        int archived = 0;
        int failures = 0;
        for (TreeMap<String, List<Path>> byTimestamp : sets.values()) {
            int index = 0;
            for (List<Path> set : byTimestamp.values()) {
                if (index++ < policy.keepRecent()) {
                    kept++;
                    continue;
                }
                for (Path file : set) {
                    try {
                        Files.createDirectories(archive);
                        Files.move(file, archive.resolve(file.getFileName()), StandardCopyOption.REPLACE_EXISTING);
                        archived++;
                    } catch (IOException e) {
                        failures++;
                        log.warn("retention.archiveFailed file={} error={}", file.getFileName(), e.getMessage());
                    }
                }
            }
        }

        ReportRetentionResult result = new ReportRetentionResult(kept, archived, failures);
        if (archived > 0) {
            events.record(PipelineEventType.REPORTS_ARCHIVED, reportsRoot.toString(), "report-retention", Map.of(
                    "filesArchived", archived,
                    "setsKept", kept,
                    "failures", failures));
        }
        log.info("retention.completed dir={} result={}", reportsRoot, result);
        return result;
    }

    static Optional<String> kindOf(String fileName) {
        if (fileName.startsWith(ReportWriter.QA_PREFIX)) {
            return Optional.of("qa");
        }
        if (fileName.startsWith(ReportWriter.AUDIT_PREFIX) || fileName.startsWith(ReportWriter.AUDIT_DETAIL_PREFIX)) {
            return Optional.of("audit");
        }
        return Optional.empty();
    }
}
