package com.libran.dictionary.audit;

import com.libran.dictionary.audit.check.AnachronismCheck;
import com.libran.dictionary.audit.check.EtymologyCheck;
import com.libran.dictionary.audit.check.MissingNotesCheck;
import com.libran.dictionary.audit.check.SuspiciousPatternCheck;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.events.PipelineEventLog;
import com.libran.dictionary.events.PipelineEventType;
import com.libran.dictionary.exclusion.ExclusionMatch;
import com.libran.dictionary.exclusion.ExclusionRegistry;
import com.libran.dictionary.metrics.NoOpPipelineMetrics;
import com.libran.dictionary.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the advisory audit checks over a dictionary that passed QA.
 *
 * <p>Every issue is tested against the {@link ExclusionRegistry} by its English key. A match
 * removes the issue from the report, adds a {@link Suppression} and records an
 * {@code EXCLUSION_SUPPRESSED} event. Score = max(0, 100 - 0.5 * remaining issues).</p>
 */
public class AuditEngine {
    private static final Logger log = LoggerFactory.getLogger(AuditEngine.class);
    private static final String ACTOR = "audit-engine";
    static final double PENALTY_PER_ISSUE = 0.5;

    private final List<AuditCheck> checks;
    private final ExclusionRegistry exclusions;
    private final PipelineEventLog events;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private AuditEngine(Builder builder) {
        this.checks = builder.checks.stream().sorted(Comparator.comparing(AuditCheck::type)).toList();
        this.exclusions = builder.exclusions;
        this.events = builder.events;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
    }

    public AuditReport audit(UnifiedDictionary dictionary) {
        log.info("audit.started entries={} exclusions={}", dictionary.size(), exclusions.size());
        List<AuditCheckResult> results = new ArrayList<>(checks.size());
        List<Suppression> suppressions = new ArrayList<>();
        // one registry lookup per subject
        Map<String, Optional<ExclusionMatch>> matches = new HashMap<>();

        for (AuditCheck check : checks) {
            List<AuditIssue> kept = new ArrayList<>();
            for (AuditIssue issue : check.inspect(dictionary)) {
                Optional<ExclusionMatch> match = matches.computeIfAbsent(issue.english(), exclusions::match);
                if (match.isPresent()) {
                    suppress(issue, match.get(), suppressions);
                } else {
                    kept.add(issue);
                }
            }
            String summary = kept.size() + " " + check.type().displayName().toLowerCase(Locale.ROOT) + " found";
            results.add(new AuditCheckResult(check.type(), kept, summary));
            log.debug("audit.check name='{}' issues={}", check.type().displayName(), kept.size());
        }

        int total = results.stream().mapToInt(AuditCheckResult::issueCount).sum();
        double score = Math.max(0, 100 - total * PENALTY_PER_ISSUE);
        AuditReport report = new AuditReport(dictionary.metadata().version(), dictionary.size(), results,
                suppressions, score, clock.instant());

        metrics.recordAuditScore(score);
        events.record(PipelineEventType.AUDIT_COMPLETED, dictionary.metadata().version(), ACTOR, Map.of(
                "score", score,
                "totalIssues", total,
                "suppressed", suppressions.size()));
        log.info("audit.completed score={} totalIssues={} suppressed={}", score, total, suppressions.size());
        return report;
    }

    private void suppress(AuditIssue issue, ExclusionMatch match, List<Suppression> suppressions) {
        suppressions.add(new Suppression(issue, match));
        metrics.incrementSuppressions();
        events.record(PipelineEventType.EXCLUSION_SUPPRESSED, issue.english(), ACTOR, Map.of(
                "check", issue.check().name(),
                "code", issue.code(),
                "category", match.entry().category(),
                "canonical", match.entry().term(),
                "matchType", match.matchType().name()));
        log.info("audit.suppressed english='{}' code={} category={} matchType={}",
                issue.english(), issue.code(), match.entry().category(), match.matchType());
    }

    public static List<AuditCheck> standardChecks(int minNotesLength) {
        return List.of(
                new SuspiciousPatternCheck(),
                new EtymologyCheck(),
                new AnachronismCheck(),
                new MissingNotesCheck(minNotesLength));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<AuditCheck> checks = standardChecks(MissingNotesCheck.DEFAULT_MIN_NOTES_LENGTH);
        private ExclusionRegistry exclusions = ExclusionRegistry.empty();
        private PipelineEventLog events = new PipelineEventLog();
        private PipelineMetrics metrics = new NoOpPipelineMetrics();
        private Clock clock = Clock.systemUTC();

        public Builder checks(List<AuditCheck> checks) {
            this.checks = List.copyOf(checks);
            return this;
        }

        public Builder exclusions(ExclusionRegistry exclusions) {
            this.exclusions = exclusions != null ? exclusions : ExclusionRegistry.empty();
            return this;
        }

        public Builder events(PipelineEventLog events) {
            this.events = events;
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public AuditEngine build() {
            return new AuditEngine(this);
        }
    }
}
