package com.libran.dictionary.api;

import com.libran.dictionary.artifact.UnifiedDictionaryWriter;
import com.libran.dictionary.audit.AuditEngine;
import com.libran.dictionary.audit.AuditReport;
import com.libran.dictionary.baseline.BaselineIndex;
import com.libran.dictionary.baseline.BaselineLoader;
import com.libran.dictionary.core.DictionaryPipelineException;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.events.PipelineEvent;
import com.libran.dictionary.events.PipelineEventLog;
import com.libran.dictionary.events.PipelineEventType;
import com.libran.dictionary.exclusion.ExclusionLoader;
import com.libran.dictionary.exclusion.ExclusionRegistry;
import com.libran.dictionary.lifecycle.DirectoryFragmentStore;
import com.libran.dictionary.lifecycle.FragmentArea;
import com.libran.dictionary.lifecycle.FragmentStore;
import com.libran.dictionary.lifecycle.LifecycleManifest;
import com.libran.dictionary.lifecycle.LifecycleState;
import com.libran.dictionary.lock.LocalRunLock;
import com.libran.dictionary.lock.LockAcquisitionException;
import com.libran.dictionary.lock.RunLock;
import com.libran.dictionary.logging.LogContext;
import com.libran.dictionary.merge.FragmentRelocator;
import com.libran.dictionary.merge.MergeOptions;
import com.libran.dictionary.merge.MergeResult;
import com.libran.dictionary.merge.TrancheMerger;
import com.libran.dictionary.metrics.NoOpPipelineMetrics;
import com.libran.dictionary.metrics.PipelineMetrics;
import com.libran.dictionary.qa.HomonymPolicy;
import com.libran.dictionary.qa.QaCategory;
import com.libran.dictionary.qa.QaCategoryType;
import com.libran.dictionary.qa.QaReport;
import com.libran.dictionary.qa.QaScorer;
import com.libran.dictionary.qa.SemanticGroupHomonymPolicy;
import com.libran.dictionary.report.AuditReportRenderer;
import com.libran.dictionary.report.QaReportRenderer;
import com.libran.dictionary.report.ReportRetentionService;
import com.libran.dictionary.report.ReportWriter;
import com.libran.dictionary.tranche.TrancheParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs the dictionary build: merge, QA gate, audit and fragment lifecycle.
 *
 * <pre>
 * DictionaryPipeline pipeline = DictionaryPipeline.builder()
 *     .options(PipelineOptions.builder()
 *         .fragmentDirectory(Path.of("tranches"))
 *         .outputDirectory(Path.of("dist"))
 *         .reportDirectory(Path.of("reports"))
 *         .build())
 *     .build();
 *
 * PipelineResult result = pipeline.run();
 * </pre>
 *
 * <p>Pending fragments are merged and moved to the merged area. If the QA gate passes the
 * audit runs and the fragments are moved to the deleted area; otherwise they stay merged and
 * the next run merges them again together with any new pending fragments. Runs over the same
 * store are serialized by a {@link RunLock}.</p>
 */
public class DictionaryPipeline {
    private static final Logger log = LoggerFactory.getLogger(DictionaryPipeline.class);
    private static final String ACTOR = "pipeline";

    private final PipelineOptions options;
    private final FragmentStore store;
    private final RunLock runLock;
    private final PipelineEventLog events;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final TrancheMerger merger;
    private final FragmentRelocator relocator;
    private final QaScorer qaScorer;
    private final AuditEngine auditEngine;
    private final UnifiedDictionaryWriter artifactWriter;
    private final ReportWriter reportWriter;
    private final ReportRetentionService retentionService;

    private DictionaryPipeline(Builder builder) {
        this.options = builder.options;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.events = builder.events != null ? builder.events : new PipelineEventLog(clock);
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpPipelineMetrics();
        this.runLock = builder.runLock != null ? builder.runLock : new LocalRunLock();

        if (builder.store != null) {
            this.store = builder.store;
        } else if (options.getFragmentDirectory() != null) {
            this.store = new DirectoryFragmentStore(options.getFragmentDirectory());
        } else {
            throw new IllegalStateException("Either a fragment store or a fragment directory is required");
        }

        // Reference data; an absent path turns the feature off
        BaselineIndex baseline = builder.baseline;
        if (baseline == null && options.getBaselinePath() != null) {
            baseline = new BaselineLoader(new TrancheParser(), options.isBaselineIgnoreCase(), options.isStemFallback())
                    .load(options.getBaselinePath());
        }
        ExclusionRegistry exclusions = builder.exclusions;
        if (exclusions == null) {
            exclusions = options.getExclusionPath() != null
                    ? new ExclusionLoader().load(options.getExclusionPath())
                    : ExclusionRegistry.empty();
        }

        // Merge
        TrancheParser parser = new TrancheParser(options.getDefaultVariant());
        MergeOptions mergeOptions = new MergeOptions(options.getVersion(), options.getProject(),
                store.describe(), clock);
        this.merger = new TrancheMerger(parser, mergeOptions, events, metrics);
        this.relocator = new FragmentRelocator(store, events);

        // QA and audit
        QaScorer.Builder qa = QaScorer.builder()
                .homonymPolicy(builder.homonymPolicy)
                .weights(options.getWeights())
                .threshold(options.getQaThreshold())
                .baseline(baseline)
                .parallel(options.isParallelQa())
                .metrics(metrics)
                .events(events)
                .clock(clock);
        if (builder.qaCategories != null) {
            qa.categories(builder.qaCategories);
        }
        this.qaScorer = qa.build();
        this.auditEngine = AuditEngine.builder()
                .checks(AuditEngine.standardChecks(options.getMinNotesLength()))
                .exclusions(exclusions)
                .events(events)
                .metrics(metrics)
                .clock(clock)
                .build();

        // Outputs
        this.artifactWriter = new UnifiedDictionaryWriter();
        this.reportWriter = options.getReportDirectory() != null
                ? new ReportWriter(options.getReportDirectory(), options.getRetentionPolicy(),
                new QaReportRenderer(), new AuditReportRenderer(), events, clock)
                : null;
        this.retentionService = new ReportRetentionService(events);
    }

    /**
     * Runs the pipeline once.
     *
     * @return the run outcome; a failed QA gate is an outcome, not an exception
     * @throws DictionaryPipelineException on fatal errors such as no valid fragments,
     *                                     a failed relocation or a held run lock
     */
    public PipelineResult run() {
        String runId = LogContext.generateRunId();
        String lockKey = store.lockKey();
        if (!runLock.tryLock(lockKey)) {
            throw new LockAcquisitionException("Could not acquire run lock for " + lockKey);
        }
        int eventMark = events.size();
        try (LogContext ignored = LogContext.forRun(runId)) {
            return execute(runId, eventMark);
        } finally {
            runLock.unlock(lockKey);
        }
    }

    private PipelineResult execute(String runId, int eventMark) {
        events.record(PipelineEventType.RUN_STARTED, runId, ACTOR, Map.of(
                "store", store.describe(),
                "version", options.getVersion(),
                "threshold", options.getQaThreshold()));
        log.info("pipeline.started store={} version={} threshold={} baseline={}",
                store.describe(), options.getVersion(), options.getQaThreshold(), qaScorer.hasBaseline());

        try {
            MergeResult merge = stage(runId, "merge", () -> merger.mergeAndRelocate(store, relocator));
            UnifiedDictionary dictionary = merge.dictionary();
            LifecycleManifest manifest = transition(LifecycleManifest.pending(runId, merge.consumed()),
                    LifecycleState.MERGED);

            Path artifact = stage(runId, "artifact", () -> writeArtifact(dictionary));
            List<Path> reportFiles = new ArrayList<>();

            QaReport qaReport = stage(runId, "qa", () -> qaScorer.score(dictionary));
            if (reportWriter != null) {
                reportFiles.addAll(reportWriter.writeQa(qaReport));
            }

            if (!qaReport.passed()) {
                manifest = transition(manifest, LifecycleState.QA_FAILED);
                logRemediation(qaReport);
                applyRetention();
                return finish(runId, eventMark, PipelineOutcome.NEEDS_REMEDIATION, manifest, merge, qaReport,
                        null, artifact, reportFiles);
            }

            manifest = transition(manifest, LifecycleState.QA_PASSED);
            AuditReport auditReport = stage(runId, "audit", () -> auditEngine.audit(dictionary));
            if (reportWriter != null) {
                reportFiles.addAll(reportWriter.writeAudit(auditReport));
            }

            stage(runId, "lifecycle",
                    () -> relocator.relocate(merge.consumed(), FragmentArea.MERGED, FragmentArea.DELETED));
            manifest = transition(manifest, LifecycleState.DELETED);
            applyRetention();
            return finish(runId, eventMark, PipelineOutcome.PASSED, manifest, merge, qaReport,
                    auditReport, artifact, reportFiles);
        } catch (DictionaryPipelineException e) {
            log.error("pipeline.failed error={}", e.getMessage());
            events.record(PipelineEventType.RUN_FINISHED, runId, ACTOR, Map.of(
                    "outcome", "FAILED",
                    "error", String.valueOf(e.getMessage())));
            throw e;
        }
    }

    private <T> T stage(String runId, String name, Supplier<T> work) {
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forStage(runId, name)) {
            return work.get();
        } finally {
            metrics.recordStageDuration(name, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private LifecycleManifest transition(LifecycleManifest manifest, LifecycleState target) {
        LifecycleManifest next = manifest.transitionTo(target, clock);
        events.record(PipelineEventType.LIFECYCLE_TRANSITION, manifest.runId(), ACTOR, Map.of(
                "from", manifest.state().name(),
                "to", target.name(),
                "fragments", manifest.fragments().size()));
        log.info("lifecycle.transition from={} to={} fragments={}",
                manifest.state(), target, manifest.fragments().size());
        try {
            store.saveManifest(next);
        } catch (IOException e) {
            log.warn("lifecycle.manifestSaveFailed store={} state={} error={}",
                    store.describe(), target, e.getMessage());
            events.record(PipelineEventType.REPORT_FAILED, manifest.runId(), ACTOR, Map.of(
                    "report", "manifest",
                    "error", String.valueOf(e.getMessage())));
        }
        return next;
    }

    private Path writeArtifact(UnifiedDictionary dictionary) {
        Path outputDirectory = options.getOutputDirectory();
        if (outputDirectory == null) {
            log.debug("artifact.skipped reason=noOutputDirectory");
            return null;
        }
        try {
            return artifactWriter.write(dictionary, outputDirectory);
        } catch (IOException e) {
            throw new DictionaryPipelineException("Failed to write unified dictionary to " + outputDirectory, e);
        }
    }

    private void logRemediation(QaReport report) {
        Map<QaCategoryType, Integer> ranked = report.issueCountsByCategory();
        log.warn("qa.gateFailed overallScore={} threshold={} totalIssues={}",
                report.overallScore(), report.threshold(), report.totalIssues());
        int rank = 1;
        for (Map.Entry<QaCategoryType, Integer> e : ranked.entrySet()) {
            log.warn("qa.remediation rank={} category='{}' issues={}", rank++, e.getKey().displayName(), e.getValue());
        }
    }

    private void applyRetention() {
        if (reportWriter != null) {
            retentionService.apply(reportWriter.reportsRoot(), options.getRetentionPolicy());
        }
    }

    private PipelineResult finish(String runId, int eventMark, PipelineOutcome outcome, LifecycleManifest manifest,
                                  MergeResult merge, QaReport qaReport, AuditReport auditReport,
                                  Path artifact, List<Path> reportFiles) {
        events.record(PipelineEventType.RUN_FINISHED, runId, ACTOR, Map.of(
                "outcome", outcome.name(),
                "state", manifest.state().name(),
                "overallScore", qaReport.overallScore()));
        log.info("pipeline.finished outcome={} state={} overallScore={} entries={}",
                outcome, manifest.state(), qaReport.overallScore(), merge.totalEntries());
        List<PipelineEvent> all = events.getAll();
        return new PipelineResult(runId, outcome, manifest, merge, qaReport, auditReport, artifact,
                reportFiles, all.subList(Math.min(eventMark, all.size()), all.size()));
    }

    public PipelineOptions getOptions() {
        return options;
    }

    public FragmentStore getStore() {
        return store;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PipelineOptions options = PipelineOptions.defaults();
        private FragmentStore store;
        private RunLock runLock;
        private PipelineEventLog events;
        private PipelineMetrics metrics;
        private Clock clock;
        private BaselineIndex baseline;
        private ExclusionRegistry exclusions;
        private HomonymPolicy homonymPolicy = new SemanticGroupHomonymPolicy();
        private List<QaCategory> qaCategories;

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Fragment store to run over. Defaults to a {@link DirectoryFragmentStore} on the
         * configured fragment directory.
         */
        public Builder store(FragmentStore store) {
            this.store = store;
            return this;
        }

        public Builder runLock(RunLock runLock) {
            this.runLock = runLock;
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

        /**
         * Baseline index to use instead of loading one from the configured path.
         */
        public Builder baseline(BaselineIndex baseline) {
            this.baseline = baseline;
            return this;
        }

        /**
         * Exclusion registry to use instead of loading one from the configured path.
         */
        public Builder exclusions(ExclusionRegistry exclusions) {
            this.exclusions = exclusions;
            return this;
        }

        public Builder homonymPolicy(HomonymPolicy homonymPolicy) {
            this.homonymPolicy = homonymPolicy;
            return this;
        }

        /**
         * Replaces the standard QA categories.
         */
        public Builder qaCategories(List<QaCategory> qaCategories) {
            this.qaCategories = qaCategories;
            return this;
        }

        public DictionaryPipeline build() {
            if (options == null) {
                throw new IllegalStateException("options are required");
            }
            return new DictionaryPipeline(this);
        }
    }
}
