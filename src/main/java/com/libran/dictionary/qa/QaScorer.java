package com.libran.dictionary.qa;

import com.libran.dictionary.baseline.BaselineIndex;
import com.libran.dictionary.core.DictionaryPipelineException;
import com.libran.dictionary.core.model.Severity;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.events.PipelineEventLog;
import com.libran.dictionary.events.PipelineEventType;
import com.libran.dictionary.metrics.NoOpPipelineMetrics;
import com.libran.dictionary.metrics.PipelineMetrics;
import com.libran.dictionary.qa.category.CollisionCheck;
import com.libran.dictionary.qa.category.CompoundHyphenReview;
import com.libran.dictionary.qa.category.CoverageAnalysis;
import com.libran.dictionary.qa.category.PhrasebookIntegration;
import com.libran.dictionary.qa.category.RulesetCompliance;
import com.libran.dictionary.qa.category.SuffixLazinessAudit;
import com.libran.dictionary.qa.category.VersioningCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Scores a dictionary snapshot with the weighted QA categories and applies the gate.
 *
 * <p>Formula: overall = round(sum(weight * categoryScore)), clamped to [0, 100].
 * The baseline consistency check runs only when a baseline is configured and never
 * contributes to the overall score.</p>
 *
 * <p>Categories are pure functions of the snapshot, so they may be evaluated on a fixed
 * thread pool; results are always reported in category order.</p>
 */
public class QaScorer {
    private static final Logger log = LoggerFactory.getLogger(QaScorer.class);
    private static final String ACTOR = "qa-scorer";

    private final List<QaCategory> categories;
    private final CategoryWeights weights;
    private final QualityGate gate;
    private final BaselineConsistencyCheck baselineCheck;
    private final boolean parallel;
    private final PipelineMetrics metrics;
    private final PipelineEventLog events;
    private final Clock clock;

    private QaScorer(Builder builder) {
        this.categories = builder.categories.stream()
                .sorted(Comparator.comparing(QaCategory::type))
                .toList();
        this.weights = builder.weights;
        this.gate = builder.gate;
        this.baselineCheck = builder.baseline != null ? new BaselineConsistencyCheck(builder.baseline) : null;
        this.parallel = builder.parallel;
        this.metrics = builder.metrics;
        this.events = builder.events;
        this.clock = builder.clock;
    }

    public QaReport score(UnifiedDictionary dictionary) {
        log.info("qa.started entries={} categories={} parallel={}", dictionary.size(), categories.size(), parallel);
        List<CategoryResult> results = parallel ? evaluateParallel(dictionary) : evaluateSequential(dictionary);

        Map<QaCategoryType, Double> scores = new EnumMap<>(QaCategoryType.class);
        for (CategoryResult result : results) {
            scores.put(result.category(), result.score());
            log.debug("qa.category name='{}' score={} issues={}",
                    result.category().displayName(), result.score(), result.issueCount());
        }
        int overall = weights.combine(scores);
        boolean passed = gate.passes(overall);

        BaselineConsistencyResult baseline = null;
        if (baselineCheck != null) {
            baseline = baselineCheck.evaluate(dictionary);
            log.info("qa.baseline score={} matches={}/{} high={}", baseline.score(),
                    baseline.baselineMatches(), baseline.totalChecked(),
                    baseline.count(Severity.HIGH));
        }

        QaReport report = new QaReport(dictionary.metadata().version(), dictionary.size(), results,
                overall, gate.threshold(), passed, baseline, clock.instant());

        metrics.recordQaScore(overall, passed);
        events.record(PipelineEventType.QA_COMPLETED, dictionary.metadata().version(), ACTOR, Map.of(
                "overallScore", overall,
                "threshold", gate.threshold(),
                "passed", passed,
                "totalIssues", report.totalIssues()));
        log.info("qa.completed overallScore={} threshold={} passed={} totalIssues={}",
                overall, gate.threshold(), passed, report.totalIssues());
        return report;
    }

    private List<CategoryResult> evaluateSequential(UnifiedDictionary dictionary) {
        List<CategoryResult> results = new ArrayList<>(categories.size());
        for (QaCategory category : categories) {
            results.add(category.evaluate(dictionary));
        }
        return results;
    }

    private List<CategoryResult> evaluateParallel(UnifiedDictionary dictionary) {
        int threads = Math.max(1, Math.min(categories.size(), Runtime.getRuntime().availableProcessors()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<CategoryResult>> tasks = new ArrayList<>(categories.size());
            for (QaCategory category : categories) {
                tasks.add(() -> category.evaluate(dictionary));
            }
            // invokeAll keeps the task order
            List<Future<CategoryResult>> futures = executor.invokeAll(tasks);
            List<CategoryResult> results = new ArrayList<>(futures.size());
            for (Future<CategoryResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DictionaryPipelineException("QA evaluation interrupted", e);
        } catch (ExecutionException e) {
            throw new DictionaryPipelineException("QA category failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdown();
        }
    }

    public CategoryWeights getWeights() {
        return weights;
    }

    public boolean hasBaseline() {
        return baselineCheck != null;
    }

    /**
     * The seven standard categories, with collisions judged by the given homonym policy.
     */
    public static List<QaCategory> standardCategories(HomonymPolicy homonymPolicy) {
        return List.of(
                new CollisionCheck(homonymPolicy),
                new SuffixLazinessAudit(),
                new CompoundHyphenReview(),
                new CoverageAnalysis(),
                new RulesetCompliance(),
                new PhrasebookIntegration(),
                new VersioningCheck());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<QaCategory> categories;
        private HomonymPolicy homonymPolicy = new SemanticGroupHomonymPolicy();
        private CategoryWeights weights = CategoryWeights.defaultWeights();
        private QualityGate gate = QualityGate.defaultGate();
        private BaselineIndex baseline;
        private boolean parallel;
        private PipelineMetrics metrics = new NoOpPipelineMetrics();
        private PipelineEventLog events = new PipelineEventLog();
        private Clock clock = Clock.systemUTC();

        /**
         * Replaces the standard categories. Each category type may appear at most once.
         */
        public Builder categories(List<QaCategory> categories) {
            this.categories = List.copyOf(categories);
            return this;
        }

        public Builder homonymPolicy(HomonymPolicy homonymPolicy) {
            this.homonymPolicy = homonymPolicy;
            return this;
        }

        public Builder weights(CategoryWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder threshold(int threshold) {
            this.gate = new QualityGate(threshold);
            return this;
        }

        public Builder baseline(BaselineIndex baseline) {
            this.baseline = baseline;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder events(PipelineEventLog events) {
            this.events = events;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public QaScorer build() {
            if (categories == null) {
                categories = standardCategories(homonymPolicy);
            }
            Set<QaCategoryType> seen = EnumSet.noneOf(QaCategoryType.class);
            for (QaCategory category : categories) {
                if (!seen.add(category.type())) {
                    throw new IllegalArgumentException("Duplicate QA category: " + category.type());
                }
            }
            return new QaScorer(this);
        }
    }
}
