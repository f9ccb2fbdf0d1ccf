package com.libran.dictionary.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link PipelineMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dictionary.stage.duration} - Timer (tag: stage)</li>
 *   <li>{@code dictionary.fragments.merged} - Counter</li>
 *   <li>{@code dictionary.fragments.skipped} - Counter</li>
 *   <li>{@code dictionary.duplicates.removed} - DistributionSummary</li>
 *   <li>{@code dictionary.qa.score} - DistributionSummary</li>
 *   <li>{@code dictionary.qa.gate} - Counter (tag: outcome)</li>
 *   <li>{@code dictionary.audit.score} - DistributionSummary</li>
 *   <li>{@code dictionary.audit.suppressions} - Counter</li>
 * </ul>
 */
public class MicrometerPipelineMetrics implements PipelineMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter fragmentsMerged;
    private final Counter fragmentsSkipped;
    private final DistributionSummary duplicatesRemoved;
    private final DistributionSummary qaScore;
    private final DistributionSummary auditScore;
    private final Counter suppressions;

    public MicrometerPipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.fragmentsMerged = Counter.builder("dictionary.fragments.merged")
                .description("Number of tranche fragments merged")
                .register(registry);
        this.fragmentsSkipped = Counter.builder("dictionary.fragments.skipped")
                .description("Number of tranche fragments skipped as unparsable")
                .register(registry);
        this.duplicatesRemoved = DistributionSummary.builder("dictionary.duplicates.removed")
                .description("Duplicate entries removed per merge")
                .register(registry);
        this.qaScore = DistributionSummary.builder("dictionary.qa.score")
                .description("Overall QA score per run")
                .register(registry);
        this.auditScore = DistributionSummary.builder("dictionary.audit.score")
                .description("Audit score per run")
                .register(registry);
        this.suppressions = Counter.builder("dictionary.audit.suppressions")
                .description("Audit issues suppressed by the exclusion registry")
                .register(registry);
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage, k ->
                Timer.builder("dictionary.stage.duration")
                        .description("Duration of pipeline stages")
                        .tag("stage", stage)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementFragmentsMerged(int count) {
        fragmentsMerged.increment(count);
    }

    @Override
    public void incrementFragmentsSkipped() {
        fragmentsSkipped.increment();
    }

    @Override
    public void recordDuplicatesRemoved(int count) {
        duplicatesRemoved.record(count);
    }

    @Override
    public void recordQaScore(int overallScore, boolean passed) {
        qaScore.record(overallScore);
        Counter.builder("dictionary.qa.gate")
                .description("QA gate outcomes")
                .tag("outcome", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuditScore(double score) {
        auditScore.record(score);
    }

    @Override
    public void incrementSuppressions() {
        suppressions.increment();
    }
}
