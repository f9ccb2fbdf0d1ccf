package com.libran.dictionary.metrics;

import java.time.Duration;

/**
 * Interface for recording pipeline metrics.
 * The default {@link NoOpPipelineMetrics} does nothing; {@link MicrometerPipelineMetrics}
 * publishes to a Micrometer registry.
 */
public interface PipelineMetrics {

    void recordStageDuration(String stage, Duration duration);

    void incrementFragmentsMerged(int count);

    void incrementFragmentsSkipped();

    void recordDuplicatesRemoved(int count);

    void recordQaScore(int overallScore, boolean passed);

    void recordAuditScore(double score);

    void incrementSuppressions();
}
