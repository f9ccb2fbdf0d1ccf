package com.libran.dictionary.metrics;

import java.time.Duration;

/**
 * Metrics implementation that records nothing.
 */
public class NoOpPipelineMetrics implements PipelineMetrics {

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }

    @Override
    public void incrementFragmentsMerged(int count) {
    }

    @Override
    public void incrementFragmentsSkipped() {
    }

    @Override
    public void recordDuplicatesRemoved(int count) {
    }

    @Override
    public void recordQaScore(int overallScore, boolean passed) {
    }

    @Override
    public void recordAuditScore(double score) {
    }

    @Override
    public void incrementSuppressions() {
    }
}
