package com.libran.dictionary.qa;

/**
 * Pass/fail decision on the overall QA score.
 *
 * @param threshold minimum overall score that passes
 */
public record QualityGate(int threshold) {

    public static final int DEFAULT_THRESHOLD = 95;

    public QualityGate {
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("threshold must be within [0, 100], got " + threshold);
        }
    }

    public static QualityGate defaultGate() {
        return new QualityGate(DEFAULT_THRESHOLD);
    }

    public boolean passes(int overallScore) {
        return overallScore >= threshold;
    }
}
