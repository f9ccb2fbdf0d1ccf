package com.libran.dictionary.api;

import com.libran.dictionary.core.model.Variant;
import com.libran.dictionary.merge.MergeOptions;
import com.libran.dictionary.qa.CategoryWeights;
import com.libran.dictionary.qa.QualityGate;
import com.libran.dictionary.report.ReportRetentionPolicy;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Options for a pipeline run.
 * Configures the gate threshold, artifact version, locations and heuristics.
 */
public class PipelineOptions {

    private static final int DEFAULT_MIN_NOTES_LENGTH = 10;

    private final int qaThreshold;
    private final String version;
    private final String project;
    private final Path fragmentDirectory;
    private final Path outputDirectory;
    private final Path reportDirectory;
    private final Path baselinePath;
    private final Path exclusionPath;
    private final CategoryWeights weights;
    private final boolean parallelQa;
    private final Variant defaultVariant;
    private final boolean baselineIgnoreCase;
    private final boolean stemFallback;
    private final int minNotesLength;
    private final ReportRetentionPolicy retentionPolicy;

    private PipelineOptions(Builder builder) {
        this.qaThreshold = builder.qaThreshold;
        this.version = builder.version;
        this.project = builder.project;
        this.fragmentDirectory = builder.fragmentDirectory;
        this.outputDirectory = builder.outputDirectory;
        this.reportDirectory = builder.reportDirectory;
        this.baselinePath = builder.baselinePath;
        this.exclusionPath = builder.exclusionPath;
        this.weights = builder.weights;
        this.parallelQa = builder.parallelQa;
        this.defaultVariant = builder.defaultVariant;
        this.baselineIgnoreCase = builder.baselineIgnoreCase;
        this.stemFallback = builder.stemFallback;
        this.minNotesLength = builder.minNotesLength;
        this.retentionPolicy = builder.retentionPolicy;
    }

    public int getQaThreshold() {
        return qaThreshold;
    }

    public String getVersion() {
        return version;
    }

    public String getProject() {
        return project;
    }

    /**
     * Root of the fragment store; pending fragments live directly in it.
     * Null when the pipeline is given a store explicitly.
     */
    public Path getFragmentDirectory() {
        return fragmentDirectory;
    }

    /**
     * Where the unified artifact is written. Null disables artifact writing.
     */
    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Root of the reports tree. Null disables report persistence.
     */
    public Path getReportDirectory() {
        return reportDirectory;
    }

    /**
     * Baseline release file. Null turns the baseline consistency check off.
     */
    public Path getBaselinePath() {
        return baselinePath;
    }

    /**
     * Exclusion list file. Null means nothing is excluded.
     */
    public Path getExclusionPath() {
        return exclusionPath;
    }

    public CategoryWeights getWeights() {
        return weights;
    }

    public boolean isParallelQa() {
        return parallelQa;
    }

    public Variant getDefaultVariant() {
        return defaultVariant;
    }

    public boolean isBaselineIgnoreCase() {
        return baselineIgnoreCase;
    }

    public boolean isStemFallback() {
        return stemFallback;
    }

    public int getMinNotesLength() {
        return minNotesLength;
    }

    public ReportRetentionPolicy getRetentionPolicy() {
        return retentionPolicy;
    }

    /**
     * Creates default options.
     */
    public static PipelineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int qaThreshold = QualityGate.DEFAULT_THRESHOLD;
        private String version = MergeOptions.DEFAULT_VERSION;
        private String project = MergeOptions.DEFAULT_PROJECT;
        private Path fragmentDirectory;
        private Path outputDirectory;
        private Path reportDirectory;
        private Path baselinePath;
        private Path exclusionPath;
        private CategoryWeights weights = CategoryWeights.defaultWeights();
        private boolean parallelQa = false;
        private Variant defaultVariant = Variant.ANCIENT;
        private boolean baselineIgnoreCase = false;
        private boolean stemFallback = true;
        private int minNotesLength = DEFAULT_MIN_NOTES_LENGTH;
        private ReportRetentionPolicy retentionPolicy = ReportRetentionPolicy.defaults();

        public Builder qaThreshold(int qaThreshold) {
            if (qaThreshold < 0 || qaThreshold > 100) {
                throw new IllegalArgumentException("qaThreshold must be between 0 and 100");
            }
            this.qaThreshold = qaThreshold;
            return this;
        }

        public Builder version(String version) {
            this.version = Objects.requireNonNull(version, "version is required");
            return this;
        }

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder fragmentDirectory(Path fragmentDirectory) {
            this.fragmentDirectory = fragmentDirectory;
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder reportDirectory(Path reportDirectory) {
            this.reportDirectory = reportDirectory;
            return this;
        }

        public Builder baselinePath(Path baselinePath) {
            this.baselinePath = baselinePath;
            return this;
        }

        public Builder exclusionPath(Path exclusionPath) {
            this.exclusionPath = exclusionPath;
            return this;
        }

        public Builder weights(CategoryWeights weights) {
            this.weights = Objects.requireNonNull(weights, "weights is required");
            return this;
        }

        public Builder parallelQa(boolean parallelQa) {
            this.parallelQa = parallelQa;
            return this;
        }

        public Builder defaultVariant(Variant defaultVariant) {
            this.defaultVariant = Objects.requireNonNull(defaultVariant, "defaultVariant is required");
            return this;
        }

        public Builder baselineIgnoreCase(boolean baselineIgnoreCase) {
            this.baselineIgnoreCase = baselineIgnoreCase;
            return this;
        }

        public Builder stemFallback(boolean stemFallback) {
            this.stemFallback = stemFallback;
            return this;
        }

        public Builder minNotesLength(int minNotesLength) {
            if (minNotesLength < 0) {
                throw new IllegalArgumentException("minNotesLength must not be negative");
            }
            this.minNotesLength = minNotesLength;
            return this;
        }

        public Builder retentionPolicy(ReportRetentionPolicy retentionPolicy) {
            this.retentionPolicy = Objects.requireNonNull(retentionPolicy, "retentionPolicy is required");
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }
    }
}
