package com.libran.dictionary.api;

import com.libran.dictionary.core.model.Variant;
import com.libran.dictionary.lock.FileRunLock;
import com.libran.dictionary.lock.LocalRunLock;
import com.libran.dictionary.lock.LockConfig;
import com.libran.dictionary.lock.RunLock;
import com.libran.dictionary.qa.CategoryWeights;
import com.libran.dictionary.report.ReportRetentionPolicy;
import org.eclipse.microprofile.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Binds {@code libran.pipeline.*} MicroProfile Config properties to {@link PipelineOptions}
 * and a {@link RunLock}.
 *
 * <pre>
 * libran.pipeline.fragment-dir=tranches
 * libran.pipeline.qa.threshold=95
 * libran.pipeline.lock.mode=file
 * </pre>
 */
public class PipelineConfiguration {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    static final String PREFIX = "libran.pipeline.";

    /**
     * How concurrent runs are serialized.
     */
    public enum LockMode {
        /** In-process lock; enough when one JVM runs the pipeline. */
        LOCAL,
        /** Lock file in the fragment directory; serializes separate processes. */
        FILE
    }

    private final PipelineOptions options;
    private final LockMode lockMode;
    private final LockConfig lockConfig;

    public PipelineConfiguration(PipelineOptions options, LockMode lockMode, LockConfig lockConfig) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.lockMode = Objects.requireNonNull(lockMode, "lockMode is required");
        this.lockConfig = Objects.requireNonNull(lockConfig, "lockConfig is required");
    }

    public static PipelineConfiguration from(Config config) {
        // ── Locations ─────────────────────────────────────────
        PipelineOptions.Builder builder = PipelineOptions.builder()
                .fragmentDirectory(path(config, "fragment-dir"))
                .outputDirectory(path(config, "output-dir"))
                .reportDirectory(path(config, "report-dir"))
                .baselinePath(path(config, "baseline-path"))
                .exclusionPath(path(config, "exclusion-path"));

        // ── Artifact ──────────────────────────────────────────
        config.getOptionalValue(PREFIX + "version", String.class).ifPresent(builder::version);
        config.getOptionalValue(PREFIX + "project", String.class).ifPresent(builder::project);
        config.getOptionalValue(PREFIX + "merge.default-variant", String.class)
                .map(v -> Variant.valueOf(v.trim().toUpperCase(Locale.ROOT)))
                .ifPresent(builder::defaultVariant);

        // ── QA ────────────────────────────────────────────────
        config.getOptionalValue(PREFIX + "qa.threshold", Integer.class).ifPresent(builder::qaThreshold);
        config.getOptionalValue(PREFIX + "qa.parallel", Boolean.class).ifPresent(builder::parallelQa);
        builder.weights(weights(config));

        // ── Baseline & audit ──────────────────────────────────
        config.getOptionalValue(PREFIX + "baseline.ignore-case", Boolean.class).ifPresent(builder::baselineIgnoreCase);
        config.getOptionalValue(PREFIX + "baseline.stem-fallback", Boolean.class).ifPresent(builder::stemFallback);
        config.getOptionalValue(PREFIX + "audit.min-notes-length", Integer.class).ifPresent(builder::minNotesLength);

        // ── Reports ───────────────────────────────────────────
        ReportRetentionPolicy retention = ReportRetentionPolicy.defaults();
        var keepRecent = config.getOptionalValue(PREFIX + "reports.keep-recent", Integer.class);
        if (keepRecent.isPresent()) {
            retention = retention.withKeepRecent(keepRecent.get());
        }
        builder.retentionPolicy(retention);

        // ── Lock ──────────────────────────────────────────────
        LockMode mode = config.getOptionalValue(PREFIX + "lock.mode", String.class)
                .map(m -> LockMode.valueOf(m.trim().toUpperCase(Locale.ROOT)))
                .orElse(LockMode.LOCAL);
        LockConfig defaults = LockConfig.defaults();
        LockConfig lockConfig = new LockConfig(
                config.getOptionalValue(PREFIX + "lock.timeout-ms", Long.class).orElse(defaults.timeoutMs()),
                config.getOptionalValue(PREFIX + "lock.max-retries", Integer.class).orElse(defaults.maxRetries()),
                config.getOptionalValue(PREFIX + "lock.retry-delay-ms", Long.class).orElse(defaults.retryDelayMs()));

        PipelineOptions options = builder.build();
        log.debug("config.loaded fragmentDir={} threshold={} lockMode={}",
                options.getFragmentDirectory(), options.getQaThreshold(), mode);
        return new PipelineConfiguration(options, mode, lockConfig);
    }

    public PipelineOptions options() {
        return options;
    }

    public LockMode lockMode() {
        return lockMode;
    }

    public LockConfig lockConfig() {
        return lockConfig;
    }

    public RunLock createRunLock() {
        return switch (lockMode) {
            case LOCAL -> new LocalRunLock(lockConfig);
            case FILE -> new FileRunLock(lockConfig);
        };
    }

    private static Path path(Config config, String key) {
        return config.getOptionalValue(PREFIX + key, String.class)
                .filter(v -> !v.isBlank())
                .map(Path::of)
                .orElse(null);
    }

    private static CategoryWeights weights(Config config) {
        CategoryWeights d = CategoryWeights.defaultWeights();
        return new CategoryWeights(
                weight(config, "collision", d.collision()),
                weight(config, "suffix-laziness", d.suffixLaziness()),
                weight(config, "compound-hyphen", d.compoundHyphen()),
                weight(config, "coverage", d.coverage()),
                weight(config, "ruleset", d.ruleset()),
                weight(config, "phrasebook", d.phrasebook()),
                weight(config, "versioning", d.versioning()));
    }

    private static double weight(Config config, String name, double defaultValue) {
        return config.getOptionalValue(PREFIX + "qa.weights." + name, Double.class).orElse(defaultValue);
    }
}
