package com.libran.dictionary.cli;

import com.libran.dictionary.api.DictionaryPipeline;
import com.libran.dictionary.api.PipelineConfiguration;
import com.libran.dictionary.api.PipelineResult;
import com.libran.dictionary.core.DictionaryPipelineException;
import com.libran.dictionary.metrics.MicrometerPipelineMetrics;
import com.libran.dictionary.qa.QaCategoryType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;

/**
 * Command line entry point. All settings come from MicroProfile Config, so they can be
 * given as system properties or environment variables:
 *
 * <pre>
 *   java -Dlibran.pipeline.fragment-dir=tranches -Dlibran.pipeline.report-dir=reports \
 *        -cp app.jar com.libran.dictionary.cli.LibranPipelineCli
 * </pre>
 *
 * Exit status: 0 passed, 1 needs remediation, 2 fatal error.
 */
public final class LibranPipelineCli {
    private static final Logger log = LoggerFactory.getLogger(LibranPipelineCli.class);

    static final int EXIT_FATAL = 2;

    private LibranPipelineCli() {
    }

    public static void main(String[] args) {
        System.exit(execute(ConfigProvider.getConfig(), System.out, System.err));
    }

    static int execute(Config config, PrintStream out, PrintStream err) {
        PipelineResult result;
        try {
            PipelineConfiguration configuration = PipelineConfiguration.from(config);
            DictionaryPipeline pipeline = DictionaryPipeline.builder()
                    .options(configuration.options())
                    .runLock(configuration.createRunLock())
                    .metrics(new MicrometerPipelineMetrics(new SimpleMeterRegistry()))
                    .build();
            result = pipeline.run();
        } catch (DictionaryPipelineException | IllegalArgumentException | IllegalStateException e) {
            log.error("cli.failed error={}", e.getMessage(), e);
            err.println("Pipeline failed: " + e.getMessage());
            return EXIT_FATAL;
        }

        out.println(result.summary());
        result.artifact().ifPresent(p -> out.println("Artifact: " + p));
        for (Path file : result.reportFiles()) {
            out.println("Report:   " + file);
        }
        if (!result.passed()) {
            out.println("Remediation needed (issues per category, most first):");
            for (Map.Entry<QaCategoryType, Integer> e : result.rankedIssues().entrySet()) {
                out.println("  " + e.getKey().displayName() + ": " + e.getValue());
            }
        }
        return result.outcome().exitCode();
    }
}
