package com.libran.dictionary.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineMetrics Tests")
class PipelineMetricsTest {

    @Nested
    @DisplayName("NoOpPipelineMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpPipelineMetrics noOp = new NoOpPipelineMetrics();

            assertDoesNotThrow(() -> {
                noOp.recordStageDuration("merge", Duration.ofMillis(10));
                noOp.incrementFragmentsMerged(3);
                noOp.incrementFragmentsSkipped();
                noOp.recordDuplicatesRemoved(2);
                noOp.recordQaScore(96, true);
                noOp.recordAuditScore(99.5);
                noOp.incrementSuppressions();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerPipelineMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerPipelineMetrics metrics = new MicrometerPipelineMetrics(registry);

        @Test
        @DisplayName("Should record stage durations per stage")
        void stageDuration() {
            metrics.recordStageDuration("merge", Duration.ofMillis(150));
            metrics.recordStageDuration("merge", Duration.ofMillis(250));
            metrics.recordStageDuration("qa", Duration.ofMillis(50));

            Timer merge = registry.find("dictionary.stage.duration").tag("stage", "merge").timer();
            assertNotNull(merge);
            assertEquals(2, merge.count());
            assertEquals(1, registry.find("dictionary.stage.duration").tag("stage", "qa").timer().count());
        }

        @Test
        @DisplayName("Should count merged and skipped fragments")
        void fragmentCounters() {
            metrics.incrementFragmentsMerged(3);
            metrics.incrementFragmentsSkipped();

            assertEquals(3.0, registry.find("dictionary.fragments.merged").counter().count());
            assertEquals(1.0, registry.find("dictionary.fragments.skipped").counter().count());
        }

        @Test
        @DisplayName("Should tag gate outcomes")
        void gateOutcome() {
            metrics.recordQaScore(96, true);
            metrics.recordQaScore(80, false);
            metrics.recordQaScore(97, true);

            Counter passed = registry.find("dictionary.qa.gate").tag("outcome", "passed").counter();
            Counter failed = registry.find("dictionary.qa.gate").tag("outcome", "failed").counter();
            assertEquals(2.0, passed.count());
            assertEquals(1.0, failed.count());

            DistributionSummary scores = registry.find("dictionary.qa.score").summary();
            assertEquals(3, scores.count());
            assertEquals(97.0, scores.max());
        }

        @Test
        @DisplayName("Should record duplicates, audit score and suppressions")
        void auditMetrics() {
            metrics.recordDuplicatesRemoved(4);
            metrics.recordAuditScore(98.5);
            metrics.incrementSuppressions();

            assertEquals(4.0, registry.find("dictionary.duplicates.removed").summary().totalAmount());
            assertEquals(98.5, registry.find("dictionary.audit.score").summary().totalAmount());
            assertEquals(1.0, registry.find("dictionary.audit.suppressions").counter().count());
        }
    }
}
