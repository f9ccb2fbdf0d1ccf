package com.libran.dictionary.api;

import com.libran.dictionary.artifact.UnifiedDictionaryReader;
import com.libran.dictionary.baseline.BaselineEntry;
import com.libran.dictionary.baseline.BaselineIndex;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.events.PipelineEvent;
import com.libran.dictionary.events.PipelineEventLog;
import com.libran.dictionary.events.PipelineEventType;
import com.libran.dictionary.exclusion.ExclusionEntry;
import com.libran.dictionary.exclusion.ExclusionRegistry;
import com.libran.dictionary.exclusion.NormalizationFlags;
import com.libran.dictionary.lifecycle.DirectoryFragmentStore;
import com.libran.dictionary.lifecycle.FragmentArea;
import com.libran.dictionary.lifecycle.InMemoryFragmentStore;
import com.libran.dictionary.lifecycle.LifecycleState;
import com.libran.dictionary.lock.LocalRunLock;
import com.libran.dictionary.lock.LockAcquisitionException;
import com.libran.dictionary.lock.LockConfig;
import com.libran.dictionary.lock.RunLock;
import com.libran.dictionary.merge.NoValidFragmentsException;
import com.libran.dictionary.metrics.MicrometerPipelineMetrics;
import com.libran.dictionary.qa.CategoryResult;
import com.libran.dictionary.qa.QaCategory;
import com.libran.dictionary.qa.QaCategoryType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DictionaryPipeline Tests")
class DictionaryPipelineTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2025-03-01T10:15:30Z"), ZoneOffset.UTC);

    private static final String STONE = """
            {"stone": {"ancient": "lapis", "modern": "kő", "notes": "Latin lapis"}}
            """;
    private static final String LEADER = """
            [{"english": "leader", "ancient": "leaderor", "modern": "leaderë"}]
            """;

    private record FixedCategory(QaCategoryType type, double score) implements QaCategory {
        @Override
        public CategoryResult evaluate(UnifiedDictionary dictionary) {
            return new CategoryResult(type, score, List.of(), "fixed");
        }
    }

    private static List<QaCategory> scoring(double score) {
        List<QaCategory> categories = new ArrayList<>();
        for (QaCategoryType type : QaCategoryType.values()) {
            categories.add(new FixedCategory(type, score));
        }
        return categories;
    }

    private static PipelineOptions.Builder options() {
        return PipelineOptions.builder().version("1.7.0").project("Libran");
    }

    private InMemoryFragmentStore store;
    private PipelineEventLog events;

    @BeforeEach
    void setUp() {
        store = new InMemoryFragmentStore()
                .add("tranche-a.json", STONE)
                .add("tranche-b.json", LEADER);
        events = new PipelineEventLog();
    }

    private DictionaryPipeline pipeline(double categoryScore) {
        return DictionaryPipeline.builder()
                .options(options().build())
                .store(store)
                .events(events)
                .clock(FIXED)
                .qaCategories(scoring(categoryScore))
                .build();
    }

    @Nested
    @DisplayName("Gate passes")
    class PassingTests {

        @Test
        @DisplayName("Fragments end in the deleted area and the audit runs")
        void passedRun() throws IOException {
            PipelineResult result = pipeline(96).run();

            assertTrue(result.passed());
            assertEquals(0, result.outcome().exitCode());
            assertEquals(LifecycleState.DELETED, result.manifest().state());
            assertEquals(List.of("tranche-a.json", "tranche-b.json"), store.list(FragmentArea.DELETED));
            assertTrue(store.list(FragmentArea.MERGED).isEmpty());
            assertTrue(store.list(FragmentArea.PENDING).isEmpty());
            assertEquals(LifecycleState.DELETED, store.lastManifest().orElseThrow().state());

            assertEquals(96, result.qaReport().overallScore());
            assertEquals(2, result.audit().orElseThrow().totalIssues());
            assertTrue(result.artifact().isEmpty());
            assertEquals("PASSED: 2 entries from 2 fragment(s), 0 duplicate(s) removed; QA 96/95; "
                    + "audit 99.0 (2 issue(s), 0 suppressed); lifecycle DELETED", result.summary());
        }

        @Test
        @DisplayName("Lifecycle history records every transition")
        void history() {
            PipelineResult result = pipeline(100).run();

            assertEquals(List.of(LifecycleState.MERGED, LifecycleState.QA_PASSED, LifecycleState.DELETED),
                    result.manifest().history().stream().map(t -> t.to()).toList());
            assertEquals(3, events.getByType(PipelineEventType.LIFECYCLE_TRANSITION).size());
        }

        @Test
        @DisplayName("Result carries the run's events from start to finish")
        void events() {
            PipelineResult result = pipeline(96).run();

            List<PipelineEvent> runEvents = result.events();
            assertEquals(PipelineEventType.RUN_STARTED, runEvents.get(0).type());
            PipelineEvent last = runEvents.get(runEvents.size() - 1);
            assertEquals(PipelineEventType.RUN_FINISHED, last.type());
            assertEquals("PASSED", last.details().get("outcome"));
            assertEquals(result.runId(), last.subject());
        }

        @Test
        @DisplayName("Events are stamped by the pipeline clock")
        void eventTimestamps() {
            PipelineResult result = DictionaryPipeline.builder()
                    .options(options().build())
                    .store(store)
                    .clock(FIXED)
                    .qaCategories(scoring(96))
                    .build()
                    .run();

            assertFalse(result.events().isEmpty());
            assertTrue(result.events().stream().allMatch(e -> e.timestamp().equals(FIXED.instant())));
        }
    }

    @Nested
    @DisplayName("Gate fails")
    class FailingTests {

        @Test
        @DisplayName("Fragments stay merged and no audit runs")
        void failedRun() throws IOException {
            PipelineResult result = pipeline(60).run();

            assertFalse(result.passed());
            assertEquals(PipelineOutcome.NEEDS_REMEDIATION, result.outcome());
            assertEquals(1, result.outcome().exitCode());
            assertEquals(LifecycleState.QA_FAILED, result.manifest().state());
            assertEquals(FragmentArea.MERGED, result.manifest().state().area());
            assertEquals(List.of("tranche-a.json", "tranche-b.json"), store.list(FragmentArea.MERGED));
            assertTrue(store.list(FragmentArea.DELETED).isEmpty());
            assertTrue(result.audit().isEmpty());
            assertTrue(events.getByType(PipelineEventType.AUDIT_COMPLETED).isEmpty());
        }

        @Test
        @DisplayName("Next run merges the failed set together with new fragments")
        void rerunAfterFailure() throws IOException {
            pipeline(60).run();
            store.add("tranche-c.json", "{\"water\": \"aqua\"}");

            PipelineResult result = pipeline(96).run();

            assertTrue(result.passed());
            assertEquals(List.of("tranche-a.json", "tranche-b.json", "tranche-c.json"), result.merge().consumed());
            assertEquals(List.of("tranche-c.json"), result.merge().relocated());
            assertEquals(3, store.list(FragmentArea.DELETED).size());
        }

        @Test
        @DisplayName("Ranked issues come from the QA report")
        void rankedIssues() {
            PipelineResult result = DictionaryPipeline.builder()
                    .options(options().build())
                    .store(store)
                    .clock(FIXED)
                    .build()
                    .run();

            assertFalse(result.passed());
            assertEquals(result.qaReport().issueCountsByCategory(), result.rankedIssues());
            assertTrue(result.rankedIssues().containsKey(QaCategoryType.PHRASEBOOK));
        }
    }

    @Nested
    @DisplayName("Fatal errors")
    class FatalTests {

        @Test
        @DisplayName("No valid fragments aborts the run and moves nothing")
        void noValidFragments() throws IOException {
            InMemoryFragmentStore broken = new InMemoryFragmentStore().add("bad.json", "{nope");
            DictionaryPipeline pipeline = DictionaryPipeline.builder()
                    .options(options().build())
                    .store(broken)
                    .events(events)
                    .build();

            assertThrows(NoValidFragmentsException.class, pipeline::run);
            assertEquals(List.of("bad.json"), broken.list(FragmentArea.PENDING));
            assertTrue(broken.lastManifest().isEmpty());
            PipelineEvent finished = events.getByType(PipelineEventType.RUN_FINISHED).get(0);
            assertEquals("FAILED", finished.details().get("outcome"));
        }

        @Test
        @DisplayName("A held run lock stops the run before anything is read")
        void lockHeld() throws IOException {
            RunLock lock = mock(RunLock.class);
            when(lock.tryLock(anyString())).thenThrow(new LockAcquisitionException("held"));

            DictionaryPipeline pipeline = DictionaryPipeline.builder()
                    .options(options().build())
                    .store(store)
                    .runLock(lock)
                    .build();

            assertThrows(LockAcquisitionException.class, pipeline::run);
            verify(lock, never()).unlock(anyString());
            assertEquals(2, store.list(FragmentArea.PENDING).size());
        }

        @Test
        @DisplayName("The run lock is keyed on the store and released after the run")
        void lockReleased() {
            RunLock lock = mock(RunLock.class);
            when(lock.tryLock(store.lockKey())).thenReturn(true);

            DictionaryPipeline.builder()
                    .options(options().build())
                    .store(store)
                    .runLock(lock)
                    .qaCategories(scoring(96))
                    .build()
                    .run();

            verify(lock).unlock(store.lockKey());
        }

        @Test
        @DisplayName("A second pipeline over the same store cannot run while the first holds it")
        void concurrentPipelinesOverOneStore() throws Exception {
            CountDownLatch inQa = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            List<QaCategory> categories = new ArrayList<>(scoring(96));
            categories.set(0, new QaCategory() {
                @Override
                public QaCategoryType type() {
                    return QaCategoryType.COLLISION;
                }

                @Override
                public CategoryResult evaluate(UnifiedDictionary dictionary) {
                    inQa.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return new CategoryResult(QaCategoryType.COLLISION, 96, List.of(), "fixed");
                }
            });
            DictionaryPipeline first = DictionaryPipeline.builder()
                    .options(options().build())
                    .store(store)
                    .qaCategories(categories)
                    .build();
            DictionaryPipeline second = DictionaryPipeline.builder()
                    .options(options().build())
                    .store(store)
                    .runLock(new LocalRunLock(new LockConfig(100, 0, 10)))
                    .qaCategories(scoring(96))
                    .build();

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<PipelineResult> running = executor.submit(first::run);
                assertTrue(inQa.await(5, TimeUnit.SECONDS));

                assertThrows(LockAcquisitionException.class, second::run);
                assertEquals(List.of("tranche-a.json", "tranche-b.json"), store.list(FragmentArea.MERGED));

                release.countDown();
                PipelineResult result = running.get(5, TimeUnit.SECONDS);
                assertEquals(LifecycleState.DELETED, result.manifest().state());
                assertEquals(List.of("tranche-a.json", "tranche-b.json"), store.list(FragmentArea.DELETED));
            } finally {
                release.countDown();
                executor.shutdown();
                executor.awaitTermination(5, TimeUnit.SECONDS);
            }
        }

        @Test
        @DisplayName("A store or fragment directory is required")
        void storeRequired() {
            assertThrows(IllegalStateException.class,
                    () -> DictionaryPipeline.builder().options(options().build()).build());
        }
    }

    @Nested
    @DisplayName("Standard QA and audit")
    class StandardTests {

        @Test
        @DisplayName("Exclusions suppress audit issues and the baseline check is reported")
        void exclusionsAndBaseline() {
            ExclusionRegistry exclusions = new ExclusionRegistry(
                    List.of(new ExclusionEntry("titles", "leader", List.of(), null)), NormalizationFlags.none());
            BaselineIndex baseline = new BaselineIndex(List.of(new BaselineEntry("stone", "lapis", "kő", null, null)));

            PipelineResult result = DictionaryPipeline.builder()
                    .options(options().qaThreshold(0).build())
                    .store(store)
                    .events(events)
                    .clock(FIXED)
                    .exclusions(exclusions)
                    .baseline(baseline)
                    .build()
                    .run();

            assertTrue(result.passed());
            assertEquals(0, result.audit().orElseThrow().totalIssues());
            assertEquals(2, result.audit().orElseThrow().suppressions().size());
            assertEquals(1, result.qaReport().baselineResult().orElseThrow().baselineMatches());
            assertEquals(2, events.getByType(PipelineEventType.EXCLUSION_SUPPRESSED).size());
        }

        @Test
        @DisplayName("Each stage is timed")
        void stageMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();

            DictionaryPipeline.builder()
                    .options(options().build())
                    .store(store)
                    .metrics(new MicrometerPipelineMetrics(registry))
                    .qaCategories(scoring(96))
                    .build()
                    .run();

            for (String stage : List.of("merge", "artifact", "qa", "audit", "lifecycle")) {
                assertEquals(1, registry.find("dictionary.stage.duration").tag("stage", stage).timer().count(), stage);
            }
            assertEquals(2.0, registry.find("dictionary.fragments.merged").counter().count());
            assertEquals(1.0, registry.find("dictionary.qa.gate").tag("outcome", "passed").counter().count());
        }
    }

    @Nested
    @DisplayName("Directory store")
    class DirectoryTests {

        @TempDir
        Path root;

        private DictionaryPipeline directoryPipeline(double categoryScore) {
            return DictionaryPipeline.builder()
                    .options(options()
                            .fragmentDirectory(root.resolve("tranches"))
                            .outputDirectory(root.resolve("dist"))
                            .reportDirectory(root.resolve("reports"))
                            .build())
                    .clock(FIXED)
                    .qaCategories(scoring(categoryScore))
                    .build();
        }

        private void writeTranches() throws IOException {
            Path tranches = Files.createDirectories(root.resolve("tranches"));
            Files.writeString(tranches.resolve("tranche-a.json"), STONE);
            Files.writeString(tranches.resolve("tranche-b.json"), LEADER);
        }

        @Test
        @DisplayName("Passing run writes the artifact, reports and manifest")
        void passingRun() throws IOException {
            writeTranches();

            PipelineResult result = directoryPipeline(97).run();

            Path artifact = result.artifact().orElseThrow();
            assertEquals(root.resolve("dist").resolve("UnifiedLibranDictionaryv1.7.0.json"), artifact);
            assertEquals(2, new UnifiedDictionaryReader().read(artifact).size());
            assertEquals(5, result.reportFiles().size());
            assertTrue(result.reportFiles().stream().allMatch(p -> p.startsWith(root.resolve("reports").resolve("recent"))));
            assertTrue(Files.exists(root.resolve("tranches").resolve("delete").resolve("tranche-a.json")));
            assertTrue(Files.exists(root.resolve("tranches").resolve(DirectoryFragmentStore.MANIFEST_FILE)));
        }

        @Test
        @DisplayName("A corrected tranche resubmitted under its name replaces the failed copy")
        void resubmittedAfterFailure() throws IOException {
            writeTranches();
            directoryPipeline(50).run();
            Path tranches = root.resolve("tranches");
            Files.writeString(tranches.resolve("tranche-a.json"), "{\"stone\": \"saxum\"}");

            PipelineResult result = directoryPipeline(97).run();

            assertTrue(result.passed());
            assertEquals(List.of("tranche-b.json", "tranche-a.json"), result.merge().consumed());
            assertEquals(List.of("tranche-a.json"), result.merge().relocated());
            assertEquals("saxum", result.merge().dictionary().find("stone").orElseThrow().ancientSurface());
            assertEquals("{\"stone\": \"saxum\"}",
                    Files.readString(tranches.resolve("delete").resolve("tranche-a.json")));
            assertFalse(Files.exists(tranches.resolve("merged").resolve("tranche-a.json")));
        }

        @Test
        @DisplayName("A tranche name can be reused after its earlier copy was deleted")
        void reusedAfterPass() throws IOException {
            writeTranches();
            directoryPipeline(97).run();
            Path tranches = root.resolve("tranches");
            Files.writeString(tranches.resolve("tranche-a.json"), "{\"water\": \"aqua\"}");

            PipelineResult result = directoryPipeline(97).run();

            assertEquals(LifecycleState.DELETED, result.manifest().state());
            assertEquals("{\"water\": \"aqua\"}",
                    Files.readString(tranches.resolve("delete").resolve("tranche-a.json")));
        }

        @Test
        @DisplayName("Failing run writes only QA reports and leaves fragments merged")
        void failingRun() throws IOException {
            writeTranches();

            PipelineResult result = directoryPipeline(50).run();

            assertEquals(2, result.reportFiles().size());
            assertTrue(Files.exists(root.resolve("tranches").resolve("merged").resolve("tranche-b.json")));
            assertTrue(result.artifact().isPresent());
        }
    }
}
