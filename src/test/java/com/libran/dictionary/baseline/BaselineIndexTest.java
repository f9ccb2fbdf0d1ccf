package com.libran.dictionary.baseline;

import com.libran.dictionary.core.ReferenceDataException;
import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.FragmentSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BaselineIndex Tests")
class BaselineIndexTest {

    private static final String CLUSTERED = """
            {"clusters": {
              "family": {
                "commentary": "kinship terms",
                "ancient": [
                  {"english": "mother", "ancient": "mater", "notes": "Lat. mater"},
                  {"english": "brother", "ancient": "frater"}
                ],
                "modern": [{"english": "mother", "modern": "anya"}]
              },
              "nature": {
                "ancient": [{"english": "walk", "ancient": "ambulo"}, {"english": "water", "ancient": "aqua"}]
              }
            }}
            """;

    private final BaselineIndex index = new BaselineLoader().parse(new FragmentSource("baseline.json", CLUSTERED));

    @Nested
    @DisplayName("Lookups")
    class LookupTests {

        @Test
        @DisplayName("Finds entries by English, Ancient and Modern")
        void lookups() {
            assertEquals("mater", index.lookup("mother").orElseThrow().ancient());
            assertEquals("mother", index.lookupByAncient("mater").orElseThrow().english());
            assertEquals("mother", index.lookupByModern("anya").orElseThrow().english());
        }

        @Test
        @DisplayName("Lookups are exact by default")
        void exactByDefault() {
            assertTrue(index.lookup("Mother").isEmpty());
            assertTrue(index.lookup("unknown").isEmpty());
            assertTrue(index.lookup(null).isEmpty());
        }

        @Test
        @DisplayName("Ignore-case folds lookups")
        void ignoreCase() {
            BaselineIndex folded = new BaselineIndex(
                    List.of(new BaselineEntry("Mother", "Mater", null, null, null)), Map.of(), true, true);

            assertTrue(folded.lookup("mother").isPresent());
            assertTrue(folded.lookupByAncient("MATER").isPresent());
        }

        @Test
        @DisplayName("Cluster membership and commentary are exposed")
        void clusters() {
            ClusterReference family = index.clusterOf("brother").orElseThrow();
            assertEquals("family", family.clusterName());
            assertEquals("kinship terms", family.commentary());
            assertEquals("", index.clusterOf("water").orElseThrow().commentary());
        }

        @Test
        @DisplayName("Stats count forms, notes and clusters")
        void stats() {
            assertEquals(new BaselineStats(4, 4, 1, 1, 2), index.stats());
        }
    }

    @Nested
    @DisplayName("findSimilar")
    class SimilarTests {

        @Test
        @DisplayName("Containment matches in both directions and excludes the key itself")
        void containment() {
            BaselineIndex small = new BaselineIndex(List.of(
                    new BaselineEntry("water", "aqua", null, null, null),
                    new BaselineEntry("waterfall", "cataracta", null, null, null),
                    new BaselineEntry("fall", "casus", null, null, null)));

            List<String> similar = small.findSimilar("water").stream().map(BaselineEntry::english).toList();
            assertEquals(List.of("waterfall"), similar);

            List<String> reverse = small.findSimilar("waterfalls").stream().map(BaselineEntry::english).toList();
            assertEquals(List.of("water", "waterfall", "fall"), reverse);
        }

        @Test
        @DisplayName("Stem fallback matches inflected forms")
        void stemFallback() {
            BaselineIndex withStem = new BaselineIndex(
                    List.of(new BaselineEntry("jumping", null, null, null, null)), Map.of(), false, true);
            assertEquals(1, withStem.findSimilar("jumped").size());

            BaselineIndex noStem = new BaselineIndex(
                    List.of(new BaselineEntry("jumping", null, null, null, null)), Map.of(), false, false);
            assertTrue(noStem.findSimilar("jumped").isEmpty());
        }

        @Test
        @DisplayName("Results are capped")
        void capped() {
            List<BaselineEntry> many = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
                many.add(new BaselineEntry("stone" + i, null, null, null, null));
            }
            assertEquals(BaselineIndex.MAX_SIMILAR, new BaselineIndex(many).findSimilar("stone").size());
        }

        @Test
        @DisplayName("Stem strips one common suffix")
        void stem() {
            assertEquals("walk", BaselineIndex.stem("walking"));
            assertEquals("quick", BaselineIndex.stem("quickly"));
            assertEquals("stone", BaselineIndex.stem("stones"));
        }
    }

    @Nested
    @DisplayName("checkConsistency")
    class ConsistencyTests {

        @Test
        @DisplayName("Matching entry has no discrepancies")
        void consistent() {
            Entry entry = Entry.builder().english("mother").ancient("mater").modern("anya").notes("Lat. mater").build();

            EntryConsistency result = index.checkConsistency(entry);
            assertTrue(result.hasReference());
            assertTrue(result.discrepancies().isEmpty());
        }

        @Test
        @DisplayName("Form mismatches are high, missing notes medium")
        void mismatches() {
            Entry entry = Entry.builder().english("mother").ancient("matra").modern("mama").build();

            List<BaselineDiscrepancy.Kind> kinds = index.checkConsistency(entry).discrepancies().stream()
                    .map(BaselineDiscrepancy::kind).toList();
            assertEquals(List.of(
                    BaselineDiscrepancy.Kind.ANCIENT_MISMATCH,
                    BaselineDiscrepancy.Kind.MODERN_MISMATCH,
                    BaselineDiscrepancy.Kind.MISSING_NOTES), kinds);
        }

        @Test
        @DisplayName("Unknown key with near matches is a low-severity suggestion")
        void similarSuggestion() {
            Entry entry = Entry.builder().english("waters").ancient("aquae").build();

            EntryConsistency result = index.checkConsistency(entry);
            assertFalse(result.hasReference());
            assertEquals(1, result.discrepancies().size());
            assertEquals(BaselineDiscrepancy.Kind.SIMILAR_ENTRIES, result.discrepancies().get(0).kind());
        }

        @Test
        @DisplayName("Missing notes are not reported when the baseline had none")
        void noBaselineNotes() {
            Entry entry = Entry.builder().english("brother").ancient("frater").build();
            assertTrue(index.checkConsistency(entry).discrepancies().isEmpty());
        }
    }

    @Test
    @DisplayName("Missing baseline file raises ReferenceDataException")
    void missingFile(@TempDir Path dir) {
        assertThrows(ReferenceDataException.class, () -> new BaselineLoader().load(dir.resolve("none.json")));
    }
}
