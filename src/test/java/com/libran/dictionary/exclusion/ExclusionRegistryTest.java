package com.libran.dictionary.exclusion;

import com.libran.dictionary.core.ReferenceDataException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExclusionRegistry Tests")
class ExclusionRegistryTest {

    private static final String LIST = """
            {
              "normalization": {"ignore_case": true, "normalize_diacritics": true, "treat_hyphen_dash_equal": true},
              "categories": {
                "proper_nouns": [
                  {"name": "Avalon", "aliases": ["Avallon"], "note": "place name"},
                  "Camelot"
                ],
                "loanwords": [{"name": "café–bar", "aliases": ["Espresso"]}]
              }
            }
            """;

    private final ExclusionLoader loader = new ExclusionLoader();

    @Nested
    @DisplayName("Lookup order")
    class LookupTests {

        private final ExclusionRegistry registry = loader.parse(LIST);

        @Test
        @DisplayName("Exact term matches first")
        void exact() {
            ExclusionMatch match = registry.match("Avalon").orElseThrow();
            assertEquals(MatchType.EXACT, match.matchType());
            assertEquals("proper_nouns", match.entry().category());
            assertEquals("place name", match.entry().justification());
        }

        @Test
        @DisplayName("Alias matches when the term does not")
        void alias() {
            assertEquals(MatchType.ALIAS, registry.match("Avallon").orElseThrow().matchType());
        }

        @Test
        @DisplayName("Normalized term folds case, diacritics and dashes")
        void normalized() {
            ExclusionMatch match = registry.match("CAFE-BAR").orElseThrow();
            assertEquals(MatchType.NORMALIZED, match.matchType());
            assertEquals("café–bar", match.entry().term());
        }

        @Test
        @DisplayName("Normalized alias is the last resort")
        void normalizedAlias() {
            assertEquals(MatchType.NORMALIZED_ALIAS, registry.match("espresso").orElseThrow().matchType());
        }

        @Test
        @DisplayName("Unknown terms do not match")
        void noMatch() {
            assertTrue(registry.match("dragon").isEmpty());
            assertFalse(registry.isExcluded(null));
        }

        @Test
        @DisplayName("Plain string members become entries without aliases")
        void plainStringMember() {
            assertTrue(registry.isExcluded("Camelot"));
            assertEquals(3, registry.size());
            assertEquals(List.of("proper_nouns", "loanwords"), List.copyOf(registry.categories().keySet()));
        }
    }

    @Nested
    @DisplayName("Normalization flags")
    class FlagTests {

        @Test
        @DisplayName("With all flags off only exact and alias lookups apply")
        void flagsOff() {
            ExclusionRegistry registry = new ExclusionRegistry(
                    List.of(new ExclusionEntry("names", "Avalon", List.of("Avallon"), null)),
                    NormalizationFlags.none());

            assertTrue(registry.isExcluded("Avalon"));
            assertTrue(registry.isExcluded("Avallon"));
            assertFalse(registry.isExcluded("avalon"));
        }

        @Test
        @DisplayName("Flags are applied independently")
        void independentFlags() {
            NormalizationFlags caseOnly = new NormalizationFlags(true, false, false);
            assertEquals("cafe", caseOnly.apply(" CAFE "));
            assertEquals("café", caseOnly.apply("CAFÉ"));

            NormalizationFlags dashOnly = new NormalizationFlags(false, false, true);
            assertEquals("A-B-C", dashOnly.apply("A—B–C"));
        }

        @Test
        @DisplayName("Empty registry matches nothing")
        void emptyRegistry() {
            assertTrue(ExclusionRegistry.empty().match("anything").isEmpty());
        }
    }

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("Loads from a file")
        void loadsFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("exclusions.json");
            Files.writeString(file, LIST);

            assertEquals(3, loader.load(file).size());
        }

        @Test
        @DisplayName("Missing file raises ReferenceDataException")
        void missingFile(@TempDir Path dir) {
            assertThrows(ReferenceDataException.class, () -> loader.load(dir.resolve("absent.json")));
        }

        @Test
        @DisplayName("Malformed list raises ReferenceDataException")
        void malformed() {
            assertThrows(ReferenceDataException.class, () -> loader.parse("[1, 2, 3]"));
            assertThrows(ReferenceDataException.class, () -> loader.parse("{broken"));
        }

        @Test
        @DisplayName("Missing normalization block leaves all flags off")
        void defaultFlags() {
            ExclusionRegistry registry = loader.parse("{\"categories\": {\"x\": [\"Term\"]}}");
            assertFalse(registry.flags().anyEnabled());
        }
    }
}
