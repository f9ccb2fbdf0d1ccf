package com.libran.dictionary.tranche;

import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.FragmentSource;
import com.libran.dictionary.core.model.Variant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TrancheParser Tests")
class TrancheParserTest {

    private final TrancheParser parser = new TrancheParser();

    private ParsedFragment parse(String json) {
        return parser.parse(new FragmentSource("tranche.json", json));
    }

    @Nested
    @DisplayName("Shape detection")
    class ShapeTests {

        @Test
        @DisplayName("Flat map assigns the value to the default variant")
        void flatMap() {
            ParsedFragment parsed = parse("{\"hello\": \"salaam\", \"water\": \"aqua\"}");

            assertEquals(FragmentShape.FLAT_MAP, parsed.shape());
            assertEquals(2, parsed.entries().size());
            Entry hello = parsed.entries().get(0);
            assertEquals("hello", hello.getEnglish());
            assertEquals("salaam", hello.ancientSurface());
            assertNull(hello.getModern());
        }

        @Test
        @DisplayName("Flat map can target the modern variant")
        void flatMapModernVariant() {
            TrancheParser modern = new TrancheParser(Variant.MODERN);
            ParsedFragment parsed = modern.parse(new FragmentSource("t.json", "{\"hello\": \"szia\"}"));

            assertEquals("szia", parsed.entries().get(0).modernSurface());
            assertNull(parsed.entries().get(0).getAncient());
        }

        @Test
        @DisplayName("Keyed entries use the key as English unless the record names one")
        void keyedEntries() {
            ParsedFragment parsed = parse("""
                    {"stone": {"ancient": "lapis", "modern": "kő", "notes": "Lat. lapis"},
                     "river": {"english": "River", "ancient": "fluvius"}}
                    """);

            assertEquals(FragmentShape.KEYED_ENTRIES, parsed.shape());
            assertEquals("stone", parsed.entries().get(0).getEnglish());
            assertEquals("Lat. lapis", parsed.entries().get(0).getNotes());
            assertEquals("River", parsed.entries().get(1).getEnglish());
        }

        @Test
        @DisplayName("Entry list and data wrapper read the same records")
        void entryListAndDataWrapper() {
            String records = "[{\"english\": \"fire\", \"ancient\": \"ignis\"}]";

            ParsedFragment list = parse(records);
            ParsedFragment wrapped = parse("{\"data\": " + records + "}");

            assertEquals(FragmentShape.ENTRY_LIST, list.shape());
            assertEquals(FragmentShape.DATA_WRAPPER, wrapped.shape());
            assertEquals(list.entries(), wrapped.entries());
        }

        @Test
        @DisplayName("Sectioned documents read section data and nested file data")
        void sectioned() {
            ParsedFragment parsed = parse("""
                    {"sections": {"Unified": {
                        "data": [{"english": "one", "ancient": "unus"}],
                        "files": [{"data": [{"english": "two", "ancient": "duo"}]}]
                    }}}
                    """);

            assertEquals(FragmentShape.SECTIONED, parsed.shape());
            assertEquals(2, parsed.entries().size());
            assertEquals("two", parsed.entries().get(1).getEnglish());
        }

        @Test
        @DisplayName("Clustered documents join ancient and modern lists on English")
        void clustered() {
            ParsedFragment parsed = parse("""
                    {"clusters": {"family": {
                        "commentary": "kinship terms",
                        "ancient": [{"english": "mother", "ancient": "mater", "notes": "Lat. mater"}],
                        "modern": [{"english": "Mother", "modern": "anya"}, {"english": "father", "modern": "apa"}]
                    }}}
                    """);

            assertEquals(FragmentShape.CLUSTERED, parsed.shape());
            assertEquals(2, parsed.entries().size());
            Entry mother = parsed.entries().get(0);
            assertEquals("mater", mother.ancientSurface());
            assertEquals("anya", mother.modernSurface());
            assertEquals("Lat. mater", mother.getNotes());

            assertEquals(1, parsed.clusters().size());
            ClusterInfo family = parsed.clusters().get(0);
            assertEquals("family", family.name());
            assertEquals("kinship terms", family.commentary());
            assertTrue(family.englishKeys().contains("father"));
        }

        @Test
        @DisplayName("Empty object is an empty flat map")
        void emptyObject() {
            ParsedFragment parsed = parse("{}");
            assertEquals(FragmentShape.FLAT_MAP, parsed.shape());
            assertTrue(parsed.entries().isEmpty());
        }
    }

    @Nested
    @DisplayName("Forms and invalid records")
    class FormTests {

        @Test
        @DisplayName("Structured forms keep sub-forms and expose the nominative surface")
        void structuredForm() {
            ParsedFragment parsed = parse("""
                    [{"english": "king", "ancient": {"nominative": "rex", "genitive": "regis"}}]
                    """);

            Entry king = parsed.entries().get(0);
            assertTrue(king.getAncient().isStructured());
            assertEquals("rex", king.ancientSurface());
            assertEquals(Map.of("nominative", "rex", "genitive", "regis"), king.getAncient().subForms());
        }

        @Test
        @DisplayName("Records without English are counted as invalid")
        void blankEnglishCounted() {
            ParsedFragment parsed = parse("""
                    [{"english": "  ", "ancient": "x"}, {"ancient": "y"}, "oops", {"english": "ok"}]
                    """);

            assertEquals(1, parsed.entries().size());
            assertEquals(3, parsed.invalidEntries());
        }

        @Test
        @DisplayName("Entry without forms is still valid")
        void entryWithoutForms() {
            ParsedFragment parsed = parse("[{\"english\": \"lonely\"}]");
            assertEquals(1, parsed.entries().size());
            assertEquals(0, parsed.invalidEntries());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Invalid JSON raises FragmentParseException naming the fragment")
        void invalidJson() {
            FragmentParseException e = assertThrows(FragmentParseException.class, () -> parse("{not json"));
            assertEquals("tranche.json", e.getFragmentName());
        }

        @Test
        @DisplayName("Empty content raises FragmentParseException")
        void emptyContent() {
            assertThrows(FragmentParseException.class, () -> parse(""));
        }

        @Test
        @DisplayName("Mixed value types are an unsupported shape")
        void unsupportedShape() {
            assertThrows(FragmentParseException.class, () -> parse("{\"a\": \"x\", \"b\": 3}"));
        }

        @Test
        @DisplayName("A scalar root is rejected")
        void scalarRoot() {
            assertThrows(FragmentParseException.class, () -> parse("42"));
        }
    }
}
