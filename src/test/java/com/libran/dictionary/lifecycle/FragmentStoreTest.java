package com.libran.dictionary.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FragmentStore Tests")
class FragmentStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:15:30Z"), ZoneOffset.UTC);

    @Nested
    @DisplayName("InMemoryFragmentStore")
    class InMemoryTests {

        private final InMemoryFragmentStore store = new InMemoryFragmentStore()
                .add("b.json", "{}")
                .add("a.json", "[]");

        @Test
        @DisplayName("Lists pending fragments by name")
        void listsSorted() {
            assertEquals(List.of("a.json", "b.json"), store.list(FragmentArea.PENDING));
            assertTrue(store.list(FragmentArea.MERGED).isEmpty());
        }

        @Test
        @DisplayName("Moves fragments between areas")
        void moves() throws IOException {
            store.move("a.json", FragmentArea.PENDING, FragmentArea.MERGED);

            assertEquals(List.of("b.json"), store.list(FragmentArea.PENDING));
            assertEquals("[]", store.read(FragmentArea.MERGED, "a.json").content());
        }

        @Test
        @DisplayName("A move replaces a fragment of the same name")
        void moveReplaces() throws IOException {
            store.move("a.json", FragmentArea.PENDING, FragmentArea.MERGED);
            store.add("a.json", "{\"stone\": \"saxum\"}");

            store.move("a.json", FragmentArea.PENDING, FragmentArea.MERGED);

            assertEquals("{\"stone\": \"saxum\"}", store.read(FragmentArea.MERGED, "a.json").content());
        }

        @Test
        @DisplayName("Distinct in-memory stores have distinct lock keys")
        void lockKeys() {
            assertNotEquals(store.lockKey(), new InMemoryFragmentStore().lockKey());
            assertEquals(store.lockKey(), store.lockKey());
        }

        @Test
        @DisplayName("Moving or reading a missing fragment fails")
        void missing() {
            assertThrows(IOException.class, () -> store.move("c.json", FragmentArea.PENDING, FragmentArea.MERGED));
            assertThrows(IOException.class, () -> store.read(FragmentArea.MERGED, "a.json"));
        }

        @Test
        @DisplayName("Keeps the last saved manifest")
        void manifests() {
            assertTrue(store.lastManifest().isEmpty());
            LifecycleManifest pending = LifecycleManifest.pending("run-1", List.of("a.json"));
            store.saveManifest(pending);
            store.saveManifest(pending.transitionTo(LifecycleState.MERGED, CLOCK));

            assertEquals(LifecycleState.MERGED, store.lastManifest().orElseThrow().state());
        }
    }

    @Nested
    @DisplayName("DirectoryFragmentStore")
    class DirectoryTests {

        @TempDir
        Path root;

        @Test
        @DisplayName("Pending area is the root, ignoring hidden files, subdirectories and the manifest")
        void listsPending() throws IOException {
            Files.writeString(root.resolve("tranche-b.json"), "{}");
            Files.writeString(root.resolve("tranche-a.json"), "[]");
            Files.writeString(root.resolve(".DS_Store"), "");
            Files.writeString(root.resolve(DirectoryFragmentStore.MANIFEST_FILE), "{}");
            DirectoryFragmentStore store = new DirectoryFragmentStore(root);
            store.directory(FragmentArea.MERGED);

            assertEquals(List.of("tranche-a.json", "tranche-b.json"), store.list(FragmentArea.PENDING));
        }

        @Test
        @DisplayName("Moves fragments into the merged and delete directories")
        void moves() throws IOException {
            Files.writeString(root.resolve("tranche-a.json"), "[]");
            DirectoryFragmentStore store = new DirectoryFragmentStore(root);

            store.move("tranche-a.json", FragmentArea.PENDING, FragmentArea.MERGED);
            assertTrue(Files.exists(root.resolve("merged").resolve("tranche-a.json")));
            assertEquals("[]", store.read(FragmentArea.MERGED, "tranche-a.json").content());

            store.move("tranche-a.json", FragmentArea.MERGED, FragmentArea.DELETED);
            assertEquals(List.of("tranche-a.json"), store.list(FragmentArea.DELETED));
            assertTrue(store.list(FragmentArea.MERGED).isEmpty());
        }

        @Test
        @DisplayName("A move replaces a fragment of the same name in the target area")
        void moveReplaces() throws IOException {
            Files.createDirectories(root.resolve("delete"));
            Files.writeString(root.resolve("delete").resolve("tranche-a.json"), "{\"old\": \"vetus\"}");
            Files.createDirectories(root.resolve("merged"));
            Files.writeString(root.resolve("merged").resolve("tranche-a.json"), "{\"new\": \"novus\"}");
            DirectoryFragmentStore store = new DirectoryFragmentStore(root);

            store.move("tranche-a.json", FragmentArea.MERGED, FragmentArea.DELETED);

            assertEquals("{\"new\": \"novus\"}", store.read(FragmentArea.DELETED, "tranche-a.json").content());
            assertTrue(store.list(FragmentArea.MERGED).isEmpty());
        }

        @Test
        @DisplayName("Relative and absolute spellings of a root share a lock key")
        void lockKeyIsNormalized() {
            DirectoryFragmentStore plain = new DirectoryFragmentStore(root);
            DirectoryFragmentStore dotted = new DirectoryFragmentStore(root.resolve("merged").resolve(".."));

            assertEquals(plain.lockKey(), dotted.lockKey());
            assertTrue(Path.of(plain.lockKey()).isAbsolute());
        }

        @Test
        @DisplayName("Moving a missing fragment fails")
        void missing() {
            DirectoryFragmentStore store = new DirectoryFragmentStore(root);
            assertThrows(IOException.class, () -> store.move("absent.json", FragmentArea.PENDING, FragmentArea.MERGED));
        }

        @Test
        @DisplayName("Writes the manifest as JSON")
        void savesManifest() throws IOException {
            DirectoryFragmentStore store = new DirectoryFragmentStore(root);
            store.saveManifest(LifecycleManifest.pending("run-1", List.of("tranche-a.json"))
                    .transitionTo(LifecycleState.MERGED, CLOCK));

            JsonNode manifest = new ObjectMapper().readTree(root.resolve(DirectoryFragmentStore.MANIFEST_FILE).toFile());
            assertEquals("run-1", manifest.get("runId").asText());
            assertEquals("MERGED", manifest.get("state").asText());
            assertEquals("tranche-a.json", manifest.get("fragments").get(0).asText());
            assertEquals("PENDING", manifest.get("history").get(0).get("from").asText());
            assertEquals(root.toString(), store.describe());
        }
    }
}
