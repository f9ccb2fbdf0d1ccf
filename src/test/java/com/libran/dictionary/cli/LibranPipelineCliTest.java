package com.libran.dictionary.cli;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LibranPipelineCli Tests")
class LibranPipelineCliTest {

    @TempDir
    Path root;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int execute(Map<String, String> properties) {
        Config config = new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(properties, "test", 500))
                .build();
        return LibranPipelineCli.execute(config,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Map<String, String> directories() {
        Map<String, String> properties = new HashMap<>();
        properties.put("libran.pipeline.fragment-dir", root.resolve("tranches").toString());
        properties.put("libran.pipeline.output-dir", root.resolve("dist").toString());
        properties.put("libran.pipeline.report-dir", root.resolve("reports").toString());
        return properties;
    }

    @Test
    @DisplayName("Failed gate exits 1 and prints the remediation ranking")
    void needsRemediation() throws IOException {
        Path tranches = Files.createDirectories(root.resolve("tranches"));
        Files.writeString(tranches.resolve("tranche-a.json"), "{\"stone\": \"lapis\", \"water\": \"aqua\"}");

        int exit = execute(directories());

        String printed = out.toString(StandardCharsets.UTF_8);
        assertEquals(1, exit);
        assertTrue(printed.startsWith("NEEDS_REMEDIATION: 2 entries from 1 fragment(s)"));
        assertTrue(printed.contains("Artifact: "));
        assertTrue(printed.contains("Remediation needed"));
        assertTrue(printed.contains("Phrasebook Integration: "));
    }

    @Test
    @DisplayName("Lowered threshold passes and exits 0")
    void passes() throws IOException {
        Path tranches = Files.createDirectories(root.resolve("tranches"));
        Files.writeString(tranches.resolve("tranche-a.json"), "{\"stone\": \"lapis\"}");
        Map<String, String> properties = directories();
        properties.put("libran.pipeline.qa.threshold", "0");

        assertEquals(0, execute(properties));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("lifecycle DELETED"));
        assertTrue(Files.exists(root.resolve("tranches").resolve("delete").resolve("tranche-a.json")));
    }

    @Test
    @DisplayName("No valid fragments exits 2")
    void noFragments() {
        assertEquals(LibranPipelineCli.EXIT_FATAL, execute(directories()));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Pipeline failed: "));
    }

    @Test
    @DisplayName("Missing fragment directory exits 2")
    void missingConfiguration() {
        assertEquals(LibranPipelineCli.EXIT_FATAL, execute(Map.of()));
    }
}
