package com.libran.dictionary.artifact;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libran.dictionary.core.ReferenceDataException;
import com.libran.dictionary.core.model.DictionaryMetadata;
import com.libran.dictionary.core.model.FileStatistics;
import com.libran.dictionary.core.model.FragmentSource;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.core.model.Variant;
import com.libran.dictionary.tranche.FragmentParseException;
import com.libran.dictionary.tranche.ParsedFragment;
import com.libran.dictionary.tranche.TrancheParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the unified artifact, used by consumers such as a translation service.
 */
public class UnifiedDictionaryReader {

    private final ObjectMapper objectMapper;
    private final TrancheParser parser;

    public UnifiedDictionaryReader() {
        this(new ObjectMapper());
    }

    public UnifiedDictionaryReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.parser = new TrancheParser(objectMapper, Variant.ANCIENT);
    }

    /**
     * @throws ReferenceDataException if the file cannot be read or is not a unified artifact
     */
    public UnifiedDictionary read(Path path) {
        try {
            return parse(path.getFileName().toString(), Files.readString(path));
        } catch (IOException e) {
            throw new ReferenceDataException("Failed to read dictionary " + path, e);
        }
    }

    public UnifiedDictionary parse(String name, String content) {
        JsonNode root;
        ParsedFragment parsed;
        try {
            root = objectMapper.readTree(content);
            parsed = parser.parse(new FragmentSource(name, content));
        } catch (IOException | FragmentParseException e) {
            throw new ReferenceDataException("Malformed dictionary " + name + ": " + e.getMessage(), e);
        }
        JsonNode meta = root.path("metadata");
        if (!meta.isObject()) {
            throw new ReferenceDataException("Dictionary " + name + " has no metadata");
        }

        List<String> files = new ArrayList<>();
        meta.path("files_included").forEach(n -> files.add(n.asText()));
        List<String> notes = new ArrayList<>();
        meta.path("processing_notes").forEach(n -> notes.add(n.asText()));
        List<FileStatistics> stats = new ArrayList<>();
        root.path("sections").path(UnifiedDictionaryWriter.SECTION).path("files").forEach(n -> stats.add(
                new FileStatistics(n.path("filename").asText(), n.path("entries").asInt(),
                        n.path("duplicates_removed").asInt(), n.path("invalid_entries").asInt())));

        DictionaryMetadata metadata = new DictionaryMetadata(
                textOrNull(meta.get("version")),
                parseInstant(textOrNull(meta.get("created_on"))),
                files,
                meta.path("total_entries").asInt(parsed.entries().size()),
                meta.path("duplicates_removed").asInt(0),
                stats,
                notes,
                textOrNull(meta.get("project")),
                textOrNull(meta.get("source_directory")));
        return new UnifiedDictionary(parsed.entries(), metadata);
    }

    /**
     * Looks up an English key, ignoring case, the way a translation lookup would.
     */
    public Optional<String> translate(UnifiedDictionary dictionary, String english, boolean modern) {
        return dictionary.find(english)
                .map(e -> modern ? e.modernSurface() : e.ancientSurface());
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ReferenceDataException("Invalid created_on timestamp: " + value, e);
        }
    }
}
