package com.libran.dictionary.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libran.dictionary.core.model.DictionaryMetadata;
import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.FileStatistics;
import com.libran.dictionary.core.model.Form;
import com.libran.dictionary.core.model.UnifiedDictionary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes a dictionary as {@code UnifiedLibranDictionaryv<version>.json}:
 * <pre>
 * {
 *   "metadata": {"version": ..., "created_on": ..., "files_included": [...], ...},
 *   "sections": {"Unified": {"data": [entries], "files": [per-file statistics]}}
 * }
 * </pre>
 * An existing artifact of the same version is replaced.
 */
public class UnifiedDictionaryWriter {
    private static final Logger log = LoggerFactory.getLogger(UnifiedDictionaryWriter.class);

    public static final String FILE_PREFIX = "UnifiedLibranDictionaryv";
    static final String SECTION = "Unified";

    private final ObjectMapper objectMapper;

    public UnifiedDictionaryWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public UnifiedDictionaryWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static String fileName(String version) {
        return FILE_PREFIX + version + ".json";
    }

    public Path write(UnifiedDictionary dictionary, Path outputDirectory) throws IOException {
        Files.createDirectories(outputDirectory);
        Path target = outputDirectory.resolve(fileName(dictionary.metadata().version()));
        objectMapper.writeValue(target.toFile(), toTree(dictionary));
        log.info("artifact.written path={} entries={}", target, dictionary.size());
        return target;
    }

    public ObjectNode toTree(UnifiedDictionary dictionary) {
        ObjectNode root = objectMapper.createObjectNode();
        writeMetadata(root.putObject("metadata"), dictionary.metadata());

        ObjectNode section = root.putObject("sections").putObject(SECTION);
        ArrayNode data = section.putArray("data");
        for (Entry entry : dictionary.entries()) {
            ObjectNode node = data.addObject();
            node.put("english", entry.getEnglish());
            putForm(node, "ancient", entry.getAncient());
            putForm(node, "modern", entry.getModern());
            if (entry.getNotes() != null) {
                node.put("notes", entry.getNotes());
            }
        }
        ArrayNode files = section.putArray("files");
        for (FileStatistics stats : dictionary.metadata().fileStatistics()) {
            ObjectNode node = files.addObject();
            node.put("filename", stats.filename());
            node.put("entries", stats.entries());
            node.put("duplicates_removed", stats.duplicatesRemoved());
            node.put("invalid_entries", stats.invalidEntries());
        }
        return root;
    }

    private static void writeMetadata(ObjectNode node, DictionaryMetadata metadata) {
        node.put("version", metadata.version());
        node.put("created_on", metadata.createdOn() != null ? metadata.createdOn().toString() : null);
        ArrayNode files = node.putArray("files_included");
        metadata.filesIncluded().forEach(files::add);
        node.put("total_entries", metadata.totalEntries());
        node.put("duplicates_removed", metadata.duplicatesRemoved());
        ArrayNode notes = node.putArray("processing_notes");
        metadata.processingNotes().forEach(notes::add);
        node.put("project", metadata.project());
        node.put("source_directory", metadata.sourceDirectory());
    }

    private static void putForm(ObjectNode node, String field, Form form) {
        if (form == null) {
            return;
        }
        if (!form.isStructured()) {
            node.put(field, form.surface());
            return;
        }
        ObjectNode sub = node.putObject(field);
        for (Map.Entry<String, String> e : form.subForms().entrySet()) {
            sub.put(e.getKey(), e.getValue());
        }
    }
}
