package com.libran.dictionary.exclusion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libran.dictionary.core.ReferenceDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads an exclusion list of the form
 * <pre>
 * {
 *   "normalization": {"ignore_case": false, "normalize_diacritics": false, "treat_hyphen_dash_equal": false},
 *   "categories": {"proper_nouns": [{"name": "Avalon", "aliases": ["Avallon"], "note": "place name"}]}
 * }
 * </pre>
 * Category members may also be plain strings.
 */
public class ExclusionLoader {
    private static final Logger log = LoggerFactory.getLogger(ExclusionLoader.class);

    private final ObjectMapper objectMapper;

    public ExclusionLoader() {
        this(new ObjectMapper());
    }

    public ExclusionLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ReferenceDataException if the file is missing, unreadable or malformed
     */
    public ExclusionRegistry load(Path path) {
        if (!Files.isReadable(path)) {
            throw new ReferenceDataException("Exclusion list not readable: " + path);
        }
        try {
            ExclusionRegistry registry = parse(Files.readString(path));
            log.info("exclusions.loaded path={} terms={}", path, registry.size());
            return registry;
        } catch (IOException e) {
            throw new ReferenceDataException("Failed to read exclusion list " + path, e);
        }
    }

    public ExclusionRegistry parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new ReferenceDataException("Malformed exclusion list: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ReferenceDataException("Exclusion list must be a JSON object");
        }

        JsonNode norm = root.path("normalization");
        NormalizationFlags flags = new NormalizationFlags(
                norm.path("ignore_case").asBoolean(false),
                norm.path("normalize_diacritics").asBoolean(false),
                norm.path("treat_hyphen_dash_equal").asBoolean(false));

        List<ExclusionEntry> entries = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> categories = root.path("categories").fields();
        while (categories.hasNext()) {
            Map.Entry<String, JsonNode> category = categories.next();
            for (JsonNode item : category.getValue()) {
                ExclusionEntry entry = toEntry(category.getKey(), item);
                if (entry != null) {
                    entries.add(entry);
                } else {
                    log.warn("exclusions.invalidItem category={} item={}", category.getKey(), item);
                }
            }
        }
        return new ExclusionRegistry(entries, flags);
    }

    private static ExclusionEntry toEntry(String category, JsonNode item) {
        if (item.isTextual() && !item.asText().isBlank()) {
            return new ExclusionEntry(category, item.asText(), List.of(), null);
        }
        String name = item.path("name").asText("");
        if (name.isBlank()) {
            return null;
        }
        List<String> aliases = new ArrayList<>();
        for (JsonNode alias : item.path("aliases")) {
            if (alias.isTextual()) {
                aliases.add(alias.asText());
            }
        }
        String note = item.path("note").isTextual() ? item.path("note").asText() : null;
        return new ExclusionEntry(category, name, aliases, note);
    }
}
