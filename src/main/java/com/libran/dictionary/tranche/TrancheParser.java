package com.libran.dictionary.tranche;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.Form;
import com.libran.dictionary.core.model.FragmentSource;
import com.libran.dictionary.core.model.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a fragment of any supported layout into a canonical entry list.
 *
 * <p>The shape is detected once from the root node; after that each shape has its own
 * extraction routine. Records without a usable English key are counted as invalid and
 * dropped, while a document that cannot be read at all raises
 * {@link FragmentParseException}.</p>
 */
public class TrancheParser {
    private static final Logger log = LoggerFactory.getLogger(TrancheParser.class);

    private final ObjectMapper objectMapper;
    private final Variant defaultVariant;

    public TrancheParser() {
        this(Variant.ANCIENT);
    }

    /**
     * @param defaultVariant variant that receives the value of a flat {@code english -> form} map
     */
    public TrancheParser(Variant defaultVariant) {
        this(new ObjectMapper(), defaultVariant);
    }

    public TrancheParser(ObjectMapper objectMapper, Variant defaultVariant) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
        this.defaultVariant = Objects.requireNonNull(defaultVariant, "defaultVariant is required");
    }

    public ParsedFragment parse(FragmentSource source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(source.content());
        } catch (JsonProcessingException e) {
            throw new FragmentParseException(source.name(), "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new FragmentParseException(source.name(), "empty document");
        }

        FragmentShape shape = detectShape(source.name(), root);
        Accumulator acc = new Accumulator();
        List<ClusterInfo> clusters = List.of();

        switch (shape) {
            case FLAT_MAP -> readFlatMap(root, acc);
            case KEYED_ENTRIES -> readKeyedEntries(root, acc);
            case ENTRY_LIST -> readEntryList(root, acc);
            case DATA_WRAPPER -> readEntryList(root.get("data"), acc);
            case SECTIONED -> readSections(root.get("sections"), acc);
            case CLUSTERED -> clusters = readClusters(root.get("clusters"), acc);
        }

        log.debug("tranche.parsed name={} shape={} entries={} invalid={}",
                source.name(), shape, acc.entries.size(), acc.invalid);
        return new ParsedFragment(source.name(), shape, acc.entries, acc.invalid, clusters);
    }

    /**
     * Decides the layout of a fragment from its root node.
     *
     * @throws FragmentParseException if no supported layout matches
     */
    public FragmentShape detectShape(String name, JsonNode root) {
        if (root.isArray()) {
            return FragmentShape.ENTRY_LIST;
        }
        if (!root.isObject()) {
            throw new FragmentParseException(name, "root must be an object or an array");
        }
        if (root.path("sections").isObject()) {
            return FragmentShape.SECTIONED;
        }
        if (root.path("clusters").isObject()) {
            return FragmentShape.CLUSTERED;
        }
        if (root.path("data").isArray()) {
            return FragmentShape.DATA_WRAPPER;
        }

        boolean allText = true;
        boolean allObjects = true;
        for (JsonNode value : root) {
            allText &= value.isTextual();
            allObjects &= value.isObject();
        }
        if (allText) {
            return FragmentShape.FLAT_MAP;
        }
        if (allObjects) {
            return FragmentShape.KEYED_ENTRIES;
        }
        throw new FragmentParseException(name, "unsupported fragment shape");
    }

    private void readFlatMap(JsonNode root, Accumulator acc) {
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().isBlank()) {
                acc.invalid++;
                continue;
            }
            Entry.Builder builder = Entry.builder().english(field.getKey());
            String value = field.getValue().asText();
            if (defaultVariant == Variant.ANCIENT) {
                builder.ancient(value);
            } else {
                builder.modern(value);
            }
            acc.entries.add(builder.build());
        }
    }

    private void readKeyedEntries(JsonNode root, Accumulator acc) {
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            String english = textOrNull(node.get("english"));
            acc.add(toEntry(english != null ? english : field.getKey(), node));
        }
    }

    private void readEntryList(JsonNode list, Accumulator acc) {
        for (JsonNode node : list) {
            if (!node.isObject()) {
                acc.invalid++;
                continue;
            }
            acc.add(toEntry(textOrNull(node.get("english")), node));
        }
    }

    private void readSections(JsonNode sections, Accumulator acc) {
        for (JsonNode section : sections) {
            if (section.path("data").isArray()) {
                readEntryList(section.get("data"), acc);
            }
            for (JsonNode file : section.path("files")) {
                if (file.path("data").isArray()) {
                    readEntryList(file.get("data"), acc);
                }
            }
        }
    }

    private List<ClusterInfo> readClusters(JsonNode clusters, Accumulator acc) {
        // ancient and modern lists are authored separately; join them on the English key
        Map<String, MutableEntry> joined = new LinkedHashMap<>();
        List<ClusterInfo> infos = new ArrayList<>();

        Iterator<Map.Entry<String, JsonNode>> fields = clusters.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode cluster = field.getValue();
            List<String> members = new ArrayList<>();
            joinVariant(cluster.path("ancient"), Variant.ANCIENT, joined, members, acc);
            joinVariant(cluster.path("modern"), Variant.MODERN, joined, members, acc);
            infos.add(new ClusterInfo(field.getKey(), textOrNull(cluster.get("commentary")), members));
        }

        for (MutableEntry entry : joined.values()) {
            acc.entries.add(entry.build());
        }
        return infos;
    }

    private void joinVariant(JsonNode list, Variant variant, Map<String, MutableEntry> joined,
                             List<String> members, Accumulator acc) {
        for (JsonNode node : list) {
            String english = node.isObject() ? textOrNull(node.get("english")) : null;
            if (english == null || english.isBlank()) {
                acc.invalid++;
                continue;
            }
            String trimmed = english.trim();
            MutableEntry target = joined.computeIfAbsent(trimmed.toLowerCase(Locale.ROOT),
                    k -> new MutableEntry(trimmed));
            Form form = toForm(node.get(variant == Variant.ANCIENT ? "ancient" : "modern"));
            if (variant == Variant.ANCIENT) {
                if (target.ancient == null) target.ancient = form;
            } else {
                if (target.modern == null) target.modern = form;
            }
            String notes = textOrNull(node.get("notes"));
            if (target.notes == null && notes != null) {
                target.notes = notes;
            }
            if (!members.contains(trimmed)) {
                members.add(trimmed);
            }
        }
    }

    private Entry toEntry(String english, JsonNode node) {
        if (english == null || english.isBlank()) {
            return null;
        }
        return Entry.builder()
                .english(english)
                .ancient(toForm(node.get("ancient")))
                .modern(toForm(node.get("modern")))
                .notes(textOrNull(node.get("notes")))
                .build();
    }

    /**
     * A form is either a string or an object of sub-form name to string.
     * Anything else is treated as absent.
     */
    static Form toForm(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return Form.of(node.asText());
        }
        if (node.isObject()) {
            Map<String, String> subForms = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                    subForms.put(field.getKey(), field.getValue().asText());
                }
            }
            return subForms.isEmpty() ? null : Form.structured(subForms);
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }

    private static final class Accumulator {
        private final List<Entry> entries = new ArrayList<>();
        private int invalid;

        void add(Entry entry) {
            if (entry == null) {
                invalid++;
            } else {
                entries.add(entry);
            }
        }
    }

    private static final class MutableEntry {
        private final String english;
        private Form ancient;
        private Form modern;
        private String notes;

        MutableEntry(String english) {
            this.english = english;
        }

        Entry build() {
            return Entry.builder().english(english).ancient(ancient).modern(modern).notes(notes).build();
        }
    }
}
