package com.libran.dictionary.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot produced by one merge: the deduplicated entries plus metadata.
 * Each merge produces a new instance; instances are never mutated.
 */
public record UnifiedDictionary(List<Entry> entries, DictionaryMetadata metadata) {

    public UnifiedDictionary {
        Objects.requireNonNull(metadata, "metadata is required");
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Finds the entry whose English key equals the given text, ignoring case.
     */
    public Optional<Entry> find(String english) {
        if (english == null) {
            return Optional.empty();
        }
        String key = english.trim().toLowerCase(Locale.ROOT);
        return entries.stream().filter(e -> e.dedupKey().equals(key)).findFirst();
    }
}
