package com.libran.dictionary.merge;

import com.libran.dictionary.core.model.UnifiedDictionary;

import java.util.List;

/**
 * Outcome of a merge.
 *
 * @param dictionary the new dictionary snapshot
 * @param consumed   fragments that contributed to the snapshot, in merge order
 * @param skipped    fragments that were not used
 * @param relocated  fragments moved from pending to merged, empty for a pure merge
 */
public record MergeResult(
        UnifiedDictionary dictionary,
        List<String> consumed,
        List<SkippedFragment> skipped,
        List<String> relocated
) {
    public MergeResult {
        consumed = consumed != null ? List.copyOf(consumed) : List.of();
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
        relocated = relocated != null ? List.copyOf(relocated) : List.of();
    }

    public int totalEntries() {
        return dictionary.metadata().totalEntries();
    }

    public int duplicatesRemoved() {
        return dictionary.metadata().duplicatesRemoved();
    }

    MergeResult withRelocated(List<String> names) {
        return new MergeResult(dictionary, consumed, skipped, names);
    }
}
