package com.libran.dictionary.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Metadata of a unified dictionary snapshot.
 *
 * @param version           semantic version of the artifact
 * @param createdOn         creation timestamp, null only for hand-built or damaged artifacts
 * @param filesIncluded     names of the fragments that contributed entries
 * @param totalEntries      number of unique entries
 * @param duplicatesRemoved number of entries dropped as duplicates
 * @param fileStatistics    per-fragment statistics
 * @param processingNotes   free-text notes describing how the merge was done
 * @param project           project name
 * @param sourceDirectory   where the fragments were read from
 */
public record DictionaryMetadata(
        String version,
        Instant createdOn,
        List<String> filesIncluded,
        int totalEntries,
        int duplicatesRemoved,
        List<FileStatistics> fileStatistics,
        List<String> processingNotes,
        String project,
        String sourceDirectory
) {
    public DictionaryMetadata {
        filesIncluded = filesIncluded != null ? List.copyOf(filesIncluded) : List.of();
        fileStatistics = fileStatistics != null ? List.copyOf(fileStatistics) : List.of();
        processingNotes = processingNotes != null ? List.copyOf(processingNotes) : List.of();
    }

    /**
     * Minimal metadata, used by tests and by readers of foreign artifacts.
     */
    public static DictionaryMetadata of(String version, Instant createdOn, List<String> filesIncluded,
                                        int totalEntries, int duplicatesRemoved) {
        return new DictionaryMetadata(version, createdOn, filesIncluded, totalEntries, duplicatesRemoved,
                List.of(), List.of(), null, null);
    }
}
