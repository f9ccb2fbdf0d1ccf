package com.libran.dictionary.core.model;

/**
 * Per-fragment merge statistics recorded in the dictionary metadata.
 *
 * @param filename          fragment name
 * @param entries           entries read from the fragment
 * @param duplicatesRemoved entries dropped because an earlier entry had the same English key
 * @param invalidEntries    entries dropped because they had no English key
 */
public record FileStatistics(String filename, int entries, int duplicatesRemoved, int invalidEntries) {
}
