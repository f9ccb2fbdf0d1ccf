package com.libran.dictionary.baseline;

import java.util.Objects;

/**
 * One entry of the baseline release.
 *
 * @param english English key
 * @param ancient Ancient surface form, may be null
 * @param modern  Modern surface form, may be null
 * @param notes   etymology note, may be null
 * @param cluster name of the cluster the entry was listed under, may be null
 */
public record BaselineEntry(String english, String ancient, String modern, String notes, String cluster) {
    public BaselineEntry {
        Objects.requireNonNull(english, "english is required");
    }

    public boolean hasNotes() {
        return notes != null && !notes.isBlank();
    }
}
