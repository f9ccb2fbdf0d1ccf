package com.libran.dictionary.baseline;

/**
 * Totals of a loaded baseline.
 */
public record BaselineStats(int totalEntries, int ancientForms, int modernForms, int withNotes, int clusters) {
}
