package com.libran.dictionary.baseline;

import java.util.List;

/**
 * Result of checking one entry against the baseline.
 *
 * @param english           English key of the checked entry
 * @param hasReference      whether the baseline has the same English key
 * @param discrepancies     differences found, empty when consistent
 */
public record EntryConsistency(String english, boolean hasReference, List<BaselineDiscrepancy> discrepancies) {
    public EntryConsistency {
        discrepancies = discrepancies != null ? List.copyOf(discrepancies) : List.of();
    }
}
