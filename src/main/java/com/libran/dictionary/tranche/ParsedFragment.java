package com.libran.dictionary.tranche;

import com.libran.dictionary.core.model.Entry;

import java.util.List;

/**
 * Canonical result of parsing one fragment.
 *
 * @param name           fragment name
 * @param shape          detected layout
 * @param entries        entries in fragment order, not yet deduplicated
 * @param invalidEntries records dropped because they had no usable English key
 * @param clusters       clusters, only for {@link FragmentShape#CLUSTERED}
 */
public record ParsedFragment(
        String name,
        FragmentShape shape,
        List<Entry> entries,
        int invalidEntries,
        List<ClusterInfo> clusters
) {
    public ParsedFragment {
        entries = entries != null ? List.copyOf(entries) : List.of();
        clusters = clusters != null ? List.copyOf(clusters) : List.of();
    }
}
