package com.libran.dictionary.tranche;

import java.util.List;

/**
 * A named cluster of a clustered fragment.
 *
 * @param name        cluster name
 * @param commentary  free-text commentary of the cluster, may be null
 * @param englishKeys English keys of the entries listed in the cluster, in order
 */
public record ClusterInfo(String name, String commentary, List<String> englishKeys) {
    public ClusterInfo {
        englishKeys = englishKeys != null ? List.copyOf(englishKeys) : List.of();
    }
}
