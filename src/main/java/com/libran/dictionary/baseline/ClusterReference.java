package com.libran.dictionary.baseline;

/**
 * @param clusterName cluster an English key belongs to
 * @param commentary  cluster commentary, empty when the cluster has none
 */
public record ClusterReference(String clusterName, String commentary) {
}
