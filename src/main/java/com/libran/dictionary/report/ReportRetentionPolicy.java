package com.libran.dictionary.report;

import java.util.Objects;

/**
 * How report files are kept.
 *
 * @param keepRecent number of most recent report sets per kind kept in the recent directory
 * @param recentDir  directory name, under the reports root, where new reports are written
 * @param archiveDir directory name, under the reports root, that receives older report sets
 */
public record ReportRetentionPolicy(int keepRecent, String recentDir, String archiveDir) {
    public ReportRetentionPolicy {
        if (keepRecent < 1) {
            throw new IllegalArgumentException("keepRecent must be at least 1");
        }
        Objects.requireNonNull(recentDir, "recentDir is required");
        Objects.requireNonNull(archiveDir, "archiveDir is required");
        if (recentDir.equals(archiveDir)) {
            throw new IllegalArgumentException("recentDir and archiveDir must differ");
        }
    }

    /**
     * Keep 3 report sets in {@code recent/}, archive the rest to {@code archive/}.
     */
    public static ReportRetentionPolicy defaults() {
        return new ReportRetentionPolicy(3, "recent", "archive");
    }

    public ReportRetentionPolicy withKeepRecent(int keepRecent) {
        return new ReportRetentionPolicy(keepRecent, recentDir, archiveDir);
    }
}
