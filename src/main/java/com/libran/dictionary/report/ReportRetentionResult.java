package com.libran.dictionary.report;

/**
 * @param setsKept      report sets left in the recent directory
 * @param filesArchived files moved to the archive directory
 * @param failures      files that could not be moved
 */
public record ReportRetentionResult(int setsKept, int filesArchived, int failures) {

    public static ReportRetentionResult empty() {
        return new ReportRetentionResult(0, 0, 0);
    }

    @Override
    public String toString() {
        return "ReportRetentionResult{kept=" + setsKept +
                ", archived=" + filesArchived +
                ", failures=" + failures + '}';
    }
}
