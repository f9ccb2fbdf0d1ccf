package com.libran.dictionary.events;

/**
 * Types of events recorded during a pipeline run.
 */
public enum PipelineEventType {
    RUN_STARTED,
    RUN_FINISHED,
    FRAGMENT_SKIPPED,
    FRAGMENT_MERGED,
    DICTIONARY_MERGED,
    FRAGMENTS_RELOCATED,
    RELOCATION_ROLLED_BACK,
    LIFECYCLE_TRANSITION,
    QA_COMPLETED,
    AUDIT_COMPLETED,
    EXCLUSION_SUPPRESSED,
    REPORT_WRITTEN,
    REPORT_FAILED,
    REPORTS_ARCHIVED
}
