package com.libran.dictionary.api;

/**
 * Final outcome of a pipeline run.
 */
public enum PipelineOutcome {
    /** QA gate passed; audit ran and the fragments were retired. */
    PASSED(0),
    /** QA gate failed; fragments remain in the merged area for a later run. */
    NEEDS_REMEDIATION(1);

    private final int exitCode;

    PipelineOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
