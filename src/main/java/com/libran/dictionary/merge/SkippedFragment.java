package com.libran.dictionary.merge;

/**
 * A fragment the merger did not use.
 *
 * @param name   fragment name
 * @param reason why it was skipped
 * @param detail human-readable detail
 */
public record SkippedFragment(String name, Reason reason, String detail) {

    public enum Reason {
        NAMING_CONVENTION,
        UNREADABLE,
        PARSE_ERROR
    }
}
