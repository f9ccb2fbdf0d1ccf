package com.libran.dictionary.merge;

import java.time.Clock;
import java.util.Objects;

/**
 * Settings stamped into the metadata of a merged dictionary.
 *
 * @param version         artifact version, e.g. {@code 1.7.0}
 * @param project         project name
 * @param sourceDirectory description of where fragments came from, may be null
 * @param clock           clock for {@code createdOn}
 */
public record MergeOptions(String version, String project, String sourceDirectory, Clock clock) {

    public static final String DEFAULT_VERSION = "1.7.0";
    public static final String DEFAULT_PROJECT = "Librán Language Files";

    public MergeOptions {
        Objects.requireNonNull(version, "version is required");
        project = project != null ? project : DEFAULT_PROJECT;
        clock = clock != null ? clock : Clock.systemUTC();
    }

    public static MergeOptions defaults() {
        return new MergeOptions(DEFAULT_VERSION, DEFAULT_PROJECT, null, Clock.systemUTC());
    }

    public MergeOptions withSourceDirectory(String sourceDirectory) {
        return new MergeOptions(version, project, sourceDirectory, clock);
    }
}
