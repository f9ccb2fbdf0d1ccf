package com.libran.dictionary.report;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File-name-safe timestamps, e.g. {@code 2025-09-23T01-42-19-197Z}. They sort
 * lexicographically in time order.
 */
public final class ReportTimestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);
    private static final Pattern IN_NAME = Pattern.compile("(\\d{4}-\\d{2}-\\d{2}T\\d{2}-\\d{2}-\\d{2}-\\d{3}Z)");

    private ReportTimestamps() {
    }

    public static String format(Instant instant) {
        return FORMAT.format(instant);
    }

    public static Optional<String> extract(String fileName) {
        Matcher m = IN_NAME.matcher(fileName);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
