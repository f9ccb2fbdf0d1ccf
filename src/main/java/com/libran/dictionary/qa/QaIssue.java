package com.libran.dictionary.qa;

import java.util.Objects;

/**
 * One finding of a QA category.
 *
 * @param category category that raised it
 * @param code     machine-readable issue code, e.g. {@code ancient_collision}
 * @param subject  what the issue is about, usually an English key
 * @param detail   human-readable explanation
 */
public record QaIssue(QaCategoryType category, String code, String subject, String detail) {
    public QaIssue {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(code, "code is required");
    }
}
