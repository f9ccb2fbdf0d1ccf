package com.libran.dictionary.audit;

import com.libran.dictionary.exclusion.ExclusionMatch;

/**
 * An issue removed from the report because its subject is on the exclusion list.
 *
 * @param issue the suppressed issue
 * @param match the registry match that suppressed it
 */
public record Suppression(AuditIssue issue, ExclusionMatch match) {
}
