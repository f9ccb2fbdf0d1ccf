package com.libran.dictionary.audit;

import com.libran.dictionary.core.model.UnifiedDictionary;

import java.util.List;

/**
 * An advisory audit check. Must not depend on anything but the snapshot.
 */
public interface AuditCheck {

    AuditCheckType type();

    List<AuditIssue> inspect(UnifiedDictionary dictionary);
}
