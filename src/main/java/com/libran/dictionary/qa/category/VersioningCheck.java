package com.libran.dictionary.qa.category;

import com.libran.dictionary.core.model.DictionaryMetadata;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.qa.CategoryResult;
import com.libran.dictionary.qa.QaCategory;
import com.libran.dictionary.qa.QaCategoryType;
import com.libran.dictionary.qa.QaIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Requires a strict {@code MAJOR.MINOR.PATCH} version and the metadata fields
 * {@code created_on}, {@code files_included} and {@code total_entries}.
 */
public class VersioningCheck implements QaCategory {

    static final double PENALTY = 15.0;
    private static final Pattern SEMVER = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    @Override
    public QaCategoryType type() {
        return QaCategoryType.VERSIONING;
    }

    @Override
    public CategoryResult evaluate(UnifiedDictionary dictionary) {
        DictionaryMetadata metadata = dictionary.metadata();
        List<QaIssue> issues = new ArrayList<>();
        if (metadata.version() == null || !SEMVER.matcher(metadata.version()).matches()) {
            issues.add(new QaIssue(type(), "invalid_version_format", String.valueOf(metadata.version()),
                    "Use semantic versioning (major.minor.patch)"));
        }
        if (metadata.createdOn() == null) {
            issues.add(missing("created_on"));
        }
        if (metadata.filesIncluded().isEmpty()) {
            issues.add(missing("files_included"));
        }
        if (metadata.totalEntries() <= 0) {
            issues.add(missing("total_entries"));
        }
        String summary = issues.isEmpty() ? "Versioning compliant" : issues.size() + " versioning issues";
        return CategoryResult.penalized(type(), issues, PENALTY, summary);
    }

    private QaIssue missing(String field) {
        return new QaIssue(type(), "missing_metadata", field, "Add " + field + " to metadata");
    }
}
