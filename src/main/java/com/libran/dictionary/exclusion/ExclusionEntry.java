package com.libran.dictionary.exclusion;

import java.util.List;
import java.util.Objects;

/**
 * A canonical term that audits must not flag.
 *
 * @param category      category the term is listed under
 * @param term          canonical term
 * @param aliases       alternative spellings
 * @param justification why the term is excluded, may be null
 */
public record ExclusionEntry(String category, String term, List<String> aliases, String justification) {
    public ExclusionEntry {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(term, "term is required");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
    }
}
