package com.libran.dictionary.exclusion;

/**
 * @param term      the term that was looked up
 * @param entry     the registry entry it matched
 * @param matchType how it matched
 */
public record ExclusionMatch(String term, ExclusionEntry entry, MatchType matchType) {
}
