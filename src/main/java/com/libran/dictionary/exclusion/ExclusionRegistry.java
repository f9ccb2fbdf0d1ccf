package com.libran.dictionary.exclusion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Categorized terms that audits must not flag.
 *
 * <p>Lookup order is exact term, then alias, then (only when a normalization flag is on)
 * normalized term and normalized alias. The first entry registered for a key wins.
 * Every match is logged; recording the suppression itself is the caller's job.</p>
 */
public class ExclusionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ExclusionRegistry.class);

    private final NormalizationFlags flags;
    private final List<ExclusionEntry> entries;
    private final Map<String, ExclusionEntry> byTerm = new HashMap<>();
    private final Map<String, ExclusionEntry> byAlias = new HashMap<>();
    private final Map<String, ExclusionEntry> byNormalizedTerm = new HashMap<>();
    private final Map<String, ExclusionEntry> byNormalizedAlias = new HashMap<>();

    public ExclusionRegistry(List<ExclusionEntry> entries, NormalizationFlags flags) {
        this.flags = flags != null ? flags : NormalizationFlags.none();
        this.entries = List.copyOf(Objects.requireNonNull(entries, "entries is required"));
        for (ExclusionEntry entry : this.entries) {
            byTerm.putIfAbsent(entry.term(), entry);
            byNormalizedTerm.putIfAbsent(this.flags.apply(entry.term()), entry);
            for (String alias : entry.aliases()) {
                byAlias.putIfAbsent(alias, entry);
                byNormalizedAlias.putIfAbsent(this.flags.apply(alias), entry);
            }
        }
    }

    public static ExclusionRegistry empty() {
        return new ExclusionRegistry(List.of(), NormalizationFlags.none());
    }

    public Optional<ExclusionMatch> match(String term) {
        if (term == null || entries.isEmpty()) {
            return Optional.empty();
        }
        ExclusionMatch match = null;
        if (byTerm.containsKey(term)) {
            match = new ExclusionMatch(term, byTerm.get(term), MatchType.EXACT);
        } else if (byAlias.containsKey(term)) {
            match = new ExclusionMatch(term, byAlias.get(term), MatchType.ALIAS);
        } else if (flags.anyEnabled()) {
            String normalized = flags.apply(term);
            if (byNormalizedTerm.containsKey(normalized)) {
                match = new ExclusionMatch(term, byNormalizedTerm.get(normalized), MatchType.NORMALIZED);
            } else if (byNormalizedAlias.containsKey(normalized)) {
                match = new ExclusionMatch(term, byNormalizedAlias.get(normalized), MatchType.NORMALIZED_ALIAS);
            }
        }
        if (match == null) {
            return Optional.empty();
        }
        log.info("exclusion.matched term='{}' canonical='{}' category={} matchType={}",
                term, match.entry().term(), match.entry().category(), match.matchType());
        return Optional.of(match);
    }

    public boolean isExcluded(String term) {
        return match(term).isPresent();
    }

    /**
     * Entries grouped by category, in load order.
     */
    public Map<String, List<ExclusionEntry>> categories() {
        Map<String, List<ExclusionEntry>> grouped = new LinkedHashMap<>();
        for (ExclusionEntry entry : entries) {
            grouped.computeIfAbsent(entry.category(), k -> new ArrayList<>()).add(entry);
        }
        grouped.replaceAll((k, v) -> List.copyOf(v));
        return grouped;
    }

    public List<ExclusionEntry> entries() {
        return entries;
    }

    public NormalizationFlags flags() {
        return flags;
    }

    public int size() {
        return entries.size();
    }
}
