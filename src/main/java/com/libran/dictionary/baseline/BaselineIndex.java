package com.libran.dictionary.baseline;

import com.libran.dictionary.core.model.Entry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lookup index over a prior stable release.
 *
 * <p>Entries are indexed by English key, Ancient surface and Modern surface. Lookups are
 * exact unless {@code ignoreCase} is set. {@link #findSimilar} is the near-match fallback and
 * always compares lower-cased keys.</p>
 *
 * <p>Instances are immutable and are passed explicitly to the components that need them.</p>
 */
public class BaselineIndex {

    static final int MAX_SIMILAR = 10;
    private static final Pattern STEM_SUFFIX = Pattern.compile("(ing|ed|er|est|ly|s)$");

    private final List<BaselineEntry> entries;
    private final boolean ignoreCase;
    private final boolean stemFallback;
    private final Map<String, BaselineEntry> byEnglish = new LinkedHashMap<>();
    private final Map<String, BaselineEntry> byAncient = new HashMap<>();
    private final Map<String, BaselineEntry> byModern = new HashMap<>();
    private final Map<String, String> clusterCommentary;

    public BaselineIndex(List<BaselineEntry> entries) {
        this(entries, Map.of(), false, true);
    }

    /**
     * @param entries           baseline entries in release order
     * @param clusterCommentary commentary per cluster name
     * @param ignoreCase        fold case for lookups
     * @param stemFallback      let {@link #findSimilar} also match on stripped stems
     */
    public BaselineIndex(List<BaselineEntry> entries, Map<String, String> clusterCommentary,
                         boolean ignoreCase, boolean stemFallback) {
        this.entries = List.copyOf(Objects.requireNonNull(entries, "entries is required"));
        this.clusterCommentary = clusterCommentary != null ? Map.copyOf(clusterCommentary) : Map.of();
        this.ignoreCase = ignoreCase;
        this.stemFallback = stemFallback;
        for (BaselineEntry entry : this.entries) {
            byEnglish.putIfAbsent(key(entry.english()), entry);
            if (entry.ancient() != null) {
                byAncient.putIfAbsent(key(entry.ancient()), entry);
            }
            if (entry.modern() != null) {
                byModern.putIfAbsent(key(entry.modern()), entry);
            }
        }
    }

    public Optional<BaselineEntry> lookup(String english) {
        return english == null ? Optional.empty() : Optional.ofNullable(byEnglish.get(key(english)));
    }

    public Optional<BaselineEntry> lookupByAncient(String ancient) {
        return ancient == null ? Optional.empty() : Optional.ofNullable(byAncient.get(key(ancient)));
    }

    public Optional<BaselineEntry> lookupByModern(String modern) {
        return modern == null ? Optional.empty() : Optional.ofNullable(byModern.get(key(modern)));
    }

    /**
     * Baseline entries whose English key contains, or is contained in, the given key, plus
     * entries sharing its stem when stem fallback is on. The key itself is not returned.
     * At most {@value #MAX_SIMILAR} results, in release order.
     */
    public List<BaselineEntry> findSimilar(String english) {
        if (english == null || english.isBlank()) {
            return List.of();
        }
        String word = english.trim().toLowerCase(Locale.ROOT);
        String wordStem = stem(word);
        Set<BaselineEntry> similar = new LinkedHashSet<>();
        for (BaselineEntry entry : byEnglish.values()) {
            if (similar.size() >= MAX_SIMILAR) {
                break;
            }
            String candidate = entry.english().toLowerCase(Locale.ROOT);
            if (candidate.equals(word)) {
                continue;
            }
            if (candidate.contains(word) || word.contains(candidate)) {
                similar.add(entry);
            } else if (stemFallback && !wordStem.isEmpty() && wordStem.equals(stem(candidate))) {
                similar.add(entry);
            }
        }
        return List.copyOf(similar);
    }

    /**
     * Compares a new entry with the baseline: mismatching forms are high severity, notes the
     * baseline had but the entry lacks are medium, and an unknown key with near matches is a
     * low-severity suggestion.
     */
    public EntryConsistency checkConsistency(Entry entry) {
        Optional<BaselineEntry> reference = lookup(entry.getEnglish());
        List<BaselineDiscrepancy> found = new ArrayList<>();
        if (reference.isPresent()) {
            BaselineEntry base = reference.get();
            String ancient = entry.ancientSurface();
            if (ancient != null && base.ancient() != null && !sameForm(ancient, base.ancient())) {
                found.add(BaselineDiscrepancy.of(entry.getEnglish(), BaselineDiscrepancy.Kind.ANCIENT_MISMATCH,
                        "Ancient form differs from baseline: \"" + ancient + "\" vs \"" + base.ancient() + "\""));
            }
            String modern = entry.modernSurface();
            if (modern != null && base.modern() != null && !sameForm(modern, base.modern())) {
                found.add(BaselineDiscrepancy.of(entry.getEnglish(), BaselineDiscrepancy.Kind.MODERN_MISMATCH,
                        "Modern form differs from baseline: \"" + modern + "\" vs \"" + base.modern() + "\""));
            }
            if (base.hasNotes() && !entry.hasNotes()) {
                found.add(BaselineDiscrepancy.of(entry.getEnglish(), BaselineDiscrepancy.Kind.MISSING_NOTES,
                        "Baseline has notes that could inform this entry: \"" + base.notes() + "\""));
            }
        } else {
            List<BaselineEntry> similar = findSimilar(entry.getEnglish());
            if (!similar.isEmpty()) {
                found.add(BaselineDiscrepancy.of(entry.getEnglish(), BaselineDiscrepancy.Kind.SIMILAR_ENTRIES,
                        "Found " + similar.size() + " similar entries in baseline for reference"));
            }
        }
        return new EntryConsistency(entry.getEnglish(), reference.isPresent(), found);
    }

    public Optional<ClusterReference> clusterOf(String english) {
        return lookup(english)
                .filter(e -> e.cluster() != null)
                .map(e -> new ClusterReference(e.cluster(), clusterCommentary.getOrDefault(e.cluster(), "")));
    }

    public BaselineStats stats() {
        int ancient = 0;
        int modern = 0;
        int notes = 0;
        Set<String> clusters = new LinkedHashSet<>();
        for (BaselineEntry entry : entries) {
            if (entry.ancient() != null) ancient++;
            if (entry.modern() != null) modern++;
            if (entry.hasNotes()) notes++;
            if (entry.cluster() != null) clusters.add(entry.cluster());
        }
        return new BaselineStats(entries.size(), ancient, modern, notes, clusters.size());
    }

    public List<BaselineEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    static String stem(String word) {
        return STEM_SUFFIX.matcher(word).replaceFirst("");
    }

    private boolean sameForm(String a, String b) {
        return ignoreCase ? a.equalsIgnoreCase(b) : a.equals(b);
    }

    private String key(String value) {
        String trimmed = value.trim();
        return ignoreCase ? trimmed.toLowerCase(Locale.ROOT) : trimmed;
    }
}
