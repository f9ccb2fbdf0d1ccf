package com.libran.dictionary.merge;

import com.libran.dictionary.core.model.DictionaryMetadata;
import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.FileStatistics;
import com.libran.dictionary.core.model.FragmentSource;
import com.libran.dictionary.core.model.UnifiedDictionary;
import com.libran.dictionary.events.PipelineEventLog;
import com.libran.dictionary.events.PipelineEventType;
import com.libran.dictionary.lifecycle.FragmentArea;
import com.libran.dictionary.lifecycle.FragmentStore;
import com.libran.dictionary.logging.LogContext;
import com.libran.dictionary.metrics.NoOpPipelineMetrics;
import com.libran.dictionary.metrics.PipelineMetrics;
import com.libran.dictionary.tranche.FragmentParseException;
import com.libran.dictionary.tranche.ParsedFragment;
import com.libran.dictionary.tranche.TrancheParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges tranche fragments into a single {@link UnifiedDictionary}.
 *
 * <p>Entries are deduplicated by English key; the first occurrence wins and every later one
 * is counted as removed. A fragment that cannot be read or parsed is skipped with a warning.
 * If no fragment is usable the merge fails with {@link NoValidFragmentsException} before
 * anything is relocated.</p>
 */
public class TrancheMerger {
    private static final Logger log = LoggerFactory.getLogger(TrancheMerger.class);
    private static final String ACTOR = "tranche-merger";

    private final TrancheParser parser;
    private final MergeOptions options;
    private final PipelineEventLog events;
    private final PipelineMetrics metrics;

    public TrancheMerger(TrancheParser parser, MergeOptions options) {
        this(parser, options, new PipelineEventLog(), new NoOpPipelineMetrics());
    }

    public TrancheMerger(TrancheParser parser, MergeOptions options,
                         PipelineEventLog events, PipelineMetrics metrics) {
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.events = events != null ? events : new PipelineEventLog();
        this.metrics = metrics != null ? metrics : new NoOpPipelineMetrics();
    }

    /**
     * Merges the given fragments without touching any store.
     * Merging the same sources twice with the same clock yields equal dictionaries.
     *
     * @throws NoValidFragmentsException if none of the sources could be used
     */
    public MergeResult merge(List<FragmentSource> sources) {
        Map<String, Entry> unique = new LinkedHashMap<>();
        List<FileStatistics> stats = new ArrayList<>();
        List<String> consumed = new ArrayList<>();
        List<SkippedFragment> skipped = new ArrayList<>();
        int duplicates = 0;

        for (FragmentSource source : sources) {
            try (LogContext ignored = LogContext.forFragment(source.name())) {
                var reason = FragmentNaming.exclusionReason(source.name());
                if (reason.isPresent()) {
                    log.debug("merge.fragmentIgnored name={} reason={}", source.name(), reason.get());
                    skipped.add(new SkippedFragment(source.name(), SkippedFragment.Reason.NAMING_CONVENTION,
                            reason.get()));
                    continue;
                }

                ParsedFragment parsed;
                try {
                    parsed = parser.parse(source);
                } catch (FragmentParseException e) {
                    skip(skipped, source.name(), SkippedFragment.Reason.PARSE_ERROR, e.getMessage());
                    continue;
                }

                int fileDuplicates = 0;
                for (Entry entry : parsed.entries()) {
                    if (unique.putIfAbsent(entry.dedupKey(), entry) != null) {
                        fileDuplicates++;
                    }
                }
                duplicates += fileDuplicates;
                consumed.add(source.name());
                int added = parsed.entries().size() - fileDuplicates;
                stats.add(new FileStatistics(source.name(), added, fileDuplicates, parsed.invalidEntries()));

                if (parsed.invalidEntries() > 0) {
                    log.warn("merge.invalidEntries name={} count={}", source.name(), parsed.invalidEntries());
                }
                if (fileDuplicates > 0) {
                    log.info("merge.duplicates name={} count={}", source.name(), fileDuplicates);
                }
                events.record(PipelineEventType.FRAGMENT_MERGED, source.name(), ACTOR, Map.of(
                        "shape", parsed.shape().name(),
                        "entries", added,
                        "duplicatesRemoved", fileDuplicates,
                        "invalidEntries", parsed.invalidEntries()));
            }
        }

        if (consumed.isEmpty()) {
            throw new NoValidFragmentsException("No valid fragments among " + sources.size() + " source(s)");
        }

        List<String> notes = new ArrayList<>(List.of(
                "Merged from individual tranche files",
                "Removed duplicate entries by English key (first occurrence wins)",
                "Excluded existing unified dictionaries and processed markers"));
        long parseFailures = skipped.stream().filter(s -> s.reason() != SkippedFragment.Reason.NAMING_CONVENTION).count();
        if (parseFailures > 0) {
            notes.add("Skipped " + parseFailures + " unreadable fragment(s)");
        }

        DictionaryMetadata metadata = new DictionaryMetadata(
                options.version(),
                options.clock().instant(),
                consumed,
                unique.size(),
                duplicates,
                stats,
                notes,
                options.project(),
                options.sourceDirectory());
        UnifiedDictionary dictionary = new UnifiedDictionary(new ArrayList<>(unique.values()), metadata);

        metrics.incrementFragmentsMerged(consumed.size());
        metrics.recordDuplicatesRemoved(duplicates);
        events.record(PipelineEventType.DICTIONARY_MERGED, options.version(), ACTOR, Map.of(
                "totalEntries", unique.size(),
                "duplicatesRemoved", duplicates,
                "filesIncluded", consumed.size()));
        log.info("merge.completed version={} totalEntries={} duplicatesRemoved={} files={} skipped={}",
                options.version(), unique.size(), duplicates, consumed.size(), skipped.size());
        return new MergeResult(dictionary, consumed, skipped, List.of());
    }

    /**
     * Merges the fragments of a store and relocates the consumed pending ones to the merged
     * area. Fragments already in the merged area (left there by a run that failed QA) are
     * merged first, followed by the pending ones. A pending fragment with the name of a
     * merged one is a resubmission: it replaces the merged copy, which is not read.
     *
     * @throws NoValidFragmentsException   if nothing could be merged; nothing is relocated
     * @throws FragmentRelocationException if relocation failed; completed moves are reversed
     */
    public MergeResult mergeAndRelocate(FragmentStore store, FragmentRelocator relocator) {
        List<FragmentSource> pendingSources = new ArrayList<>();
        List<SkippedFragment> unreadable = new ArrayList<>();
        Set<String> pending = new HashSet<>();
        collect(store, FragmentArea.PENDING, pendingSources, unreadable, pending, Set.of());

        List<FragmentSource> sources = new ArrayList<>();
        collect(store, FragmentArea.MERGED, sources, unreadable, null, pending);
        sources.addAll(pendingSources);

        MergeResult result;
        try {
            result = merge(sources);
        } catch (NoValidFragmentsException e) {
            log.error("merge.aborted store={} unreadable={} reason={}", store.describe(), unreadable.size(), e.getMessage());
            throw e;
        }
        if (!unreadable.isEmpty()) {
            List<SkippedFragment> allSkipped = new ArrayList<>(unreadable);
            allSkipped.addAll(result.skipped());
            result = new MergeResult(result.dictionary(), result.consumed(), allSkipped, List.of());
        }

        List<String> toRelocate = result.consumed().stream().filter(pending::contains).toList();
        List<String> moved = relocator.relocate(toRelocate, FragmentArea.PENDING, FragmentArea.MERGED);
        return result.withRelocated(moved);
    }

    private void collect(FragmentStore store, FragmentArea area, List<FragmentSource> sources,
                         List<SkippedFragment> unreadable, Set<String> names, Set<String> superseded) {
        List<String> listed;
        try {
            listed = store.list(area);
        } catch (IOException e) {
            log.warn("merge.listFailed area={} store={} error={}", area, store.describe(), e.getMessage());
            return;
        }
        for (String name : listed) {
            if (superseded.contains(name)) {
                log.info("merge.fragmentSuperseded name={} area={}", name, area);
                continue;
            }
            if (FragmentNaming.isFragment(name)) {
                try {
                    sources.add(store.read(area, name));
                    if (names != null) {
                        names.add(name);
                    }
                } catch (IOException e) {
                    skip(unreadable, name, SkippedFragment.Reason.UNREADABLE, e.getMessage());
                }
            } else {
                // still reported through merge() so the skip is visible in the result
                sources.add(new FragmentSource(name, ""));
            }
        }
    }

    private void skip(List<SkippedFragment> skipped, String name, SkippedFragment.Reason reason, String detail) {
        log.warn("merge.fragmentSkipped name={} reason={} detail={}", name, reason, detail);
        skipped.add(new SkippedFragment(name, reason, detail));
        events.record(PipelineEventType.FRAGMENT_SKIPPED, name, ACTOR, Map.of(
                "reason", reason.name(),
                "detail", String.valueOf(detail)));
        metrics.incrementFragmentsSkipped();
    }
}
