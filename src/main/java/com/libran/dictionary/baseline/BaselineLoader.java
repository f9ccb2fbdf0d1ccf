package com.libran.dictionary.baseline;

import com.libran.dictionary.core.ReferenceDataException;
import com.libran.dictionary.core.model.Entry;
import com.libran.dictionary.core.model.FragmentSource;
import com.libran.dictionary.tranche.ClusterInfo;
import com.libran.dictionary.tranche.FragmentParseException;
import com.libran.dictionary.tranche.ParsedFragment;
import com.libran.dictionary.tranche.TrancheParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a {@link BaselineIndex} from a baseline release file. Clustered snapshots are the
 * usual input, but any layout the {@link TrancheParser} reads is accepted.
 */
public class BaselineLoader {
    private static final Logger log = LoggerFactory.getLogger(BaselineLoader.class);

    private final TrancheParser parser;
    private final boolean ignoreCase;
    private final boolean stemFallback;

    public BaselineLoader() {
        this(new TrancheParser(), false, true);
    }

    public BaselineLoader(TrancheParser parser, boolean ignoreCase, boolean stemFallback) {
        this.parser = parser;
        this.ignoreCase = ignoreCase;
        this.stemFallback = stemFallback;
    }

    /**
     * @throws ReferenceDataException if the file is missing, unreadable or not a dictionary
     */
    public BaselineIndex load(Path path) {
        if (!Files.isReadable(path)) {
            throw new ReferenceDataException("Baseline reference not readable: " + path);
        }
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new ReferenceDataException("Failed to read baseline " + path, e);
        }
        BaselineIndex index = parse(new FragmentSource(path.getFileName().toString(), content));
        BaselineStats stats = index.stats();
        log.info("baseline.loaded path={} entries={} clusters={}", path, stats.totalEntries(), stats.clusters());
        return index;
    }

    public BaselineIndex parse(FragmentSource source) {
        ParsedFragment fragment;
        try {
            fragment = parser.parse(source);
        } catch (FragmentParseException e) {
            throw new ReferenceDataException("Malformed baseline " + source.name() + ": " + e.getMessage(), e);
        }

        Map<String, String> clusterByKey = new HashMap<>();
        Map<String, String> commentary = new LinkedHashMap<>();
        for (ClusterInfo cluster : fragment.clusters()) {
            commentary.put(cluster.name(), cluster.commentary() != null ? cluster.commentary() : "");
            for (String english : cluster.englishKeys()) {
                clusterByKey.putIfAbsent(english.toLowerCase(Locale.ROOT), cluster.name());
            }
        }

        List<BaselineEntry> entries = new ArrayList<>(fragment.entries().size());
        for (Entry entry : fragment.entries()) {
            entries.add(new BaselineEntry(
                    entry.getEnglish(),
                    entry.ancientSurface(),
                    entry.modernSurface(),
                    entry.getNotes(),
                    clusterByKey.get(entry.dedupKey())));
        }
        return new BaselineIndex(entries, commentary, ignoreCase, stemFallback);
    }
}
