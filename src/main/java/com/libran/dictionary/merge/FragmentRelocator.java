package com.libran.dictionary.merge;

import com.libran.dictionary.events.PipelineEventLog;
import com.libran.dictionary.events.PipelineEventType;
import com.libran.dictionary.lifecycle.FragmentArea;
import com.libran.dictionary.lifecycle.FragmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Moves a set of fragments between lifecycle areas as one unit: either every fragment
 * moves or, after compensation, none does. A fragment whose reverse move also fails is
 * reported as stranded in the event and on the exception.
 */
public class FragmentRelocator {
    private static final Logger log = LoggerFactory.getLogger(FragmentRelocator.class);
    private static final String ACTOR = "fragment-relocator";

    private final FragmentStore store;
    private final PipelineEventLog events;

    public FragmentRelocator(FragmentStore store, PipelineEventLog events) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.events = events != null ? events : new PipelineEventLog();
    }

    /**
     * @return the names that were moved, in order
     * @throws FragmentRelocationException if any move failed; completed moves are reversed first
     *                                     and any that could not be are listed as stranded
     */
    public List<String> relocate(List<String> names, FragmentArea from, FragmentArea to) {
        if (names.isEmpty()) {
            return List.of();
        }
        List<String> moved = new ArrayList<>(names.size());
        RelocationTransaction tx = new RelocationTransaction();
        try (tx) {
            for (String name : names) {
                tx.execute(name,
                        () -> store.move(name, from, to),
                        () -> store.move(name, to, from));
                moved.add(name);
            }
            tx.markSuccess();
        } catch (IOException | RuntimeException e) {
            throw rolledBack(from, to, moved, tx.failedCompensations(), e);
        }

        events.record(PipelineEventType.FRAGMENTS_RELOCATED, store.describe(), ACTOR, Map.of(
                "from", from.name(),
                "to", to.name(),
                "count", moved.size(),
                "fragments", List.copyOf(moved)));
        log.info("relocation.completed from={} to={} count={}", from, to, moved.size());
        return List.copyOf(moved);
    }

    private FragmentRelocationException rolledBack(FragmentArea from, FragmentArea to, List<String> moved,
                                                   List<String> stranded, Exception cause) {
        int restored = moved.size() - stranded.size();
        events.record(PipelineEventType.RELOCATION_ROLLED_BACK, store.describe(), ACTOR, Map.of(
                "from", from.name(),
                "to", to.name(),
                "rolledBack", restored,
                "stranded", List.copyOf(stranded),
                "error", String.valueOf(cause.getMessage())));
        if (stranded.isEmpty()) {
            log.error("relocation.rolledBack from={} to={} rolledBack={} error={}",
                    from, to, restored, cause.getMessage());
            return new FragmentRelocationException(
                    "Failed to relocate fragments " + from + " -> " + to + ": " + cause.getMessage(), cause);
        }
        log.error("relocation.inconsistent from={} to={} rolledBack={} stranded={} error={}",
                from, to, restored, stranded, cause.getMessage());
        return new FragmentRelocationException(
                "Failed to relocate fragments " + from + " -> " + to + " and could not move "
                        + stranded + " back to " + from + ": " + cause.getMessage(), cause, stranded);
    }
}
