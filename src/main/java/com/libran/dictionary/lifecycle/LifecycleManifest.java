package com.libran.dictionary.lifecycle;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable record of where a run's fragment set is in its lifecycle.
 * {@link #transitionTo} validates the move and returns a new manifest; the physical
 * relocation of files is done separately by a {@link FragmentStore}.
 *
 * @param runId     id of the pipeline run that owns the fragment set
 * @param state     current state
 * @param fragments names of the fragments in the set
 * @param history   transitions applied so far, oldest first
 */
public record LifecycleManifest(
        String runId,
        LifecycleState state,
        List<String> fragments,
        List<LifecycleTransition> history
) {
    public LifecycleManifest {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(state, "state is required");
        fragments = fragments != null ? List.copyOf(fragments) : List.of();
        history = history != null ? List.copyOf(history) : List.of();
    }

    /**
     * Starts a manifest in PENDING for the given fragments.
     */
    public static LifecycleManifest pending(String runId, List<String> fragments) {
        return new LifecycleManifest(runId, LifecycleState.PENDING, fragments, List.of());
    }

    /**
     * Returns a manifest in the target state.
     *
     * @throws IllegalLifecycleTransitionException if the current state cannot reach the target
     */
    public LifecycleManifest transitionTo(LifecycleState target, Clock clock) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalLifecycleTransitionException(state, target);
        }
        List<LifecycleTransition> next = new ArrayList<>(history);
        next.add(new LifecycleTransition(state, target, clock.instant()));
        return new LifecycleManifest(runId, target, fragments, next);
    }

    /**
     * Returns a copy restricted to the given fragment names, keeping state and history.
     */
    public LifecycleManifest withFragments(List<String> names) {
        return new LifecycleManifest(runId, state, names, history);
    }
}
