package com.libran.dictionary.lifecycle;

import com.libran.dictionary.core.DictionaryPipelineException;

/**
 * Thrown when a fragment set is asked to move to a state its current state cannot reach.
 */
public class IllegalLifecycleTransitionException extends DictionaryPipelineException {

    private final LifecycleState from;
    private final LifecycleState to;

    public IllegalLifecycleTransitionException(LifecycleState from, LifecycleState to) {
        super("Illegal lifecycle transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public LifecycleState getFrom() {
        return from;
    }

    public LifecycleState getTo() {
        return to;
    }
}
