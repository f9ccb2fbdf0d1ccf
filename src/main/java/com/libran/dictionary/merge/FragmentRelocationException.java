package com.libran.dictionary.merge;

import com.libran.dictionary.core.DictionaryPipelineException;

import java.util.List;

/**
 * Thrown when moving fragments between lifecycle areas fails.
 * Moves completed before the failure have been reversed, except for the fragments listed
 * by {@link #strandedFragments()}, which are left in the target area.
 */
public class FragmentRelocationException extends DictionaryPipelineException {

    private final List<String> strandedFragments;

    public FragmentRelocationException(String message) {
        super(message);
        this.strandedFragments = List.of();
    }

    public FragmentRelocationException(String message, Throwable cause) {
        this(message, cause, List.of());
    }

    public FragmentRelocationException(String message, Throwable cause, List<String> strandedFragments) {
        super(message, cause);
        this.strandedFragments = List.copyOf(strandedFragments);
    }

    /**
     * Fragments whose reverse move failed. Empty when the rollback was complete.
     */
    public List<String> strandedFragments() {
        return strandedFragments;
    }

    public boolean isConsistent() {
        return strandedFragments.isEmpty();
    }
}
