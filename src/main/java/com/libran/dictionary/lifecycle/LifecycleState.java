package com.libran.dictionary.lifecycle;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a set of tranche fragments within one pipeline run.
 *
 * <pre>
 * PENDING -> MERGED -> QA_PASSED -> DELETED
 *                   \-> QA_FAILED
 * </pre>
 *
 * DELETED is only reachable from QA_PASSED. QA_FAILED is terminal for the run; the
 * fragments stay in the merged area and a later run picks them up again.
 */
public enum LifecycleState {
    PENDING(FragmentArea.PENDING),
    MERGED(FragmentArea.MERGED),
    QA_PASSED(FragmentArea.MERGED),
    QA_FAILED(FragmentArea.MERGED),
    DELETED(FragmentArea.DELETED);

    private final FragmentArea area;

    LifecycleState(FragmentArea area) {
        this.area = area;
    }

    /**
     * The area fragments in this state are stored in.
     */
    public FragmentArea area() {
        return area;
    }

    public Set<LifecycleState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(MERGED);
            case MERGED -> EnumSet.of(QA_PASSED, QA_FAILED);
            case QA_PASSED -> EnumSet.of(DELETED);
            case QA_FAILED, DELETED -> EnumSet.noneOf(LifecycleState.class);
        };
    }

    public boolean canTransitionTo(LifecycleState target) {
        return successors().contains(target);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
