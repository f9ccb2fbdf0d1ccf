package com.libran.dictionary.qa;

/**
 * Decides whether two English meanings may legitimately share one surface form.
 */
@FunctionalInterface
public interface HomonymPolicy {

    boolean isJustified(String english1, String english2);

    /**
     * Policy that justifies nothing: every shared form is a collision.
     */
    static HomonymPolicy none() {
        return (a, b) -> false;
    }
}
