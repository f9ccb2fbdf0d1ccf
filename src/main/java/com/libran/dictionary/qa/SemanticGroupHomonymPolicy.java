package com.libran.dictionary.qa;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Justifies a shared form when both English meanings belong to the same semantic group.
 * The default groups are kinship terms and body parts.
 */
public class SemanticGroupHomonymPolicy implements HomonymPolicy {

    public static final Set<String> KINSHIP = Set.of("brother", "sister", "father", "mother", "son", "daughter");
    public static final Set<String> BODY_PARTS = Set.of("hand", "foot", "eye", "ear", "mouth");

    private final List<Set<String>> groups;

    public SemanticGroupHomonymPolicy() {
        this(List.of(KINSHIP, BODY_PARTS));
    }

    public SemanticGroupHomonymPolicy(List<Set<String>> groups) {
        this.groups = List.copyOf(groups);
    }

    @Override
    public boolean isJustified(String english1, String english2) {
        String w1 = english1.toLowerCase(Locale.ROOT);
        String w2 = english2.toLowerCase(Locale.ROOT);
        for (Set<String> group : groups) {
            if (group.contains(w1) && group.contains(w2)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a policy with an additional group.
     */
    public SemanticGroupHomonymPolicy withGroup(Set<String> group) {
        List<Set<String>> extended = new ArrayList<>(groups);
        extended.add(Set.copyOf(group));
        return new SemanticGroupHomonymPolicy(extended);
    }
}
