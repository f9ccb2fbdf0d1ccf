package com.libran.dictionary.merge;

import java.util.Optional;

/**
 * Naming conventions that mark a file as not being a tranche fragment: unified artifacts,
 * download duplicates and previously processed markers.
 */
public final class FragmentNaming {

    public static final String UNIFIED_ARTIFACT_MARKER = "UnifiedLibranDictionary";

    private FragmentNaming() {
    }

    /**
     * @return why the name is excluded from merging, or empty if it is a fragment
     */
    public static Optional<String> exclusionReason(String name) {
        if (!name.endsWith(".json")) {
            return Optional.of("not a .json file");
        }
        if (name.contains(UNIFIED_ARTIFACT_MARKER)) {
            return Optional.of("unified dictionary artifact");
        }
        if (name.contains(" (1)")) {
            return Optional.of("duplicate download copy");
        }
        if (name.startsWith("merged") || name.startsWith("delete")) {
            return Optional.of("processed marker");
        }
        return Optional.empty();
    }

    public static boolean isFragment(String name) {
        return exclusionReason(name).isEmpty();
    }
}
