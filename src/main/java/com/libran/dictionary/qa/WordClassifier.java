package com.libran.dictionary.qa;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword heuristics that bucket an English key into a {@link WordClass}.
 *
 * <p>Order matters: verb markers win over everything, multi-word keys are {@code OTHER},
 * then adjective suffixes and a list of common adjectives; the rest are nouns.</p>
 */
public class WordClassifier {

    private static final List<String> ADJECTIVE_SUFFIXES =
            List.of("ous", "ful", "ive", "able", "ible", "al", "less", "ic", "ish", "ary");

    private static final Set<String> COMMON_ADJECTIVES = Set.of(
            "good", "bad", "big", "small", "old", "new", "young", "long", "short", "high", "low",
            "hot", "cold", "warm", "dark", "light", "strong", "weak", "fast", "slow", "great",
            "true", "false", "rich", "poor", "wise", "red", "green", "blue", "black", "white",
            "holy", "free", "full", "empty", "deep", "wide", "happy", "sad", "brave", "proud");

    // short words that happen to end in an adjective suffix
    private static final Set<String> SUFFIX_EXCEPTIONS = Set.of(
            "animal", "metal", "canal", "ritual", "arrival", "festival", "music", "magic", "library",
            "dictionary", "sanctuary", "olive", "crystal", "portal", "hospital");

    public WordClass classify(String english) {
        String word = english.trim().toLowerCase(Locale.ROOT);
        if (word.endsWith("ing") || word.startsWith("to ")) {
            return WordClass.VERB;
        }
        if (word.contains(" ") || word.contains("-")) {
            return WordClass.OTHER;
        }
        if (COMMON_ADJECTIVES.contains(word)) {
            return WordClass.ADJECTIVE;
        }
        if (word.length() > 4 && !SUFFIX_EXCEPTIONS.contains(word)) {
            for (String suffix : ADJECTIVE_SUFFIXES) {
                if (word.endsWith(suffix)) {
                    return WordClass.ADJECTIVE;
                }
            }
        }
        return WordClass.NOUN;
    }
}
