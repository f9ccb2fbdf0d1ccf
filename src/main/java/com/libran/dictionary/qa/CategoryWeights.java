package com.libran.dictionary.qa;

import java.util.EnumMap;
import java.util.Map;

/**
 * Weights of the QA categories in the overall score.
 */
public record CategoryWeights(
        double collision,
        double suffixLaziness,
        double compoundHyphen,
        double coverage,
        double ruleset,
        double phrasebook,
        double versioning
) {
    public CategoryWeights {
        if (collision < 0 || suffixLaziness < 0 || compoundHyphen < 0 || coverage < 0
                || ruleset < 0 || phrasebook < 0 || versioning < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = collision + suffixLaziness + compoundHyphen + coverage + ruleset + phrasebook + versioning;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * 0.20 / 0.20 / 0.15 / 0.15 / 0.15 / 0.10 / 0.05.
     */
    public static CategoryWeights defaultWeights() {
        return new CategoryWeights(0.20, 0.20, 0.15, 0.15, 0.15, 0.10, 0.05);
    }

    public double weightOf(QaCategoryType type) {
        return switch (type) {
            case COLLISION -> collision;
            case SUFFIX_LAZINESS -> suffixLaziness;
            case COMPOUND_HYPHEN -> compoundHyphen;
            case COVERAGE -> coverage;
            case RULESET -> ruleset;
            case PHRASEBOOK -> phrasebook;
            case VERSIONING -> versioning;
        };
    }

    /**
     * Weighted sum of category scores, rounded and clamped to [0, 100].
     * A category without a score contributes nothing.
     */
    public int combine(Map<QaCategoryType, Double> scores) {
        double weighted = 0;
        for (Map.Entry<QaCategoryType, Double> e : scores.entrySet()) {
            weighted += weightOf(e.getKey()) * e.getValue();
        }
        long rounded = Math.round(weighted);
        return (int) Math.max(0, Math.min(100, rounded));
    }

    public Map<QaCategoryType, Double> asMap() {
        Map<QaCategoryType, Double> map = new EnumMap<>(QaCategoryType.class);
        for (QaCategoryType type : QaCategoryType.values()) {
            map.put(type, weightOf(type));
        }
        return map;
    }
}
