package com.jay.fundrater.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tier buckets for the normalized 0–100 score.
 * Declared from the highest floor down; {@link #forScore(int)} walks them in order.
 */
public enum RatingTier {
    ELITE("elite", 91),
    BULLISH("bullish", 76),
    SOLID("solid", 61),
    MIXED("mixed", 46),
    SPEC("spec", 31),
    DANGER("danger", Integer.MIN_VALUE);

    private final String label;
    private final int floor;

    RatingTier(String label, int floor) {
        this.label = label;
        this.floor = floor;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int floor() {
        return floor;
    }

    public static RatingTier forScore(int normalizedScore) {
        for (RatingTier tier : values()) {
            if (normalizedScore >= tier.floor) return tier;
        }
        return DANGER;
    }
}
