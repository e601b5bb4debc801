package com.jay.fundrater.layer4_rating;

import com.jay.fundrater.model.enums.RatingTier;

/** Maps the raw rule total onto 0–100 and into a tier. */
public final class ScoreNormalizer {

    private ScoreNormalizer() {
    }

    public static int normalize(double raw, double min, double max) {
        double scaled = (raw - min) / (max - min) * 100;
        return (int) Math.round(Math.max(0, Math.min(100, scaled)));
    }

    public static RatingTier tier(int normalizedScore) {
        return RatingTier.forScore(normalizedScore);
    }
}
