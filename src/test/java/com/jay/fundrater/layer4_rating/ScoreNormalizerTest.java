package com.jay.fundrater.layer4_rating;

import com.jay.fundrater.model.enums.RatingTier;
import org.junit.jupiter.api.Test;

import static com.jay.fundrater.layer4_rating.Bands.at;
import static org.assertj.core.api.Assertions.assertThat;

class ScoreNormalizerTest {

    @Test
    void normalize_mapsRawRangeOntoZeroToHundredAndClamps() {
        assertThat(ScoreNormalizer.normalize(-60, -60, 100)).isZero();
        assertThat(ScoreNormalizer.normalize(20, -60, 100)).isEqualTo(50);
        assertThat(ScoreNormalizer.normalize(100, -60, 100)).isEqualTo(100);
        assertThat(ScoreNormalizer.normalize(-500, -60, 100)).isZero();
        assertThat(ScoreNormalizer.normalize(500, -60, 100)).isEqualTo(100);
    }

    @Test
    void tier_boundaries() {
        assertThat(ScoreNormalizer.tier(91)).isEqualTo(RatingTier.ELITE);
        assertThat(ScoreNormalizer.tier(90)).isEqualTo(RatingTier.BULLISH);
        assertThat(ScoreNormalizer.tier(76)).isEqualTo(RatingTier.BULLISH);
        assertThat(ScoreNormalizer.tier(61)).isEqualTo(RatingTier.SOLID);
        assertThat(ScoreNormalizer.tier(46)).isEqualTo(RatingTier.MIXED);
        assertThat(ScoreNormalizer.tier(31)).isEqualTo(RatingTier.SPEC);
        assertThat(ScoreNormalizer.tier(30)).isEqualTo(RatingTier.DANGER);
        assertThat(ScoreNormalizer.tier(0)).isEqualTo(RatingTier.DANGER);
    }

    @Test
    void tier_isMonotoneInScore() {
        for (int score = 1; score <= 100; score++) {
            assertThat(ScoreNormalizer.tier(score).ordinal())
                .isLessThanOrEqualTo(ScoreNormalizer.tier(score - 1).ordinal());
        }
    }

    @Test
    void bands_firstReachedFloorWinsAndBottomBandCatchesTheRest() {
        Bands.Band[] bands = {at(20, 6), at(10, 3), at(0, 0), at(-20, -4)};

        assertThat(Bands.score(25, bands)).isEqualTo(6);
        assertThat(Bands.score(10, bands)).isEqualTo(3);
        assertThat(Bands.score(-5, bands)).isEqualTo(-4);
        assertThat(Bands.score(-500, bands)).isEqualTo(-4);
        assertThat(Bands.score(1)).isZero();
    }

    @Test
    void bands_formatting() {
        assertThat(Bands.pct(12.345)).isEqualTo("12.35%");
        assertThat(Bands.pct(null)).isEqualTo("n/a");
        assertThat(Bands.money(2.5e9)).isEqualTo("$2.50B");
        assertThat(Bands.money(-3.2e6)).isEqualTo("$-3.20M");
        assertThat(Bands.ratio(1.234, 1)).isEqualTo("1.2x");
    }
}
