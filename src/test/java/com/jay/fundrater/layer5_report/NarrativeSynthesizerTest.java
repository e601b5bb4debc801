package com.jay.fundrater.layer5_report;

import com.jay.fundrater.model.Completeness;
import com.jay.fundrater.model.FilingSignal;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.Narrative;
import com.jay.fundrater.model.RatingResult;
import com.jay.fundrater.model.enums.RatingTier;
import com.jay.fundrater.model.enums.SectorBucket;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NarrativeSynthesizerTest {

    private final NarrativeSynthesizer synthesizer = new NarrativeSynthesizer();

    @Test
    void synthesize_isDeterministicPerTicker() {
        FinancialState s = investmentPhase("GROW");
        RatingResult rating = rating(RatingTier.MIXED, false);

        Narrative first = synthesizer.synthesize(s, rating, List.of());
        Narrative second = synthesizer.synthesize(s, rating, List.of());

        assertThat(first).isEqualTo(second);
        assertThat(first.sentences()).hasSize(3);
        assertThat(first.summary()).isEqualTo(String.join(" ", first.sentences()));
    }

    @Test
    void synthesize_picksFromTheMatchingPools() {
        Narrative narrative = synthesizer.synthesize(investmentPhase("GROW"), rating(RatingTier.MIXED, false), List.of());

        assertThat(narrative.sentences()).containsExactly(
            NarrativeSynthesizer.pick("GROW", "tier.mixed"),
            NarrativeSynthesizer.pick("GROW", "burn.narrowing"),
            NarrativeSynthesizer.pick("GROW", "regime.investment"));
    }

    @Test
    void synthesize_addsDilutionFilingsAndPennyRunway() {
        FinancialState s = FinancialState.builder().ticker("TINY").runwayYears(0.4).build();
        List<FilingSignal> signals = List.of(
            FilingSignal.builder().id("dilution_risk").score(-4).build(),
            FilingSignal.builder().id("going_concern").score(-10).build());

        Narrative narrative = synthesizer.synthesize(s, rating(RatingTier.DANGER, true), signals);

        assertThat(narrative.sentences()).contains(
            NarrativeSynthesizer.pick("TINY", "filings.dilution"),
            NarrativeSynthesizer.pick("TINY", "penny.runway"));
        assertThat(narrative.sentences()).doesNotContain(NarrativeSynthesizer.pick("TINY", "distress"));
    }

    @Test
    void synthesize_dangerTierWithoutPennyReadsAsDistress() {
        Narrative narrative = synthesizer.synthesize(FinancialState.builder().ticker("SICK").build(),
            rating(RatingTier.DANGER, false), null);

        assertThat(narrative.sentences()).contains(NarrativeSynthesizer.pick("SICK", "distress"));
    }

    @Test
    void momentumScore_combinesTrendsAndCapsFilingImpact() {
        FinancialState s = FinancialState.builder().sectorBucket(SectorBucket.TECH)
            .revenueTrend(60.0).operatingMarginTrend(8.0).rndTrend(15.0).build();

        assertThat(NarrativeSynthesizer.momentumScore(s, List.of())).isEqualTo(80);
        assertThat(NarrativeSynthesizer.momentumScore(s, List.of(FilingSignal.builder().score(-50).build()))).isEqualTo(60);
        assertThat(NarrativeSynthesizer.momentumScore(FinancialState.builder().revenueTrend(-30.0)
            .operatingMarginTrend(-20.0).build(), List.of(FilingSignal.builder().score(-40).build()))).isEqualTo(10);
    }

    @Test
    void momentumLabel_bands() {
        assertThat(NarrativeSynthesizer.momentumLabel(85)).isEqualTo("Strong Momentum");
        assertThat(NarrativeSynthesizer.momentumLabel(60)).isEqualTo("Likely Continuation");
        assertThat(NarrativeSynthesizer.momentumLabel(50)).isEqualTo("Stable / Mixed");
        assertThat(NarrativeSynthesizer.momentumLabel(25)).isEqualTo("Weak / Stalling");
        assertThat(NarrativeSynthesizer.momentumLabel(5)).isEqualTo("Deteriorating");
    }

    @Test
    void pick_unknownPoolThrows() {
        assertThatThrownBy(() -> NarrativeSynthesizer.pick("X", "tier.legendary"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tier.legendary");
    }

    private static FinancialState investmentPhase(String ticker) {
        return FinancialState.builder().ticker(ticker).sectorBucket(SectorBucket.TECH)
            .revenueGrowthYoY(60.0).fcfMargin(-15.0).burnTrend(25.0).build();
    }

    static RatingResult rating(RatingTier tier, boolean penny) {
        return RatingResult.builder()
            .rawScore(0)
            .normalizedScore(tier.floor() < 0 ? 10 : tier.floor())
            .tier(tier)
            .reasons(List.of())
            .completeness(new Completeness(0, 0, 0, 0, 0))
            .overrideNotes(List.of())
            .missingNotes(List.of())
            .pennyStock(penny)
            .ruleCatalogVersion("test")
            .build();
    }
}
