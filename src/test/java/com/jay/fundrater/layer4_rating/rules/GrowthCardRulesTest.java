package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.SectorBucket;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GrowthCardRulesTest {

    @Test
    void assetGrowthVelocity_scoresDatedYearOverYearGrowth() {
        FinancialState scaling = FinancialState.builder()
            .sectorBucket(SectorBucket.TECH).revenueGrowthYoY(40.0).assetGrowthYoY(55.0).build();

        RuleOutcome outcome = GrowthCardRules.ASSET_GROWTH_VELOCITY.evaluate(scaling);

        assertThat(outcome.score()).isEqualTo(4);
        assertThat(outcome.message()).isEqualTo("55.00% YoY (Aggressive buildout)");
    }

    @Test
    void assetGrowthVelocity_withoutComparablePeriodIsNotScored() {
        FinancialState shortHistory = FinancialState.builder()
            .sectorBucket(SectorBucket.TECH).revenueGrowthYoY(10.0).build();

        assertThat(GrowthCardRules.ASSET_GROWTH_VELOCITY.evaluate(shortHistory).notApplicable()).isTrue();
        assertThat(GrowthCardRules.ASSET_GROWTH_VELOCITY.evaluate(shortHistory.toBuilder().revenueGrowthYoY(60.0).build())
            .message()).isEqualTo("Rapid expansion presumed (high rev growth)");
    }
}
