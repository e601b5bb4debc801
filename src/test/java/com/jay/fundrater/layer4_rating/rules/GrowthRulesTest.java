package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.SectorBucket;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GrowthRulesTest {

    private static FinancialState.FinancialStateBuilder tech(double growth) {
        return FinancialState.builder().sectorBucket(SectorBucket.TECH).periodCount(8).revenueGrowthYoY(growth);
    }

    @Test
    void revenueGrowth_bandsBySector() {
        assertThat(GrowthRules.REVENUE_GROWTH.evaluate(tech(35).build()).score()).isEqualTo(10);
        assertThat(GrowthRules.REVENUE_GROWTH.evaluate(tech(-15).build()).score()).isEqualTo(-8);
        assertThat(GrowthRules.REVENUE_GROWTH.evaluate(tech(12).sectorBucket(SectorBucket.INDUSTRIAL).build()).message())
            .endsWith("(Industrial YoY)");
    }

    @Test
    void revenueGrowth_shortHistoryWithExtremeGrowthIsNotScored() {
        RuleOutcome outcome = GrowthRules.REVENUE_GROWTH.evaluate(tech(120).periodCount(4).build());

        assertThat(outcome.notApplicable()).isTrue();
        assertThat(outcome.message()).contains("New entity");
    }

    @Test
    void revenueGrowth_oneOffDropIgnoredWhenCagrIsStrong() {
        RuleOutcome outcome = GrowthRules.REVENUE_GROWTH.evaluate(tech(-30).revenueCagr3y(25.0).build());

        assertThat(outcome.notApplicable()).isTrue();
    }

    @Test
    void revenueGrowth_missingWithoutData() {
        RuleOutcome outcome = GrowthRules.REVENUE_GROWTH.evaluate(FinancialState.builder().build());

        assertThat(outcome.missing()).isTrue();
        assertThat(outcome.notApplicable()).isFalse();
    }

    @Test
    void fintechMomentum_onlyForFintechsAboveThreshold() {
        assertThat(GrowthRules.FINTECH_MOMENTUM.evaluate(tech(60).build()).notApplicable()).isTrue();
        assertThat(GrowthRules.FINTECH_MOMENTUM.evaluate(tech(60).fintech(true).build()).score()).isEqualTo(8);
        assertThat(GrowthRules.FINTECH_MOMENTUM.evaluate(tech(10).fintech(true).build()).notApplicable()).isTrue();
    }
}
