package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.SectorBucket;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProfitabilityRulesTest {

    @Test
    void grossMargin_scoredForTechOnly() {
        FinancialState tech = FinancialState.builder().sectorBucket(SectorBucket.TECH).grossMargin(65.0).build();

        RuleOutcome outcome = ProfitabilityRules.GROSS_MARGIN.evaluate(tech);
        assertThat(outcome.score()).isEqualTo(6);
        assertThat(outcome.message()).isEqualTo("65.00%");
        assertThat(ProfitabilityRules.GROSS_MARGIN.evaluate(tech.toBuilder().sectorBucket(SectorBucket.RETAIL).build())
            .notApplicable()).isTrue();
    }

    @Test
    void fcfMargin_techBands() {
        FinancialState tech = FinancialState.builder().sectorBucket(SectorBucket.TECH).fcfMargin(-30.0).build();

        assertThat(ProfitabilityRules.FCF_MARGIN.evaluate(tech).score()).isEqualTo(-8);
        assertThat(ProfitabilityRules.FCF_MARGIN.evaluate(tech.toBuilder().fcfMargin(25.0).build()).score()).isEqualTo(6);
        assertThat(ProfitabilityRules.FCF_MARGIN.evaluate(tech.toBuilder().fcfMargin(null).build()).missing()).isTrue();
    }

    @Test
    void fcfMargin_biotechBurnReadsAsInvestmentWhenNarrowing() {
        FinancialState burning = FinancialState.builder()
            .sectorBucket(SectorBucket.BIOTECH).marketCap(300_000_000.0).fcfMargin(-60.0).build();

        assertThat(ProfitabilityRules.FCF_MARGIN.evaluate(burning).score()).isEqualTo(-6);

        RuleOutcome narrowing = ProfitabilityRules.FCF_MARGIN.evaluate(burning.toBuilder().burnTrend(20.0).build());
        assertThat(narrowing.score()).isEqualTo(-2);
        assertThat(narrowing.message()).endsWith("(Inv. Mode)");
    }

    @Test
    void roeQuality_treatsExtremeReturnAsSuspect() {
        FinancialState tech = FinancialState.builder().sectorBucket(SectorBucket.TECH).roe(90.0).build();

        assertThat(ProfitabilityRules.ROE_QUALITY.evaluate(tech).score()).isEqualTo(-4);
        assertThat(ProfitabilityRules.ROE_QUALITY.evaluate(tech.toBuilder().roe(20.0).build()).score()).isEqualTo(4);
    }

    @Test
    void roic_notApplicableWhenDistortedOrEquityNegative() {
        FinancialState tech = FinancialState.builder().sectorBucket(SectorBucket.TECH).roic(250.0).build();

        assertThat(ProfitabilityRules.ROIC.evaluate(tech).notApplicable()).isTrue();
        assertThat(ProfitabilityRules.ROIC.evaluate(tech.toBuilder().roic(18.0).totalEquity(-5.0).build()).notApplicable())
            .isTrue();
        assertThat(ProfitabilityRules.ROIC.evaluate(tech.toBuilder().roic(18.0).build()).score()).isEqualTo(4);
    }
}
