package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.InterestCoverage;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.CoverageStatus;
import com.jay.fundrater.model.enums.IssuerType;
import com.jay.fundrater.model.enums.SectorBucket;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SolvencyRulesTest {

    @Test
    void cashRunway_onlyScoredForBiotech() {
        FinancialState bio = FinancialState.builder().sectorBucket(SectorBucket.BIOTECH).runwayYears(2.0).build();

        assertThat(SolvencyRules.CASH_RUNWAY.evaluate(bio).score()).isEqualTo(2);
        assertThat(SolvencyRules.CASH_RUNWAY.evaluate(bio.toBuilder().runwayYears(Double.POSITIVE_INFINITY).build()).message())
            .isEqualTo("Self-funded");
        assertThat(SolvencyRules.CASH_RUNWAY.evaluate(bio.toBuilder().runwayYears(0.3).build()).score()).isEqualTo(-6);
        assertThat(SolvencyRules.CASH_RUNWAY.evaluate(bio.toBuilder().sectorBucket(SectorBucket.TECH).build())
            .notApplicable()).isTrue();
    }

    @Test
    void debtToEquity_rewardsDebtFreeAndPunishesNegativeEquity() {
        FinancialState debtFree = FinancialState.builder().sectorBucket(SectorBucket.TECH).totalDebt(0.0).build();
        FinancialState deficit = FinancialState.builder().sectorBucket(SectorBucket.TECH).debtToEquity(-2.0).build();

        assertThat(SolvencyRules.DEBT_TO_EQUITY.evaluate(debtFree).score()).isEqualTo(10);
        assertThat(SolvencyRules.DEBT_TO_EQUITY.evaluate(debtFree.toBuilder().sectorBucket(SectorBucket.BIOTECH).build())
            .score()).isEqualTo(5);
        assertThat(SolvencyRules.DEBT_TO_EQUITY.evaluate(deficit).score()).isEqualTo(-10);
    }

    @Test
    void interestCoverage_bandsAndUnknowns() {
        FinancialState.FinancialStateBuilder base = FinancialState.builder().sectorBucket(SectorBucket.INDUSTRIAL);

        assertThat(SolvencyRules.INTEREST_COVERAGE.evaluate(base
            .interestCoverage(new InterestCoverage(7.0, 4, CoverageStatus.COMPUTED)).build()).score()).isEqualTo(4);
        assertThat(SolvencyRules.INTEREST_COVERAGE.evaluate(base
            .interestCoverage(new InterestCoverage(0.5, 4, CoverageStatus.COMPUTED)).build()).score()).isEqualTo(-8);

        RuleOutcome missingInterest = SolvencyRules.INTEREST_COVERAGE.evaluate(base
            .interestCoverage(InterestCoverage.unknown(4, CoverageStatus.MISSING_INTEREST)).debtToEquity(1.0).build());
        assertThat(missingInterest.missing()).isTrue();
        assertThat(missingInterest.notApplicable()).isFalse();

        RuleOutcome debtFree = SolvencyRules.INTEREST_COVERAGE.evaluate(base
            .interestCoverage(new InterestCoverage(Double.POSITIVE_INFINITY, 4, CoverageStatus.DEBT_FREE)).build());
        assertThat(debtFree.notApplicable()).isTrue();
    }

    @Test
    void interestCoverage_foreignCashGeneratorIsNotPunished() {
        FinancialState s = FinancialState.builder().sectorBucket(SectorBucket.INDUSTRIAL).issuerType(IssuerType.FOREIGN)
            .fcfMargin(12.0).interestCoverage(new InterestCoverage(2.0, 4, CoverageStatus.COMPUTED)).build();

        assertThat(SolvencyRules.INTEREST_COVERAGE.evaluate(s).score()).isZero();
    }
}
