package com.jay.fundrater.layer3_state;

import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.InterestCoverage;
import com.jay.fundrater.model.enums.CoverageStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InterestCoverageCalculatorTest {

    @Test
    void compute_sumsEbitOverInterest() {
        InterestCoverage coverage = InterestCoverageCalculator.compute(List.of(
            period(10.0, -2.0, 50e6), period(10.0, 2.0, 50e6), period(10.0, 2.0, 50e6), period(10.0, 2.0, 50e6),
            period(1000.0, 1.0, 50e6)));

        assertThat(coverage.status()).isEqualTo(CoverageStatus.COMPUTED);
        assertThat(coverage.value()).isEqualTo(5.0);
        assertThat(coverage.periods()).isEqualTo(4);
    }

    @Test
    void compute_noInterestAndNoDebtIsDebtFree() {
        InterestCoverage coverage = InterestCoverageCalculator.compute(List.of(
            period(10.0, 0.0, 0.0), period(10.0, 0.0, 0.0)));

        assertThat(coverage.isDebtFree()).isTrue();
        assertThat(coverage.value()).isInfinite();
    }

    @Test
    void compute_noInterestWithRealDebtIsMissingData() {
        InterestCoverage coverage = InterestCoverageCalculator.compute(List.of(
            period(10.0, 0.0, 5e6), period(10.0, 0.0, 5e6)));

        assertThat(coverage.status()).isEqualTo(CoverageStatus.MISSING_INTEREST);
        assertThat(coverage.value()).isNull();
    }

    @Test
    void compute_needsTwoPeriods() {
        assertThat(InterestCoverageCalculator.compute(List.of(period(10.0, 2.0, 1e6))).status())
            .isEqualTo(CoverageStatus.INSUFFICIENT_DATA);
    }

    private static FinancialPeriod period(Double ebit, Double interest, Double debt) {
        return FinancialPeriod.builder().operatingIncome(ebit).interestExpense(interest).totalDebt(debt).build();
    }
}
