package com.jay.fundrater.layer3_state;

import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.Projections;
import com.jay.fundrater.model.ShareChange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProjectionCalculatorTest {

    @Test
    void compute_risingRevenueCashAndMarginIsAStrongUptrend() {
        FinancialState state = FinancialState.builder()
            .periodsDesc(List.of(period(200, 30, 40), period(150, 15, 20), period(100, 5, 10)))
            .netDebtToFcfYears(-1.0)
            .fcfMargin(20.0)
            .build();

        Projections p = ProjectionCalculator.compute(state);

        assertThat(p.deteriorationLabel()).isEqualTo("Strong uptrend");
        assertThat(p.businessTrendLabel()).isEqualTo("Improving");
        assertThat(p.bankruptcyRiskScore()).isLessThanOrEqualTo(0.2);
        assertThat(p.bankruptcyRiskLabel()).isEqualTo("Low");
    }

    @Test
    void compute_burningDilutingCompanyCarriesHighRisk() {
        FinancialState state = FinancialState.builder()
            .periodsDesc(List.of(period(80, -40, -30), period(90, -30, -20), period(100, -20, -10)))
            .fcfMargin(-40.0)
            .debtToEquity(2.5)
            .shareChange(new ShareChange(8.0, 40.0, 40.0, null, null))
            .build();

        Projections p = ProjectionCalculator.compute(state);

        assertThat(p.deteriorationLabel()).isEqualTo("Declining");
        assertThat(p.businessTrendLabel()).isEqualTo("Worsening");
        assertThat(p.dilutionRiskLabel()).isEqualTo("High");
        assertThat(p.bankruptcyRiskLabel()).isEqualTo("High");
    }

    @Test
    void compute_flatLatestQuarterCapsDilutionRisk() {
        FinancialState state = FinancialState.builder()
            .periodsDesc(List.of(period(100, 5, 5), period(100, 5, 5)))
            .fcfMargin(-40.0)
            .shareChange(new ShareChange(0.0, 40.0, 40.0, null, null))
            .build();

        assertThat(ProjectionCalculator.compute(state).dilutionRiskScore()).isLessThanOrEqualTo(0.2);
    }

    @Test
    void slope_isLastMinusFirstPresentValue() {
        List<FinancialPeriod> asc = List.of(period(100, 0, 0), FinancialPeriod.builder().build(), period(130, 0, 0));

        assertThat(ProjectionCalculator.slope(asc, FinancialPeriod::getRevenue)).isEqualTo(30.0);
        assertThat(ProjectionCalculator.slope(asc.subList(0, 1), FinancialPeriod::getRevenue)).isZero();
    }

    private static FinancialPeriod period(double revenue, double netIncome, double fcf) {
        return FinancialPeriod.builder().revenue(revenue).netIncome(netIncome).freeCashFlow(fcf)
            .operatingCashFlow(fcf).build();
    }
}
