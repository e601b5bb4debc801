package com.jay.fundrater.layer1_normalize;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.NormalizedSeries;
import com.jay.fundrater.model.TtmSnapshot;
import com.jay.fundrater.model.enums.PeriodType;
import com.jay.fundrater.model.enums.TtmBasis;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TtmAggregatorTest {

    private final TtmAggregator aggregator = new TtmAggregator(new RaterConfig());

    @Test
    void latest_sumsFourCompleteQuartersAsTtm() {
        NormalizedSeries series = new NormalizedSeries(List.of(
            quarter("2024-03-31", 100.0, 10.0),
            quarter("2024-06-30", 110.0, 11.0),
            quarter("2024-09-30", 120.0, 12.0),
            quarter("2024-12-31", 130.0, 13.0)
        ), List.of());

        TtmSnapshot ttm = aggregator.latest(series);

        assertThat(ttm.basis()).isEqualTo(TtmBasis.TTM);
        assertThat(ttm.totals().getRevenue()).isEqualTo(460.0);
        assertThat(ttm.totals().getNetIncome()).isEqualTo(46.0);
        assertThat(ttm.asOf()).isEqualTo(LocalDate.parse("2024-12-31"));
        assertThat(ttm.periodEnds()).hasSize(4);
    }

    @Test
    void latest_derivesFourthQuarterFromAnnualTotal() {
        NormalizedSeries series = new NormalizedSeries(List.of(
            quarter("2024-03-31", 100.0, 10.0),
            quarter("2024-06-30", 110.0, 11.0),
            quarter("2024-09-30", 120.0, 12.0)
        ), List.of(year("2024-12-31", 470.0, 50.0)));

        TtmSnapshot ttm = aggregator.latest(series);

        assertThat(ttm.basis()).isEqualTo(TtmBasis.DERIVED);
        assertThat(ttm.totals().getRevenue()).isEqualTo(470.0);
        assertThat(ttm.totals().getNetIncome()).isEqualTo(50.0);
    }

    @Test
    void latest_neverLabelsTtmWhenAQuarterLacksNetIncome() {
        NormalizedSeries series = new NormalizedSeries(List.of(
            quarter("2024-03-31", 100.0, 10.0),
            quarter("2024-06-30", 110.0, null),
            quarter("2024-09-30", 120.0, 12.0),
            quarter("2024-12-31", 130.0, null)
        ), List.of(year("2023-12-31", 380.0, 30.0)));

        TtmSnapshot ttm = aggregator.latest(series);

        assertThat(ttm.basis()).isEqualTo(TtmBasis.ANNUAL);
        assertThat(ttm.totals().getRevenue()).isEqualTo(380.0);
    }

    @Test
    void prior_requiresEightQuarters() {
        NormalizedSeries series = new NormalizedSeries(List.of(
            quarter("2024-03-31", 100.0, 10.0),
            quarter("2024-06-30", 110.0, 11.0),
            quarter("2024-09-30", 120.0, 12.0),
            quarter("2024-12-31", 130.0, 13.0)
        ), List.of());

        assertThat(aggregator.prior(series)).isNull();
    }

    static FinancialPeriod quarter(String end, Double revenue, Double netIncome) {
        return FinancialPeriod.builder().periodEnd(LocalDate.parse(end)).periodType(PeriodType.QUARTER)
            .revenue(revenue).netIncome(netIncome).build();
    }

    static FinancialPeriod year(String end, Double revenue, Double netIncome) {
        return FinancialPeriod.builder().periodEnd(LocalDate.parse(end)).periodType(PeriodType.YEAR)
            .revenue(revenue).netIncome(netIncome).build();
    }
}
