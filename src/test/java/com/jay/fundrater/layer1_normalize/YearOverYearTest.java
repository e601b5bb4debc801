package com.jay.fundrater.layer1_normalize;

import com.jay.fundrater.model.FinancialField;
import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.enums.PeriodType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class YearOverYearTest {

    private final YearOverYear yoy = new YearOverYear(5, 30);

    @Test
    void latestChange_isNullWithFewerThanFivePeriodsEvenWhenADateMatches() {
        List<FinancialPeriod> four = List.of(
            q("2023-12-31", 100), q("2024-03-31", 105), q("2024-06-30", 110), q("2024-12-31", 130));

        assertThat(yoy.latestChange(four, FinancialField.REVENUE)).isNull();
    }

    @Test
    void latestChange_comparesAgainstTheSameQuarterLastYear() {
        List<FinancialPeriod> five = List.of(
            q("2023-12-31", 100), q("2024-03-31", 105), q("2024-06-30", 110),
            q("2024-09-30", 115), q("2024-12-31", 130));

        assertThat(yoy.latestChange(five, FinancialField.REVENUE)).isCloseTo(30.0, within(1e-9));
    }

    @Test
    void comparable_isEmptyWhenNoPeriodEndsNearOneYearEarlier() {
        List<FinancialPeriod> gappy = List.of(
            q("2023-06-30", 90), q("2024-03-31", 105), q("2024-06-30", 110),
            q("2024-09-30", 115), q("2024-12-31", 130));

        assertThat(yoy.comparable(gappy, LocalDate.parse("2024-12-31"))).isEmpty();
    }

    @Test
    void pctChange_measuresAgainstTheMagnitudeOfTheBase() {
        assertThat(FinancialMath.pctChange(-50.0, -100.0)).isCloseTo(50.0, within(1e-9));
        assertThat(FinancialMath.pctChange(10.0, 0.0)).isNull();
    }

    private static FinancialPeriod q(String end, double revenue) {
        return FinancialPeriod.builder().periodEnd(LocalDate.parse(end)).periodType(PeriodType.QUARTER)
            .revenue(revenue).build();
    }
}
