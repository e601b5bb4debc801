package com.jay.fundrater.model;

import java.util.List;

/** Normalizer output: quarters and fiscal years, each ascending by period end. */
public record NormalizedSeries(List<FinancialPeriod> quarters, List<FinancialPeriod> years) {

    public boolean isEmpty() {
        return quarters.isEmpty() && years.isEmpty();
    }

    public FinancialPeriod latestQuarter() {
        return quarters.isEmpty() ? null : quarters.get(quarters.size() - 1);
    }

    public FinancialPeriod latestYear() {
        return years.isEmpty() ? null : years.get(years.size() - 1);
    }
}
