package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.FinancialState;

import java.util.List;
import java.util.function.Function;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;
import static com.jay.fundrater.layer1_normalize.FinancialMath.orZero;
import static com.jay.fundrater.layer1_normalize.FinancialMath.safeDiv;

/** Derived figures several rule families read. Every method returns null when an input is missing. */
final class Metrics {

    private Metrics() {
    }

    static Double revenueGrowth(FinancialState s) {
        return present(s.getRevenueGrowthYoY());
    }

    static double revenueGrowthOrZero(FinancialState s) {
        return orZero(s.getRevenueGrowthYoY());
    }

    /** History length in quarters; years count as four. */
    static int quarterEquivalents(FinancialState s) {
        return s.isAnnualMode() ? s.getPeriodCount() * 4 : s.getPeriodCount();
    }

    static int periodsPerYear(FinancialState s) {
        return s.isAnnualMode() ? 1 : 4;
    }

    static Double present(Double v) {
        return isFiniteValue(v) ? v : null;
    }

    static Double roaPct(FinancialState s) {
        Double ratio = safeDiv(s.getNetIncome(), s.getTotalAssets());
        return ratio == null ? null : ratio * 100;
    }

    static Double assetTurnover(FinancialState s) {
        return safeDiv(s.getRevenue(), s.getTotalAssets());
    }

    static Double grossMarginTrend(FinancialState s) {
        if (!isFiniteValue(s.getGrossMargin()) || !isFiniteValue(s.getGrossMarginPrev())) return null;
        return s.getGrossMargin() - s.getGrossMarginPrev();
    }

    static Double dividendPayoutPct(FinancialState s) {
        Double dividends = s.getDividendsTtm();
        Double fcf = s.getFreeCashFlow();
        if (!isFiniteValue(dividends) || dividends <= 0 || !isFiniteValue(fcf) || fcf <= 0) return null;
        return dividends / fcf * 100;
    }

    // ── Period access (newest first) ──────────────────────────────────────────

    static List<FinancialPeriod> periods(FinancialState s) {
        return s.getPeriodsDesc() == null ? List.of() : s.getPeriodsDesc();
    }

    static Double at(FinancialState s, int index, Function<FinancialPeriod, Double> field) {
        List<FinancialPeriod> desc = periods(s);
        if (index >= desc.size()) return null;
        return present(field.apply(desc.get(index)));
    }

    static Double periodMargin(FinancialState s, int index, Function<FinancialPeriod, Double> numerator) {
        Double ratio = safeDiv(at(s, index, numerator), at(s, index, FinancialPeriod::getRevenue));
        return ratio == null ? null : ratio * 100;
    }
}
