package com.jay.fundrater.layer1_normalize;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.model.FinancialField;
import com.jay.fundrater.model.FinancialPeriod;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Year-over-year comparisons against the period ending one year earlier.
 * The comparable period must end within the tolerance of {@code target - 1 year}; it is never
 * approximated from adjacent periods, and short histories yield nothing at all.
 */
public final class YearOverYear {

    private final int minPeriods;
    private final int toleranceDays;

    public YearOverYear(int minPeriods, int toleranceDays) {
        this.minPeriods = minPeriods;
        this.toleranceDays = toleranceDays;
    }

    public static YearOverYear from(RaterConfig config) {
        RaterConfig.Normalizer n = config.normalizer();
        return new YearOverYear(n.getMinPeriodsForYoy(), n.getYoyToleranceDays());
    }

    /** The period closest to one year before {@code target}, if the series is long enough and one is close enough. */
    public Optional<FinancialPeriod> comparable(List<FinancialPeriod> seriesAsc, LocalDate target) {
        if (seriesAsc == null || seriesAsc.size() < minPeriods || target == null) return Optional.empty();
        LocalDate wanted = target.minusYears(1);
        FinancialPeriod best = null;
        long bestGap = Long.MAX_VALUE;
        for (FinancialPeriod p : seriesAsc) {
            long gap = Math.abs(ChronoUnit.DAYS.between(wanted, p.getPeriodEnd()));
            if (gap <= toleranceDays && gap < bestGap) {
                best = p;
                bestGap = gap;
            }
        }
        return Optional.ofNullable(best);
    }

    /** Percent change of {@code field} for the latest period versus its comparable one; null when unavailable. */
    public Double latestChange(List<FinancialPeriod> seriesAsc, FinancialField field) {
        if (seriesAsc == null || seriesAsc.isEmpty()) return null;
        FinancialPeriod latest = seriesAsc.get(seriesAsc.size() - 1);
        return comparable(seriesAsc, latest.getPeriodEnd())
            .map(prior -> FinancialMath.pctChange(field.get(latest), field.get(prior)))
            .orElse(null);
    }
}
