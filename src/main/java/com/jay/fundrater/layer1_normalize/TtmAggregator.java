package com.jay.fundrater.layer1_normalize;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.model.FinancialField;
import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.NormalizedSeries;
import com.jay.fundrater.model.TtmSnapshot;
import com.jay.fundrater.model.enums.PeriodType;
import com.jay.fundrater.model.enums.TtmBasis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;

/**
 * Layer 1 — TTM / Annual Aggregator.
 *
 * A window is four quarter slots stepping back three months from an anchor date. A slot is filled by the
 * reported quarter ending nearest to it (within the YoY tolerance).
 *   - all four slots report revenue and net income   → basis TTM
 *   - exactly one slot is missing or incomplete      → derived from its fiscal year's annual total, basis DERIVED
 *   - anything else                                  → latest fiscal year, basis ANNUAL
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TtmAggregator {

    private static final int SLOTS = 4;

    private final RaterConfig config;

    /** Trailing twelve months ending at the newest reported period; null when there is nothing to aggregate. */
    public TtmSnapshot latest(NormalizedSeries series) {
        if (series == null || series.isEmpty()) return null;
        LocalDate anchor = anchorDate(series);
        if (!series.quarters().isEmpty()) {
            TtmSnapshot window = window(series, anchor);
            if (window != null) return window;
        }
        FinancialPeriod year = series.latestYear();
        if (year == null) {
            log.debug("No complete quarterly window and no annual period to fall back to");
            return null;
        }
        return new TtmSnapshot(TtmBasis.ANNUAL, year.getPeriodEnd(), List.of(year.getPeriodEnd()), year, Set.of());
    }

    /** The same window one year earlier; requires a long enough quarterly history and never falls back to annual. */
    public TtmSnapshot prior(NormalizedSeries series) {
        if (series == null || series.quarters().size() < config.normalizer().getMinQuartersForPriorTtm()) return null;
        return window(series, anchorDate(series).minusYears(1));
    }

    // ── Window assembly ───────────────────────────────────────────────────────

    private LocalDate anchorDate(NormalizedSeries series) {
        FinancialPeriod q = series.latestQuarter();
        FinancialPeriod y = series.latestYear();
        if (q == null) return y.getPeriodEnd();
        if (y == null) return q.getPeriodEnd();
        // a fiscal year closing after the last 10-Q means its fourth quarter is only in the annual report
        return y.getPeriodEnd().isAfter(q.getPeriodEnd().plusDays(tolerance())) ? y.getPeriodEnd() : q.getPeriodEnd();
    }

    private TtmSnapshot window(NormalizedSeries series, LocalDate anchor) {
        List<LocalDate> slotEnds = new ArrayList<>();
        List<FinancialPeriod> slots = new ArrayList<>();
        for (int k = 0; k < SLOTS; k++) {
            LocalDate expected = anchor.minusMonths(3L * k);
            slotEnds.add(expected);
            slots.add(nearest(series.quarters(), expected));
        }

        List<Integer> gaps = new ArrayList<>();
        for (int k = 0; k < SLOTS; k++) {
            if (!isComplete(slots.get(k))) gaps.add(k);
        }

        if (gaps.isEmpty()) {
            return aggregate(TtmBasis.TTM, slots);
        }
        if (gaps.size() == 1) {
            int gap = gaps.get(0);
            LocalDate gapEnd = slots.get(gap) != null ? slots.get(gap).getPeriodEnd() : slotEnds.get(gap);
            FinancialPeriod derived = deriveQuarter(series, gapEnd, slots.get(gap));
            if (isComplete(derived)) {
                slots.set(gap, derived);
                return aggregate(TtmBasis.DERIVED, slots);
            }
        }
        return null;
    }

    /**
     * Fourth quarter (or any single missing quarter) as annual minus the other quarters of that fiscal year.
     * Fields without a full set of inputs stay null.
     */
    private FinancialPeriod deriveQuarter(NormalizedSeries series, LocalDate gapEnd, FinancialPeriod incomplete) {
        FinancialPeriod annual = null;
        long bestGap = Long.MAX_VALUE;
        for (FinancialPeriod year : series.years()) {
            long days = ChronoUnit.DAYS.between(gapEnd, year.getPeriodEnd());
            if (days >= -tolerance() && days <= 365 + tolerance() && Math.abs(days) < bestGap) {
                annual = year;
                bestGap = Math.abs(days);
            }
        }
        if (annual == null) return null;

        LocalDate fyStart = annual.getPeriodEnd().minusYears(1).plusDays(tolerance());
        LocalDate fyEnd = annual.getPeriodEnd().plusDays(tolerance());
        List<FinancialPeriod> siblings = new ArrayList<>();
        for (FinancialPeriod q : series.quarters()) {
            boolean inYear = q.getPeriodEnd().isAfter(fyStart) && !q.getPeriodEnd().isAfter(fyEnd);
            boolean isGap = Math.abs(ChronoUnit.DAYS.between(q.getPeriodEnd(), gapEnd)) <= tolerance();
            if (inYear && !isGap) siblings.add(q);
        }
        if (siblings.size() != SLOTS - 1) return null;

        FinancialPeriod.FinancialPeriodBuilder builder = incomplete != null
            ? incomplete.toBuilder()
            : FinancialPeriod.builder().periodEnd(gapEnd).periodType(PeriodType.QUARTER);
        for (FinancialField field : FinancialField.values()) {
            if (field.isFlow()) {
                field.set(builder, annualMinusSiblings(field, annual, siblings));
            } else if (field.get(incomplete) == null && gapEnd.equals(annual.getPeriodEnd())) {
                field.set(builder, field.get(annual));
            }
        }
        return builder.build();
    }

    private static Double annualMinusSiblings(FinancialField field, FinancialPeriod annual, List<FinancialPeriod> siblings) {
        Double total = field.get(annual);
        if (!isFiniteValue(total)) return null;
        double rest = 0;
        for (FinancialPeriod q : siblings) {
            Double v = field.get(q);
            if (!isFiniteValue(v)) return null;
            rest += v;
        }
        return total - rest;
    }

    private static TtmSnapshot aggregate(TtmBasis basis, List<FinancialPeriod> slotsNewestFirst) {
        List<FinancialPeriod> periods = new ArrayList<>(slotsNewestFirst);
        Collections.reverse(periods);
        FinancialPeriod latest = periods.get(periods.size() - 1);

        FinancialPeriod.FinancialPeriodBuilder builder = FinancialPeriod.builder()
            .periodEnd(latest.getPeriodEnd())
            .periodType(PeriodType.YEAR);
        Set<String> partial = new LinkedHashSet<>();
        for (FinancialField field : FinancialField.values()) {
            if (!field.isFlow()) {
                field.set(builder, field.get(latest));
                continue;
            }
            double sum = 0;
            int count = 0;
            for (FinancialPeriod p : periods) {
                Double v = field.get(p);
                if (isFiniteValue(v)) {
                    sum += v;
                    count++;
                }
            }
            if (count > 0) {
                field.set(builder, sum);
                if (count < periods.size()) partial.add(field.key());
            }
        }
        List<LocalDate> ends = periods.stream().map(FinancialPeriod::getPeriodEnd).toList();
        return new TtmSnapshot(basis, latest.getPeriodEnd(), ends, builder.build(), Collections.unmodifiableSet(partial));
    }

    private FinancialPeriod nearest(List<FinancialPeriod> quarters, LocalDate expected) {
        FinancialPeriod best = null;
        long bestGap = Long.MAX_VALUE;
        for (FinancialPeriod q : quarters) {
            long gap = Math.abs(ChronoUnit.DAYS.between(expected, q.getPeriodEnd()));
            if (gap <= tolerance() && gap < bestGap) {
                best = q;
                bestGap = gap;
            }
        }
        return best;
    }

    private static boolean isComplete(FinancialPeriod p) {
        return p != null && isFiniteValue(p.getRevenue()) && isFiniteValue(p.getNetIncome());
    }

    private int tolerance() {
        return config.normalizer().getYoyToleranceDays();
    }
}
