package com.jay.fundrater.layer3_state;

import com.jay.fundrater.layer1_normalize.FinancialMath;
import com.jay.fundrater.layer1_normalize.YearOverYear;
import com.jay.fundrater.model.FinancialField;
import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.ShareChange;
import com.jay.fundrater.model.SplitSignal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;

/**
 * Share-count change with a guard against stock splits.
 *
 * A forward split shows up as shares x2 or more while EPS moves the inverse way and net income holds steady;
 * a reverse split as shares /4 or less with EPS scaled up by the same factor. Either way the raw YoY change
 * says nothing about dilution, so {@link ShareChange#changeYoY()} is left null.
 */
public class ShareChangeCalculator {

    static final double SPLIT_MIN_RATIO = 2.0;
    static final double REVERSE_MIN_RATIO = 4.0;
    static final double INVERSE_TOLERANCE = 0.25;
    static final double EPS_FLOOR = 0.01;
    static final double NET_INCOME_STABILITY = 0.35;

    // adjacent pairs inspected, newest first: enough to span the YoY window
    private static final int PAIRS_INSPECTED = 4;

    private final YearOverYear yoy;

    public ShareChangeCalculator(YearOverYear yoy) {
        this.yoy = yoy;
    }

    /** @param seriesAsc quarters (or years in annual mode), ascending */
    public ShareChange compute(List<FinancialPeriod> seriesAsc) {
        List<FinancialPeriod> withShares = seriesAsc.stream()
            .filter(p -> isFiniteValue(p.getSharesOutstanding()))
            .toList();
        if (withShares.isEmpty()) return ShareChange.none();

        FinancialPeriod latest = withShares.get(withShares.size() - 1);
        Double qoq = withShares.size() >= 2
            ? FinancialMath.pctChange(latest.getSharesOutstanding(), withShares.get(withShares.size() - 2).getSharesOutstanding())
            : null;
        Double rawYoY = yoy.latestChange(withShares, FinancialField.SHARES_OUTSTANDING);

        List<FinancialPeriod> desc = new ArrayList<>(withShares);
        Collections.reverse(desc);
        SplitSignal split = detectSplit(desc);
        SplitSignal reverse = split == null ? detectReverseSplit(desc) : null;

        Double adjusted = (split != null || reverse != null) ? null : rawYoY;
        return new ShareChange(qoq, adjusted, rawYoY, split, reverse);
    }

    static SplitSignal detectSplit(List<FinancialPeriod> desc) {
        for (int i = 0; i < Math.min(PAIRS_INSPECTED, desc.size() - 1); i++) {
            FinancialPeriod curr = desc.get(i);
            FinancialPeriod prev = desc.get(i + 1);
            double sharesRatio = curr.getSharesOutstanding() / prev.getSharesOutstanding();
            if (!Double.isFinite(sharesRatio) || sharesRatio < SPLIT_MIN_RATIO) continue;
            Double epsRatio = comparableEpsRatio(curr, prev);
            if (epsRatio == null) continue;
            double inverse = Math.abs(sharesRatio * epsRatio - 1);
            if (inverse > INVERSE_TOLERANCE) continue;
            if (!netIncomeStable(curr, prev)) continue;
            return new SplitSignal(sharesRatio, epsRatio, inverse, curr.getPeriodEnd(), prev.getPeriodEnd());
        }
        return null;
    }

    static SplitSignal detectReverseSplit(List<FinancialPeriod> desc) {
        for (int i = 0; i < Math.min(PAIRS_INSPECTED, desc.size() - 1); i++) {
            FinancialPeriod curr = desc.get(i);
            FinancialPeriod prev = desc.get(i + 1);
            if (curr.getSharesOutstanding() <= 0) continue;
            double reverseRatio = prev.getSharesOutstanding() / curr.getSharesOutstanding();
            if (!Double.isFinite(reverseRatio) || reverseRatio < REVERSE_MIN_RATIO) continue;
            Double epsRatio = comparableEpsRatio(curr, prev);
            if (epsRatio == null) continue;
            double inverse = Math.abs(epsRatio / reverseRatio - 1);
            if (inverse > INVERSE_TOLERANCE) continue;
            return new SplitSignal(reverseRatio, epsRatio, inverse, curr.getPeriodEnd(), prev.getPeriodEnd());
        }
        return null;
    }

    // EPS on both sides, same sign, not rounding noise
    private static Double comparableEpsRatio(FinancialPeriod curr, FinancialPeriod prev) {
        Double epsCurr = curr.getEpsBasic();
        Double epsPrev = prev.getEpsBasic();
        if (!isFiniteValue(epsCurr) || !isFiniteValue(epsPrev)) return null;
        if (Math.signum(epsCurr) != Math.signum(epsPrev) || epsCurr == 0) return null;
        if (Math.abs(epsCurr) < EPS_FLOOR || Math.abs(epsPrev) < EPS_FLOOR) return null;
        return epsCurr / epsPrev;
    }

    private static boolean netIncomeStable(FinancialPeriod curr, FinancialPeriod prev) {
        Double niCurr = curr.getNetIncome();
        Double niPrev = prev.getNetIncome();
        if (!isFiniteValue(niCurr) || !isFiniteValue(niPrev) || Math.abs(niPrev) <= 1e-6) return false;
        return Math.abs(niCurr / niPrev - 1) < NET_INCOME_STABILITY;
    }
}
