package com.jay.fundrater.layer3_state;

import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.Projections;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;
import static com.jay.fundrater.layer1_normalize.FinancialMath.safeDiv;

/**
 * Coarse forward-looking heuristics built from the recent slopes of revenue, free cash flow and net margin.
 * Scores are in [0,1]. Cash-rich companies have their bankruptcy risk capped at Low.
 */
public final class ProjectionCalculator {

    private static final double MEGA_CAP = 50_000_000_000d;

    private ProjectionCalculator() {
    }

    public static Projections compute(FinancialState s) {
        List<FinancialPeriod> asc = new ArrayList<>(s.getPeriodsDesc() == null ? List.of() : s.getPeriodsDesc());
        Collections.reverse(asc);

        double revenueSlope = slope(asc, FinancialPeriod::getRevenue);
        double fcfSlope = slope(asc, FinancialPeriod::getFreeCashFlow);
        double marginSlope = slope(asc, p -> safeDiv(p.getNetIncome(), p.getRevenue()));

        List<Double> margins = asc.stream().map(p -> safeDiv(p.getNetIncome(), p.getRevenue()))
            .filter(Objects::nonNull).toList();
        Double marginStability = margins.size() >= 2
            ? 1 - Math.min(1, Math.abs(margins.get(margins.size() - 1) - margins.get(0)))
            : null;
        List<FinancialPeriod> lastFour = asc.subList(Math.max(0, asc.size() - 4), asc.size());
        double ocfSlope = slope(lastFour, FinancialPeriod::getOperatingCashFlow);

        Double fcfMargin = s.getFcfMargin() == null ? null : s.getFcfMargin() / 100;
        Double cagr = s.getRevenueCagr3y() == null ? null : s.getRevenueCagr3y() / 100;
        Double coverage = s.getInterestCoverage() == null ? null : s.getInterestCoverage().value();
        Double debtYears = s.getNetDebtToFcfYears();

        double growthContinuation = clamp01(
            normalize(cagr == null ? 0 : cagr, -0.2, 0.5) * 0.4
                + normalize(ocfSlope, -1, 1) * 0.35
                + normalize(marginStability == null ? 0.5 : marginStability, 0, 1) * 0.25);

        // ── Dilution risk ─────────────────────────────────────────────────────
        List<Double> dilutionParts = new ArrayList<>();
        Double sharesYoY = s.getShareChange() == null ? null : s.getShareChange().changeYoY();
        if (sharesYoY != null) dilutionParts.add(normalize(sharesYoY / 100, -0.03, 0.12));
        dilutionParts.add(normalize(debtYears == null ? 0 : debtYears, 0, 8));
        if (isFiniteValue(coverage)) dilutionParts.add(1 - normalize(coverage, 1, 8));
        if (fcfMargin != null && fcfMargin < 0) {
            dilutionParts.add(normalize(-fcfMargin, 0, 0.25));
            if (debtYears == null) dilutionParts.add(1.0);
        }
        double dilutionRisk = clamp01(avg(dilutionParts));
        double qoq = s.getShareChange() == null || s.getShareChange().changeQoQ() == null
            ? 0 : s.getShareChange().changeQoQ() / 100;
        // a flat latest quarter means the YoY jump was a one-off
        if (dilutionRisk > 0.4 && qoq < 0.01) dilutionRisk = Math.min(dilutionRisk, qoq < 0 ? 0 : 0.2);

        // ── Bankruptcy risk ───────────────────────────────────────────────────
        List<Double> bankruptcyParts = new ArrayList<>();
        Double fallbackYears = debtYears != null ? debtYears : (fcfMargin != null && fcfMargin < 0 ? 12.0 : null);
        if (fallbackYears != null) bankruptcyParts.add(normalize(fallbackYears, 0, 10));
        bankruptcyParts.add(normalize(s.getDebtToEquity() == null ? 0 : s.getDebtToEquity(), 0, 3));
        bankruptcyParts.add(normalize(-marginSlope, -0.05, 0.05));
        if (isFiniteValue(coverage)) bankruptcyParts.add(1 - normalize(coverage, 1, 8));
        if (fcfMargin != null && fcfMargin < 0) bankruptcyParts.add(normalize(-fcfMargin, 0, 0.25));
        double bankruptcyRisk = clamp01(avg(bankruptcyParts));

        boolean megaCap = s.getMarketCap() != null && s.getMarketCap() > MEGA_CAP;
        boolean lowDebtYears = debtYears == null || debtYears <= 2;
        boolean strongFcf = fcfMargin != null && fcfMargin > 0.15;
        boolean strongCoverage = coverage != null && coverage > 15;
        boolean netCash = debtYears != null && debtYears < 0;
        boolean cashRich = s.getRunwayYears() != null && s.getRunwayYears() >= 3 && s.getNetDebt() != null && s.getNetDebt() < 0;
        if ((megaCap && lowDebtYears && strongFcf) || netCash || strongCoverage || cashRich) {
            bankruptcyRisk = Math.min(bankruptcyRisk, 0.2);
        }
        if (megaCap && fcfMargin != null && fcfMargin > 0) bankruptcyRisk = Math.min(bankruptcyRisk, 0.3);

        // ── Trend labels ──────────────────────────────────────────────────────
        int positives = 0;
        int negatives = 0;
        for (double slope : new double[] {revenueSlope, fcfSlope, marginSlope}) {
            if (slope > 0) positives++;
            else if (slope < 0) negatives++;
        }
        String deterioration = positives >= 3 ? "Strong uptrend"
            : positives >= 2 ? "Improving"
            : negatives >= 2 ? "Declining"
            : "Stabilizing";
        String businessTrend = positives >= 2 ? "Improving" : negatives >= 2 ? "Worsening" : "Stable";

        return new Projections(businessTrend, deterioration, growthContinuation,
            dilutionRisk, Projections.riskLabel(dilutionRisk),
            bankruptcyRisk, Projections.riskLabel(bankruptcyRisk));
    }

    // last minus first present value
    static double slope(List<FinancialPeriod> asc, Function<FinancialPeriod, Double> metric) {
        List<Double> values = asc.stream().map(metric).filter(v -> isFiniteValue(v)).toList();
        if (values.size() < 2) return 0;
        return values.get(values.size() - 1) - values.get(0);
    }

    static double normalize(double value, double min, double max) {
        return clamp01((value - min) / (max - min));
    }

    private static double clamp01(double v) {
        return Math.max(0, Math.min(1, v));
    }

    private static double avg(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }
}
