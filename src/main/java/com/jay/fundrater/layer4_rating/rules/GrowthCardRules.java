package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.layer4_rating.Rule;
import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.RuleCategory;
import com.jay.fundrater.model.enums.SectorBucket;

import java.util.Locale;

import static com.jay.fundrater.layer1_normalize.FinancialMath.orZero;
import static com.jay.fundrater.layer1_normalize.FinancialMath.safeDiv;
import static com.jay.fundrater.layer4_rating.Bands.at;
import static com.jay.fundrater.layer4_rating.Bands.pct;
import static com.jay.fundrater.layer4_rating.Bands.ratio;
import static com.jay.fundrater.layer4_rating.Bands.score;
import static com.jay.fundrater.layer4_rating.rules.Metrics.at;
import static com.jay.fundrater.layer4_rating.rules.Metrics.present;
import static com.jay.fundrater.layer4_rating.rules.Metrics.periods;

/**
 * Cards for companies in a build-out phase. They read the period series directly (newest first),
 * mostly score small bonuses, and stay not-applicable for mature or slow-growing businesses.
 */
public final class GrowthCardRules {

    private GrowthCardRules() {
    }

    public static final Rule ASSET_GROWTH_VELOCITY = new Rule("Asset Growth Velocity", 4, RuleCategory.GROWTH,
        Rule.BASIS_SERIES, GrowthCardRules::assetGrowthVelocity);

    public static final Rule REVENUE_PER_ASSET = new Rule("Revenue per Asset Efficiency", 3, RuleCategory.OTHER,
        Rule.BASIS_SERIES, GrowthCardRules::revenuePerAsset);

    public static final Rule DEBT_MATURITY = new Rule("Debt Maturity Runway", 3, RuleCategory.SOLVENCY,
        Rule.BASIS_BALANCE, GrowthCardRules::debtMaturity);

    public static final Rule OPERATING_LEVERAGE_INFLECTION = new Rule("Operating Leverage Inflection", 4,
        RuleCategory.PROFITABILITY, Rule.BASIS_SERIES, GrowthCardRules::operatingLeverageInflection);

    public static final Rule CASH_BURN_DECELERATION = new Rule("Cash Burn Deceleration", 4, RuleCategory.SOLVENCY,
        Rule.BASIS_SERIES, GrowthCardRules::cashBurnDeceleration);

    public static final Rule WORKING_CAPITAL_EFFICIENCY = new Rule("Working Capital Efficiency", 2, RuleCategory.OTHER,
        Rule.BASIS_BALANCE, GrowthCardRules::workingCapitalEfficiency);

    public static final Rule REVENUE_QUALITY = new Rule("Revenue Quality", 3, RuleCategory.GROWTH,
        Rule.BASIS_SERIES, GrowthCardRules::revenueQuality);

    record Inflection(boolean improving, double ratioChange, double latest) {}

    // ── Asset growth ──────────────────────────────────────────────────────────

    static RuleOutcome assetGrowthVelocity(FinancialState s) {
        Double g = present(s.getAssetGrowthYoY());
        double revGrowth = Metrics.revenueGrowthOrZero(s);
        if (g == null) {
            if (revGrowth > 50) return RuleOutcome.scored(2, "Rapid expansion presumed (high rev growth)");
            return RuleOutcome.notApplicable("Insufficient history");
        }
        if (revGrowth <= 30) return RuleOutcome.notApplicable("Not applicable (mature company)");
        int points = score(g, at(50, 4), at(30, 2), at(15, 1), at(-1000, 0));
        String label = g >= 50 ? " (Aggressive buildout)" : g >= 30 ? " (Scaling infra)" : "";
        return RuleOutcome.scored(points, pct(g) + " YoY" + label);
    }

    static Double revenuePerAssetTrend(FinancialState s) {
        Double latest = safeDiv(at(s, 0, FinancialPeriod::getRevenue), at(s, 0, FinancialPeriod::getTotalAssets));
        Double prev = safeDiv(at(s, 1, FinancialPeriod::getRevenue), at(s, 1, FinancialPeriod::getTotalAssets));
        if (latest == null || prev == null || prev == 0) return null;
        return (latest - prev) / Math.abs(prev) * 100;
    }

    static RuleOutcome revenuePerAsset(FinancialState s) {
        Double trend = revenuePerAssetTrend(s);
        if (trend == null) return RuleOutcome.notApplicable("Insufficient data");
        if (Metrics.revenueGrowthOrZero(s) < 20) return RuleOutcome.notApplicable("Not applicable (low growth)");
        int points = score(trend, at(15, 3), at(5, 2), at(0, 1), at(-15, 0), at(-1000, -2));
        String label = trend >= 15 ? " (Strong monetization)" : trend >= 5 ? " (Improving)" : "";
        return RuleOutcome.scored(points, pct(trend) + " QoQ" + label);
    }

    // ── Debt structure ────────────────────────────────────────────────────────

    static Double longTermShare(FinancialState s) {
        Double lt = Metrics.present(s.getLongTermDebt());
        Double st = Metrics.present(s.getShortTermDebt());
        if (lt == null && st == null) return null;
        double total = orZero(lt) + orZero(st);
        if (total == 0) return null;
        return orZero(lt) / total * 100;
    }

    static RuleOutcome debtMaturity(FinancialState s) {
        Double ltShare = longTermShare(s);
        if (ltShare == null) return RuleOutcome.notApplicable("No debt structure data");
        if (orZero(s.getTotalDebt()) <= 0) return RuleOutcome.notApplicable("Debt-free");

        // growth companies are still building a capital structure
        boolean growth = Metrics.revenueGrowthOrZero(s) > 20;
        int points = growth
            ? score(ltShare, at(60, 3), at(40, 2), at(20, 0), at(-1000, -1))
            : score(ltShare, at(80, 3), at(60, 2), at(40, 0), at(-1000, -2));
        double high = growth ? 60 : 80;
        double low = growth ? 20 : 40;
        String label = ltShare >= high ? " (Long-term focused)" : ltShare < low ? " (Near-term refinancing risk)" : "";
        return RuleOutcome.scored(points, String.format(Locale.ROOT, "%.0f%% long-term%s", ltShare, label));
    }

    // ── Operating efficiency ──────────────────────────────────────────────────

    static Inflection inflection(FinancialState s) {
        if (periods(s).size() < 3) return null;
        Double q0 = Metrics.periodMargin(s, 0, FinancialPeriod::getOperatingExpenses);
        Double q1 = Metrics.periodMargin(s, 1, FinancialPeriod::getOperatingExpenses);
        Double q2 = Metrics.periodMargin(s, 2, FinancialPeriod::getOperatingExpenses);
        if (q0 == null || q1 == null || q2 == null) return null;
        // positive ratioChange means opex is taking a bigger share of revenue
        return new Inflection(q0 < q1 && q1 < q2, q0 - q2, q0);
    }

    static RuleOutcome operatingLeverageInflection(FinancialState s) {
        Inflection inflection = inflection(s);
        if (inflection == null) return RuleOutcome.notApplicable("Insufficient quarterly history");
        double revGrowth = Metrics.revenueGrowthOrZero(s);
        if (revGrowth < 15) return RuleOutcome.notApplicable("Not applicable (low growth)");

        if (inflection.improving()) {
            int points = score(-inflection.ratioChange(), at(10, 4), at(5, 3), at(2, 2), at(-1000, 1));
            return RuleOutcome.scored(points, "OpEx/Rev declining (" + pct(inflection.latest()) + ")");
        }
        if (revGrowth > 50) {
            return RuleOutcome.scored(1, "OpEx/Rev: " + pct(inflection.latest()) + " (Aggressive scaling)");
        }
        return RuleOutcome.scored(0, "OpEx/Rev: " + pct(inflection.latest()) + " (Not yet inflecting)");
    }

    /** Period-over-period change of the FCF margin; positive means the burn is shrinking. */
    static Double burnDeceleration(FinancialState s) {
        Double latest = Metrics.periodMargin(s, 0, FinancialPeriod::getFreeCashFlow);
        Double prev = Metrics.periodMargin(s, 1, FinancialPeriod::getFreeCashFlow);
        if (latest == null || prev == null) return null;
        if (latest < 0 && prev < 0) return (latest - prev) / Math.abs(prev) * 100;
        return latest - prev;
    }

    static RuleOutcome cashBurnDeceleration(FinancialState s) {
        Double decel = burnDeceleration(s);
        if (decel == null) return RuleOutcome.notApplicable("Insufficient quarterly data");
        Double fcfMargin = Metrics.present(s.getFcfMargin());
        if (fcfMargin == null || fcfMargin >= 0) return RuleOutcome.notApplicable("Not applicable (FCF positive)");
        int points = score(decel, at(30, 4), at(15, 3), at(5, 2), at(0, 0), at(-1000, -2));
        String label = decel >= 30 ? " (Rapid improvement)"
            : decel >= 15 ? " (Path to profitability)"
            : decel < 0 ? " (Worsening)" : "";
        return RuleOutcome.scored(points, pct(decel) + " QoQ improvement" + label);
    }

    static Double workingCapitalToCapex(FinancialState s) {
        Double currentAssets = at(s, 0, FinancialPeriod::getCurrentAssets);
        Double currentLiabilities = at(s, 0, FinancialPeriod::getCurrentLiabilities);
        double capex = Math.abs(orZero(at(s, 0, FinancialPeriod::getCapex)));
        if (currentAssets == null || currentLiabilities == null || capex == 0) return null;
        return (currentAssets - currentLiabilities) / capex;
    }

    static RuleOutcome workingCapitalEfficiency(FinancialState s) {
        Double v = workingCapitalToCapex(s);
        if (v == null) return RuleOutcome.notApplicable("Insufficient data");
        if (Metrics.revenueGrowthOrZero(s) < 20) return RuleOutcome.notApplicable("Not applicable (mature)");
        int points = score(v, at(0.5, 2), at(0.2, 1), at(0, 0), at(-1000, -1));
        String label = v >= 0.5 ? " (Well-funded)" : v < 0.2 ? " (Tight)" : "";
        return RuleOutcome.scored(points, ratio(v, 2) + label);
    }

    // ── Revenue quality ───────────────────────────────────────────────────────

    // days sales outstanding of one period, with its revenue annualised
    static Double periodDso(FinancialState s, int index) {
        Double receivables = at(s, index, FinancialPeriod::getAccountsReceivable);
        Double revenue = at(s, index, FinancialPeriod::getRevenue);
        Double ratio = safeDiv(receivables, revenue == null ? null : revenue * Metrics.periodsPerYear(s));
        return ratio == null ? null : ratio * 365;
    }

    static RuleOutcome revenueQuality(FinancialState s) {
        if (s.isFintech() || s.isBucket(SectorBucket.FINANCIALS)) {
            return RuleOutcome.notApplicable("Not applicable (Financials)");
        }
        Double dso = periodDso(s, 0);
        Double dsoPrev = periodDso(s, 1);
        Double revGrowth = Metrics.revenueGrowth(s);
        if (dso == null || dsoPrev == null || revGrowth == null) return RuleOutcome.notApplicable("Insufficient DSO data");

        double change = dso - dsoPrev;
        String detail = String.format(Locale.ROOT, "DSO %+.0fd, Rev %+.0f%%", change, revGrowth);
        if (revGrowth > 10 && change <= 0)             return RuleOutcome.scored(3, "High-quality (" + detail + ")");
        if (revGrowth > 10 && change > 0 && change < 5) return RuleOutcome.scored(1, "Acceptable quality (" + detail + ")");
        if (change > 5)                                 return RuleOutcome.scored(-2, "Quality concerns (" + detail + ")");
        return RuleOutcome.notApplicable("Not applicable");
    }
}
