package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.layer4_rating.Rule;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.RuleCategory;
import com.jay.fundrater.model.enums.SectorBucket;

import static com.jay.fundrater.layer4_rating.Bands.at;
import static com.jay.fundrater.layer4_rating.Bands.pct;
import static com.jay.fundrater.layer4_rating.Bands.score;
import static com.jay.fundrater.layer4_rating.rules.Metrics.present;

/** Top-line growth, earnings momentum, long-term compounding and innovation spend. */
public final class GrowthRules {

    private GrowthRules() {
    }

    public static final Rule REVENUE_GROWTH = new Rule("Revenue growth YoY", 10, RuleCategory.GROWTH,
        Rule.BASIS_TTM, GrowthRules::revenueGrowth);

    public static final Rule FINTECH_MOMENTUM = new Rule("Fintech Growth Momentum", 8, RuleCategory.GROWTH,
        Rule.BASIS_TTM, GrowthRules::fintechMomentum);

    public static final Rule NET_INCOME_TREND = new Rule("Net income trend", 6, RuleCategory.GROWTH,
        Rule.BASIS_SERIES, GrowthRules::netIncomeTrend);

    public static final Rule REVENUE_CAGR = new Rule("Revenue CAGR (3Y)", 6, RuleCategory.GROWTH,
        Rule.BASIS_ANNUAL, s -> cagr(s, s.getRevenueCagr3y(), 12, 7));

    public static final Rule EPS_CAGR = new Rule("EPS CAGR (3Y)", 6, RuleCategory.GROWTH,
        Rule.BASIS_ANNUAL, s -> cagr(s, s.getEpsCagr3y(), 15, 8));

    public static final Rule RND_INTENSITY = new Rule("R&D intensity", 5, RuleCategory.OTHER,
        Rule.BASIS_TTM, GrowthRules::rndIntensity);

    static RuleOutcome revenueGrowth(FinancialState s) {
        Double g = Metrics.revenueGrowth(s);
        if (g == null) return RuleOutcome.missing("No revenue growth data");

        // post-merger or post-IPO histories distort YoY comparisons
        if (Metrics.quarterEquivalents(s) < 8 && Math.abs(g) > 50) {
            return RuleOutcome.notApplicable(pct(g) + " (New entity; YoY distorted)");
        }
        Double cagr = present(s.getRevenueCagr3y());
        if (g < -20 && cagr != null && cagr > 20) {
            return RuleOutcome.notApplicable(pct(g) + " (CAGR " + pct(cagr) + "; one-time distortion)");
        }

        if (s.isBucket(SectorBucket.TECH)) {
            int points = score(g, at(30, 10), at(20, 8), at(10, 4), at(0, 0), at(-10, -4), at(-1000, -8));
            return RuleOutcome.scored(points, pct(g) + " (YoY)");
        }
        if (s.isBucket(SectorBucket.BIOTECH)) {
            int points = score(g, at(50, 4), at(0, 2), at(-1000, -4));
            return RuleOutcome.scored(points, pct(g) + " (YoY)");
        }
        int points = score(g, at(10, 4), at(0, 0), at(-1000, -4));
        return RuleOutcome.scored(points, pct(g) + " (Industrial YoY)");
    }

    static RuleOutcome fintechMomentum(FinancialState s) {
        if (!s.isFintech()) return RuleOutcome.notApplicable("Not applicable (fintech only)");
        Double g = Metrics.revenueGrowth(s);
        if (g == null) g = present(s.getRevenueTrend());
        if (g == null || g < 15) return RuleOutcome.notApplicable("Not applicable (growth threshold not met)");
        int points = score(g, at(50, 8), at(35, 6), at(25, 4), at(15, 2), at(-1000, 0));
        return RuleOutcome.scored(points, pct(g) + " revenue growth (digital banking scale-up)");
    }

    static RuleOutcome netIncomeTrend(FinancialState s) {
        Double v = present(s.getNetIncomeTrend());
        if (v == null) return RuleOutcome.notApplicable("Not applicable (insufficient history)");

        if (s.isBucket(SectorBucket.FINANCIALS)) {
            return RuleOutcome.scored(score(v, at(10, 4), at(0, 0), at(-1000, -4)), pct(v));
        }
        // a shrinking loss offsets the missing P/E for turnarounds
        boolean unprofitable = s.getNetIncome() != null && s.getNetIncome() < 0;
        if (unprofitable && (s.isBucket(SectorBucket.TECH) || s.isBucket(SectorBucket.INDUSTRIAL))) {
            int points = score(v, at(50, 6), at(20, 4), at(10, 2), at(0, 0), at(-1000, -2));
            return RuleOutcome.scored(points, points > 0 ? pct(v) + " (Loss narrowing)" : pct(v));
        }
        return RuleOutcome.notApplicable("Not applicable");
    }

    private static RuleOutcome cagr(FinancialState s, Double value, double top, double good) {
        if (s.isBucket(SectorBucket.TECH)) return RuleOutcome.notApplicable("Not applicable");
        Double g = present(value);
        if (g == null) return RuleOutcome.notApplicable("Not applicable (insufficient history)");
        int points = score(g, at(top, 6), at(good, 3), at(3, 1), at(0, -2), at(-1000, -6));
        return RuleOutcome.scored(points, pct(g));
    }

    static RuleOutcome rndIntensity(FinancialState s) {
        if (s.isBucket(SectorBucket.FINANCIALS) || s.isBucket(SectorBucket.REAL_ESTATE)) {
            return RuleOutcome.notApplicable("Not applicable");
        }
        Double rd = present(s.getRdToRevenue());
        if (rd == null) return RuleOutcome.missing("No R&D data");
        if (rd > 100) return RuleOutcome.notApplicable(pct(rd) + " (R&D exceeds revenue; burn mode)");

        SectorBucket bucket = s.getSectorBucket() == null ? SectorBucket.OTHER : s.getSectorBucket();
        return switch (bucket) {
            case TECH -> RuleOutcome.scored(score(rd, at(20, 5), at(15, 3), at(10, 2), at(-1000, 0)), pct(rd));
            case BIOTECH -> RuleOutcome.scored(score(rd, at(30, 5), at(20, 3), at(15, 2), at(-1000, 0)), pct(rd));
            case INDUSTRIAL -> RuleOutcome.scored(score(rd, at(7, 5), at(5, 3), at(3, 2), at(-1000, 0)), pct(rd));
            default -> RuleOutcome.notApplicable("Not applicable");
        };
    }
}
