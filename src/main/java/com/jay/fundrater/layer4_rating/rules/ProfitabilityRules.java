package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.layer4_rating.Rule;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.RuleCategory;
import com.jay.fundrater.model.enums.SectorBucket;

import java.util.Locale;

import static com.jay.fundrater.layer4_rating.Bands.Band;
import static com.jay.fundrater.layer4_rating.Bands.at;
import static com.jay.fundrater.layer4_rating.Bands.pct;
import static com.jay.fundrater.layer4_rating.Bands.ratio;
import static com.jay.fundrater.layer4_rating.Bands.score;
import static com.jay.fundrater.layer4_rating.rules.Metrics.present;

/** Margins, cash generation and returns on capital. */
public final class ProfitabilityRules {

    private static final double EARLY_STAGE_BIOTECH_REVENUE = 50_000_000;

    private ProfitabilityRules() {
    }

    public static final Rule GROSS_MARGIN = new Rule("Gross margin", 8, RuleCategory.PROFITABILITY,
        Rule.BASIS_TTM, ProfitabilityRules::grossMargin);

    public static final Rule GROSS_MARGIN_INDUSTRIAL = new Rule("Gross margin (industrial)", 5, RuleCategory.PROFITABILITY,
        Rule.BASIS_TTM, ProfitabilityRules::grossMarginIndustrial);

    public static final Rule GROSS_MARGIN_TREND = new Rule("Gross margin trend", 6, RuleCategory.PROFITABILITY,
        Rule.BASIS_SERIES, ProfitabilityRules::grossMarginTrend);

    public static final Rule GROSS_MARGIN_HEALTH = new Rule("Gross margin (health)", 6, RuleCategory.PROFITABILITY,
        Rule.BASIS_TTM, ProfitabilityRules::grossMarginHealth);

    public static final Rule OPERATING_LEVERAGE = new Rule("Operating leverage", 5, RuleCategory.PROFITABILITY,
        Rule.BASIS_TTM, ProfitabilityRules::operatingLeverage);

    public static final Rule FCF_MARGIN = new Rule("FCF margin", 10, RuleCategory.PROFITABILITY,
        Rule.BASIS_TTM, ProfitabilityRules::fcfMargin);

    public static final Rule ROE = new Rule("ROE", 10, RuleCategory.PROFITABILITY,
        Rule.BASIS_TTM, ProfitabilityRules::roe);

    public static final Rule ROE_QUALITY = new Rule("ROE quality", 8, RuleCategory.PROFITABILITY,
        Rule.BASIS_TTM, ProfitabilityRules::roeQuality);

    public static final Rule RETURN_ON_ASSETS = new Rule("Return on Assets", 6, RuleCategory.PROFITABILITY,
        Rule.BASIS_TTM, ProfitabilityRules::returnOnAssets);

    public static final Rule ASSET_EFFICIENCY = new Rule("Asset Efficiency", 6, RuleCategory.OTHER,
        Rule.BASIS_TTM, ProfitabilityRules::assetEfficiency);

    public static final Rule ROIC = new Rule("ROIC", 8, RuleCategory.PROFITABILITY,
        Rule.BASIS_TTM, ProfitabilityRules::roic);

    // ── Margins ───────────────────────────────────────────────────────────────

    static RuleOutcome grossMargin(FinancialState s) {
        if (!s.isBucket(SectorBucket.TECH)) return RuleOutcome.notApplicable("Not applicable");
        Double gm = present(s.getGrossMargin());
        if (gm == null) return RuleOutcome.missing("No gross margin data");
        return RuleOutcome.scored(score(gm, at(75, 8), at(60, 6), at(50, 2), at(40, -2), at(-1000, -6)), pct(gm));
    }

    static RuleOutcome grossMarginIndustrial(FinancialState s) {
        if (!s.isBucket(SectorBucket.INDUSTRIAL)) return RuleOutcome.notApplicable("Not applicable");
        Double gm = present(s.getGrossMargin());
        if (gm == null) return RuleOutcome.missing("No gross margin data");
        return RuleOutcome.scored(score(gm, at(35, 5), at(25, 2), at(15, 0), at(0, -4), at(-1000, -6)), pct(gm));
    }

    static RuleOutcome grossMarginTrend(FinancialState s) {
        if (!s.isBucket(SectorBucket.RETAIL)) return RuleOutcome.notApplicable("Not applicable");
        Double trend = Metrics.grossMarginTrend(s);
        if (trend == null) return RuleOutcome.missing("No gross margin trend data");
        int points = trend > 0 ? 6 : trend == 0 ? 0 : -6;
        return RuleOutcome.scored(points, pct(trend));
    }

    static RuleOutcome grossMarginHealth(FinancialState s) {
        if (!s.isBucket(SectorBucket.BIOTECH)) return RuleOutcome.notApplicable("Not applicable");
        Double revenue = present(s.getRevenueLatest());
        if (revenue != null && revenue < EARLY_STAGE_BIOTECH_REVENUE) {
            return RuleOutcome.notApplicable("Not applicable (early stage)");
        }
        Double gm = present(s.getGrossMargin());
        if (gm == null) return RuleOutcome.missing("No gross margin data");
        return RuleOutcome.scored(score(gm, at(80, 6), at(60, 3), at(40, 0), at(-1000, -2)), pct(gm));
    }

    static RuleOutcome operatingLeverage(FinancialState s) {
        if (s.isBucket(SectorBucket.FINANCIALS) || s.isBucket(SectorBucket.REAL_ESTATE)) {
            return RuleOutcome.notApplicable("Not applicable");
        }
        Double v = present(s.getOperatingLeverage());
        if (v == null) return RuleOutcome.missing("No operating leverage data");
        int points = score(v, at(0.6, 5), at(0.5, 3), at(0.4, 2), at(-1000, 0));
        return RuleOutcome.scored(points, String.format(Locale.ROOT, "%.1f%%", v * 100));
    }

    static RuleOutcome fcfMargin(FinancialState s) {
        Double fcf = present(s.getFcfMargin());
        if (fcf == null) return RuleOutcome.missing("No FCF margin data");

        if (s.isBucket(SectorBucket.BIOTECH)) {
            boolean midOrLarge = s.getMarketCap() != null && s.getMarketCap() > 2e9;
            Double burnTrend = present(s.getBurnTrend());
            Double g = Metrics.revenueGrowth(s);
            // a narrowing burn or surging sales reads as investment, not distress
            boolean healthyBurn = (burnTrend != null && burnTrend > 15) || (g != null && g > 50);
            int points = score(fcf,
                at(10, 2), at(0, 0), at(-20, -2),
                at(-50, healthyBurn ? -2 : (midOrLarge ? -2 : -4)),
                at(-100, healthyBurn ? -2 : (midOrLarge ? -4 : -6)),
                at(-1_000_000, healthyBurn ? -2 : (midOrLarge ? -6 : -8)));
            return RuleOutcome.scored(points, healthyBurn ? pct(fcf) + " (Inv. Mode)" : pct(fcf));
        }
        if (s.isBucket(SectorBucket.REAL_ESTATE) || s.isBucket(SectorBucket.FINANCIALS)) {
            return RuleOutcome.notApplicable("Not applicable (Use FFO/Book)");
        }
        if (s.isBucket(SectorBucket.INDUSTRIAL)) {
            return RuleOutcome.scored(score(fcf, at(12, 6), at(8, 3), at(4, 0), at(0, -2), at(-1_000_000, -6)), pct(fcf));
        }
        if (s.isBucket(SectorBucket.TECH)) {
            int points = score(fcf, at(20, 6), at(10, 3), at(0, 0), at(-20, -4), at(-50, -8), at(-1_000_000, -12));
            return RuleOutcome.scored(points, pct(fcf));
        }
        return RuleOutcome.scored(0, pct(fcf));
    }

    // ── Returns ───────────────────────────────────────────────────────────────

    static RuleOutcome roe(FinancialState s) {
        if (s.isFintech()) {
            Double v = present(s.getRoe());
            if (v == null) return RuleOutcome.missing("No ROE data");
            if (Metrics.revenueGrowthOrZero(s) > 20) {
                int points = score(v, at(12, 8), at(5, 4), at(0, 0), at(-1000, -6));
                return RuleOutcome.scored(points, pct(v) + " (Growth Phase)");
            }
            return RuleOutcome.scored(score(v, bankRoeBands()), pct(v));
        }
        if (!s.isBucket(SectorBucket.FINANCIALS)) return RuleOutcome.notApplicable("Not applicable (financials only)");
        Double v = present(s.getRoe());
        if (v == null) return RuleOutcome.missing("No ROE data");
        return RuleOutcome.scored(score(v, bankRoeBands()), pct(v));
    }

    private static Band[] bankRoeBands() {
        return new Band[] {at(15, 10), at(8, 5), at(0, -4), at(-1000, -10)};
    }

    static RuleOutcome roeQuality(FinancialState s) {
        if (s.isBucket(SectorBucket.FINANCIALS)) return RuleOutcome.notApplicable("Not applicable (use ROE for financials)");
        if (s.isBucket(SectorBucket.BIOTECH)) return RuleOutcome.notApplicable("Not applicable (pre-profit)");
        Double roe = present(s.getRoe());
        if (roe == null) return RuleOutcome.missing("No ROE data");
        // above 80% usually means a shrunken equity base, not quality
        int points = score(roe, at(80, -4), at(40, 6), at(15, 4), at(10, 2), at(0, 0), at(-1000, -8));
        return RuleOutcome.scored(points, pct(roe));
    }

    static RuleOutcome returnOnAssets(FinancialState s) {
        Double v = Metrics.roaPct(s);
        if (v == null) return RuleOutcome.missing("No ROA data");
        return RuleOutcome.scored(score(v, at(15, 8), at(10, 6), at(5, 3), at(0, 0), at(-1000, -4)), pct(v));
    }

    static RuleOutcome assetEfficiency(FinancialState s) {
        if (s.isBucket(SectorBucket.FINANCIALS)) return RuleOutcome.notApplicable("Not applicable");
        if (s.isBucket(SectorBucket.BIOTECH)) return RuleOutcome.notApplicable("Not applicable (pre-revenue)");
        Double v = Metrics.assetTurnover(s);
        if (v == null) return RuleOutcome.missing("No asset turnover data");
        boolean assetHeavy = s.isBucket(SectorBucket.ENERGY) || s.isBucket(SectorBucket.INDUSTRIAL)
            || s.isBucket(SectorBucket.REAL_ESTATE);
        int points = assetHeavy
            ? score(v, at(0.6, 6), at(0.35, 3), at(0.2, 1), at(0.1, -2), at(-1000, -4))
            : score(v, at(1.0, 8), at(0.7, 5), at(0.4, 2), at(0.2, 0), at(-1000, -4));
        return RuleOutcome.scored(points, ratio(v, 2));
    }

    static RuleOutcome roic(FinancialState s) {
        if (s.isBucket(SectorBucket.FINANCIALS)) return RuleOutcome.notApplicable("Not applicable");
        if (s.getTotalEquity() != null && s.getTotalEquity() < 0) {
            return RuleOutcome.notApplicable("Not applicable (negative equity)");
        }
        Double v = present(s.getRoic());
        if (v == null) return RuleOutcome.missing("No ROIC data");
        if (v > 200) return RuleOutcome.notApplicable("Not applicable (distorted calculation)");
        return RuleOutcome.scored(score(v, at(25, 8), at(15, 4), at(6, 1), at(0, -4), at(-1000, -8)), pct(v));
    }
}
