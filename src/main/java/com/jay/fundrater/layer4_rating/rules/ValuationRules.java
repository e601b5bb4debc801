package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.layer4_rating.Rule;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.RuleCategory;
import com.jay.fundrater.model.enums.SectorBucket;

import static com.jay.fundrater.layer4_rating.Bands.at;
import static com.jay.fundrater.layer4_rating.Bands.ratio;
import static com.jay.fundrater.layer4_rating.Bands.score;
import static com.jay.fundrater.layer4_rating.rules.Metrics.present;

/**
 * Price multiples. Bands are applied to the negated multiple so that cheaper scores higher.
 * Tech and biotech get wider bands; fintechs sit between banks and software.
 */
public final class ValuationRules {

    private ValuationRules() {
    }

    public static final Rule PRICE_TO_SALES = new Rule("Price / Sales", 8, RuleCategory.VALUATION,
        Rule.BASIS_MARKET, ValuationRules::priceToSales);

    public static final Rule PRICE_TO_EARNINGS = new Rule("Price / Earnings", 8, RuleCategory.VALUATION,
        Rule.BASIS_MARKET, ValuationRules::priceToEarnings);

    public static final Rule PRICE_TO_BOOK = new Rule("Price / Book", 6, RuleCategory.VALUATION,
        Rule.BASIS_MARKET, ValuationRules::priceToBook);

    static RuleOutcome priceToSales(FinancialState s) {
        Double ps = present(s.getPsRatio());
        if (ps == null) return RuleOutcome.missing("No P/S data");
        // a near-zero multiple means the market cap or price is missing, not a bargain
        if (ps < 0.01) return RuleOutcome.notApplicable("Data invalid");

        double g = Metrics.revenueGrowthOrZero(s);
        if (s.isBucket(SectorBucket.TECH) && g > 40) {
            int points = score(-ps, at(-10, 8), at(-18, 6), at(-25, 4), at(-40, 0), at(-1000, -4));
            return RuleOutcome.scored(points, ratio(ps, 1) + " (High Growth)");
        }
        if (s.isBucket(SectorBucket.TECH) || s.isBucket(SectorBucket.BIOTECH)) {
            int points = score(-ps, at(-3, 8), at(-6, 5), at(-12, 2), at(-18, -2), at(-1000, -6));
            return RuleOutcome.scored(points, ratio(ps, 1));
        }
        int points = score(-ps, at(-1.5, 8), at(-3, 6), at(-5, 2), at(-1000, -4));
        return RuleOutcome.scored(points, ratio(ps, 1));
    }

    static RuleOutcome priceToEarnings(FinancialState s) {
        Double pe = present(s.getPeRatio());
        if (pe == null) {
            if (s.isBucket(SectorBucket.TECH) && Metrics.revenueGrowthOrZero(s) > 30) {
                return RuleOutcome.scored(0, "Unprofitable (High Growth)");
            }
            if (s.getNetIncome() != null && s.getNetIncome() > 0) return RuleOutcome.missing("Price data unavailable");
            return RuleOutcome.notApplicable("Unprofitable");
        }
        String msg = Math.abs(pe) > 1000 ? (pe > 0 ? "> 1000x" : "< -1000x") : ratio(pe, 1);

        if (s.isFintech()) {
            int points = score(-pe, at(-25, 8), at(-40, 5), at(-60, 0), at(-100, -4), at(-1000, -6));
            return RuleOutcome.scored(points, msg + " (Fintech)");
        }
        int points = s.isBucket(SectorBucket.FINANCIALS)
            ? score(-pe, at(-12, 8), at(-20, 5), at(-35, 0), at(-60, -4), at(-1000, -6))
            : score(-pe, at(-12, 8), at(-20, 5), at(-30, 0), at(-50, -4), at(-1000, -8));
        return RuleOutcome.scored(points, msg);
    }

    static RuleOutcome priceToBook(FinancialState s) {
        if (!s.isBucket(SectorBucket.FINANCIALS) && !s.isBucket(SectorBucket.REAL_ESTATE)) {
            return RuleOutcome.notApplicable("Not applicable");
        }
        Double pb = present(s.getPbRatio());
        if (pb == null) return RuleOutcome.missing("No P/B data");

        if (s.isFintech()) {
            int points = score(-pb, at(-2, 4), at(-4, 0), at(-6, -2), at(-1000, -4));
            return RuleOutcome.scored(points, ratio(pb, 1) + " (Fintech)");
        }
        int points = score(-pb, at(-1, 8), at(-1.5, 5), at(-3, 0), at(-1000, -4));
        return RuleOutcome.scored(points, ratio(pb, 1));
    }
}
