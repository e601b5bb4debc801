package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.layer4_rating.Rule;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.RuleCategory;
import com.jay.fundrater.model.enums.SectorBucket;

import static com.jay.fundrater.layer4_rating.Bands.at;
import static com.jay.fundrater.layer4_rating.Bands.money;
import static com.jay.fundrater.layer4_rating.Bands.pct;
import static com.jay.fundrater.layer4_rating.Bands.score;
import static com.jay.fundrater.layer4_rating.rules.Metrics.present;

/** Share count, shareholder returns, working capital and other uses of cash. */
public final class CapitalRules {

    private static final double LARGE_BIOTECH_CAP = 1e9;

    private CapitalRules() {
    }

    public static final Rule SHARE_DILUTION = new Rule("Shares dilution YoY", 10, RuleCategory.OTHER,
        Rule.BASIS_SERIES, CapitalRules::shareDilution);

    public static final Rule CAPITAL_RETURN = new Rule("Capital Return", 3, RuleCategory.OTHER,
        Rule.BASIS_TTM, CapitalRules::capitalReturn);

    public static final Rule WORKING_CAPITAL = new Rule("Working Capital", 2, RuleCategory.OTHER,
        Rule.BASIS_BALANCE, CapitalRules::workingCapital);

    public static final Rule EFFECTIVE_TAX_RATE = new Rule("Effective Tax Rate", 0, RuleCategory.OTHER,
        Rule.BASIS_TTM, CapitalRules::effectiveTaxRate);

    public static final Rule CAPEX_INTENSITY = new Rule("Capex intensity", 4, RuleCategory.OTHER,
        Rule.BASIS_TTM, CapitalRules::capexIntensity);

    public static final Rule DIVIDEND_COVERAGE = new Rule("Dividend coverage", 5, RuleCategory.OTHER,
        Rule.BASIS_TTM, CapitalRules::dividendCoverage);

    static RuleOutcome shareDilution(FinancialState s) {
        Double d = s.getShareChange() == null ? null : present(s.getShareChange().changeYoY());
        if (d == null) return RuleOutcome.missing("No share count data");
        String msg = pct(d) + " (YoY)";
        // negated so that issuance scores low and buybacks score high
        double val = -d;

        if (s.isBucket(SectorBucket.BIOTECH)) {
            int points = score(val, at(0, 2), at(-20, 0), at(-50, -5), at(-100, -10), at(-1000, -15));
            boolean large = s.getMarketCap() != null && s.getMarketCap() > LARGE_BIOTECH_CAP;
            return RuleOutcome.scored(large ? Math.max(points, -10) : points, msg);
        }
        if (Metrics.revenueGrowthOrZero(s) > 40) {
            return RuleOutcome.scored(score(val, at(-5, 5), at(-10, 3), at(-20, 0), at(-1000, -6)), msg);
        }
        int points = score(val, at(1, 8), at(-1, 5), at(-3, 2), at(-5, 0), at(-15, -6), at(-1000, -12));
        return RuleOutcome.scored(points, msg);
    }

    static RuleOutcome capitalReturn(FinancialState s) {
        Double total = present(s.getShareholderReturnTtm());
        Double pctOfFcf = present(s.getTotalReturnPctFcf());
        Double fcf = present(s.getFreeCashFlow());
        // bonus only: never penalise when the figures are incomplete
        if (total == null || pctOfFcf == null || fcf == null || fcf <= 0) {
            return RuleOutcome.notApplicable("Not applicable");
        }
        int points = score(pctOfFcf, at(0.75, 4), at(0.4, 3), at(0.2, 2), at(0.05, 1), at(-1000, 0));
        String msg = String.format("%s (%d%% of FCF); buybacks %s; dividends %s",
            money(total), Math.round(pctOfFcf * 100), money(s.getBuybacksTtm()), money(s.getDividendsTtm()));
        return RuleOutcome.scored(points, msg);
    }

    static RuleOutcome workingCapital(FinancialState s) {
        if (s.isBucket(SectorBucket.FINANCIALS)) return RuleOutcome.notApplicable("Not applicable (Sector standard)");
        Double ccc = present(s.getCashConversionCycleDays());
        if (ccc == null) return RuleOutcome.notApplicable("Not applicable");
        int points = score(-ccc, at(-30, 2), at(-60, 1), at(-120, 0), at(-200, -1), at(-100_000, -2));
        Double dso = present(s.getDsoDays());
        String msg = Math.round(ccc) + "d CCC" + (dso == null ? "" : " · " + Math.round(dso) + "d DSO");
        return RuleOutcome.scored(points, msg);
    }

    static RuleOutcome effectiveTaxRate(FinancialState s) {
        Double raw = present(s.getEffectiveTaxRate());
        if (raw == null) return RuleOutcome.notApplicable("Not applicable");
        double rate = Math.abs(raw) <= 1 ? raw * 100 : raw;

        StringBuilder msg = new StringBuilder(pct(rate));
        Double pretax = present(s.getIncomeBeforeTaxes());
        if (pretax != null && pretax <= 0)      msg.append(" (loss-making)");
        else if (rate < 5)                      msg.append(" (likely tax credits/loss carryforwards)");
        else if (rate > 45)                     msg.append(" (elevated - check for one-time items)");
        else if (rate >= 15 && rate <= 35)      msg.append(" (normal range)");
        return RuleOutcome.scored(0, msg.toString());
    }

    static RuleOutcome capexIntensity(FinancialState s) {
        if (!s.isBucket(SectorBucket.ENERGY)) return RuleOutcome.notApplicable("Not applicable");
        Double v = present(s.getCapexToRevenue());
        if (v == null) return RuleOutcome.missing("No data");
        return RuleOutcome.scored(score(-v, at(-5, 2), at(-10, 0), at(-1000, -4)), pct(v));
    }

    static RuleOutcome dividendCoverage(FinancialState s) {
        Double payout = Metrics.dividendPayoutPct(s);
        if (payout == null) return RuleOutcome.notApplicable("Not applicable (no FCF-funded dividend)");
        int points;
        if (payout < 20)        points = 2;
        else if (payout <= 80)  points = 5;
        else if (payout <= 100) points = 2;
        else if (payout <= 130) points = -4;
        else                    points = -6;
        return RuleOutcome.scored(points, pct(payout) + " of FCF");
    }
}
