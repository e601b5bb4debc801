package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.layer4_rating.Rule;
import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.RuleCategory;
import com.jay.fundrater.model.enums.SectorBucket;

import static com.jay.fundrater.layer1_normalize.FinancialMath.orZero;
import static com.jay.fundrater.layer4_rating.Bands.at;
import static com.jay.fundrater.layer4_rating.Bands.pct;
import static com.jay.fundrater.layer4_rating.Bands.score;
import static com.jay.fundrater.layer4_rating.rules.Metrics.at;
import static com.jay.fundrater.layer4_rating.rules.Metrics.present;

/** Cards for banks and fintechs: deposit franchise, lending spread and technology spend. */
public final class BankingRules {

    private BankingRules() {
    }

    public static final Rule DEPOSIT_GROWTH = new Rule("Deposit Growth", 8, RuleCategory.GROWTH,
        Rule.BASIS_SERIES, BankingRules::depositGrowth);

    public static final Rule NET_INTEREST_MARGIN = new Rule("Net Interest Margin", 5, RuleCategory.PROFITABILITY,
        Rule.BASIS_SERIES, BankingRules::netInterestMargin);

    public static final Rule TECH_INVESTMENT = new Rule("Tech Investment", 2, RuleCategory.OTHER,
        Rule.BASIS_SERIES, BankingRules::techInvestment);

    private static boolean banking(FinancialState s) {
        return s.isFintech() || s.isBucket(SectorBucket.FINANCIALS);
    }

    static RuleOutcome depositGrowth(FinancialState s) {
        if (!banking(s)) return RuleOutcome.notApplicable("Not applicable (banking only)");
        Double g = present(s.getDepositGrowthYoY());
        if (g == null) return RuleOutcome.notApplicable("No deposit data");
        int points = score(g, at(40, 8), at(25, 5), at(15, 3), at(5, 1), at(-1000, 0));
        String label = g >= 40 ? " (Franchise expansion)" : g >= 25 ? " (Strong growth)" : "";
        return RuleOutcome.scored(points, pct(g) + " YoY" + label);
    }

    /** Annualised net interest income over average total assets of the two newest periods, in percent. */
    static Double netInterestMarginPct(FinancialState s) {
        Double interestIncome = at(s, 0, FinancialPeriod::getInterestIncome);
        double interestExpense = Math.abs(orZero(at(s, 0, FinancialPeriod::getInterestExpense)));
        Double assets0 = at(s, 0, FinancialPeriod::getTotalAssets);
        Double assets1 = at(s, 1, FinancialPeriod::getTotalAssets);
        if (interestIncome == null || assets0 == null || assets1 == null) return null;
        double avgAssets = (assets0 + assets1) / 2;
        if (avgAssets == 0) return null;
        return (interestIncome - interestExpense) * Metrics.periodsPerYear(s) / avgAssets * 100;
    }

    static RuleOutcome netInterestMargin(FinancialState s) {
        if (!banking(s)) return RuleOutcome.notApplicable("Not applicable (banking only)");
        Double nim = netInterestMarginPct(s);
        if (nim == null) return RuleOutcome.notApplicable("Insufficient interest income data");
        int points = score(nim, at(4, 5), at(2.5, 3), at(1.5, 1), at(0, 0), at(-1000, -2));
        String label = nim >= 4 ? " (Strong spread)" : nim < 1.5 ? " (Thin margins)" : "";
        return RuleOutcome.scored(points, pct(nim) + label);
    }

    static Double techSpendingPct(FinancialState s) {
        double rd = Math.abs(orZero(at(s, 0, FinancialPeriod::getResearchAndDevelopmentExpenses)));
        double tech = Math.abs(orZero(at(s, 0, FinancialPeriod::getTechnologyExpenses)));
        double opex = Math.abs(orZero(at(s, 0, FinancialPeriod::getOperatingExpenses)));
        if (opex == 0) return null;
        return (rd + tech) / opex * 100;
    }

    static RuleOutcome techInvestment(FinancialState s) {
        if (!s.isFintech()) return RuleOutcome.notApplicable("Not applicable (fintech only)");
        Double ratio = techSpendingPct(s);
        if (ratio == null) return RuleOutcome.notApplicable("Tech spending not disclosed");
        int points = score(ratio, at(25, 2), at(15, 1), at(5, 0), at(-1000, -1));
        String label = ratio >= 25 ? " (Tech-first)" : ratio >= 15 ? " (Tech-enabled)" : "";
        return RuleOutcome.scored(points, pct(ratio) + " of OpEx" + label);
    }
}
