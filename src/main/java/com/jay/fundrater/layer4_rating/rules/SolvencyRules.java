package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.layer4_rating.Rule;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.InterestCoverage;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.CoverageStatus;
import com.jay.fundrater.model.enums.IssuerType;
import com.jay.fundrater.model.enums.RuleCategory;
import com.jay.fundrater.model.enums.SectorBucket;

import java.util.Locale;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;
import static com.jay.fundrater.layer4_rating.Bands.at;
import static com.jay.fundrater.layer4_rating.Bands.ratio;
import static com.jay.fundrater.layer4_rating.Bands.score;
import static com.jay.fundrater.layer4_rating.rules.Metrics.present;

/** Cash runway, leverage and debt service. */
public final class SolvencyRules {

    private SolvencyRules() {
    }

    public static final Rule CASH_RUNWAY = new Rule("Cash Runway (years)", 10, RuleCategory.SOLVENCY,
        Rule.BASIS_BALANCE, SolvencyRules::cashRunway);

    public static final Rule DEBT_TO_EQUITY = new Rule("Debt / Equity", 8, RuleCategory.SOLVENCY,
        Rule.BASIS_BALANCE, SolvencyRules::debtToEquity);

    public static final Rule NET_DEBT_TO_FCF = new Rule("Net Debt / FCF", 6, RuleCategory.SOLVENCY,
        Rule.BASIS_TTM, SolvencyRules::netDebtToFcf);

    public static final Rule INTEREST_COVERAGE = new Rule("Interest coverage", 8, RuleCategory.SOLVENCY,
        Rule.BASIS_SERIES, SolvencyRules::interestCoverage);

    static RuleOutcome cashRunway(FinancialState s) {
        if (!s.isBucket(SectorBucket.BIOTECH)) return RuleOutcome.notApplicable("Not applicable");
        Double runway = s.getRunwayYears();
        if (runway == null || runway.isNaN()) return RuleOutcome.missing("No runway data");
        if (runway.isInfinite() || runway > 50) return RuleOutcome.scored(4, "Self-funded");
        int points = score(runway, at(3, 3), at(1.5, 2), at(0.75, 0), at(0.5, -3), at(-1000, -6));
        return RuleOutcome.scored(points, String.format(Locale.ROOT, "%.2fy", runway));
    }

    static RuleOutcome debtToEquity(FinancialState s) {
        Double rawDe = present(s.getDebtToEquity());
        if (rawDe != null && rawDe < 0) {
            return RuleOutcome.scored(-10, "Negative equity (balance sheet deficit; monitor solvency)");
        }

        Double totalDebt = present(s.getTotalDebt());
        Double finDebt = present(s.getFinancialDebt());
        Double assets = present(s.getTotalAssets());
        boolean debtFree = (totalDebt != null && totalDebt == 0)
            || (finDebt != null && finDebt == 0)
            || (finDebt != null && assets != null && assets > 0 && finDebt < assets * 0.01);
        if (debtFree) {
            int bonus = s.isBucket(SectorBucket.BIOTECH) ? 5 : 10;
            boolean leasesOnly = totalDebt != null && totalDebt > 0 && finDebt != null && finDebt == 0;
            return RuleOutcome.scored(bonus, leasesOnly ? "No financial debt (leases only)" : "No financial debt (debt-free)");
        }

        if (s.isBucket(SectorBucket.FINANCIALS)) return RuleOutcome.notApplicable("Not applicable (Sector standard)");
        if (rawDe == null) return RuleOutcome.missing("No leverage data");

        Double netDe = present(s.getNetDebtToEquity());
        if (netDe != null && netDe < 0) {
            return RuleOutcome.scored(8, String.format(Locale.ROOT, "%.2fx (Net Cash)", netDe));
        }
        int points = score(-rawDe, at(-1.5, 8), at(-3, 6), at(-4, 2), at(-1000, -6));
        return RuleOutcome.scored(points, ratio(rawDe, 2));
    }

    static RuleOutcome netDebtToFcf(FinancialState s) {
        if (!s.isBucket(SectorBucket.ENERGY) && !s.isBucket(SectorBucket.REAL_ESTATE)) {
            return RuleOutcome.notApplicable("Not applicable");
        }
        Double years = zeroDebt(s) ? Double.valueOf(0) : present(s.getNetDebtToFcfYears());
        if (years == null) return RuleOutcome.missing("No data");
        int points = score(-years, at(-1, 4), at(-3, 0), at(-1000, -6));
        return RuleOutcome.scored(points, String.format(Locale.ROOT, "%.1fy", years));
    }

    private static boolean zeroDebt(FinancialState s) {
        return (s.getTotalDebt() != null && s.getTotalDebt() == 0)
            || (s.getFinancialDebt() != null && s.getFinancialDebt() == 0);
    }

    static RuleOutcome interestCoverage(FinancialState s) {
        if (s.isBucket(SectorBucket.FINANCIALS)) return RuleOutcome.notApplicable("Not applicable (Financials)");
        InterestCoverage coverage = s.getInterestCoverage();
        Double ic = coverage == null ? null : coverage.value();

        if (ic == null) {
            Double de = present(s.getDebtToEquity());
            if (de != null && de < 0.2) return RuleOutcome.notApplicable("Debt-Free");
            if (coverage != null && coverage.status() == CoverageStatus.MISSING_INTEREST) {
                return RuleOutcome.missing("Interest expense missing; coverage unknown");
            }
            return RuleOutcome.missing("Data unavailable");
        }
        if (ic.isInfinite() || ic > 1e6) return RuleOutcome.notApplicable("Debt-Free");

        // IFRS amortization can depress operating income of foreign filers that still generate cash
        boolean fcfPositive = isFiniteValue(s.getFcfMargin()) && s.getFcfMargin() > 5;
        if (s.getIssuerType() == IssuerType.FOREIGN && fcfPositive && ic < 3) {
            return RuleOutcome.scored(ic < 1 ? -2 : 0, ratio(ic, 1) + " (FCF positive; IFRS distortion likely)");
        }
        int points = score(ic, at(12, 8), at(6, 4), at(3, 1), at(1, -4), at(-1000, -8));
        return RuleOutcome.scored(points, ratio(ic, 1));
    }
}
