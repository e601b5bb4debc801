package com.jay.fundrater.layer3_state;

import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.InterestCoverage;
import com.jay.fundrater.model.enums.CoverageStatus;

import java.util.List;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;
import static com.jay.fundrater.layer1_normalize.FinancialMath.orZero;

/**
 * Trailing EBIT over trailing interest expense, from up to the four newest periods.
 * At least two periods with operating income are needed. Zero interest means debt-free only
 * when the balance sheet agrees; otherwise the interest line is treated as missing.
 */
public final class InterestCoverageCalculator {

    static final int WINDOW = 4;
    static final int MIN_PERIODS = 2;
    static final double DEBT_FREE_CEILING = 1_000_000;

    private InterestCoverageCalculator() {
    }

    /** @param desc periods, newest first */
    public static InterestCoverage compute(List<FinancialPeriod> desc) {
        List<FinancialPeriod> usable = desc.stream()
            .limit(WINDOW)
            .filter(p -> isFiniteValue(p.getOperatingIncome())
                && (isFiniteValue(p.getInterestExpense()) || isFiniteValue(p.getTotalDebt())))
            .toList();
        if (usable.size() < MIN_PERIODS) {
            return InterestCoverage.unknown(usable.size(), CoverageStatus.INSUFFICIENT_DATA);
        }

        double ebit = 0;
        double interest = 0;
        for (FinancialPeriod p : usable) {
            ebit += p.getOperatingIncome();
            interest += Math.abs(orZero(p.getInterestExpense()));
        }

        if (interest < 1) {
            double debt = orZero(usable.get(0).getTotalDebt());
            if (debt < DEBT_FREE_CEILING) {
                return new InterestCoverage(Double.POSITIVE_INFINITY, usable.size(), CoverageStatus.DEBT_FREE);
            }
            return InterestCoverage.unknown(usable.size(), CoverageStatus.MISSING_INTEREST);
        }
        return new InterestCoverage(ebit / interest, usable.size(), CoverageStatus.COMPUTED);
    }
}
