package com.jay.fundrater.layer3_state;

import com.jay.fundrater.model.enums.SectorBucket;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;
import static com.jay.fundrater.layer1_normalize.FinancialMath.orZero;

/** Years of cash left at the trailing free-cash-flow burn. +Infinity when the company funds itself. */
public final class RunwayCalculator {

    private RunwayCalculator() {
    }

    public static Double runwayYears(SectorBucket bucket, Double cash, Double shortTermInvestments,
                                     Double freeCashFlowTtm, Double netIncomeTtm) {
        // bank cash is working inventory, not a survival buffer
        if (bucket == SectorBucket.FINANCIALS) return null;
        if (!isFiniteValue(freeCashFlowTtm)) {
            return isFiniteValue(netIncomeTtm) && netIncomeTtm > 0 ? Double.POSITIVE_INFINITY : null;
        }
        if (freeCashFlowTtm >= 0) return Double.POSITIVE_INFINITY;
        if (!isFiniteValue(cash) && !isFiniteValue(shortTermInvestments)) return null;
        double liquid = orZero(cash) + orZero(shortTermInvestments);
        if (liquid <= 0) return 0.0;
        return liquid / Math.abs(freeCashFlowTtm);
    }
}
