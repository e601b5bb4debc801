package com.jay.fundrater.model;

import com.jay.fundrater.model.enums.CoverageStatus;

/**
 * EBIT over interest expense. {@code value} is +Infinity for debt-free companies and null when unknown.
 *
 * @param periods number of periods with reported interest expense that fed the ratio
 */
public record InterestCoverage(Double value, int periods, CoverageStatus status) {

    public static InterestCoverage unknown(int periods, CoverageStatus status) {
        return new InterestCoverage(null, periods, status);
    }

    public boolean isDebtFree() {
        return status == CoverageStatus.DEBT_FREE;
    }
}
