package com.jay.fundrater.model.enums;

/** Outcome of the interest coverage calculation. */
public enum CoverageStatus {
    COMPUTED,
    DEBT_FREE,
    MISSING_INTEREST,
    INSUFFICIENT_DATA
}
