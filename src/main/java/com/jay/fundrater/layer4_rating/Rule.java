package com.jay.fundrater.layer4_rating;

import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.enums.RuleCategory;

import java.util.function.Function;

/**
 * One entry of the rule catalog. Evaluation is pure: the same state always yields the same outcome.
 *
 * @param basis which figures the rule reads; {@link #BASIS_TTM} is reported as the actual TTM basis of the state
 */
public record Rule(String name,
                   int weight,
                   RuleCategory category,
                   String basis,
                   Function<FinancialState, RuleOutcome> evaluator) {

    public static final String BASIS_TTM     = "ttm";
    public static final String BASIS_BALANCE = "balance";
    public static final String BASIS_SERIES  = "series";
    public static final String BASIS_ANNUAL  = "annual";
    public static final String BASIS_MARKET  = "market";

    public RuleOutcome evaluate(FinancialState state) {
        return evaluator.apply(state);
    }
}
