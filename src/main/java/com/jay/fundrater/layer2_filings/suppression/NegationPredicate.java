package com.jay.fundrater.layer2_filings.suppression;

import java.util.List;

/** Drops hits preceded closely by a negation: "no substantial doubt", "did not receive a subpoena". */
public class NegationPredicate implements SuppressionPredicate {

    static final List<String> NEGATIONS = List.of(
        "no ", "not ", "without ", "does not ", "did not ", "will not ", "hardly ", "unlikely ", "neither ", "never ");

    @Override
    public String name() {
        return "negation";
    }

    @Override
    public boolean suppresses(MatchContext match) {
        return NEGATIONS.stream().anyMatch(match.preceding()::contains);
    }
}
