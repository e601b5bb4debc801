package com.jay.fundrater.layer2_filings.suppression;

import java.util.List;

/** Drops hits told in the past tense of the company's history rather than as a current condition. */
public class HistoricalFramingPredicate implements SuppressionPredicate {

    static final List<String> MARKERS = List.of(" historically", " in the past", " previously", " prior ", " legacy ");

    @Override
    public String name() {
        return "historical";
    }

    @Override
    public boolean suppresses(MatchContext match) {
        return MARKERS.stream().anyMatch(match.snippetLower()::contains);
    }
}
