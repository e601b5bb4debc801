package com.jay.fundrater.layer2_filings.suppression;

import java.time.LocalDate;

/** Drops hits whose surrounding text dates the event to one of the years before the filing year. */
public class StaleYearPredicate implements SuppressionPredicate {

    private final int yearSpan;

    public StaleYearPredicate(int yearSpan) {
        this.yearSpan = yearSpan;
    }

    @Override
    public String name() {
        return "stale-year";
    }

    @Override
    public boolean suppresses(MatchContext match) {
        int filingYear = (match.filed() != null ? match.filed() : LocalDate.now()).getYear();
        for (int year = filingYear - yearSpan; year < filingYear; year++) {
            if (match.context().contains(Integer.toString(year))) return true;
        }
        return false;
    }
}
