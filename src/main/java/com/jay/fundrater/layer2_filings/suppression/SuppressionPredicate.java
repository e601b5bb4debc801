package com.jay.fundrater.layer2_filings.suppression;

/**
 * One reason to discard a phrase hit. Predicates are independent of each other and stateless;
 * {@link SuppressionChain} decides the order they run in.
 */
public interface SuppressionPredicate {

    /** Short name used in debug logs. */
    String name();

    boolean suppresses(MatchContext match);
}
