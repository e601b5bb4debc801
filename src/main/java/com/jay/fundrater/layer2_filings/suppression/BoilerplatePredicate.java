package com.jay.fundrater.layer2_filings.suppression;

import java.util.List;

/**
 * Drops hits inside risk-factor and forward-looking-statement disclaimers.
 * A substantive section marker nearby (MD&amp;A, liquidity, notes to the financial statements) keeps the hit.
 */
public class BoilerplatePredicate implements SuppressionPredicate {

    static final List<String> BOILERPLATE_MARKERS = List.of(
        "risk factors",
        "forward-looking statements",
        "cautionary statements",
        "cautionary note",
        "general legal",
        "legal proceedings",
        "liquidity risks may include",
        "cautionary note regarding",
        "cautionary statement regarding",
        "actual results could vary materially");

    static final List<String> SUBSTANTIVE_MARKERS = List.of(
        "management's discussion",
        "managements discussion",
        "results of operations",
        "financial condition",
        "liquidity",
        "business",
        "clinical",
        "clinical update",
        "clinical results",
        "regulatory update",
        "subsequent events",
        "material weakness",
        "commitments",
        "contingencies",
        "notes to consolidated financial statements",
        "notes to financial statements");

    @Override
    public String name() {
        return "boilerplate";
    }

    @Override
    public boolean suppresses(MatchContext match) {
        String ctx = match.context();
        boolean boilerplate = BOILERPLATE_MARKERS.stream().anyMatch(ctx::contains);
        return boilerplate && SUBSTANTIVE_MARKERS.stream().noneMatch(ctx::contains);
    }
}
