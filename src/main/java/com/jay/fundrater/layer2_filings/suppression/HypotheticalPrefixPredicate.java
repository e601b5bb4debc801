package com.jay.fundrater.layer2_filings.suppression;

import java.util.List;

/** Drops hits framed as a possibility: "imposition of a clinical hold", "risk of default". */
public class HypotheticalPrefixPredicate implements SuppressionPredicate {

    static final List<String> PREFIXES = List.of(
        "imposition of",
        "possibility of",
        "risk of",
        "potential for",
        "investigation into",
        "subject to");

    @Override
    public String name() {
        return "hypothetical-prefix";
    }

    @Override
    public boolean suppresses(MatchContext match) {
        return PREFIXES.stream().anyMatch(match.snippetLower()::contains);
    }
}
