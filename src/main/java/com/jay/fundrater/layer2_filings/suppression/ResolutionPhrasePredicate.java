package com.jay.fundrater.layer2_filings.suppression;

/** Drops hits of families that declare resolution phrases when one of them appears nearby ("hold was lifted"). */
public class ResolutionPhrasePredicate implements SuppressionPredicate {

    @Override
    public String name() {
        return "resolved";
    }

    @Override
    public boolean suppresses(MatchContext match) {
        if (!match.definition().hasResolutionPhrases()) return false;
        return match.definition().resolutionPhrases().stream().anyMatch(match.resolutionContext()::contains);
    }
}
