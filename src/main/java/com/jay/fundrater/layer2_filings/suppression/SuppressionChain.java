package com.jay.fundrater.layer2_filings.suppression;

import com.jay.fundrater.config.RaterConfig;

import java.util.List;
import java.util.Optional;

/**
 * Ordered list of suppression predicates; a hit survives only if none of them fires.
 * Cheap, high-precision checks come first so the common boilerplate cases exit early.
 */
public class SuppressionChain {

    private final List<SuppressionPredicate> predicates;

    public SuppressionChain(List<SuppressionPredicate> predicates) {
        this.predicates = List.copyOf(predicates);
    }

    public static SuppressionChain standard(RaterConfig.Scanner cfg) {
        return new SuppressionChain(List.of(
            new StaleYearPredicate(cfg.getStaleYearSpan()),
            new ResolutionPhrasePredicate(),
            new HypotheticalPrefixPredicate(),
            new BoilerplatePredicate(),
            new TopicGuardPredicate(),
            new NegationPredicate(),
            new ModalLanguagePredicate(),
            new HistoricalFramingPredicate()));
    }

    /** Name of the first predicate that rejects the hit, or empty if the hit is kept. */
    public Optional<String> rejection(MatchContext match) {
        for (SuppressionPredicate p : predicates) {
            if (p.suppresses(match)) return Optional.of(p.name());
        }
        return Optional.empty();
    }

    public List<SuppressionPredicate> predicates() {
        return predicates;
    }
}
