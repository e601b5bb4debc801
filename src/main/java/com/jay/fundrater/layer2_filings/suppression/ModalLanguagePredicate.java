package com.jay.fundrater.layer2_filings.suppression;

import java.util.List;

/** Drops speculative hits: modal wording around the match and no verb saying the event actually happened. */
public class ModalLanguagePredicate implements SuppressionPredicate {

    static final List<String> MODALS = List.of(
        " could ", " may ", " might ", " would ", " should ", " in the event that ");

    static final List<String> CONCRETE_VERBS = List.of(
        "received ", "breached", "accelerate", "defaulted", "issued", "announced", "filed");

    @Override
    public String name() {
        return "modal";
    }

    @Override
    public boolean suppresses(MatchContext match) {
        String s = match.snippetLower();
        return MODALS.stream().anyMatch(s::contains) && CONCRETE_VERBS.stream().noneMatch(s::contains);
    }
}
