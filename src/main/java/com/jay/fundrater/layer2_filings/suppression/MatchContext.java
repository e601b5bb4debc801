package com.jay.fundrater.layer2_filings.suppression;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.layer2_filings.FilingText;
import com.jay.fundrater.layer2_filings.SignalDefinition;

import java.time.LocalDate;
import java.util.Locale;

/**
 * A single phrase hit inside a filing, with the text around it cut at the widths the predicates look at.
 * All windows except {@code snippet} are lower-case.
 *
 * @param snippet           evidence shown to the user, original case
 * @param context           wide window used for section and boilerplate markers
 * @param resolutionContext widest window, searched for resolution phrases
 * @param preceding         text just before the match, searched for negations
 */
public record MatchContext(SignalDefinition definition,
                           String phrase,
                           int index,
                           LocalDate filed,
                           String snippet,
                           String snippetLower,
                           String context,
                           String resolutionContext,
                           String preceding) {

    public static MatchContext at(String text, int index, String phrase, SignalDefinition definition,
                                  LocalDate filed, RaterConfig.Scanner cfg) {
        String snippet = FilingText.window(text, index, cfg.getSnippetRadius());
        return new MatchContext(
            definition,
            phrase,
            index,
            filed,
            snippet,
            lower(snippet),
            lower(FilingText.window(text, index, cfg.getContextRadius())),
            lower(FilingText.window(text, index, cfg.getResolutionRadius())),
            lower(FilingText.preceding(text, index, cfg.getNegationWindow())));
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
