package com.jay.fundrater.layer2_filings.suppression;

import java.util.regex.Pattern;

/**
 * Drops hits about somebody else's problem: government restructuring programmes, or generic
 * "prevalence and severity of adverse events" wording in drug-risk sections.
 */
public class TopicGuardPredicate implements SuppressionPredicate {

    private static final Pattern PUBLIC_SECTOR = Pattern.compile("\\b(government|federal|state|non-company-level)\\b");

    @Override
    public String name() {
        return "topic-guard";
    }

    @Override
    public boolean suppresses(MatchContext match) {
        String s = match.snippetLower();
        if (s.contains("restructuring") && PUBLIC_SECTOR.matcher(s).find()) return true;
        return s.contains("adverse events")
            && (s.contains("prevalence") || s.contains("severity") || s.contains("risk"));
    }
}
