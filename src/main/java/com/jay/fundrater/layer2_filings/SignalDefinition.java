package com.jay.fundrater.layer2_filings;

import com.jay.fundrater.model.enums.Severity;

import java.util.List;

/**
 * One phrase family of the filing catalog.
 *
 * @param resolutionPhrases phrases that, found near a match, mean the flagged event has since been resolved
 */
public record SignalDefinition(String id,
                               String title,
                               int score,
                               Severity severity,
                               List<String> phrases,
                               List<String> resolutionPhrases) {

    public boolean hasResolutionPhrases() {
        return !resolutionPhrases.isEmpty();
    }
}
