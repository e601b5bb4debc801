package com.jay.fundrater.model;

import com.jay.fundrater.model.enums.RuleCategory;

/** A rule outcome as reported in the rating, after tuning and adjustments. */
public record RuleReason(String name,
                         int weight,
                         RuleCategory category,
                         int score,
                         String message,
                         boolean missing,
                         boolean notApplicable,
                         String basis,
                         String explanation) {
}
