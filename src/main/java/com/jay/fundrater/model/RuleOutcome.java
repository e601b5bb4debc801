package com.jay.fundrater.model;

/** Result of evaluating one rule. Missing and not-applicable outcomes always carry score 0. */
public record RuleOutcome(int score, String message, boolean missing, boolean notApplicable) {

    public static RuleOutcome scored(int score, String message) {
        return new RuleOutcome(score, message, false, false);
    }

    public static RuleOutcome missing(String message) {
        return new RuleOutcome(0, message, true, false);
    }

    public static RuleOutcome notApplicable(String message) {
        return new RuleOutcome(0, message, true, true);
    }

    public boolean skipped() {
        return missing || notApplicable;
    }

    public RuleOutcome withScore(int newScore) {
        return new RuleOutcome(newScore, message, missing, notApplicable);
    }

    public RuleOutcome withMessage(String newMessage) {
        return new RuleOutcome(score, newMessage, missing, notApplicable);
    }
}
