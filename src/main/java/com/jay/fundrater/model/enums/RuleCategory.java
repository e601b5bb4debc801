package com.jay.fundrater.model.enums;

/** Grouping used when summarising missing data. */
public enum RuleCategory {
    VALUATION("Valuation"),
    SOLVENCY("Solvency"),
    PROFITABILITY("Profitability"),
    GROWTH("Growth"),
    OTHER("Other");

    private final String label;

    RuleCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
