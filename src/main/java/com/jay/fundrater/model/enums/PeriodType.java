package com.jay.fundrater.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PeriodType {
    QUARTER,
    YEAR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps the labels seen across data providers onto a period type.
     * Returns null for anything unrecognised so the record can be dropped.
     */
    @JsonCreator
    public static PeriodType fromLabel(String raw) {
        if (raw == null) return null;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "quarter", "quarterly", "q", "qtr", "10-q" -> QUARTER;
            case "year", "annual", "fy", "10-k" -> YEAR;
            default -> null;
        };
    }
}
