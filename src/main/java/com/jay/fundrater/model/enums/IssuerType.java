package com.jay.fundrater.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IssuerType {
    DOMESTIC,
    FOREIGN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IssuerType fromWire(String raw) {
        if (raw == null) return DOMESTIC;
        String lower = raw.trim().toLowerCase(Locale.ROOT);
        // 20-F / 40-F filers are foreign private issuers
        return lower.equals("foreign") || lower.equals("fpi") || lower.contains("20-f") || lower.contains("40-f")
            ? FOREIGN : DOMESTIC;
    }
}
