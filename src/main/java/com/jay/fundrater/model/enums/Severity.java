package com.jay.fundrater.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWire(String raw) {
        if (raw == null) return INFO;
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    /** Default severity for a signal that does not declare one. */
    public static Severity forScore(int score) {
        if (score <= -8) return CRITICAL;
        if (score < 0) return WARNING;
        return INFO;
    }
}
