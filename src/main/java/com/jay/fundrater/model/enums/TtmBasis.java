package com.jay.fundrater.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How a trailing-twelve-month aggregate was obtained. */
public enum TtmBasis {
    TTM,        // four reported quarters
    DERIVED,    // three reported quarters plus one derived from the annual total
    ANNUAL;     // latest fiscal year used as a stand-in

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
