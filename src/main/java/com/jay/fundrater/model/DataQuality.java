package com.jay.fundrater.model;

import java.util.List;

/** Issues with the input periods that a reader should know about before trusting the rating. */
public record DataQuality(boolean mismatchedPeriods, boolean stale, List<String> notes) {

    public static DataQuality clean() {
        return new DataQuality(false, false, List.of());
    }
}
