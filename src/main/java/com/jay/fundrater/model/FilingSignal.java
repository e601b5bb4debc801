package com.jay.fundrater.model;

import com.jay.fundrater.model.enums.Severity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * A qualitative flag extracted from filing text.
 * {@code includeInScore=false} marks informational signals that are shown but never summed into the rating.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FilingSignal {
    String    id;
    String    title;
    int       score;
    Severity  severity;
    String    snippet;
    String    form;
    LocalDate filed;
    String    docUrl;
    String    accession;
    String    cik;
    @Builder.Default
    boolean   includeInScore = true;
}
