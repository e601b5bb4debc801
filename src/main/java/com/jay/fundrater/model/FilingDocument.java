package com.jay.fundrater.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * A regulatory filing as handed over by the fetch layer.
 * {@code text} may be absent when only the index entry is known; the fetcher fills it on demand.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FilingDocument {
    String    form;             // 10-K, 10-Q, 8-K, DEF 14A, 4, 10-K/A ...
    LocalDate filed;
    String    accession;
    String    cik;
    String    docUrl;
    String    transactionCode;  // Form 4 only: P = open-market buy, S = sale
    String    text;

    public boolean isAmendment() {
        return form != null && form.trim().toUpperCase().endsWith("/A");
    }

    public boolean isInsiderTransaction() {
        return form != null && form.trim().equals("4");
    }
}
