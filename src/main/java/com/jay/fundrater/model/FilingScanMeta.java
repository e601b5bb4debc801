package com.jay.fundrater.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/** Provenance of a scan: the newest filing looked at, and whether the signals were carried over. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FilingScanMeta {
    private String    latestForm;
    private LocalDate latestFiled;
    private String    latestAccession;
    private String    latestDocUrl;
    private int       filingsScanned;
    private boolean   reused;
    private String    note;
}
