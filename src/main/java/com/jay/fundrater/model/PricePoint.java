package com.jay.fundrater.model;

import java.time.LocalDate;

/** One daily close. */
public record PricePoint(LocalDate date, double close) {
}
