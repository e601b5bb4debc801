package com.jay.fundrater.model;

/** How much of the rule catalog could be evaluated. */
public record Completeness(int applicable, int missing, int notApplicable, int total, double percent) {
}
