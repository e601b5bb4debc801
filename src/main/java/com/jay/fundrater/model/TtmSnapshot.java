package com.jay.fundrater.model;

import com.jay.fundrater.model.enums.TtmBasis;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Trailing-twelve-month aggregate.
 *
 * @param basis         how the window was assembled
 * @param asOf          period end of the latest period in the window
 * @param periodEnds    period ends that contributed, oldest first
 * @param totals        summed flow fields plus point-in-time balance fields from the latest period
 * @param partialFields flow fields summed from fewer periods than the window holds
 */
public record TtmSnapshot(TtmBasis basis,
                          LocalDate asOf,
                          List<LocalDate> periodEnds,
                          FinancialPeriod totals,
                          Set<String> partialFields) {

    public Double get(FinancialField field) {
        return field.get(totals);
    }
}
