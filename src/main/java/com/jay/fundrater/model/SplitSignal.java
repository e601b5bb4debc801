package com.jay.fundrater.model;

import java.time.LocalDate;

/**
 * A share-count jump whose EPS moved inversely, i.e. a likely (reverse) split rather than issuance.
 *
 * @param sharesRatio    magnitude of the share-count change (always &gt;= 1)
 * @param epsRatio       current EPS over prior EPS
 * @param inverseProduct distance of the EPS move from a perfectly inverse one
 */
public record SplitSignal(double sharesRatio,
                          double epsRatio,
                          double inverseProduct,
                          LocalDate currentPeriod,
                          LocalDate priorPeriod) {
}
