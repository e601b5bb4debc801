package com.jay.fundrater.model;

import java.time.Instant;
import java.util.List;

/**
 * Signals for one ticker plus where they came from.
 *
 * @param fromCache true when no filing was fetched for this result
 */
public record FilingScanResult(List<FilingSignal> signals,
                               FilingScanMeta meta,
                               Instant scannedAt,
                               int depth,
                               boolean fromCache) {

    public static FilingScanResult empty() {
        return new FilingScanResult(List.of(), new FilingScanMeta(), Instant.EPOCH, 0, false);
    }
}
