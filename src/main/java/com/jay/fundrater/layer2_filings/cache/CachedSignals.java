package com.jay.fundrater.layer2_filings.cache;

import com.jay.fundrater.model.FilingScanMeta;
import com.jay.fundrater.model.FilingSignal;

import java.time.Instant;
import java.util.List;

/**
 * A persisted scan.
 *
 * @param depth number of filings the scan covered
 */
public record CachedSignals(List<FilingSignal> signals,
                            FilingScanMeta meta,
                            Instant cachedAt,
                            String scannerVersion,
                            int depth) {
}
