package com.jay.fundrater.layer2_filings.cache;

import java.util.Optional;

/** Per-ticker store of the latest filing scan. Read and write failures are reported as misses, never thrown. */
public interface FilingSignalCache {

    Optional<CachedSignals> load(String ticker);

    void store(String ticker, CachedSignals entry);
}
