package com.jay.fundrater.layer2_filings.cache;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Decides whether a cached scan can stand in for a new one.
 * All of: same scanner version, at least the requested depth, no filing newer than the scan,
 * and either inside the TTL or still anchored on the latest known filing.
 */
public class CachePolicy {

    private final String scannerVersion;
    private final Duration ttl;

    public CachePolicy(String scannerVersion, Duration ttl) {
        this.scannerVersion = scannerVersion;
        this.ttl = ttl;
    }

    public boolean isReusable(CachedSignals entry, int requestedDepth, LocalDate latestKnownFiling, Instant now) {
        if (!sameVersion(entry)) return false;
        if (requestedDepth > entry.depth()) return false;

        LocalDate scannedThrough = scannedThrough(entry);
        if (latestKnownFiling != null && scannedThrough != null && latestKnownFiling.isAfter(scannedThrough)) {
            return false;
        }
        boolean fresh = entry.cachedAt() == null || !entry.cachedAt().plus(ttl).isBefore(now);
        boolean anchored = latestKnownFiling != null && entry.meta() != null
            && latestKnownFiling.equals(entry.meta().getLatestFiled());
        return fresh || anchored;
    }

    public boolean sameVersion(CachedSignals entry) {
        return entry != null && scannerVersion.equals(entry.scannerVersion());
    }

    // newest filing the scan saw; the cache timestamp stands in when the meta has none
    private static LocalDate scannedThrough(CachedSignals entry) {
        if (entry.meta() != null && entry.meta().getLatestFiled() != null) return entry.meta().getLatestFiled();
        return entry.cachedAt() == null ? null : entry.cachedAt().atZone(ZoneOffset.UTC).toLocalDate();
    }
}
