package com.jay.fundrater.layer2_filings.cache;

import com.jay.fundrater.model.FilingScanMeta;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CachePolicyTest {

    private static final Instant NOW = Instant.parse("2025-06-10T12:00:00Z");
    private static final LocalDate LATEST = LocalDate.of(2025, 5, 1);

    private final CachePolicy policy = new CachePolicy("3", Duration.ofHours(72));

    @Test
    void reusedWithinTtlAtSmallerDepth() {
        CachedSignals entry = entry("3", NOW.minus(Duration.ofHours(10)), 10);

        assertThat(policy.isReusable(entry, 3, LATEST, NOW)).isTrue();
    }

    @Test
    void invalidatedByScannerVersionChange() {
        CachedSignals entry = entry("2", NOW.minus(Duration.ofHours(1)), 10);

        assertThat(policy.isReusable(entry, 3, LATEST, NOW)).isFalse();
    }

    @Test
    void invalidatedByNewerFiling() {
        CachedSignals entry = entry("3", NOW.minus(Duration.ofHours(1)), 10);

        assertThat(policy.isReusable(entry, 3, LATEST.plusDays(30), NOW)).isFalse();
    }

    @Test
    void invalidatedWhenDeeperScanRequested() {
        CachedSignals entry = entry("3", NOW.minus(Duration.ofHours(1)), 3);

        assertThat(policy.isReusable(entry, 10, LATEST, NOW)).isFalse();
    }

    @Test
    void expiredEntryStillReusedWhileAnchoredOnLatestFiling() {
        CachedSignals entry = entry("3", NOW.minus(Duration.ofDays(10)), 3);

        assertThat(policy.isReusable(entry, 3, LATEST, NOW)).isTrue();
        assertThat(policy.isReusable(entry, 3, null, NOW)).isFalse();
    }

    private static CachedSignals entry(String version, Instant cachedAt, int depth) {
        FilingScanMeta meta = FilingScanMeta.builder().latestFiled(LATEST).latestForm("10-Q").filingsScanned(depth).build();
        return new CachedSignals(List.of(), meta, cachedAt, version, depth);
    }
}
