package com.jay.fundrater.layer2_filings;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.layer2_filings.cache.CachePolicy;
import com.jay.fundrater.layer2_filings.cache.CachedSignals;
import com.jay.fundrater.layer2_filings.cache.FilingSignalCache;
import com.jay.fundrater.model.FilingDocument;
import com.jay.fundrater.model.FilingScanMeta;
import com.jay.fundrater.model.FilingScanResult;
import com.jay.fundrater.model.FilingSignal;
import com.jay.fundrater.model.enums.IssuerType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Layer 2 — Filing Signal Service.
 *
 * Cache-aware front of the scanner:
 *   1. a cached scan is reused when {@link CachePolicy} allows it
 *   2. otherwise the most recent filings are fetched and scanned one by one, newest first
 *   3. a scan that finds nothing falls back to the previous signals of the same scanner version
 *
 * Only one scan per ticker runs at a time; concurrent callers for the same ticker wait for it and share the result.
 */
@Slf4j
@Service
public class FilingSignalService {

    static final String REUSED_NOTE = "No new flags detected; showing prior risks.";

    private final RaterConfig config;
    private final FilingSignalScanner scanner;
    private final DeepScanSignals deepScanSignals;
    private final FilingSignalCache cache;
    private final CachePolicy policy;

    private final Map<String, CompletableFuture<FilingScanResult>> inFlight = new ConcurrentHashMap<>();

    public FilingSignalService(RaterConfig config, FilingSignalScanner scanner,
                               DeepScanSignals deepScanSignals, FilingSignalCache cache) {
        this.config = config;
        this.scanner = scanner;
        this.deepScanSignals = deepScanSignals;
        this.cache = cache;
        this.policy = new CachePolicy(config.scanner().getVersion(),
            Duration.ofHours(config.scanner().getCacheTtlHours()));
    }

    /**
     * @param latestKnownFiling newest filing date the fundamentals store knows about; may be null
     */
    public FilingScanResult signalsFor(String ticker, FilingFetcher fetcher, IssuerType issuerType,
                                       boolean deep, LocalDate latestKnownFiling) {
        String key = ticker.trim().toUpperCase(Locale.ROOT);
        CompletableFuture<FilingScanResult> mine = new CompletableFuture<>();
        CompletableFuture<FilingScanResult> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.debug("Joining in-flight filing scan for {}", key);
            return running.join();
        }
        try {
            FilingScanResult result = load(key, fetcher, issuerType, deep, latestKnownFiling);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private FilingScanResult load(String ticker, FilingFetcher fetcher, IssuerType issuerType,
                                  boolean deep, LocalDate latestKnownFiling) {
        RaterConfig.Scanner cfg = config.scanner();
        int depth = deep ? cfg.getDeepDepth() : cfg.getDefaultDepth();
        Instant now = Instant.now();

        Optional<CachedSignals> cached = cache.load(ticker);
        if (cached.isPresent() && policy.isReusable(cached.get(), depth, latestKnownFiling, now)) {
            CachedSignals hit = cached.get();
            log.info("Filing signals for {} served from cache ({} signal(s), depth {})",
                ticker, hit.signals().size(), hit.depth());
            return new FilingScanResult(hit.signals(), hit.meta(), hit.cachedAt(), hit.depth(), true);
        }

        List<FilingDocument> listed;
        try {
            listed = fetcher.recentFilings(ticker, cfg.getForms(), depth);
        } catch (IOException e) {
            log.warn("Could not list filings for {}: {}", ticker, e.getMessage());
            listed = List.of();
        }

        List<FilingDocument> withText = new ArrayList<>();
        for (FilingDocument filing : listed) {
            try {
                withText.add(filing.toBuilder().text(fetcher.fetchText(filing)).build());
            } catch (IOException e) {
                log.warn("Skipping {} {} for {}: {}", filing.getForm(), filing.getAccession(), ticker, e.getMessage());
            }
        }

        List<FilingSignal> signals = new ArrayList<>(scanner.scan(withText, issuerType));
        if (deep) {
            signals.addAll(deepSignals(ticker, fetcher, now));
        }

        if (signals.isEmpty() && cached.isPresent() && policy.sameVersion(cached.get())
            && !cached.get().signals().isEmpty()) {
            CachedSignals prior = cached.get();
            FilingScanMeta meta = (prior.meta() == null ? new FilingScanMeta() : prior.meta()).toBuilder()
                .reused(true)
                .note(REUSED_NOTE)
                .build();
            log.info("No new filing flags for {}; reusing {} prior signal(s)", ticker, prior.signals().size());
            return new FilingScanResult(prior.signals(), meta, prior.cachedAt(), prior.depth(), true);
        }

        FilingScanMeta meta = metaFor(listed, signals, withText.size());
        if (listed.isEmpty()) {
            log.info("No filings available for {}", ticker);
            return new FilingScanResult(List.of(), meta, now, depth, false);
        }
        cache.store(ticker, new CachedSignals(signals, meta, now, cfg.getVersion(), depth));
        log.info("Scanned {} filing(s) for {}: {} signal(s)", withText.size(), ticker, signals.size());
        return new FilingScanResult(signals, meta, now, depth, false);
    }

    private List<FilingSignal> deepSignals(String ticker, FilingFetcher fetcher, Instant now) {
        try {
            List<FilingDocument> metadata = fetcher.recentFilings(ticker, DeepScanSignals.METADATA_FORMS, 200);
            return deepScanSignals.derive(metadata, LocalDate.ofInstant(now, ZoneOffset.UTC));
        } catch (IOException e) {
            log.warn("Deep-scan metadata unavailable for {}: {}", ticker, e.getMessage());
            return List.of();
        }
    }

    private static FilingScanMeta metaFor(List<FilingDocument> listed, List<FilingSignal> signals, int scanned) {
        if (listed.isEmpty()) return FilingScanMeta.builder().filingsScanned(0).build();
        FilingDocument latest = listed.get(0);
        String latestDocUrl = signals.stream()
            .filter(s -> latest.getAccession() != null && latest.getAccession().equals(s.getAccession()))
            .map(FilingSignal::getDocUrl)
            .findFirst()
            .orElse(latest.getDocUrl());
        return FilingScanMeta.builder()
            .latestForm(latest.getForm())
            .latestFiled(latest.getFiled())
            .latestAccession(latest.getAccession())
            .latestDocUrl(latestDocUrl)
            .filingsScanned(scanned)
            .build();
    }
}
