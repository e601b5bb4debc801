package com.jay.fundrater.layer6_service;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.layer1_normalize.PeriodNormalizer;
import com.jay.fundrater.layer2_filings.FilingFetcher;
import com.jay.fundrater.layer2_filings.FilingSignalService;
import com.jay.fundrater.layer2_filings.InlineFilingFetcher;
import com.jay.fundrater.layer3_state.FinancialStateBuilder;
import com.jay.fundrater.layer3_state.ProjectionCalculator;
import com.jay.fundrater.layer4_rating.RatingEngine;
import com.jay.fundrater.layer5_report.NarrativeSynthesizer;
import com.jay.fundrater.model.FilingScanResult;
import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.NormalizedSeries;
import com.jay.fundrater.model.RatingResult;
import com.jay.fundrater.model.TickerDataset;
import com.jay.fundrater.model.TickerRatingView;
import com.jay.fundrater.model.enums.IssuerType;
import com.jay.fundrater.store.DirectoryFilingFetcher;
import com.jay.fundrater.store.FundamentalsStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Layer 6 — Ticker Rating Service.
 *
 * Runs the full pipeline for one ticker:
 *   normalize periods → build financial state → filing signals → rating → projections → narrative
 *
 * An empty result means the input had no usable periods. Any other failure is logged and
 * returned as a view with {@code errorMessage} set. Batches run on a bounded worker pool,
 * each ticker with its own timeout.
 */
@Slf4j
@Service
public class TickerRatingService {

    private final RaterConfig config;
    private final PeriodNormalizer normalizer;
    private final FinancialStateBuilder stateBuilder;
    private final FilingSignalService filingSignalService;
    private final RatingEngine ratingEngine;
    private final NarrativeSynthesizer narrativeSynthesizer;
    private final FundamentalsStore store;

    private final ExecutorService executor;

    public TickerRatingService(RaterConfig config, PeriodNormalizer normalizer, FinancialStateBuilder stateBuilder,
                               FilingSignalService filingSignalService, RatingEngine ratingEngine,
                               NarrativeSynthesizer narrativeSynthesizer, FundamentalsStore store) {
        this.config = config;
        this.normalizer = normalizer;
        this.stateBuilder = stateBuilder;
        this.filingSignalService = filingSignalService;
        this.ratingEngine = ratingEngine;
        this.narrativeSynthesizer = narrativeSynthesizer;
        this.store = store;
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.service().getMaxConcurrentTickers()));
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    // ── Entry points ──────────────────────────────────────────────────────────

    /** Rates the supplied data. Filings travel with the request or, when absent, come from the filings directory. */
    public Optional<TickerRatingView> rate(TickerDataset dataset) {
        if (dataset == null || dataset.getTicker() == null || dataset.getTicker().isBlank()) {
            throw new IllegalArgumentException("ticker is required");
        }
        String ticker = dataset.getTicker().trim().toUpperCase(Locale.ROOT);
        log.info("Rating requested for {}", ticker);
        try {
            return run(ticker, dataset);
        } catch (Exception e) {
            log.error("Rating failed for {}: {}", ticker, e.getMessage(), e);
            return Optional.of(error(ticker, "Rating failed: " + e.getMessage()));
        }
    }

    /** Rates a ticker from the fundamentals store; empty when the store has no usable periods for it. */
    public Optional<TickerRatingView> rateStored(String rawTicker) {
        String ticker = rawTicker.trim().toUpperCase(Locale.ROOT);
        Optional<TickerDataset> dataset = store.load(ticker);
        if (dataset.isEmpty()) {
            log.info("No stored fundamentals for {}", ticker);
            return Optional.empty();
        }
        dataset.get().setTicker(ticker);
        return rate(dataset.get());
    }

    /**
     * Rates several tickers concurrently, at most {@code service.max-concurrent-tickers} at a time.
     * Results keep the input order; tickers without usable periods are left out.
     */
    public List<TickerRatingView> rateBatch(List<TickerDataset> datasets) {
        long timeout = config.service().getTimeoutSeconds();
        List<CompletableFuture<Optional<TickerRatingView>>> futures = datasets.stream()
            .map(d -> CompletableFuture.supplyAsync(() -> rate(d), executor))
            .toList();

        List<TickerRatingView> views = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String ticker = datasets.get(i).getTicker();
            try {
                futures.get(i).get(timeout, TimeUnit.SECONDS).ifPresent(views::add);
            } catch (TimeoutException e) {
                futures.get(i).cancel(true);
                log.warn("Rating timed out for {} after {}s", ticker, timeout);
                views.add(error(ticker, "Rating timed out after " + timeout + "s"));
            } catch (ExecutionException e) {
                log.error("Rating failed for {}: {}", ticker, e.getCause().getMessage());
                views.add(error(ticker, "Rating failed: " + e.getCause().getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                views.add(error(ticker, "Rating interrupted"));
            }
        }
        log.info("Batch rating complete: {} of {} ticker(s) rated", views.size(), datasets.size());
        return views;
    }

    public List<String> storedTickers() {
        return store.tickers();
    }

    // ── Pipeline ──────────────────────────────────────────────────────────────

    private Optional<TickerRatingView> run(String ticker, TickerDataset dataset) {
        NormalizedSeries series = normalizer.normalize(dataset.getPeriods());
        if (series.isEmpty()) {
            log.info("No usable periods for {}", ticker);
            return Optional.empty();
        }

        FinancialState state = stateBuilder.build(dataset, series, LocalDate.now());

        FilingScanResult scan = filingSignalService.signalsFor(ticker, fetcherFor(ticker, dataset),
            IssuerType.fromWire(dataset.getIssuerType()), dataset.isDeepScan(), latestFiled(series));

        RatingResult rating = ratingEngine.rate(state, scan.signals(), dataset.getPrices());

        return Optional.of(TickerRatingView.builder()
            .ticker(ticker)
            .companyName(dataset.getCompanyName())
            .sector(state.getSector())
            .sectorBucket(state.getSectorBucket() == null ? null : state.getSectorBucket().label())
            .ttm(state.getTtm())
            .quarterCount(series.quarters().size())
            .annualCount(series.years().size())
            .filingSignals(scan.signals())
            .filingSignalsMeta(scan.meta())
            .rating(rating)
            .projections(ProjectionCalculator.compute(state))
            .narrative(narrativeSynthesizer.synthesize(state, rating, scan.signals()))
            .ratedAt(LocalDateTime.now())
            .build());
    }

    private FilingFetcher fetcherFor(String ticker, TickerDataset dataset) {
        if (dataset.getFilings() != null && !dataset.getFilings().isEmpty()) {
            return new InlineFilingFetcher(dataset.getFilings());
        }
        return new DirectoryFilingFetcher(Path.of(config.store().getFilingsDir()), ticker);
    }

    private static LocalDate latestFiled(NormalizedSeries series) {
        return Stream.concat(series.quarters().stream(), series.years().stream())
            .map(FinancialPeriod::getFiledDate)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElse(null);
    }

    private static TickerRatingView error(String ticker, String message) {
        return TickerRatingView.builder()
            .ticker(ticker)
            .errorMessage(message)
            .ratedAt(LocalDateTime.now())
            .build();
    }
}
