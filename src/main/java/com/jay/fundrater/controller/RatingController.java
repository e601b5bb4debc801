package com.jay.fundrater.controller;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.layer4_rating.RuleCatalog;
import com.jay.fundrater.layer5_report.RatingReportGenerator;
import com.jay.fundrater.layer6_service.TickerRatingService;
import com.jay.fundrater.model.TickerDataset;
import com.jay.fundrater.model.TickerRatingView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * REST API — Ratings.
 *
 * Endpoints:
 *   POST /api/ratings                   — Rate the supplied periods (and optional filings)
 *   POST /api/ratings/batch             — Rate several datasets on the bounded worker pool
 *   GET  /api/ratings/{ticker}          — Rate a ticker from the fundamentals store
 *   GET  /api/ratings/{ticker}/report   — Same, as a plain-text report
 *   GET  /api/status                    — Version and configuration summary
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RatingController {

    private final RaterConfig config;
    private final TickerRatingService ratingService;
    private final RatingReportGenerator reportGenerator;

    // ── GET /api/status ────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
            "status", "RUNNING",
            "timestamp", LocalDateTime.now().toString(),
            "ruleCatalogVersion", RuleCatalog.VERSION,
            "ruleCount", RuleCatalog.rules().size(),
            "scannerVersion", config.scanner().getVersion(),
            "cacheTtlHours", config.scanner().getCacheTtlHours(),
            "maxConcurrentTickers", config.service().getMaxConcurrentTickers(),
            "storedTickers", ratingService.storedTickers().size()
        ));
    }

    // ── POST /api/ratings ──────────────────────────────────────────────────────

    @PostMapping("/ratings")
    public ResponseEntity<TickerRatingView> rate(@RequestBody TickerDataset dataset) {
        if (dataset.getTicker() == null || dataset.getTicker().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ratingService.rate(dataset)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    // ── POST /api/ratings/batch ────────────────────────────────────────────────

    @PostMapping("/ratings/batch")
    public ResponseEntity<List<TickerRatingView>> rateBatch(@RequestBody List<TickerDataset> datasets) {
        return ResponseEntity.ok(ratingService.rateBatch(datasets));
    }

    // ── GET /api/ratings/{ticker} ──────────────────────────────────────────────

    @GetMapping("/ratings/{ticker}")
    public ResponseEntity<TickerRatingView> rateStored(@PathVariable String ticker) {
        return ratingService.rateStored(ticker)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    // ── GET /api/ratings/{ticker}/report ───────────────────────────────────────

    @GetMapping(value = "/ratings/{ticker}/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> report(@PathVariable String ticker) {
        return ratingService.rateStored(ticker)
            .map(view -> ResponseEntity.ok(reportGenerator.generate(view)))
            .orElse(ResponseEntity.notFound().build());
    }
}
