package com.jay.fundrater.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Full rating view for a single ticker.
 * Returned by TickerRatingService and served by the /api/ratings endpoints.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TickerRatingView {

    private String ticker;
    private String companyName;
    private String sector;
    private String sectorBucket;

    // ── Financials ────────────────────────────────────────────────────────────
    private TtmSnapshot ttm;
    private Integer     quarterCount;
    private Integer     annualCount;

    // ── Filing intelligence ───────────────────────────────────────────────────
    private List<FilingSignal> filingSignals;
    private FilingScanMeta     filingSignalsMeta;

    // ── Rating ────────────────────────────────────────────────────────────────
    private RatingResult rating;
    private Projections  projections;
    private Narrative    narrative;

    // ── Meta ──────────────────────────────────────────────────────────────────
    private LocalDateTime ratedAt;
    private String        errorMessage;   // non-null if the pipeline failed
}
