package com.jay.fundrater.layer5_report;

import com.jay.fundrater.model.Completeness;
import com.jay.fundrater.model.FilingSignal;
import com.jay.fundrater.model.Narrative;
import com.jay.fundrater.model.Projections;
import com.jay.fundrater.model.RatingResult;
import com.jay.fundrater.model.RuleReason;
import com.jay.fundrater.model.TickerRatingView;
import com.jay.fundrater.model.enums.RatingTier;
import com.jay.fundrater.model.enums.RuleCategory;
import com.jay.fundrater.model.enums.Severity;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RatingReportGeneratorTest {

    private final RatingReportGenerator generator = new RatingReportGenerator();

    @Test
    void generate_rendersScoreRulesSignalsAndNarrative() {
        RatingResult rating = RatingResult.builder()
            .rawScore(34.0)
            .normalizedScore(59)
            .tier(RatingTier.MIXED)
            .reasons(List.of(
                new RuleReason("Revenue growth YoY", 10, RuleCategory.GROWTH, 8, "24.00% (YoY)", false, false, "ttm", null),
                new RuleReason("Cash Runway (years)", 10, RuleCategory.SOLVENCY, 0, "Not applicable", true, true, "balance", null),
                new RuleReason("Price / Earnings", 8, RuleCategory.VALUATION, 0, "Price data unavailable", true, false, "market", null)))
            .completeness(new Completeness(2, 1, 1, 3, 66.7))
            .overrideNotes(List.of("Likely split: share count x2.0 while EPS moved inversely; dilution not scored."))
            .missingNotes(List.of("Price / Earnings: Data unavailable"))
            .filingSignalContribution(-8)
            .ruleCatalogVersion("test")
            .build();
        TickerRatingView view = TickerRatingView.builder()
            .ticker("ACME").companyName("Acme Corp").sector("Technology").sectorBucket("Tech/Internet")
            .quarterCount(8).annualCount(2)
            .rating(rating)
            .filingSignals(List.of(FilingSignal.builder().id("material_weakness").title("Internal Control Weakness")
                .score(-8).severity(Severity.CRITICAL).form("10-K").filed(LocalDate.of(2025, 3, 1)).build()))
            .projections(new Projections("Improving", "Improving", 0.6, 0.1, "Low", 0.2, "Low"))
            .narrative(new Narrative("Solid footing.", List.of("Solid footing."), 65, "Likely Continuation"))
            .ratedAt(LocalDateTime.of(2025, 6, 1, 9, 30))
            .build();

        String report = generator.generate(view);

        assertThat(report).contains("FUNDAMENTALS RATING REPORT", "01-Jun-2025 09:30");
        assertThat(report).contains("TICKER            :  ACME");
        assertThat(report).contains("SCORE             :  59 / 100  [mixed]");
        assertThat(report).contains("FILING IMPACT     :  -8 pts");
        assertThat(report).contains("GROWTH", "SOLVENCY", "VALUATION");
        assertThat(report).containsPattern("Revenue growth YoY\\s+\\+8 / 10");
        assertThat(report).containsPattern("Cash Runway \\(years\\)\\s+n/a / 10");
        assertThat(report).containsPattern("Price / Earnings\\s+-- / 8");
        assertThat(report).contains("NOTES:", "Likely split", "DATA GAPS:");
        assertThat(report).contains("[critical] Internal Control Weakness (-8)");
        assertThat(report).contains("MOMENTUM          :  65  [Likely Continuation]");
        assertThat(report).contains("SUMMARY           :  Solid footing.");
    }

    @Test
    void generate_errorViewStopsAfterHeader() {
        TickerRatingView view = TickerRatingView.builder().ticker("BAD").errorMessage("Rating failed: boom").build();

        String report = generator.generate(view);

        assertThat(report).contains("ERROR             :  Rating failed: boom");
        assertThat(report).contains("COMPANY           :  -");
        assertThat(report).doesNotContain("SCORE");
    }
}
