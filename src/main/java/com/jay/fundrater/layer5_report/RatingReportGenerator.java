package com.jay.fundrater.layer5_report;

import com.jay.fundrater.model.FilingSignal;
import com.jay.fundrater.model.Projections;
import com.jay.fundrater.model.RatingResult;
import com.jay.fundrater.model.RuleReason;
import com.jay.fundrater.model.TickerRatingView;
import com.jay.fundrater.model.TtmSnapshot;
import com.jay.fundrater.model.enums.RuleCategory;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Layer 5 — Rating Report Generator.
 * Renders a rated ticker as a plain-text report: headline score, rule breakdown per category,
 * notes, filing signals and projections.
 */
@Component
public class RatingReportGenerator {

    private static final String DIVIDER =
        "━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━";
    private static final DateTimeFormatter FMT = DateTimeFormatter.ofPattern("dd-MMM-yyyy HH:mm", Locale.ENGLISH);

    public String generate(TickerRatingView view) {
        StringBuilder sb = new StringBuilder();
        String timestamp = view.getRatedAt() != null ? view.getRatedAt().format(FMT) : "NOW";
        sb.append("FUNDAMENTALS RATING REPORT  —  ").append(timestamp).append("\n");
        sb.append(DIVIDER).append("\n");
        sb.append(String.format("TICKER            :  %s%n", view.getTicker()));
        sb.append(String.format("COMPANY           :  %s%n", orDash(view.getCompanyName())));
        sb.append(String.format("SECTOR            :  %s (%s)%n", orDash(view.getSector()), orDash(view.getSectorBucket())));

        if (view.getErrorMessage() != null) {
            sb.append(DIVIDER).append("\n");
            sb.append(String.format("ERROR             :  %s%n", view.getErrorMessage()));
            return sb.toString();
        }

        RatingResult rating = view.getRating();
        TtmSnapshot ttm = view.getTtm();
        sb.append(String.format("PERIODS           :  %d quarter(s), %d year(s)%n",
            view.getQuarterCount() == null ? 0 : view.getQuarterCount(),
            view.getAnnualCount() == null ? 0 : view.getAnnualCount()));
        if (ttm != null) {
            sb.append(String.format("TTM BASIS         :  %s (as of %s)%n", ttm.basis().wireName(), ttm.asOf()));
        }
        sb.append(DIVIDER).append("\n");

        if (rating != null) {
            sb.append(String.format("SCORE             :  %d / 100  [%s]%n", rating.getNormalizedScore(), rating.tierLabel()));
            sb.append(String.format("RAW TOTAL         :  %.1f%n", rating.getRawScore()));
            sb.append(String.format("COMPLETENESS      :  %.0f%%  (%d applicable, %d missing, %d n/a)%n",
                rating.getCompleteness().percent(), rating.getCompleteness().applicable(),
                rating.getCompleteness().missing(), rating.getCompleteness().notApplicable()));
            sb.append(String.format("FILING IMPACT     :  %+d pts%n", rating.getFilingSignalContribution()));
            if (rating.getGrowthPhaseAdjustment() > 0) {
                sb.append(String.format("GROWTH PHASE      :  +%d pts (intensity %.2f)%n",
                    rating.getGrowthPhaseAdjustment(), rating.getGrowthStageIntensity()));
            }
            if (rating.isPennyStock()) sb.append("PROFILE           :  Penny / micro-cap\n");
            if (rating.isEventRiskCapped()) sb.append("EVENT RISK        :  score capped after a sharp price drop\n");
            sb.append(DIVIDER).append("\n");

            for (RuleCategory category : RuleCategory.values()) {
                List<RuleReason> inCategory = rating.getReasons().stream()
                    .filter(r -> r.category() == category)
                    .toList();
                if (inCategory.isEmpty()) continue;
                sb.append(category.label().toUpperCase()).append("\n");
                inCategory.forEach(r -> sb.append(formatReason(r)));
            }
            sb.append(DIVIDER).append("\n");

            appendNotes(sb, "NOTES:", rating.getOverrideNotes());
            appendNotes(sb, "DATA GAPS:", rating.getMissingNotes());
        }

        List<FilingSignal> signals = view.getFilingSignals();
        if (signals != null && !signals.isEmpty()) {
            sb.append("FILING SIGNALS:\n");
            signals.forEach(s -> sb.append(String.format("   • [%s] %s (%+d%s) — %s %s%n",
                s.getSeverity() == null ? "info" : s.getSeverity().wireName(), s.getTitle(), s.getScore(),
                s.isIncludeInScore() ? "" : ", info only", orDash(s.getForm()),
                s.getFiled() == null ? "" : s.getFiled().toString())));
            sb.append(DIVIDER).append("\n");
        }

        Projections projections = view.getProjections();
        if (projections != null) {
            sb.append(String.format("BUSINESS TREND    :  %s / %s%n",
                projections.businessTrendLabel(), projections.deteriorationLabel()));
            sb.append(String.format("DILUTION RISK     :  %s (%.2f)%n",
                projections.dilutionRiskLabel(), projections.dilutionRiskScore()));
            sb.append(String.format("BANKRUPTCY RISK   :  %s (%.2f)%n",
                projections.bankruptcyRiskLabel(), projections.bankruptcyRiskScore()));
        }
        if (view.getNarrative() != null) {
            sb.append(String.format("MOMENTUM          :  %d  [%s]%n",
                view.getNarrative().momentumScore(), view.getNarrative().momentumLabel()));
            sb.append(String.format("SUMMARY           :  %s%n", view.getNarrative().summary()));
        }
        sb.append("─────────────────────────────────────────────────────────\n");
        return sb.toString();
    }

    private static String formatReason(RuleReason r) {
        String score = r.notApplicable() ? "n/a" : r.missing() ? "--" : String.format("%+d", r.score());
        return String.format("   %-28s %5s / %-3d  %s%n", r.name(), score, r.weight(), orDash(r.message()));
    }

    private static void appendNotes(StringBuilder sb, String heading, List<String> notes) {
        if (notes == null || notes.isEmpty()) return;
        sb.append(heading).append("\n");
        notes.forEach(n -> sb.append("   • ").append(n).append("\n"));
        sb.append(DIVIDER).append("\n");
    }

    private static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
