package com.jay.fundrater.layer5_report;

import com.jay.fundrater.model.FilingSignal;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.Narrative;
import com.jay.fundrater.model.RatingResult;
import com.jay.fundrater.model.enums.RatingTier;
import com.jay.fundrater.model.enums.SectorBucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;
import static com.jay.fundrater.layer1_normalize.FinancialMath.orZero;

/**
 * Layer 5 — Narrative Synthesizer.
 *
 * Picks summary sentences from fixed template pools:
 *   1. rating tier
 *   2. cash-burn trend
 *   3. growth versus profitability regime
 *   4. filing-signal balance
 *   5. penny-stock nuance (or distress for the danger tier)
 *
 * The variant within a pool depends only on the ticker and the pool key, so the same company
 * always reads the same way. Also computes the 0–100 momentum-health score.
 */
@Slf4j
@Component
public class NarrativeSynthesizer {

    private static final Map<String, List<String>> POOLS = Map.ofEntries(
        Map.entry("tier.elite", List.of(
            "Fundamentals rank among the strongest in the rated universe.",
            "An exceptional fundamental profile across growth, returns and balance sheet.")),
        Map.entry("tier.bullish", List.of(
            "Fundamentals are clearly constructive.",
            "Most quality checks come out in the company's favour.")),
        Map.entry("tier.solid", List.of(
            "A solid fundamental profile with a few soft spots.",
            "Fundamentals are sound overall, with some areas to watch.")),
        Map.entry("tier.mixed", List.of(
            "Strengths and weaknesses roughly offset each other.",
            "The fundamental picture is mixed.")),
        Map.entry("tier.spec", List.of(
            "A speculative profile: the fundamentals do not yet carry the story.",
            "Fundamentals are weak; the case rests on execution still to come.")),
        Map.entry("tier.danger", List.of(
            "Fundamentals are in poor shape.",
            "Most quality checks fail.")),
        Map.entry("burn.narrowing", List.of(
            "Cash burn is narrowing, indicating improved operational efficiency.",
            "The cash deficit is shrinking as operations become more efficient.")),
        Map.entry("burn.accelerating", List.of(
            "Cash burn is accelerating.",
            "The cash deficit is widening.")),
        Map.entry("regime.investment", List.of(
            "Aggressive investment phase: Capital is being deployed into R&D to fuel rapid top-line growth.",
            "Investment phase: Heavy spending is funding rapid revenue growth.")),
        Map.entry("regime.unprofitable", List.of(
            "Unprofitable growth: Revenue is surging, but at the cost of deep cash flow deficits.",
            "Growth is expensive: Revenue is climbing while cash flow stays deeply negative.")),
        Map.entry("regime.mature", List.of(
            "Mature profile: Revenue is soft, but the business generates healthy free cash flow.",
            "Cash generator: Sales are flat to down, yet free cash flow remains healthy.")),
        Map.entry("regime.compounder", List.of(
            "Balanced compounder: Delivering both double-digit growth and healthy cash flows.",
            "Growth with discipline: Double-digit revenue gains come with solid free cash flow.")),
        Map.entry("filings.positive", List.of(
            "Regulatory filings suggest positive underlying momentum.",
            "Recent filings lean positive.")),
        Map.entry("filings.dilution", List.of(
            "Filings indicate potential shareholder dilution.",
            "Recent filings point to possible equity issuance.")),
        Map.entry("filings.negative", List.of(
            "Regulatory filings contain recent risk factors.",
            "Recent filings flag risks worth reading in full.")),
        Map.entry("penny.runway", List.of(
            "Speculative: Extremely short cash runway creates high financing risk.")),
        Map.entry("penny.dilution", List.of(
            "Dilution Risk: Micro-cap structure relying heavily on equity financing.")),
        Map.entry("penny.burn", List.of(
            "Micro-cap profile: High volatility and burn rate.")),
        Map.entry("penny.stable", List.of(
            "Micro-cap profile: Volatility expected, but balance sheet appears stable.")),
        Map.entry("distress", List.of(
            "Financial position appears distressed.",
            "The balance sheet shows signs of distress."))
    );

    private static final int FILING_IMPACT_CAP = 20;

    public Narrative synthesize(FinancialState s, RatingResult rating, List<FilingSignal> signals) {
        List<FilingSignal> safeSignals = signals == null ? List.of() : signals;
        Set<String> sentences = new LinkedHashSet<>();
        String ticker = s.getTicker() == null ? "" : s.getTicker();

        if (rating != null && rating.getTier() != null) {
            sentences.add(pick(ticker, "tier." + rating.getTier().label()));
        }

        double fcfMargin = orZero(s.getFcfMargin());
        double growth = orZero(s.getRevenueGrowthYoY());

        // ── Burn ──────────────────────────────────────────────────────────────
        Double burnTrend = s.getBurnTrend();
        if (isFiniteValue(burnTrend) && burnTrend > 15) {
            sentences.add(pick(ticker, "burn.narrowing"));
        } else if (isFiniteValue(burnTrend) && burnTrend < -15 && fcfMargin < -20) {
            sentences.add(pick(ticker, "burn.accelerating"));
        }

        // ── Regime ────────────────────────────────────────────────────────────
        if (growth > 40 && fcfMargin < 0) {
            boolean rndHeavy = s.isBucket(SectorBucket.BIOTECH) || s.isBucket(SectorBucket.TECH);
            sentences.add(pick(ticker, rndHeavy ? "regime.investment" : "regime.unprofitable"));
        } else if (growth < 0 && fcfMargin > 10) {
            sentences.add(pick(ticker, "regime.mature"));
        } else if (growth > 15 && fcfMargin > 10) {
            sentences.add(pick(ticker, "regime.compounder"));
        }

        // ── Filings ───────────────────────────────────────────────────────────
        long positives = safeSignals.stream().filter(sig -> sig.getScore() > 0).count();
        long negatives = safeSignals.stream().filter(sig -> sig.getScore() < 0).count();
        if (positives > negatives) {
            sentences.add(pick(ticker, "filings.positive"));
        } else if (negatives > positives) {
            boolean dilution = safeSignals.stream().anyMatch(sig -> "dilution_risk".equals(sig.getId()));
            sentences.add(pick(ticker, dilution ? "filings.dilution" : "filings.negative"));
        }

        // ── Penny / distress ──────────────────────────────────────────────────
        if (rating != null && rating.isPennyStock()) {
            Double runway = s.getRunwayYears();
            Double dilution = s.getShareChange() == null ? null : s.getShareChange().changeYoY();
            if (runway != null && runway < 0.75) sentences.add(pick(ticker, "penny.runway"));
            else if (isFiniteValue(dilution) && dilution > 20) sentences.add(pick(ticker, "penny.dilution"));
            else if (fcfMargin < -50) sentences.add(pick(ticker, "penny.burn"));
            else sentences.add(pick(ticker, "penny.stable"));
        } else if (rating != null && rating.getTier() == RatingTier.DANGER) {
            sentences.add(pick(ticker, "distress"));
        }

        int momentum = momentumScore(s, safeSignals);
        List<String> ordered = new ArrayList<>(sentences);
        log.debug("[NARRATIVE] {} | {} sentence(s) | momentum={}", ticker, ordered.size(), momentum);
        return new Narrative(String.join(" ", ordered), List.copyOf(ordered), momentum, momentumLabel(momentum));
    }

    // ── Momentum health ───────────────────────────────────────────────────────

    /** 50 is neutral. Revenue trend and margin trend are percent / percentage points. */
    public static int momentumScore(FinancialState s, List<FilingSignal> signals) {
        int score = 50;
        double revenueTrend = orZero(s.getRevenueTrend());
        double marginTrend = orZero(s.getOperatingMarginTrend());
        double rndTrend = orZero(s.getRndTrend());

        if (revenueTrend > 50) score += 15;
        else if (revenueTrend > 20) score += 10;
        else if (revenueTrend > 5) score += 5;
        else if (revenueTrend < -10) score -= 10;

        if (marginTrend > 5) score += 10;
        else if (marginTrend < -5) score -= 10;

        if ((s.isBucket(SectorBucket.BIOTECH) || s.isBucket(SectorBucket.TECH)) && rndTrend > 10) score += 5;

        int filingScore = signals == null ? 0 : signals.stream().mapToInt(FilingSignal::getScore).sum();
        score += Math.max(-FILING_IMPACT_CAP, Math.min(FILING_IMPACT_CAP, filingScore));

        return Math.max(0, Math.min(100, score));
    }

    public static String momentumLabel(int score) {
        if (score >= 80) return "Strong Momentum";
        if (score >= 60) return "Likely Continuation";
        if (score >= 40) return "Stable / Mixed";
        if (score >= 20) return "Weak / Stalling";
        return "Deteriorating";
    }

    static String pick(String ticker, String key) {
        List<String> pool = POOLS.get(key);
        if (pool == null || pool.isEmpty()) throw new IllegalArgumentException("Unknown narrative pool: " + key);
        return pool.get(Math.floorMod((ticker + ":" + key).hashCode(), pool.size()));
    }
}
