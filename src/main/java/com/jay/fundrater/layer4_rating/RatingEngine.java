package com.jay.fundrater.layer4_rating;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.layer3_state.ProjectionCalculator;
import com.jay.fundrater.layer4_rating.rules.CapitalRules;
import com.jay.fundrater.layer4_rating.rules.GrowthRules;
import com.jay.fundrater.model.Completeness;
import com.jay.fundrater.model.FilingSignal;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.InterestCoverage;
import com.jay.fundrater.model.Projections;
import com.jay.fundrater.model.PricePoint;
import com.jay.fundrater.model.RatingResult;
import com.jay.fundrater.model.RuleOutcome;
import com.jay.fundrater.model.RuleReason;
import com.jay.fundrater.model.ShareChange;
import com.jay.fundrater.model.SplitSignal;
import com.jay.fundrater.model.enums.CoverageStatus;
import com.jay.fundrater.model.enums.RatingTier;
import com.jay.fundrater.model.enums.RuleCategory;
import com.jay.fundrater.model.enums.SectorBucket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;

/**
 * Layer 4 — Rating Engine.
 *
 * Evaluates the rule catalog against one company's financial state and folds in:
 *   1. sector tuning (a multiplier of 0 gates a rule)
 *   2. lifecycle softening for hypergrowth investment phases
 *   3. split / reverse-split handling of the share count
 *   4. penny-stock adjustments, raw caps and the macro-rate penalty
 *   5. the filing-signal contribution and the growth-phase adjustment
 *
 * The raw total is normalized to 0–100, optionally capped for event risk, and bucketed into a tier.
 * Partial data never makes the engine throw: missing rules contribute 0 and are counted in completeness.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RatingEngine {

    private static final Pattern BIO_SECTOR = Pattern.compile("bio|pharma|drug|therap");
    private static final double PENNY_SMALL_REVENUE = 10_000_000;
    private static final double HEAVY_DILUTION_PCT = 50;
    private static final double DEATH_SPIRAL_DILUTION_PCT = 100;
    private static final double PENNY_DILUTION_PCT = 25;
    private static final double HIGH_BURN_FCF_MARGIN = -50;
    private static final int GROUPED_MISSING_THRESHOLD = 2;

    private final RaterConfig config;
    private final GrowthStage growthStage;
    private final EventRiskGuard eventRiskGuard;

    public RatingResult rate(FinancialState s, List<FilingSignal> signals, List<PricePoint> prices) {
        RaterConfig.Rating cfg = config.rating();
        List<String> overrideNotes = new ArrayList<>();
        List<String> missingNotes = new ArrayList<>();

        double intensity = growthStage.intensity(s);
        boolean bio = isBio(s);
        boolean penny = isPenny(s, bio);
        Double dilution = s.getShareChange() == null ? null : s.getShareChange().changeYoY();

        // ── Rules ─────────────────────────────────────────────────────────────
        List<RuleReason> reasons = new ArrayList<>();
        double total = 0;
        int missing = 0;
        int notApplicable = 0;
        int offsetPenalties = 0;
        Map<RuleCategory, List<String>> missingByCategory = new EnumMap<>(RuleCategory.class);

        for (Rule rule : RuleCatalog.rules()) {
            RuleOutcome outcome = evaluate(rule, s);
            outcome = applySectorTuning(rule, outcome, s.getSectorBucket());

            if (!outcome.skipped() && intensity > 0 && growthStage.softens(rule.name())) {
                outcome = outcome.withScore(growthStage.soften(outcome.score(), intensity));
            }
            outcome = applyShareStructure(rule, outcome, s.getShareChange(), overrideNotes);
            if (penny && !outcome.skipped()) {
                outcome = applyPennyAdjustments(rule, outcome, s, bio, dilution, overrideNotes);
            }

            if (outcome.skipped()) {
                missingByCategory.computeIfAbsent(rule.category(), c -> new ArrayList<>()).add(rule.name());
                if (outcome.notApplicable()) notApplicable++;
                else missing++;
            } else {
                total += outcome.score();
                if (outcome.score() < 0 && RuleCatalog.PROFITABILITY_OFFSET_RULES.contains(rule.name())) {
                    offsetPenalties += -outcome.score();
                }
            }
            log.debug("[RULES] {} {} | score={} | {}", s.getTicker(), rule.name(), outcome.score(), outcome.message());
            reasons.add(toReason(rule, outcome, s));
        }

        // ── Raw caps ──────────────────────────────────────────────────────────
        Double runway = s.getRunwayYears();
        Double fcfMargin = s.getFcfMargin();
        if (s.isBucket(SectorBucket.BIOTECH) && runway != null && runway < 1
                && isFiniteValue(fcfMargin) && fcfMargin < -80) {
            total = Math.min(total, 30);
        }
        if (s.isBucket(SectorBucket.TECH) && isFiniteValue(s.getRevenueGrowthYoY()) && s.getRevenueGrowthYoY() < 0
                && isFiniteValue(fcfMargin) && fcfMargin < -10 && isFiniteValue(dilution) && dilution > 10) {
            total = Math.min(total, 45);
        }

        if (isFiniteValue(fcfMargin) && fcfMargin < HIGH_BURN_FCF_MARGIN) {
            overrideNotes.add(String.format(Locale.ROOT,
                "High Cash Burn: Spends ~$%.1f for every $1 of revenue generated.", Math.abs(fcfMargin / 100)));
        }

        // ── Macro ─────────────────────────────────────────────────────────────
        if (cfg.getRiskFreeRatePct() > cfg.getMacroRateThresholdPct()
                && isFiniteValue(s.getNetMargin()) && s.getNetMargin() < 0) {
            total -= cfg.getMacroPenalty();
            overrideNotes.add("Economic Climate: High interest rates make it harder and more expensive "
                + "for unprofitable companies to borrow money.");
        }

        // ── Filing signals ────────────────────────────────────────────────────
        int filingContribution = filingContribution(signals);
        if (filingContribution != 0) {
            total += filingContribution;
            if (filingContribution <= -5) {
                overrideNotes.add(String.format("Regulatory filings signal caution (Net impact: %d pts).", filingContribution));
            } else if (filingContribution >= 3) {
                overrideNotes.add(String.format(
                    "Regulatory filings suggest positive underlying momentum (Net impact: +%d pts).", filingContribution));
            }
        }

        // ── Growth phase ──────────────────────────────────────────────────────
        int phaseAdjustment = growthStage.phaseAdjustment(s, intensity, offsetPenalties);
        if (phaseAdjustment > 0) {
            total += phaseAdjustment;
            overrideNotes.add(String.format(Locale.ROOT,
                "Growth-phase adjustment: +%d pts for scaling investment (intensity %.2f).", phaseAdjustment, intensity));
        }

        // ── Normalize, cap, tier ──────────────────────────────────────────────
        int normalized = ScoreNormalizer.normalize(total, cfg.getRatingMin(), cfg.getRatingMax());
        boolean eventCapped = false;
        if (eventRiskGuard.applies(s, prices)) {
            int capped = eventRiskGuard.cap(normalized);
            eventCapped = capped < normalized;
            normalized = capped;
            overrideNotes.add(String.format(Locale.ROOT,
                "Event risk: price fell %.0f%% over the last %d sessions; score held at %d or below.",
                Math.abs(eventRiskGuard.recentChangePct(prices)), config.eventRisk().getWindowTradingDays(),
                config.eventRisk().getScoreCeiling()));
        }
        RatingTier tier = ScoreNormalizer.tier(normalized);

        // ── Notes ─────────────────────────────────────────────────────────────
        overrideNotes.addAll(contradictions(s));
        missingNotes.addAll(groupMissing(missingByCategory));
        if (s.getDataQuality() != null) missingNotes.addAll(s.getDataQuality().notes());
        String coverageNote = limitedCoverageNote(s);
        if (coverageNote != null) missingNotes.add(coverageNote);

        int totalRules = reasons.size();
        int applicable = totalRules - missing;
        double percent = totalRules == 0 ? 0 : Math.max(0, Math.min(100, applicable * 100.0 / totalRules));

        log.info("[RATING] {} | raw={} | normalized={} | tier={} | penny={} | filings={} | phase=+{}",
            s.getTicker(), total, normalized, tier.label(), penny, filingContribution, phaseAdjustment);

        return RatingResult.builder()
            .rawScore(total)
            .normalizedScore(normalized)
            .tier(tier)
            .reasons(List.copyOf(reasons))
            .completeness(new Completeness(applicable, missing, notApplicable, totalRules, percent))
            .overrideNotes(List.copyOf(overrideNotes))
            .missingNotes(List.copyOf(missingNotes))
            .filingSignalContribution(filingContribution)
            .growthStageIntensity(intensity)
            .growthPhaseAdjustment(phaseAdjustment)
            .eventRiskCapped(eventCapped)
            .pennyStock(penny)
            .ruleCatalogVersion(RuleCatalog.VERSION)
            .build();
    }

    // ── Rule pipeline steps ───────────────────────────────────────────────────

    private RuleOutcome evaluate(Rule rule, FinancialState s) {
        try {
            RuleOutcome outcome = rule.evaluate(s);
            return outcome == null ? RuleOutcome.missing("No result") : outcome;
        } catch (RuntimeException e) {
            log.warn("Rule '{}' failed for {}: {}", rule.name(), s.getTicker(), e.getMessage());
            return RuleOutcome.missing("Evaluation failed");
        }
    }

    RuleOutcome applySectorTuning(Rule rule, RuleOutcome outcome, SectorBucket bucket) {
        if (bucket == null) return outcome;
        Map<String, Double> multipliers = config.rating().getSectorTuning().get(bucket.label());
        if (multipliers == null) return outcome;
        Double multiplier = multipliers.get(rule.name());
        if (multiplier == null || multiplier == 1.0) return outcome;
        if (multiplier == 0) return RuleOutcome.notApplicable("Not applicable (" + bucket.label() + " tuning)");
        if (outcome.skipped()) return outcome;
        return outcome.withScore((int) Math.round(outcome.score() * multiplier));
    }

    private RuleOutcome applyShareStructure(Rule rule, RuleOutcome outcome, ShareChange shares, List<String> notes) {
        if (shares == null) return outcome;
        if (rule == CapitalRules.SHARE_DILUTION) {
            if (shares.likelySplit()) {
                SplitSignal split = shares.split();
                notes.add(String.format(Locale.ROOT,
                    "Likely split: share count x%.1f while EPS moved inversely; dilution not scored.", split.sharesRatio()));
                return RuleOutcome.notApplicable(String.format(Locale.ROOT,
                    "Likely split (shares x%.1f, EPS x%.2f)", split.sharesRatio(), split.epsRatio()));
            }
            if (shares.likelyReverseSplit()) {
                SplitSignal reverse = shares.reverseSplit();
                notes.add("Likely reverse split: treated as dilution risk.");
                return RuleOutcome.scored(config.rating().getReverseSplitPenalty(), String.format(Locale.ROOT,
                    "Likely reverse split (1-for-%.0f); dilution risk", reverse.sharesRatio()));
            }
        }
        // a reverse split is not a buyback
        if (rule == CapitalRules.CAPITAL_RETURN && shares.likelyReverseSplit() && !outcome.skipped()) {
            return outcome.withScore(Math.min(outcome.score(), 0));
        }
        return outcome;
    }

    private RuleOutcome applyPennyAdjustments(Rule rule, RuleOutcome outcome, FinancialState s, boolean bio,
                                              Double dilution, List<String> notes) {
        if (rule == GrowthRules.REVENUE_GROWTH) {
            Double growth = s.getRevenueGrowthYoY();
            if (!isFiniteValue(growth) || growth <= 15) return outcome;
            Double revenue = s.getRevenue();
            if (isFiniteValue(revenue) && revenue < PENNY_SMALL_REVENUE) {
                return new RuleOutcome((int) Math.round(outcome.score() / 2.0),
                    outcome.message() + " - Early-Stage Surge (low base)", false, false);
            }
            return outcome.withMessage(outcome.message() + " - Growth from a low base; sustainability uncertain.");
        }
        if (rule == CapitalRules.SHARE_DILUTION && isFiniteValue(dilution) && !bio) {
            RuleOutcome adjusted = outcome;
            if (dilution > HEAVY_DILUTION_PCT) {
                adjusted = new RuleOutcome(Math.min(outcome.score(), -Math.max(12, rule.weight())),
                    outcome.message() + " - Heavy dilution suggests continuous equity raises; "
                        + "survival depends on external capital.", false, false);
            }
            if (dilution > DEATH_SPIRAL_DILUTION_PCT) {
                notes.add("Death Spiral Dilution Risk flagged (share count more than doubled YoY).");
            }
            return adjusted;
        }
        return outcome;
    }

    private RuleReason toReason(Rule rule, RuleOutcome outcome, FinancialState s) {
        String basis = rule.basis();
        if (Rule.BASIS_TTM.equals(basis)) basis = s.getTtm() == null ? null : s.getTtm().basis().wireName();
        String explanation = outcome.skipped() ? null : RuleExplanations.explain(rule.name(), outcome.score());
        return new RuleReason(rule.name(), rule.weight(), rule.category(), outcome.score(), outcome.message(),
            outcome.missing(), outcome.notApplicable(), basis, explanation);
    }

    // ── Classification ────────────────────────────────────────────────────────

    static boolean isBio(FinancialState s) {
        if (s.isBucket(SectorBucket.BIOTECH)) return true;
        return s.isBucket(SectorBucket.OTHER) && s.getSector() != null
            && BIO_SECTOR.matcher(s.getSector().toLowerCase(Locale.ROOT)).find();
    }

    boolean isPenny(FinancialState s, boolean bio) {
        RaterConfig.Rating cfg = config.rating();
        Double price = s.getLastPrice();
        Double cap = s.getMarketCap();
        Double dilution = s.getShareChange() == null ? null : s.getShareChange().changeYoY();
        Double runway = s.getRunwayYears();
        return (!bio && isFiniteValue(price) && price < cfg.getPennyPriceThreshold())
            || (!bio && isFiniteValue(cap) && cap > 0 && cap < cfg.getPennyMarketCap())
            || (bio && isFiniteValue(cap) && cap > 0 && cap < cfg.getPennyBiotechMarketCap())
            || (isFiniteValue(dilution) && dilution > PENNY_DILUTION_PCT)
            || (runway != null && runway < 1);
    }

    static int filingContribution(List<FilingSignal> signals) {
        if (signals == null) return 0;
        return signals.stream().filter(FilingSignal::isIncludeInScore).mapToInt(FilingSignal::getScore).sum();
    }

    // ── Notes ─────────────────────────────────────────────────────────────────

    private static List<String> contradictions(FinancialState s) {
        List<String> notes = new ArrayList<>();
        Projections projections = ProjectionCalculator.compute(s);
        Double opMargin = s.getOperatingMargin();
        if (isFiniteValue(opMargin) && opMargin < -50 && projections.bankruptcyRiskScore() <= 0.3) {
            Double cash = s.getCash();
            String cashText = cash == null ? "AMPLE"
                : cash > 1e9 ? String.format(Locale.ROOT, "$%.1fB", cash / 1e9)
                : cash > 1e6 ? String.format(Locale.ROOT, "$%.0fM", cash / 1e6)
                : "AMPLE";
            notes.add(String.format(Locale.ROOT,
                "Despite heavy operating losses (%.0f%%), the strong cash position (%s) secures a 'Low' bankruptcy risk rating.",
                opMargin, cashText));
        }
        Double growth = s.getRevenueGrowthYoY();
        if (isFiniteValue(growth) && growth > 50 && "Declining".equals(projections.deteriorationLabel())) {
            notes.add(String.format(Locale.ROOT,
                "Revenue is surging (%.0f%%), but fundamental efficiency is deteriorating.", growth));
        }
        return notes;
    }

    static List<String> groupMissing(Map<RuleCategory, List<String>> byCategory) {
        List<String> notes = new ArrayList<>();
        for (RuleCategory category : RuleCategory.values()) {
            List<String> names = byCategory.getOrDefault(category, List.of());
            if (names.size() > GROUPED_MISSING_THRESHOLD) {
                notes.add(category == RuleCategory.VALUATION
                    ? "Valuation blindspot: P/E, P/S, and other ratios unavailable (likely negative earnings)."
                    : String.format("%s data limited (%d metrics missing).", category.label(), names.size()));
            } else {
                names.forEach(name -> notes.add(name + ": Data unavailable"));
            }
        }
        return notes;
    }

    private static String limitedCoverageNote(FinancialState s) {
        InterestCoverage coverage = s.getInterestCoverage();
        if (coverage == null || coverage.status() != CoverageStatus.COMPUTED || coverage.periods() >= 4) return null;
        String unit = s.isAnnualMode() ? "fiscal year(s)" : "quarter(s)";
        return String.format("Interest coverage based on %d %s of data.", coverage.periods(), unit);
    }
}
