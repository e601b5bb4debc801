package com.jay.fundrater.layer4_rating;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.model.FinancialState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;

/**
 * Lifecycle-stage heuristics for companies that are deliberately loss-making while they scale.
 *
 * Intensity is the mean of three linear ramps, each clamped to [0,1]: revenue growth, FCF burn
 * (negative FCF margin) and capex over revenue. Small caps always have intensity 0.
 */
@Component
@RequiredArgsConstructor
public class GrowthStage {

    private final RaterConfig config;

    public boolean isMidOrLarge(FinancialState s) {
        RaterConfig.GrowthStage cfg = config.growthStage();
        Double assets = s.getTotalAssets();
        Double cap = s.getMarketCap();
        boolean byAssets = isFiniteValue(assets) && assets >= cfg.getMidAssetsFloor() && assets < cfg.getMidAssetsCeiling();
        boolean byCap = isFiniteValue(cap) && cap >= cfg.getMidMarketCapFloor() && cap < cfg.getMidMarketCapCeiling();
        return byAssets || byCap;
    }

    public double intensity(FinancialState s) {
        if (!isMidOrLarge(s)) return 0;
        RaterConfig.GrowthStage cfg = config.growthStage();
        double growth = ramp(s.getRevenueGrowthYoY(), cfg.getRevenueGrowthFloorPct(), cfg.getRevenueGrowthFullPct());
        double burn = ramp(s.getFcfMargin() == null ? null : -s.getFcfMargin(), cfg.getBurnFloorPct(), cfg.getBurnFullPct());
        double capex = ramp(s.getCapexToRevenue(), cfg.getCapexFloorPct(), cfg.getCapexFullPct());
        return (growth + burn + capex) / 3;
    }

    public boolean isHypergrowth(double intensity) {
        return intensity >= config.growthStage().getIntensityThreshold();
    }

    public boolean softens(String ruleName) {
        return config.growthStage().getSoftenedRules().contains(ruleName);
    }

    /** Scales a penalty down by intensity; in the hypergrowth band it never goes below the configured floor. */
    public int soften(int score, double intensity) {
        if (score >= 0 || intensity <= 0) return score;
        RaterConfig.GrowthStage cfg = config.growthStage();
        int softened = (int) Math.round(score * (1 - intensity * cfg.getSofteningStrength()));
        if (isHypergrowth(intensity)) softened = Math.max(softened, cfg.getHypergrowthPenaltyFloor());
        return softened;
    }

    /**
     * Bonus for a mid/large company in a hypergrowth investment phase, capped at a share of the
     * profitability penalties it offsets.
     *
     * @param offsetPenalties absolute sum of the negative profitability scores
     */
    public int phaseAdjustment(FinancialState s, double intensity, int offsetPenalties) {
        if (!isMidOrLarge(s) || !isHypergrowth(intensity)) return 0;
        Double growth = s.getRevenueGrowthYoY();
        if (!isFiniteValue(growth)) return 0;
        int base = growth >= 80 ? 12 : growth >= 50 ? 10 : growth >= 30 ? 8 : 0;
        int bonus = (int) Math.round(base * intensity);
        int cap = (int) Math.floor(offsetPenalties * config.growthStage().getMaxRecoveryShare());
        return Math.max(0, Math.min(bonus, cap));
    }

    static double ramp(Double value, double floor, double full) {
        if (!isFiniteValue(value) || full <= floor) return 0;
        return Math.max(0, Math.min(1, (value - floor) / (full - floor)));
    }
}
