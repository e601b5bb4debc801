package com.jay.fundrater.model;

import com.jay.fundrater.model.enums.RatingTier;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Composite rating for one company. Recomputed per request, never persisted. */
@Value
@Builder
public class RatingResult {

    double           rawScore;
    int              normalizedScore;
    RatingTier       tier;
    List<RuleReason> reasons;
    Completeness     completeness;
    List<String>     overrideNotes;
    List<String>     missingNotes;

    // ── Contributions outside the rule catalog ────────────────────────────────
    int     filingSignalContribution;
    double  growthStageIntensity;
    int     growthPhaseAdjustment;
    boolean eventRiskCapped;
    boolean pennyStock;
    String  ruleCatalogVersion;

    public String tierLabel() {
        return tier.label();
    }
}
