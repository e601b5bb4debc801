package com.jay.fundrater.model;

/**
 * Forward-looking heuristics derived from recent slopes.
 * Risk scores are in [0,1]; labels are Low / Medium / High.
 */
public record Projections(String businessTrendLabel,
                          String deteriorationLabel,
                          double growthContinuationScore,
                          double dilutionRiskScore,
                          String dilutionRiskLabel,
                          double bankruptcyRiskScore,
                          String bankruptcyRiskLabel) {

    public static String riskLabel(double score) {
        if (score < 0.3) return "Low";
        if (score < 0.6) return "Medium";
        return "High";
    }
}
