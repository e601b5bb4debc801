package com.jay.fundrater.layer1_normalize;

/**
 * Numeric helpers shared by every layer.
 * A value is "present" only if {@link #isFiniteValue(Double)} says so; callers never test for null or NaN themselves.
 */
public final class FinancialMath {

    private FinancialMath() {
    }

    public static boolean isFiniteValue(Double value) {
        return value != null && Double.isFinite(value);
    }

    /** Accepts numbers or numeric strings ("1,234.5", " 12 "); anything else, including NaN and infinities, is null. */
    public static Double toNumber(Object raw) {
        if (raw == null) return null;
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof String s) {
            String cleaned = s.trim().replace(",", "");
            if (cleaned.isEmpty()) return null;
            try {
                value = Double.parseDouble(cleaned);
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    /** Percent change from {@code prior} to {@code now}, measured against |prior|. */
    public static Double pctChange(Double now, Double prior) {
        if (!isFiniteValue(now) || !isFiniteValue(prior) || prior == 0) return null;
        return (now - prior) / Math.abs(prior) * 100;
    }

    /** {@code numerator / denominator} as a percentage. */
    public static Double margin(Double numerator, Double denominator) {
        Double ratio = safeDiv(numerator, denominator);
        return ratio == null ? null : ratio * 100;
    }

    public static Double safeDiv(Double numerator, Double denominator) {
        if (!isFiniteValue(numerator) || !isFiniteValue(denominator) || denominator == 0) return null;
        double result = numerator / denominator;
        return Double.isFinite(result) ? result : null;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /** Compound annual growth in percent; null unless both ends are positive. */
    public static Double cagr(Double end, Double start, double years) {
        if (!isFiniteValue(end) || !isFiniteValue(start) || start <= 0 || end <= 0 || years <= 0) return null;
        return (Math.pow(end / start, 1.0 / years) - 1) * 100;
    }

    public static double orZero(Double value) {
        return isFiniteValue(value) ? value : 0;
    }

    /** Sum of the present values; null when none is present. */
    public static Double sumPresent(Double... values) {
        double sum = 0;
        boolean any = false;
        for (Double v : values) {
            if (isFiniteValue(v)) {
                sum += v;
                any = true;
            }
        }
        return any ? sum : null;
    }
}
