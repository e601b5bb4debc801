package com.jay.fundrater.layer4_rating;

import java.util.Locale;

/**
 * Threshold tables used by the rules.
 * Bands are listed from the highest floor down; the first band whose floor the value reaches wins,
 * and a value below every floor takes the last band's score.
 */
public final class Bands {

    public record Band(double min, int score) {}

    private Bands() {
    }

    public static Band at(double min, int score) {
        return new Band(min, score);
    }

    public static int score(double value, Band... bands) {
        for (Band band : bands) {
            if (value >= band.min()) return band.score();
        }
        return bands.length == 0 ? 0 : bands[bands.length - 1].score();
    }

    // ── Formatting ────────────────────────────────────────────────────────────

    public static String pct(Double value) {
        if (value == null || !Double.isFinite(value)) return "n/a";
        return String.format(Locale.ROOT, "%.2f%%", value);
    }

    public static String ratio(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "fx", value);
    }

    public static String money(Double value) {
        if (value == null || !Double.isFinite(value)) return "n/a";
        double abs = Math.abs(value);
        if (abs >= 1e12) return String.format(Locale.ROOT, "$%.2fT", value / 1e12);
        if (abs >= 1e9)  return String.format(Locale.ROOT, "$%.2fB", value / 1e9);
        if (abs >= 1e6)  return String.format(Locale.ROOT, "$%.2fM", value / 1e6);
        if (abs >= 1e3)  return String.format(Locale.ROOT, "$%.1fK", value / 1e3);
        return String.format(Locale.ROOT, "$%.0f", value);
    }
}
