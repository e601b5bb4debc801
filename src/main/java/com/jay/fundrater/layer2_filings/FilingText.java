package com.jay.fundrater.layer2_filings;

import java.util.regex.Pattern;

/** Plain-text helpers for filing documents. */
public final class FilingText {

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FilingText() {
    }

    /** Replaces every markup tag with a space and collapses runs of whitespace. */
    public static String stripTags(String html) {
        if (html == null || html.isEmpty()) return "";
        String withoutTags = TAG.matcher(html).replaceAll(" ");
        return WHITESPACE.matcher(withoutTags).replaceAll(" ").trim();
    }

    /** {@code text[index - radius, index + radius)}, clipped to the text bounds. */
    public static String window(String text, int index, int radius) {
        int start = Math.max(0, index - radius);
        int end = Math.min(text.length(), index + radius);
        return text.substring(start, end);
    }

    /** The {@code length} characters before {@code index}. */
    public static String preceding(String text, int index, int length) {
        return text.substring(Math.max(0, index - length), index);
    }
}
