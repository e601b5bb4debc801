package com.jay.fundrater.layer3_state;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fintechs report like banks but grow like software companies, so several rules band them separately.
 * A company counts as one if its ticker is on the configured list, or its name or industry text matches.
 */
public final class FintechDetector {

    private static final Pattern NAME = Pattern.compile(
        "sofi|upstart|affirm|square|paypal|lendingclub|robinhood|chime|coinbase", Pattern.CASE_INSENSITIVE);
    private static final Pattern INDUSTRY = Pattern.compile(
        "fintech|digital.?bank|neo.?bank|online.?lend|peer.?to.?peer|payment.?platform|mobile.?pay",
        Pattern.CASE_INSENSITIVE);

    private FintechDetector() {
    }

    public static boolean isFintech(String ticker, String companyName, String sector, String sicDescription,
                                    Collection<String> knownTickers) {
        if (ticker != null && knownTickers.contains(ticker.trim().toUpperCase(Locale.ROOT))) return true;
        if (companyName != null && NAME.matcher(companyName).find()) return true;
        if (sector != null && INDUSTRY.matcher(sector).find()) return true;
        return sicDescription != null && INDUSTRY.matcher(sicDescription).find();
    }
}
