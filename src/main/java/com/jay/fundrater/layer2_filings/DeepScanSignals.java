package com.jay.fundrater.layer2_filings;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.model.FilingDocument;
import com.jay.fundrater.model.FilingSignal;
import com.jay.fundrater.model.enums.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Signals read from filing metadata rather than text, produced only by a deep scan:
 * a history of amended 10-K/10-Q reports, and the recent balance of insider open-market buys and sales.
 */
@Component
@RequiredArgsConstructor
public class DeepScanSignals {

    /** Form types listed in addition to the regular forms when a deep scan is requested. */
    public static final List<String> METADATA_FORMS = List.of("10-K/A", "10-Q/A", "4");

    private final RaterConfig config;

    public List<FilingSignal> derive(List<FilingDocument> metadata, LocalDate asOf) {
        List<FilingSignal> signals = new ArrayList<>();
        FilingSignal amended = amendments(metadata, asOf);
        if (amended != null) signals.add(amended);
        FilingSignal insider = insiderPattern(metadata, asOf);
        if (insider != null) signals.add(insider);
        return signals;
    }

    FilingSignal amendments(List<FilingDocument> metadata, LocalDate asOf) {
        LocalDate since = asOf.minusYears(config.scanner().getAmendmentLookbackYears());
        List<FilingDocument> amended = metadata.stream()
            .filter(FilingDocument::isAmendment)
            .filter(f -> f.getFiled() != null && !f.getFiled().isBefore(since))
            .toList();
        if (amended.isEmpty()) return null;
        FilingDocument latest = amended.stream()
            .max((a, b) -> a.getFiled().compareTo(b.getFiled()))
            .orElseThrow();
        return FilingSignal.builder()
            .id(FilingSignalCatalog.AMENDED_FILINGS)
            .title("Amended Filing History")
            .score(-3)
            .severity(Severity.WARNING)
            .snippet(String.format("%d amended periodic report(s) filed since %s; latest %s on %s.",
                amended.size(), since, latest.getForm(), latest.getFiled()))
            .form(latest.getForm())
            .filed(latest.getFiled())
            .docUrl(latest.getDocUrl())
            .accession(latest.getAccession())
            .cik(latest.getCik())
            .build();
    }

    /**
     * Counts Form 4 open-market purchases (code P) and sales (code S).
     * One net buy is enough for a small credit; selling only registers when it clearly dominates and is never scored.
     */
    FilingSignal insiderPattern(List<FilingDocument> metadata, LocalDate asOf) {
        LocalDate since = asOf.minusDays(config.scanner().getInsiderLookbackDays());
        int buys = 0;
        int sells = 0;
        for (FilingDocument f : metadata) {
            if (!f.isInsiderTransaction() || f.getFiled() == null || f.getFiled().isBefore(since)) continue;
            String code = f.getTransactionCode() == null ? "" : f.getTransactionCode().trim().toUpperCase(Locale.ROOT);
            if (code.equals("P")) buys++;
            else if (code.equals("S")) sells++;
        }
        String summary = String.format("%d insider purchase(s) vs %d sale(s) in the last %d days.",
            buys, sells, config.scanner().getInsiderLookbackDays());

        if (buys > 0 && buys > sells) {
            int score = buys >= 3 && buys >= 2 * sells ? 4 : 2;
            return FilingSignal.builder()
                .id(FilingSignalCatalog.INSIDER_BUYING)
                .title("Insider Buying")
                .score(score)
                .severity(Severity.INFO)
                .snippet(summary)
                .form("4")
                .build();
        }
        if (sells >= 3 && sells > 2 * buys) {
            return FilingSignal.builder()
                .id(FilingSignalCatalog.INSIDER_SELLING)
                .title("Insider Selling")
                .score(-2)
                .severity(Severity.INFO)
                .snippet(summary)
                .form("4")
                .includeInScore(false)
                .build();
        }
        return null;
    }
}
