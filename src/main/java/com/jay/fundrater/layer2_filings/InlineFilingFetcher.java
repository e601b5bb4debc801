package com.jay.fundrater.layer2_filings;

import com.jay.fundrater.model.FilingDocument;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/** Serves filings supplied directly with a rating request. */
public class InlineFilingFetcher implements FilingFetcher {

    private final List<FilingDocument> filings;

    public InlineFilingFetcher(List<FilingDocument> filings) {
        this.filings = filings == null ? List.of() : List.copyOf(filings);
    }

    @Override
    public List<FilingDocument> recentFilings(String ticker, List<String> forms, int limit) {
        return filings.stream()
            .filter(f -> matchesForm(f, forms))
            .sorted(Comparator.comparing(FilingDocument::getFiled, Comparator.nullsLast(Comparator.reverseOrder())))
            .limit(limit)
            .toList();
    }

    @Override
    public String fetchText(FilingDocument filing) throws IOException {
        if (filing.getText() == null) {
            throw new IOException("No text supplied for " + filing.getForm() + " " + filing.getAccession());
        }
        return filing.getText();
    }

    public static boolean matchesForm(FilingDocument filing, List<String> forms) {
        if (filing.getForm() == null) return false;
        String form = filing.getForm().trim().toUpperCase(Locale.ROOT);
        return forms.stream().anyMatch(f -> f.equalsIgnoreCase(form));
    }
}
