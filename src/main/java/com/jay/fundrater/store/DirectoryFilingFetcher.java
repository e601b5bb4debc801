package com.jay.fundrater.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.fundrater.config.JsonMappers;
import com.jay.fundrater.layer2_filings.FilingFetcher;
import com.jay.fundrater.layer2_filings.InlineFilingFetcher;
import com.jay.fundrater.model.FilingDocument;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Serves pre-fetched filings of one ticker from disk:
 * <pre>
 *   {filingsDir}/{TICKER}/index.json      array of filing metadata
 *   {filingsDir}/{TICKER}/{accession}.txt  filing text (.htm and .html are also tried)
 * </pre>
 * A ticker without a directory simply has no filings.
 */
public class DirectoryFilingFetcher implements FilingFetcher {

    private static final List<String> EXTENSIONS = List.of(".txt", ".htm", ".html");

    private final Path tickerDir;
    private final ObjectMapper mapper = JsonMappers.documentMapper();

    public DirectoryFilingFetcher(Path filingsDir, String ticker) {
        this.tickerDir = filingsDir.resolve(ticker.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public List<FilingDocument> recentFilings(String ticker, List<String> forms, int limit) throws IOException {
        Path index = tickerDir.resolve("index.json");
        if (!Files.exists(index)) return List.of();
        List<FilingDocument> all = mapper.readValue(index.toFile(), new TypeReference<List<FilingDocument>>() {});
        return all.stream()
            .filter(f -> InlineFilingFetcher.matchesForm(f, forms))
            .sorted(Comparator.comparing(FilingDocument::getFiled, Comparator.nullsLast(Comparator.reverseOrder())))
            .limit(limit)
            .toList();
    }

    @Override
    public String fetchText(FilingDocument filing) throws IOException {
        if (filing.getText() != null) return filing.getText();
        if (filing.getAccession() == null) throw new IOException("Filing has no accession number");
        for (String ext : EXTENSIONS) {
            Path file = tickerDir.resolve(filing.getAccession() + ext);
            if (Files.exists(file)) return Files.readString(file, StandardCharsets.UTF_8);
        }
        throw new IOException("No text on disk for " + filing.getForm() + " " + filing.getAccession());
    }
}
