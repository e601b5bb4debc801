package com.jay.fundrater.store;

import com.jay.fundrater.model.FilingDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryFilingFetcherTest {

    @TempDir
    Path filingsDir;

    private DirectoryFilingFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        Path tickerDir = Files.createDirectories(filingsDir.resolve("ACME"));
        Files.writeString(tickerDir.resolve("index.json"), """
            [
              {"form": "10-Q", "filed": "2024-11-05", "accession": "q3"},
              {"form": "10-K", "filed": "2025-02-20", "accession": "fy"},
              {"form": "4", "filed": "2025-03-01", "accession": "f4", "transactionCode": "P"},
              {"form": "8-K", "filed": "2025-01-10", "accession": "ek"}
            ]
            """);
        Files.writeString(tickerDir.resolve("fy.txt"), "annual report text");
        Files.writeString(tickerDir.resolve("q3.htm"), "<p>quarterly</p>");
        fetcher = new DirectoryFilingFetcher(filingsDir, "acme");
    }

    @Test
    void recentFilings_filtersFormsNewestFirstWithLimit() throws Exception {
        List<FilingDocument> filings = fetcher.recentFilings("ACME", List.of("10-K", "10-Q", "8-K"), 2);

        assertThat(filings).extracting(FilingDocument::getAccession).containsExactly("fy", "ek");
    }

    @Test
    void fetchText_triesKnownExtensions() throws Exception {
        List<FilingDocument> filings = fetcher.recentFilings("ACME", List.of("10-K", "10-Q"), 5);

        assertThat(fetcher.fetchText(filings.get(0))).isEqualTo("annual report text");
        assertThat(fetcher.fetchText(filings.get(1))).isEqualTo("<p>quarterly</p>");
    }

    @Test
    void fetchText_missingFileIsAnIoError() throws Exception {
        FilingDocument eightK = fetcher.recentFilings("ACME", List.of("8-K"), 1).get(0);

        assertThatThrownBy(() -> fetcher.fetchText(eightK)).isInstanceOf(IOException.class).hasMessageContaining("ek");
    }

    @Test
    void recentFilings_unknownTickerHasNone() throws Exception {
        assertThat(new DirectoryFilingFetcher(filingsDir, "NOPE").recentFilings("NOPE", List.of("10-K"), 3)).isEmpty();
    }
}
