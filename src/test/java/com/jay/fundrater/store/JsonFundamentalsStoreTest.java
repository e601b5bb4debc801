package com.jay.fundrater.store;

import com.jay.fundrater.model.TickerDataset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFundamentalsStoreTest {

    @TempDir
    Path dataDir;

    @Test
    void load_readsDocumentAndIgnoresCacheFields() throws Exception {
        Files.writeString(dataDir.resolve("ACME-fundamentals.json"), """
            {
              "companyName": "Acme Corp",
              "sector": "Technology",
              "sic": 7372,
              "periods": [
                {"periodEnd": "2024-12-31", "periodType": "quarter", "revenue": 100}
              ],
              "prices": [{"date": "2025-01-02", "close": 12.5}],
              "filingSignals": [],
              "filingSignalsScannerVersion": "3"
            }
            """);

        Optional<TickerDataset> dataset = new JsonFundamentalsStore(dataDir).load("acme");

        assertThat(dataset).isPresent();
        assertThat(dataset.get().getTicker()).isEqualTo("ACME");
        assertThat(dataset.get().getSic()).isEqualTo(7372);
        assertThat(dataset.get().getPeriods()).hasSize(1);
        assertThat(dataset.get().getPrices().get(0).close()).isEqualTo(12.5);
    }

    @Test
    void load_missingOrBrokenDocumentIsEmpty() throws Exception {
        JsonFundamentalsStore store = new JsonFundamentalsStore(dataDir);
        Files.writeString(dataDir.resolve("BAD-fundamentals.json"), "[1, 2");

        assertThat(store.load("NONE")).isEmpty();
        assertThat(store.load("BAD")).isEmpty();
    }

    @Test
    void tickers_listsDocumentsInOrder() throws Exception {
        Files.writeString(dataDir.resolve("ZZZ-fundamentals.json"), "{}");
        Files.writeString(dataDir.resolve("AAA-fundamentals.json"), "{}");
        Files.writeString(dataDir.resolve("notes.txt"), "x");

        assertThat(new JsonFundamentalsStore(dataDir).tickers()).containsExactly("AAA", "ZZZ");
        assertThat(new JsonFundamentalsStore(dataDir.resolve("missing")).tickers()).isEmpty();
    }
}
