package com.jay.fundrater.layer2_filings.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.fundrater.model.FilingScanMeta;
import com.jay.fundrater.model.FilingSignal;
import com.jay.fundrater.model.enums.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileSignalCacheTest {

    @TempDir
    Path dataDir;

    @Test
    void store_keepsOtherFieldsOfTheFundamentalsDocument() throws Exception {
        Files.writeString(dataDir.resolve("ACME-fundamentals.json"),
            "{\"ticker\":\"ACME\",\"periods\":[{\"periodEnd\":\"2025-03-31\",\"periodType\":\"quarter\",\"revenue\":10}]}");

        new JsonFileSignalCache(dataDir).store("acme", entry());

        JsonNode root = new ObjectMapper().readTree(dataDir.resolve("ACME-fundamentals.json").toFile());
        assertThat(root.get("periods")).hasSize(1);
        assertThat(root.get("filingSignals").get(0).get("id").asText()).isEqualTo("going_concern");
        assertThat(root.get("filingSignalsScannerVersion").asText()).isEqualTo("3");
        assertThat(root.get("filingSignalsDepth").asInt()).isEqualTo(3);
    }

    @Test
    void load_readsBackWhatAnotherInstanceStored() {
        new JsonFileSignalCache(dataDir).store("ACME", entry());

        Optional<CachedSignals> loaded = new JsonFileSignalCache(dataDir).load("ACME");

        assertThat(loaded).isPresent();
        assertThat(loaded.get().signals()).extracting(FilingSignal::getId).containsExactly("going_concern");
        assertThat(loaded.get().signals().get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(loaded.get().meta().getLatestFiled()).isEqualTo(LocalDate.of(2025, 3, 1));
        assertThat(loaded.get().cachedAt()).isEqualTo(Instant.parse("2025-03-02T00:00:00Z"));
    }

    @Test
    void load_missingOrCorruptDocumentIsAMiss() throws Exception {
        JsonFileSignalCache cache = new JsonFileSignalCache(dataDir);
        assertThat(cache.load("NONE")).isEmpty();

        Files.writeString(dataDir.resolve("BAD-fundamentals.json"), "{not json");
        assertThat(cache.load("BAD")).isEmpty();
    }

    private static CachedSignals entry() {
        FilingSignal signal = FilingSignal.builder()
            .id("going_concern").title("Going-Concern Warning").score(-10).severity(Severity.CRITICAL)
            .snippet("substantial doubt").form("10-K").filed(LocalDate.of(2025, 3, 1)).accession("a-1")
            .build();
        FilingScanMeta meta = FilingScanMeta.builder().latestForm("10-K").latestFiled(LocalDate.of(2025, 3, 1))
            .latestAccession("a-1").filingsScanned(1).build();
        return new CachedSignals(List.of(signal), meta, Instant.parse("2025-03-02T00:00:00Z"), "3", 3);
    }
}
