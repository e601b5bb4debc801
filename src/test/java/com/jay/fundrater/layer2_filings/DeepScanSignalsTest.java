package com.jay.fundrater.layer2_filings;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.model.FilingDocument;
import com.jay.fundrater.model.FilingSignal;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DeepScanSignalsTest {

    private static final LocalDate AS_OF = LocalDate.of(2025, 6, 30);

    private final DeepScanSignals deepScan = new DeepScanSignals(new RaterConfig());

    @Test
    void amendments_flagsRecentAmendedReports() {
        FilingSignal signal = deepScan.amendments(List.of(
            doc("10-K/A", "2024-04-02", null),
            doc("10-Q/A", "2025-01-15", null),
            doc("10-Q", "2025-05-01", null)), AS_OF);

        assertThat(signal).isNotNull();
        assertThat(signal.getId()).isEqualTo(FilingSignalCatalog.AMENDED_FILINGS);
        assertThat(signal.getScore()).isEqualTo(-3);
        assertThat(signal.getFiled()).isEqualTo(LocalDate.of(2025, 1, 15));
        assertThat(signal.getSnippet()).startsWith("2 amended");
    }

    @Test
    void amendments_ignoresAmendmentsOutsideLookback() {
        assertThat(deepScan.amendments(List.of(doc("10-K/A", "2021-04-02", null)), AS_OF)).isNull();
    }

    @Test
    void insiderPattern_strongBuyingScoresFour() {
        FilingSignal signal = deepScan.insiderPattern(form4s("P", 3, "S", 1), AS_OF);

        assertThat(signal.getId()).isEqualTo(FilingSignalCatalog.INSIDER_BUYING);
        assertThat(signal.getScore()).isEqualTo(4);
        assertThat(signal.isIncludeInScore()).isTrue();
    }

    @Test
    void insiderPattern_singleNetBuyScoresTwo() {
        FilingSignal signal = deepScan.insiderPattern(form4s("P", 1, "S", 0), AS_OF);

        assertThat(signal.getScore()).isEqualTo(2);
    }

    @Test
    void insiderPattern_heavySellingIsInformationalOnly() {
        FilingSignal signal = deepScan.insiderPattern(form4s("P", 1, "S", 4), AS_OF);

        assertThat(signal.getId()).isEqualTo(FilingSignalCatalog.INSIDER_SELLING);
        assertThat(signal.isIncludeInScore()).isFalse();
    }

    @Test
    void insiderPattern_balancedOrStaleActivityIsNothing() {
        assertThat(deepScan.insiderPattern(form4s("P", 2, "S", 2), AS_OF)).isNull();
        assertThat(deepScan.insiderPattern(List.of(doc("4", "2024-01-10", "P")), AS_OF)).isNull();
    }

    @Test
    void derive_combinesBothSignals() {
        List<FilingDocument> metadata = new ArrayList<>(form4s("P", 3, "S", 0));
        metadata.add(doc("10-K/A", "2025-02-01", null));

        assertThat(deepScan.derive(metadata, AS_OF)).extracting(FilingSignal::getId)
            .containsExactly(FilingSignalCatalog.AMENDED_FILINGS, FilingSignalCatalog.INSIDER_BUYING);
    }

    private static List<FilingDocument> form4s(String code1, int n1, String code2, int n2) {
        List<FilingDocument> docs = new ArrayList<>();
        for (int i = 0; i < n1; i++) docs.add(doc("4", "2025-05-0" + (i + 1), code1));
        for (int i = 0; i < n2; i++) docs.add(doc("4", "2025-06-0" + (i + 1), code2));
        return docs;
    }

    private static FilingDocument doc(String form, String filed, String code) {
        return FilingDocument.builder().form(form).filed(LocalDate.parse(filed)).transactionCode(code).build();
    }
}
