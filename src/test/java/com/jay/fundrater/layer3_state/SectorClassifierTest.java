package com.jay.fundrater.layer3_state;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.model.enums.SectorBucket;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SectorClassifierTest {

    @Test
    void classify_prefersOverrideThenSuppliedThenSic() {
        RaterConfig config = new RaterConfig();
        config.sectors().getTickerOverrides().put("ACME", "Biotech/Pharma");
        SectorClassifier classifier = new SectorClassifier(config);

        assertThat(classifier.classify("acme", "Technology", 7372)).isEqualTo("Biotech/Pharma");
        assertThat(classifier.classify("OTHR", "Technology", 2834)).isEqualTo("Technology");
        assertThat(classifier.classify("OTHR", null, 2834)).isEqualTo("Biotech/Pharma");
        assertThat(classifier.classify("OTHR", " ", null)).isEqualTo(SectorClassifier.DEFAULT_SECTOR);
    }

    @Test
    void sectorFromSic_narrowRangesBeatTheIndustrialBlock() {
        assertThat(SectorClassifier.sectorFromSic(3674)).isEqualTo("Tech/Internet");
        assertThat(SectorClassifier.sectorFromSic(3711)).isEqualTo("Industrial/Cyclical");
        assertThat(SectorClassifier.sectorFromSic(6022)).isEqualTo("Financials");
        assertThat(SectorClassifier.sectorFromSic(6798)).isEqualTo("Real Estate");
        assertThat(SectorClassifier.sectorFromSic(9999)).isNull();
    }

    @Test
    void bucket_resolvesFreeFormSectorNames() {
        SectorClassifier classifier = new SectorClassifier(new RaterConfig());

        assertThat(classifier.bucket("X", "Regional Banks", null)).isEqualTo(SectorBucket.FINANCIALS);
        assertThat(classifier.bucket("X", "Software - Infrastructure", null)).isEqualTo(SectorBucket.TECH);
        assertThat(classifier.bucket("X", null, 5411)).isEqualTo(SectorBucket.RETAIL);
    }
}
