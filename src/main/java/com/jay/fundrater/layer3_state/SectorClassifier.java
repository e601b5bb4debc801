package com.jay.fundrater.layer3_state;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.model.enums.SectorBucket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Layer 3 — Sector Classifier.
 * Resolution order: per-ticker override from config, the sector string supplied with the data,
 * the SIC code range table, and finally "Other".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SectorClassifier {

    public static final String DEFAULT_SECTOR = "Other";

    private record SicRange(String sector, int min, int max) {}

    // first matching range wins, so the narrow ranges precede the broad industrial block
    private static final List<SicRange> SIC_RANGES = List.of(
        new SicRange("Real Estate", 6500, 6599),
        new SicRange("Real Estate", 6798, 6798),
        new SicRange("Biotech/Pharma", 2830, 2839),
        new SicRange("Biotech/Pharma", 3840, 3849),
        new SicRange("Biotech/Pharma", 8000, 8099),
        new SicRange("Tech/Internet", 3570, 3579),
        new SicRange("Tech/Internet", 3670, 3679),
        new SicRange("Tech/Internet", 4800, 4899),
        new SicRange("Tech/Internet", 7370, 7389),
        new SicRange("Tech/Internet", 3600, 3699),
        new SicRange("Energy/Materials", 100, 1499),
        new SicRange("Energy/Materials", 2900, 2999),
        new SicRange("Energy/Materials", 3300, 3399),
        new SicRange("Financials", 6000, 6499),
        new SicRange("Financials", 6700, 6797),
        new SicRange("Consumer & Services", 5000, 5999),
        new SicRange("Consumer & Services", 7000, 7299),
        new SicRange("Consumer & Services", 7400, 7999),
        new SicRange("Consumer & Services", 8100, 8999),
        new SicRange("Industrial/Cyclical", 1500, 4999));

    private final RaterConfig config;

    public String classify(String ticker, String suppliedSector, Integer sic) {
        if (ticker != null) {
            String override = config.sectors().getTickerOverrides().get(ticker.trim().toUpperCase(Locale.ROOT));
            if (override != null) {
                log.debug("Sector override for {}: {}", ticker, override);
                return override;
            }
        }
        if (suppliedSector != null && !suppliedSector.isBlank()) return suppliedSector.trim();
        String fromSic = sectorFromSic(sic);
        return fromSic != null ? fromSic : DEFAULT_SECTOR;
    }

    public SectorBucket bucket(String ticker, String suppliedSector, Integer sic) {
        return SectorBucket.resolve(classify(ticker, suppliedSector, sic));
    }

    static String sectorFromSic(Integer sic) {
        if (sic == null) return null;
        for (SicRange range : SIC_RANGES) {
            if (sic >= range.min() && sic <= range.max()) return range.sector();
        }
        return null;
    }
}
