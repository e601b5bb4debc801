package com.jay.fundrater.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Coarse sector classes the rule catalog is tuned for.
 * Sector strings are resolved through an ordered substring alias table; first hit wins.
 */
public enum SectorBucket {
    BIOTECH("Biotech/Pharma", List.of("biotech", "pharma", "pharmaceutical")),
    FINANCIALS("Financials", List.of("financial", "bank", "finance", "insurance")),
    TECH("Tech/Internet", List.of("tech", "technology", "internet", "software")),
    RETAIL("Retail", List.of("consumer", "retail")),
    ENERGY("Energy/Materials", List.of("energy", "materials")),
    INDUSTRIAL("Industrial/Cyclical", List.of("industrial", "cyclical")),
    REAL_ESTATE("Real Estate", List.of("real", "reit")),
    OTHER("Other", List.of());

    private final String label;
    private final List<String> aliases;

    SectorBucket(String label, List<String> aliases) {
        this.label = label;
        this.aliases = aliases;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static SectorBucket resolve(String sector) {
        if (sector == null || sector.isBlank()) return OTHER;
        String lower = sector.toLowerCase(Locale.ROOT);
        for (SectorBucket bucket : values()) {
            if (bucket.label.toLowerCase(Locale.ROOT).equals(lower)) return bucket;
            for (String alias : bucket.aliases) {
                if (lower.contains(alias)) return bucket;
            }
        }
        return OTHER;
    }
}
