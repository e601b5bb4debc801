package com.jay.fundrater.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Raw inputs for one ticker: the shape of a fundamentals document on disk and of a rating request body.
 * Periods stay as loosely typed maps until the normalizer has seen them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickerDataset {
    private String                    ticker;
    private String                    companyName;
    private String                    sector;
    private Integer                   sic;
    private String                    sicDescription;
    private String                    issuerType;
    private Double                    marketCap;
    private Double                    lastPrice;
    private List<Map<String, Object>> periods;
    private List<PricePoint>          prices;
    private List<FilingDocument>      filings;
    private boolean                   deepScan;
}
