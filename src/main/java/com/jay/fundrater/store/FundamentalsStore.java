package com.jay.fundrater.store;

import com.jay.fundrater.model.TickerDataset;

import java.util.List;
import java.util.Optional;

/** Source of already-ingested fundamentals: periods, identity fields and prices per ticker. */
public interface FundamentalsStore {

    Optional<TickerDataset> load(String ticker);

    List<String> tickers();
}
