package com.jay.fundrater.layer2_filings;

import com.jay.fundrater.model.FilingDocument;

import java.io.IOException;
import java.util.List;

/**
 * Source of filings for one ticker. Implementations never reach the network from inside the rater;
 * they hand over documents somebody else already fetched.
 */
public interface FilingFetcher {

    /** Metadata of the most recent filings of the given forms, newest first, at most {@code limit}. */
    List<FilingDocument> recentFilings(String ticker, List<String> forms, int limit) throws IOException;

    /** Raw (possibly HTML) text of one filing. */
    String fetchText(FilingDocument filing) throws IOException;
}
