package com.jay.fundrater.layer4_rating;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.PricePoint;
import com.jay.fundrater.model.enums.SectorBucket;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Caps the score of a small-cap biotech whose price just collapsed.
 * A sharp drop over a few sessions usually means a trial readout the filings have not caught up with yet.
 */
@Component
@RequiredArgsConstructor
public class EventRiskGuard {

    private final RaterConfig config;

    /** Percent change over the configured window of trading days, or null with too few closes. */
    public Double recentChangePct(List<PricePoint> prices) {
        int window = config.eventRisk().getWindowTradingDays();
        if (prices == null || prices.size() <= window) return null;
        List<PricePoint> asc = prices.stream().sorted(Comparator.comparing(PricePoint::date)).toList();
        double last = asc.get(asc.size() - 1).close();
        double reference = asc.get(asc.size() - 1 - window).close();
        if (reference <= 0) return null;
        return (last - reference) / reference * 100;
    }

    public boolean applies(FinancialState s, List<PricePoint> prices) {
        RaterConfig.EventRisk cfg = config.eventRisk();
        if (!cfg.isEnabled() || !s.isBucket(SectorBucket.BIOTECH)) return false;
        if (s.getMarketCap() == null || s.getMarketCap() >= cfg.getSmallCapCeiling()) return false;
        Double change = recentChangePct(prices);
        return change != null && change <= -cfg.getDeclinePct();
    }

    public int cap(int normalizedScore) {
        return Math.min(normalizedScore, config.eventRisk().getScoreCeiling());
    }
}
