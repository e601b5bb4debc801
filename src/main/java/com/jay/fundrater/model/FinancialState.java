package com.jay.fundrater.model;

import com.jay.fundrater.model.enums.IssuerType;
import com.jay.fundrater.model.enums.SectorBucket;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the rule catalog reads for one company.
 * Built once per rating request; percentages are expressed as 15 = 15%.
 * Any metric may be null when the inputs needed for it were missing.
 */
@Value
@Builder(toBuilder = true)
public class FinancialState {

    // ── Identity ──────────────────────────────────────────────────────────────
    String       ticker;
    String       companyName;
    String       sector;
    String       sicDescription;
    SectorBucket sectorBucket;
    boolean      fintech;
    IssuerType   issuerType;
    Double       marketCap;
    Double       lastPrice;

    // ── Periods ───────────────────────────────────────────────────────────────
    boolean               annualMode;
    int                   periodCount;
    List<FinancialPeriod> periodsDesc;      // series the rules look at, newest first
    TtmSnapshot           ttm;
    TtmSnapshot           priorTtm;

    // ── Headline figures ──────────────────────────────────────────────────────
    Double revenue;                // TTM, falling back to the latest period
    Double revenueLatest;
    Double netIncome;
    Double freeCashFlow;
    Double incomeBeforeTaxes;

    // ── Growth ────────────────────────────────────────────────────────────────
    Double revenueGrowthYoY;
    Double revenueCagr3y;
    Double epsCagr3y;

    // ── Momentum (same quarter last year, percent) ────────────────────────────
    Double revenueTrend;
    Double assetGrowthYoY;
    Double depositGrowthYoY;
    Double burnTrend;
    Double netIncomeTrend;
    Double rndTrend;
    Double grossMarginPrev;
    Double operatingMarginTrend;

    // ── Margins ───────────────────────────────────────────────────────────────
    Double grossMargin;
    Double operatingMargin;
    Double netMargin;
    Double fcfMargin;
    Double operatingLeverage;      // operating income / gross profit, ratio

    // ── Financial position ────────────────────────────────────────────────────
    Double           totalAssets;
    Double           totalEquity;
    Double           totalDebt;
    Double           financialDebt;
    Double           shortTermDebt;
    Double           longTermDebt;
    Double           cash;
    Double           netDebt;
    Double           debtToEquity;
    Double           netDebtToEquity;
    Double           netDebtToFcfYears;
    InterestCoverage interestCoverage;
    Double           currentRatio;
    Double           dsoDays;
    Double           cashConversionCycleDays;
    Double           runwayYears;  // +Infinity when self-funded

    // ── Cash usage ────────────────────────────────────────────────────────────
    Double capexToRevenue;
    Double buybacksTtm;
    Double dividendsTtm;
    Double shareholderReturnTtm;
    Double totalReturnPctFcf;      // ratio, 0.4 = 40% of FCF
    Double rdToRevenue;
    Double effectiveTaxRate;       // ratio in [0, 0.5]

    // ── Returns ───────────────────────────────────────────────────────────────
    Double roe;
    Double roic;

    // ── Shares and valuation ──────────────────────────────────────────────────
    ShareChange shareChange;
    Double      peRatio;
    Double      psRatio;
    Double      pbRatio;
    Double      pfcfRatio;

    DataQuality dataQuality;

    public boolean isBucket(SectorBucket bucket) {
        return sectorBucket == bucket;
    }

    public FinancialPeriod latestPeriod() {
        return periodsDesc == null || periodsDesc.isEmpty() ? null : periodsDesc.get(0);
    }
}
