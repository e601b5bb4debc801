package com.jay.fundrater.model;

import com.jay.fundrater.model.enums.PeriodType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * One normalized reporting period (a fiscal quarter or a fiscal year).
 * Immutable once built by the normalizer. Every numeric field is either a finite value or null;
 * use {@link FinancialField} for name-driven access.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FinancialPeriod {

    LocalDate  periodEnd;
    PeriodType periodType;
    LocalDate  filedDate;

    // ── Income statement ──────────────────────────────────────────────────────
    Double revenue;
    Double costOfRevenue;
    Double grossProfit;
    Double operatingIncome;
    Double operatingExpenses;
    Double netIncome;
    Double epsBasic;
    Double incomeBeforeIncomeTaxes;
    Double incomeTaxExpenseBenefit;
    Double researchAndDevelopmentExpenses;
    Double sellingGeneralAndAdministrativeExpenses;
    Double interestExpense;
    Double interestIncome;
    Double technologyExpenses;
    Double depreciationAndAmortization;

    // ── Balance sheet ─────────────────────────────────────────────────────────
    Double totalAssets;
    Double totalLiabilities;
    Double totalEquity;
    Double currentAssets;
    Double currentLiabilities;
    Double cash;
    Double shortTermInvestments;
    Double accountsReceivable;
    Double inventories;
    Double accountsPayable;
    Double totalDebt;
    Double financialDebt;
    Double shortTermDebt;
    Double longTermDebt;
    Double leaseLiabilities;
    Double deposits;
    Double sharesOutstanding;

    // ── Cash flow ─────────────────────────────────────────────────────────────
    Double operatingCashFlow;
    Double capex;
    Double freeCashFlow;
    Double treasuryStockRepurchased;
    Double dividendsPaid;
    Double shareBasedCompensation;

    public boolean isQuarter() {
        return periodType == PeriodType.QUARTER;
    }
}
