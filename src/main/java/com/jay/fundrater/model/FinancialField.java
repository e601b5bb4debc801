package com.jay.fundrater.model;

import com.jay.fundrater.model.FinancialPeriod.FinancialPeriodBuilder;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Name-driven view over the numeric fields of {@link FinancialPeriod}.
 * Flow fields (income and cash-flow lines) are summed when building trailing aggregates;
 * stock fields (balance-sheet lines) are taken point-in-time from the latest period.
 */
public enum FinancialField {

    REVENUE("revenue", true, FinancialPeriod::getRevenue, FinancialPeriodBuilder::revenue, "totalRevenue", "revenues"),
    COST_OF_REVENUE("costOfRevenue", true, FinancialPeriod::getCostOfRevenue, FinancialPeriodBuilder::costOfRevenue),
    GROSS_PROFIT("grossProfit", true, FinancialPeriod::getGrossProfit, FinancialPeriodBuilder::grossProfit),
    OPERATING_INCOME("operatingIncome", true, FinancialPeriod::getOperatingIncome, FinancialPeriodBuilder::operatingIncome),
    OPERATING_EXPENSES("operatingExpenses", true, FinancialPeriod::getOperatingExpenses, FinancialPeriodBuilder::operatingExpenses),
    NET_INCOME("netIncome", true, FinancialPeriod::getNetIncome, FinancialPeriodBuilder::netIncome, "netIncomeLoss"),
    EPS_BASIC("epsBasic", true, FinancialPeriod::getEpsBasic, FinancialPeriodBuilder::epsBasic, "eps"),
    INCOME_BEFORE_TAXES("incomeBeforeIncomeTaxes", true, FinancialPeriod::getIncomeBeforeIncomeTaxes,
        FinancialPeriodBuilder::incomeBeforeIncomeTaxes, "pretaxIncome"),
    INCOME_TAX("incomeTaxExpenseBenefit", true, FinancialPeriod::getIncomeTaxExpenseBenefit,
        FinancialPeriodBuilder::incomeTaxExpenseBenefit, "incomeTaxExpense"),
    RESEARCH_AND_DEVELOPMENT("researchAndDevelopmentExpenses", true, FinancialPeriod::getResearchAndDevelopmentExpenses,
        FinancialPeriodBuilder::researchAndDevelopmentExpenses, "researchAndDevelopment"),
    SG_AND_A("sellingGeneralAndAdministrativeExpenses", true, FinancialPeriod::getSellingGeneralAndAdministrativeExpenses,
        FinancialPeriodBuilder::sellingGeneralAndAdministrativeExpenses),
    INTEREST_EXPENSE("interestExpense", true, FinancialPeriod::getInterestExpense, FinancialPeriodBuilder::interestExpense),
    INTEREST_INCOME("interestIncome", true, FinancialPeriod::getInterestIncome, FinancialPeriodBuilder::interestIncome,
        "interestAndDividendIncome"),
    TECHNOLOGY_EXPENSES("technologyExpenses", true, FinancialPeriod::getTechnologyExpenses,
        FinancialPeriodBuilder::technologyExpenses, "softwareExpenses"),
    DEPRECIATION("depreciationAndAmortization", true, FinancialPeriod::getDepreciationAndAmortization,
        FinancialPeriodBuilder::depreciationAndAmortization, "depreciationDepletionAndAmortization"),

    TOTAL_ASSETS("totalAssets", false, FinancialPeriod::getTotalAssets, FinancialPeriodBuilder::totalAssets),
    TOTAL_LIABILITIES("totalLiabilities", false, FinancialPeriod::getTotalLiabilities, FinancialPeriodBuilder::totalLiabilities),
    TOTAL_EQUITY("totalEquity", false, FinancialPeriod::getTotalEquity, FinancialPeriodBuilder::totalEquity,
        "stockholdersEquity", "totalStockholdersEquity"),
    CURRENT_ASSETS("currentAssets", false, FinancialPeriod::getCurrentAssets, FinancialPeriodBuilder::currentAssets),
    CURRENT_LIABILITIES("currentLiabilities", false, FinancialPeriod::getCurrentLiabilities,
        FinancialPeriodBuilder::currentLiabilities),
    CASH("cash", false, FinancialPeriod::getCash, FinancialPeriodBuilder::cash, "cashAndCashEquivalents"),
    SHORT_TERM_INVESTMENTS("shortTermInvestments", false, FinancialPeriod::getShortTermInvestments,
        FinancialPeriodBuilder::shortTermInvestments),
    ACCOUNTS_RECEIVABLE("accountsReceivable", false, FinancialPeriod::getAccountsReceivable,
        FinancialPeriodBuilder::accountsReceivable),
    INVENTORIES("inventories", false, FinancialPeriod::getInventories, FinancialPeriodBuilder::inventories, "inventory"),
    ACCOUNTS_PAYABLE("accountsPayable", false, FinancialPeriod::getAccountsPayable, FinancialPeriodBuilder::accountsPayable),
    TOTAL_DEBT("totalDebt", false, FinancialPeriod::getTotalDebt, FinancialPeriodBuilder::totalDebt),
    FINANCIAL_DEBT("financialDebt", false, FinancialPeriod::getFinancialDebt, FinancialPeriodBuilder::financialDebt),
    SHORT_TERM_DEBT("shortTermDebt", false, FinancialPeriod::getShortTermDebt, FinancialPeriodBuilder::shortTermDebt),
    LONG_TERM_DEBT("longTermDebt", false, FinancialPeriod::getLongTermDebt, FinancialPeriodBuilder::longTermDebt),
    LEASE_LIABILITIES("leaseLiabilities", false, FinancialPeriod::getLeaseLiabilities, FinancialPeriodBuilder::leaseLiabilities),
    DEPOSITS("deposits", false, FinancialPeriod::getDeposits, FinancialPeriodBuilder::deposits,
        "customerDeposits", "totalDeposits", "depositLiabilities"),
    SHARES_OUTSTANDING("sharesOutstanding", false, FinancialPeriod::getSharesOutstanding,
        FinancialPeriodBuilder::sharesOutstanding, "shares"),

    OPERATING_CASH_FLOW("operatingCashFlow", true, FinancialPeriod::getOperatingCashFlow,
        FinancialPeriodBuilder::operatingCashFlow, "netCashProvidedByOperatingActivities"),
    CAPEX("capex", true, FinancialPeriod::getCapex, FinancialPeriodBuilder::capex, "capitalExpenditure"),
    FREE_CASH_FLOW("freeCashFlow", true, FinancialPeriod::getFreeCashFlow, FinancialPeriodBuilder::freeCashFlow),
    TREASURY_STOCK_REPURCHASED("treasuryStockRepurchased", true, FinancialPeriod::getTreasuryStockRepurchased,
        FinancialPeriodBuilder::treasuryStockRepurchased, "shareRepurchases"),
    DIVIDENDS_PAID("dividendsPaid", true, FinancialPeriod::getDividendsPaid, FinancialPeriodBuilder::dividendsPaid),
    SHARE_BASED_COMPENSATION("shareBasedCompensation", true, FinancialPeriod::getShareBasedCompensation,
        FinancialPeriodBuilder::shareBasedCompensation, "stockBasedCompensation");

    private final String key;
    private final boolean flow;
    private final Function<FinancialPeriod, Double> getter;
    private final BiConsumer<FinancialPeriodBuilder, Double> setter;
    private final List<String> aliases;

    FinancialField(String key, boolean flow, Function<FinancialPeriod, Double> getter,
                   BiConsumer<FinancialPeriodBuilder, Double> setter, String... aliases) {
        this.key = key;
        this.flow = flow;
        this.getter = getter;
        this.setter = setter;
        this.aliases = List.of(aliases);
    }

    public String key()            { return key; }
    public boolean isFlow()        { return flow; }
    public List<String> aliases()  { return aliases; }

    public Double get(FinancialPeriod period) {
        return period == null ? null : getter.apply(period);
    }

    public void set(FinancialPeriodBuilder builder, Double value) {
        setter.accept(builder, value);
    }
}
