package com.jay.fundrater.layer4_rating;

import com.jay.fundrater.layer4_rating.rules.BankingRules;
import com.jay.fundrater.layer4_rating.rules.CapitalRules;
import com.jay.fundrater.layer4_rating.rules.GrowthCardRules;
import com.jay.fundrater.layer4_rating.rules.GrowthRules;
import com.jay.fundrater.layer4_rating.rules.ProfitabilityRules;
import com.jay.fundrater.layer4_rating.rules.SolvencyRules;
import com.jay.fundrater.layer4_rating.rules.ValuationRules;

import java.util.List;
import java.util.Set;

/**
 * The ordered, immutable rule set. Bump {@link #VERSION} whenever a band, weight or rule changes;
 * ratings produced under different versions are not comparable.
 */
public final class RuleCatalog {

    public static final String VERSION = "2025.12.1";

    public static final List<Rule> RULES = List.of(
        GrowthRules.REVENUE_GROWTH,
        ValuationRules.PRICE_TO_SALES,
        ValuationRules.PRICE_TO_EARNINGS,
        ValuationRules.PRICE_TO_BOOK,
        ProfitabilityRules.GROSS_MARGIN,
        ProfitabilityRules.GROSS_MARGIN_INDUSTRIAL,
        ProfitabilityRules.GROSS_MARGIN_TREND,
        ProfitabilityRules.GROSS_MARGIN_HEALTH,
        ProfitabilityRules.OPERATING_LEVERAGE,
        ProfitabilityRules.FCF_MARGIN,
        SolvencyRules.CASH_RUNWAY,
        CapitalRules.SHARE_DILUTION,
        CapitalRules.CAPITAL_RETURN,
        CapitalRules.WORKING_CAPITAL,
        GrowthRules.FINTECH_MOMENTUM,
        CapitalRules.EFFECTIVE_TAX_RATE,
        SolvencyRules.DEBT_TO_EQUITY,
        SolvencyRules.NET_DEBT_TO_FCF,
        CapitalRules.CAPEX_INTENSITY,
        ProfitabilityRules.ROE,
        ProfitabilityRules.ROE_QUALITY,
        ProfitabilityRules.RETURN_ON_ASSETS,
        ProfitabilityRules.ASSET_EFFICIENCY,
        ProfitabilityRules.ROIC,
        GrowthRules.NET_INCOME_TREND,
        SolvencyRules.INTEREST_COVERAGE,
        GrowthRules.REVENUE_CAGR,
        GrowthRules.EPS_CAGR,
        CapitalRules.DIVIDEND_COVERAGE,
        GrowthRules.RND_INTENSITY,
        GrowthCardRules.ASSET_GROWTH_VELOCITY,
        GrowthCardRules.REVENUE_PER_ASSET,
        GrowthCardRules.DEBT_MATURITY,
        GrowthCardRules.OPERATING_LEVERAGE_INFLECTION,
        GrowthCardRules.CASH_BURN_DECELERATION,
        GrowthCardRules.WORKING_CAPITAL_EFFICIENCY,
        GrowthCardRules.REVENUE_QUALITY,
        BankingRules.DEPOSIT_GROWTH,
        BankingRules.NET_INTEREST_MARGIN,
        BankingRules.TECH_INVESTMENT
    );

    /** Rules whose penalties a growth-phase adjustment may partially offset. */
    public static final Set<String> PROFITABILITY_OFFSET_RULES = Set.of(
        ProfitabilityRules.ROE.name(),
        ProfitabilityRules.ROE_QUALITY.name(),
        ProfitabilityRules.ROIC.name(),
        ProfitabilityRules.RETURN_ON_ASSETS.name(),
        ProfitabilityRules.GROSS_MARGIN.name(),
        ProfitabilityRules.GROSS_MARGIN_INDUSTRIAL.name(),
        ProfitabilityRules.GROSS_MARGIN_HEALTH.name(),
        ProfitabilityRules.OPERATING_LEVERAGE.name(),
        ProfitabilityRules.FCF_MARGIN.name()
    );

    private RuleCatalog() {
    }

    public static List<Rule> rules() {
        return RULES;
    }
}
