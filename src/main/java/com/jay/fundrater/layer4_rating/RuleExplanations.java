package com.jay.fundrater.layer4_rating;

import java.util.Map;

/** Plain-language reading of a rule outcome, picked by the sign of its score. */
public final class RuleExplanations {

    private record Pair(String positive, String negative) {}

    private static final Map<String, Pair> TEXT = Map.ofEntries(
        Map.entry("Revenue growth YoY", new Pair("Sales are growing vs. last year.", "Sales are shrinking vs. last year.")),
        Map.entry("Price / Sales", new Pair("Valuation is reasonable relative to sales.", "Expensive relative to sales.")),
        Map.entry("Price / Earnings", new Pair("Valuation is reasonable relative to profit.", "Expensive relative to profit.")),
        Map.entry("Price / Book", new Pair("Valuation is reasonable relative to book value.", "Expensive relative to book value.")),
        Map.entry("Gross margin", new Pair("High profit on every product sold.", "Low profit per product sold.")),
        Map.entry("Gross margin (industrial)", new Pair("Healthy markup on goods.", "Low markup suggests commodity pricing.")),
        Map.entry("Gross margin trend", new Pair("Business is becoming more efficient.", "Profitability per unit is dropping.")),
        Map.entry("Gross margin (health)", new Pair("Strong margins support R&D.", "Margins are squeezed.")),
        Map.entry("Operating leverage", new Pair("Converts gross profit into operating profit efficiently.", "Overhead eats into gross profit.")),
        Map.entry("FCF margin", new Pair("Business generates extra cash for growth.", "Burning cash to operate.")),
        Map.entry("Cash Runway (years)", new Pair("Enough cash for the long haul.", "Might need to raise money soon.")),
        Map.entry("Shares dilution YoY", new Pair("Share count is stable.", "New shares reduce your ownership slice.")),
        Map.entry("Capital Return", new Pair("Returns cash to shareholders via buybacks and dividends.",
            "Capital return is limited or constrained by weak cash generation.")),
        Map.entry("Working Capital", new Pair("Efficient cash cycle; sales turn into cash quickly.",
            "Cash cycle is inefficient; working capital can trap cash.")),
        Map.entry("Fintech Growth Momentum", new Pair("Digital banking operations are scaling quickly.", "Growth is too slow for a scaling fintech.")),
        Map.entry("Effective Tax Rate", new Pair("Tax rate looks within a normal operating range.",
            "Tax rate looks distorted (often one-time items or mix effects).")),
        Map.entry("Debt / Equity", new Pair("Conservative debt levels.", "High debt increases risk.")),
        Map.entry("Net Debt / FCF", new Pair("Debt can be paid off quickly.", "Debt burden is heavy relative to cash flow.")),
        Map.entry("Capex intensity", new Pair("Efficient spending on assets.", "Heavy spending required to maintain business.")),
        Map.entry("ROE", new Pair("Efficiently using shareholder money.", "Low return on shareholder capital.")),
        Map.entry("ROE quality", new Pair("High quality returns.", "Weak returns on capital.")),
        Map.entry("Return on Assets", new Pair("Profitable relative to total assets.", "Low profit relative to asset base.")),
        Map.entry("Asset Efficiency", new Pair("Assets are being put to work efficiently.", "Assets are under-productive relative to revenue.")),
        Map.entry("ROIC", new Pair("Creating value on every dollar invested.", "Returns are lower than the cost of capital.")),
        Map.entry("Net income trend", new Pair("Profits are trending up.", "Profits are shrinking.")),
        Map.entry("Interest coverage", new Pair("Profits easily cover interest payments.", "Struggling to pay interest costs.")),
        Map.entry("Revenue CAGR (3Y)", new Pair("Consistent long-term growth.", "Growth has stalled over time.")),
        Map.entry("EPS CAGR (3Y)", new Pair("Earnings are compounding.", "Earnings have stagnated.")),
        Map.entry("Dividend coverage", new Pair("Dividend is safe and funded by cash.", "Dividend costs more than the cash earned.")),
        Map.entry("R&D intensity", new Pair("Investing heavily in the future.", "Spending little on innovation.")),
        Map.entry("Asset Growth Velocity", new Pair("Asset base is expanding to support growth.", "Asset base is not keeping up with growth.")),
        Map.entry("Revenue per Asset Efficiency", new Pair("New assets are turning into revenue.", "New assets are not yet producing revenue.")),
        Map.entry("Debt Maturity Runway", new Pair("More long-term debt reduces near-term refinancing risk.",
            "More short-term debt increases refinancing risk.")),
        Map.entry("Operating Leverage Inflection", new Pair("Operating costs are shrinking relative to sales.", "Operating costs are not yet scaling down.")),
        Map.entry("Cash Burn Deceleration", new Pair("Cash burn is narrowing.", "Cash burn is getting worse.")),
        Map.entry("Working Capital Efficiency", new Pair("Liquidity comfortably funds expansion.", "Liquidity is tight relative to expansion spend.")),
        Map.entry("Revenue Quality", new Pair("Sales are being collected promptly.", "Customers are taking longer to pay.")),
        Map.entry("Deposit Growth", new Pair("Deposit franchise is growing.", "Deposit base is flat or shrinking.")),
        Map.entry("Net Interest Margin", new Pair("Healthy lending spread.", "Lending spread is thin.")),
        Map.entry("Tech Investment", new Pair("Technology is central to the business.", "Low technology spend for a fintech."))
    );

    private RuleExplanations() {
    }

    /** @return the sentence for this rule and score, or an empty string for an unknown rule */
    public static String explain(String ruleName, int score) {
        Pair pair = TEXT.get(ruleName);
        if (pair == null) return "";
        return score >= 0 ? pair.positive() : pair.negative();
    }
}
