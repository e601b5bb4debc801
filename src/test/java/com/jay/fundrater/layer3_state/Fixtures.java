package com.jay.fundrater.layer3_state;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.layer1_normalize.PeriodNormalizer;
import com.jay.fundrater.layer1_normalize.TtmAggregator;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.NormalizedSeries;
import com.jay.fundrater.model.TickerDataset;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Raw period records and datasets shared by tests across packages. */
public final class Fixtures {

    public static final List<String> QUARTER_ENDS = List.of(
        "2023-03-31", "2023-06-30", "2023-09-30", "2023-12-31",
        "2024-03-31", "2024-06-30", "2024-09-30", "2024-12-31");

    private Fixtures() {
    }

    public static TickerDataset dataset(List<Map<String, Object>> periods) {
        return TickerDataset.builder()
            .ticker("ACME")
            .companyName("Acme Software Corp")
            .sector("Technology")
            .lastPrice(10.0)
            .periods(periods)
            .build();
    }

    /** Revenue 100..170 by 10 per quarter, a 10% net margin and a steady balance sheet. */
    public static List<Map<String, Object>> growingQuarters() {
        List<Map<String, Object>> raw = new ArrayList<>();
        for (int i = 0; i < QUARTER_ENDS.size(); i++) {
            double revenue = 100 + 10 * i;
            Map<String, Object> p = period(QUARTER_ENDS.get(i), "quarter", revenue, revenue / 10);
            p.put("grossProfit", revenue * 0.6);
            p.put("operatingIncome", revenue * 0.15);
            p.put("operatingCashFlow", revenue * 0.2);
            p.put("capex", -revenue * 0.05);
            p.put("totalAssets", 2000);
            p.put("totalEquity", 1000);
            p.put("totalDebt", 500);
            p.put("cash", 350);
            p.put("sharesOutstanding", 1000);
            p.put("epsBasic", revenue / 10 / 1000);
            p.put("interestExpense", 5);
            raw.add(p);
        }
        return raw;
    }

    /** Two quarters, no fiscal year: not enough for any trailing-year figure. */
    public static List<Map<String, Object>> twoQuartersOnly() {
        List<Map<String, Object>> raw = new ArrayList<>();
        double[] revenue = {100, 110};
        String[] ends = {"2024-09-30", "2024-12-31"};
        for (int i = 0; i < 2; i++) {
            Map<String, Object> p = period(ends[i], "quarter", revenue[i], revenue[i] / 10);
            p.put("grossProfit", revenue[i] * 0.6);
            p.put("operatingCashFlow", -40);
            p.put("capex", -10);
            p.put("cash", 400);
            p.put("totalAssets", 2000);
            p.put("totalEquity", 1000);
            p.put("sharesOutstanding", 1000);
            raw.add(p);
        }
        return raw;
    }

    public static Map<String, Object> period(String end, String type, double revenue, double netIncome) {
        Map<String, Object> p = new HashMap<>();
        p.put("periodEnd", end);
        p.put("periodType", type);
        p.put("revenue", revenue);
        p.put("netIncome", netIncome);
        return p;
    }

    /** Normalizes {@code dataset} and builds its state with the default configuration. */
    public static FinancialState build(TickerDataset dataset, LocalDate asOf) {
        RaterConfig config = new RaterConfig();
        FinancialStateBuilder builder =
            new FinancialStateBuilder(config, new TtmAggregator(config), new SectorClassifier(config));
        NormalizedSeries series = new PeriodNormalizer().normalize(dataset.getPeriods());
        return builder.build(dataset, series, asOf);
    }
}
