package com.jay.fundrater.layer1_normalize;

import com.jay.fundrater.model.FinancialField;
import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.NormalizedSeries;
import com.jay.fundrater.model.enums.PeriodType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;

/**
 * Layer 1 — Period Normalizer.
 * Turns heterogeneous raw period records into canonical quarterly and annual series.
 *
 * Guarantees on the output:
 *   - each series is sorted ascending by period end
 *   - at most one period per (period type, period end)
 *   - numeric fields are finite or null
 *   - revenue, gross profit and free cash flow are derived when they can be inferred safely
 */
@Slf4j
@Component
public class PeriodNormalizer {

    public NormalizedSeries normalize(List<Map<String, Object>> rawRecords) {
        if (rawRecords == null || rawRecords.isEmpty()) {
            return new NormalizedSeries(List.of(), List.of());
        }

        Map<LocalDate, FinancialPeriod> quarters = new LinkedHashMap<>();
        Map<LocalDate, FinancialPeriod> years = new LinkedHashMap<>();
        int dropped = 0;

        for (Map<String, Object> raw : rawRecords) {
            FinancialPeriod period = toPeriod(raw);
            if (period == null) {
                dropped++;
                continue;
            }
            Map<LocalDate, FinancialPeriod> target = period.isQuarter() ? quarters : years;
            target.merge(period.getPeriodEnd(), period, PeriodNormalizer::mergeDuplicates);
        }
        if (dropped > 0) {
            log.debug("Dropped {} raw period record(s) without a usable period end or type", dropped);
        }

        return new NormalizedSeries(sorted(quarters), sorted(years));
    }

    /** Converts one raw record; returns null when it has no parseable period end or recognised type. */
    FinancialPeriod toPeriod(Map<String, Object> raw) {
        if (raw == null) return null;
        LocalDate periodEnd = parseDate(firstPresent(raw, "periodEnd", "date", "endDate"));
        PeriodType type = PeriodType.fromLabel(asString(firstPresent(raw, "periodType", "period", "form")));
        if (periodEnd == null || type == null) return null;

        Map<FinancialField, Double> values = new EnumMap<>(FinancialField.class);
        for (FinancialField field : FinancialField.values()) {
            Double value = FinancialMath.toNumber(raw.get(field.key()));
            if (value == null) {
                for (String alias : field.aliases()) {
                    value = FinancialMath.toNumber(raw.get(alias));
                    if (value != null) break;
                }
            }
            if (value != null) values.put(field, value);
        }
        deriveMissing(values);

        FinancialPeriod.FinancialPeriodBuilder builder = FinancialPeriod.builder()
            .periodEnd(periodEnd)
            .periodType(type)
            .filedDate(parseDate(firstPresent(raw, "filedDate", "filed", "fillingDate")));
        values.forEach((field, value) -> field.set(builder, value));
        return builder.build();
    }

    // ── Derivations ───────────────────────────────────────────────────────────

    private static void deriveMissing(Map<FinancialField, Double> values) {
        Double revenue = values.get(FinancialField.REVENUE);
        Double cost = values.get(FinancialField.COST_OF_REVENUE);
        Double grossProfit = values.get(FinancialField.GROSS_PROFIT);

        if (!isFiniteValue(revenue) && isFiniteValue(grossProfit) && isFiniteValue(cost)) {
            revenue = grossProfit + cost;
            values.put(FinancialField.REVENUE, revenue);
        }
        if (!isFiniteValue(grossProfit) && isFiniteValue(revenue) && isFiniteValue(cost)) {
            values.put(FinancialField.GROSS_PROFIT, revenue - cost);
        }

        Double ocf = values.get(FinancialField.OPERATING_CASH_FLOW);
        if (!values.containsKey(FinancialField.FREE_CASH_FLOW) && isFiniteValue(ocf)) {
            Double capex = values.get(FinancialField.CAPEX);
            values.put(FinancialField.FREE_CASH_FLOW, ocf - Math.abs(FinancialMath.orZero(capex)));
        }
    }

    /** Later filing wins; its gaps are filled from the earlier record. */
    private static FinancialPeriod mergeDuplicates(FinancialPeriod existing, FinancialPeriod incoming) {
        boolean incomingIsNewer = incoming.getFiledDate() != null
            && (existing.getFiledDate() == null || incoming.getFiledDate().isAfter(existing.getFiledDate()));
        FinancialPeriod winner = incomingIsNewer ? incoming : existing;
        FinancialPeriod other = incomingIsNewer ? existing : incoming;

        FinancialPeriod.FinancialPeriodBuilder builder = winner.toBuilder();
        for (FinancialField field : FinancialField.values()) {
            if (field.get(winner) == null && field.get(other) != null) {
                field.set(builder, field.get(other));
            }
        }
        return builder.build();
    }

    private static List<FinancialPeriod> sorted(Map<LocalDate, FinancialPeriod> byEnd) {
        List<FinancialPeriod> list = new ArrayList<>(byEnd.values());
        list.sort(Comparator.comparing(FinancialPeriod::getPeriodEnd));
        return List.copyOf(list);
    }

    // ── Parsing helpers ───────────────────────────────────────────────────────

    private static Object firstPresent(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value != null) return value;
        }
        return null;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    static LocalDate parseDate(Object raw) {
        if (raw == null) return null;
        if (raw instanceof LocalDate date) return date;
        String text = raw.toString().trim();
        if (text.length() < 10) return null;
        try {
            // tolerate timestamps such as 2024-03-31T00:00:00Z
            return LocalDate.parse(text.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
