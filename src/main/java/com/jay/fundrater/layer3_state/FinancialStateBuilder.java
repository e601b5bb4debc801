package com.jay.fundrater.layer3_state;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.layer1_normalize.FinancialMath;
import com.jay.fundrater.layer1_normalize.TtmAggregator;
import com.jay.fundrater.layer1_normalize.YearOverYear;
import com.jay.fundrater.model.DataQuality;
import com.jay.fundrater.model.FinancialField;
import com.jay.fundrater.model.FinancialPeriod;
import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.NormalizedSeries;
import com.jay.fundrater.model.PricePoint;
import com.jay.fundrater.model.TickerDataset;
import com.jay.fundrater.model.TtmSnapshot;
import com.jay.fundrater.model.enums.IssuerType;
import com.jay.fundrater.model.enums.SectorBucket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static com.jay.fundrater.layer1_normalize.FinancialMath.isFiniteValue;
import static com.jay.fundrater.layer1_normalize.FinancialMath.margin;
import static com.jay.fundrater.layer1_normalize.FinancialMath.orZero;
import static com.jay.fundrater.layer1_normalize.FinancialMath.pctChange;
import static com.jay.fundrater.layer1_normalize.FinancialMath.safeDiv;

/**
 * Layer 3 — Financial State Builder.
 *
 * Turns a normalized series into the flat set of metrics the rule catalog reads. Flow metrics come from the
 * TTM snapshot (or the latest fiscal year), balance-sheet metrics from the newest period.
 * With four or more quarters the quarterly series drives trends and share counts; otherwise the annual one does.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FinancialStateBuilder {

    private static final int QUARTERS_FOR_QUARTERLY_MODE = 4;
    private static final double DEFAULT_TAX_RATE = 0.21;
    private static final double MAX_TAX_RATE = 0.5;

    private final RaterConfig config;
    private final TtmAggregator ttmAggregator;
    private final SectorClassifier sectorClassifier;

    public FinancialState build(TickerDataset dataset, NormalizedSeries series, LocalDate asOf) {
        YearOverYear yoy = YearOverYear.from(config);

        boolean annualMode = series.quarters().size() < QUARTERS_FOR_QUARTERLY_MODE && !series.years().isEmpty();
        List<FinancialPeriod> asc = annualMode ? series.years() : series.quarters();
        List<FinancialPeriod> desc = new ArrayList<>(asc);
        Collections.reverse(desc);
        FinancialPeriod latest = desc.isEmpty() ? null : desc.get(0);

        TtmSnapshot ttm = ttmAggregator.latest(series);
        TtmSnapshot priorTtm = ttmAggregator.prior(series);
        // without a trailing-year snapshot there are no annual flows; a single quarter never stands in for one
        FinancialPeriod totals = ttm != null ? ttm.totals() : null;

        String sector = sectorClassifier.classify(dataset.getTicker(), dataset.getSector(), dataset.getSic());
        SectorBucket bucket = SectorBucket.resolve(sector);
        boolean fintech = FintechDetector.isFintech(dataset.getTicker(), dataset.getCompanyName(), sector,
            dataset.getSicDescription(), config.sectors().getFintechTickers());

        // ── Headline flows ────────────────────────────────────────────────────
        Double revenue = get(totals, FinancialField.REVENUE);
        Double netIncome = get(totals, FinancialField.NET_INCOME);
        Double fcf = get(totals, FinancialField.FREE_CASH_FLOW);
        Double opIncome = get(totals, FinancialField.OPERATING_INCOME);
        Double grossProfit = get(totals, FinancialField.GROSS_PROFIT);
        Double pretax = get(totals, FinancialField.INCOME_BEFORE_TAXES);

        // ── Balance sheet (newest period) ─────────────────────────────────────
        Double assets = get(latest, FinancialField.TOTAL_ASSETS);
        Double equity = get(latest, FinancialField.TOTAL_EQUITY);
        Double cash = get(latest, FinancialField.CASH);
        Double sti = get(latest, FinancialField.SHORT_TERM_INVESTMENTS);
        Double shortDebt = get(latest, FinancialField.SHORT_TERM_DEBT);
        Double longDebt = get(latest, FinancialField.LONG_TERM_DEBT);
        Double financialDebt = firstPresent(get(latest, FinancialField.FINANCIAL_DEBT),
            FinancialMath.sumPresent(longDebt, shortDebt));
        Double debt = totalDebt(get(latest, FinancialField.TOTAL_DEBT), financialDebt,
            get(latest, FinancialField.LEASE_LIABILITIES));
        Double netDebt = debt == null ? null : debt - (orZero(cash) + orZero(sti));

        // ── Market data ───────────────────────────────────────────────────────
        Double lastPrice = firstPresent(dataset.getLastPrice(), lastClose(dataset.getPrices()));
        Double shares = get(latest, FinancialField.SHARES_OUTSTANDING);
        Double marketCap = firstPresent(dataset.getMarketCap(),
            isFiniteValue(lastPrice) && isFiniteValue(shares) ? lastPrice * shares : null);

        // ── Capital use ───────────────────────────────────────────────────────
        Double buybacks = absOrNull(get(totals, FinancialField.TREASURY_STOCK_REPURCHASED));
        Double dividends = absOrNull(get(totals, FinancialField.DIVIDENDS_PAID));
        Double shareholderReturn = FinancialMath.sumPresent(buybacks, dividends);
        Double capex = absOrNull(get(totals, FinancialField.CAPEX));
        Double rnd = get(totals, FinancialField.RESEARCH_AND_DEVELOPMENT);

        Double taxRate = effectiveTaxRate(get(totals, FinancialField.INCOME_TAX), pretax);

        FinancialState.FinancialStateBuilder b = FinancialState.builder()
            .ticker(dataset.getTicker())
            .companyName(dataset.getCompanyName())
            .sector(sector)
            .sicDescription(dataset.getSicDescription())
            .sectorBucket(bucket)
            .fintech(fintech)
            .issuerType(IssuerType.fromWire(dataset.getIssuerType()))
            .marketCap(marketCap)
            .lastPrice(lastPrice)
            .annualMode(annualMode)
            .periodCount(asc.size())
            .periodsDesc(Collections.unmodifiableList(desc))
            .ttm(ttm)
            .priorTtm(priorTtm)
            // headline
            .revenue(revenue)
            .revenueLatest(get(latest, FinancialField.REVENUE))
            .netIncome(netIncome)
            .freeCashFlow(fcf)
            .incomeBeforeTaxes(pretax)
            // growth
            .revenueGrowthYoY(revenueGrowth(ttm, priorTtm, asc, yoy))
            .revenueCagr3y(cagr3y(series.years(), FinancialField.REVENUE))
            .epsCagr3y(cagr3y(series.years(), FinancialField.EPS_BASIC))
            // momentum
            .revenueTrend(yoy.latestChange(asc, FinancialField.REVENUE))
            .assetGrowthYoY(yoy.latestChange(asc, FinancialField.TOTAL_ASSETS))
            .depositGrowthYoY(yoy.latestChange(asc, FinancialField.DEPOSITS))
            .burnTrend(yoy.latestChange(asc, FinancialField.FREE_CASH_FLOW))
            .netIncomeTrend(yoy.latestChange(asc, FinancialField.NET_INCOME))
            .rndTrend(yoy.latestChange(asc, FinancialField.RESEARCH_AND_DEVELOPMENT))
            .grossMarginPrev(comparableMargin(asc, yoy, FinancialPeriod::getGrossProfit))
            .operatingMarginTrend(marginTrend(asc, yoy))
            // margins
            .grossMargin(margin(grossProfit, revenue))
            .operatingMargin(margin(opIncome, revenue))
            .netMargin(margin(netIncome, revenue))
            .fcfMargin(margin(fcf, revenue))
            .operatingLeverage(safeDiv(opIncome, grossProfit))
            // financial position
            .totalAssets(assets)
            .totalEquity(equity)
            .totalDebt(debt)
            .financialDebt(financialDebt)
            .shortTermDebt(shortDebt)
            .longTermDebt(longDebt)
            .cash(FinancialMath.sumPresent(cash, sti))
            .netDebt(netDebt)
            .debtToEquity(safeDiv(debt, equity))
            .netDebtToEquity(safeDiv(netDebt, equity))
            .netDebtToFcfYears(isFiniteValue(fcf) && fcf > 0 ? safeDiv(netDebt, fcf) : null)
            .interestCoverage(InterestCoverageCalculator.compute(desc))
            .currentRatio(safeDiv(get(latest, FinancialField.CURRENT_ASSETS), get(latest, FinancialField.CURRENT_LIABILITIES)))
            .dsoDays(days(get(latest, FinancialField.ACCOUNTS_RECEIVABLE), revenue))
            .cashConversionCycleDays(cashConversionCycle(latest, revenue, grossProfit))
            .runwayYears(RunwayCalculator.runwayYears(bucket, cash, sti, fcf, netIncome))
            // cash usage
            .capexToRevenue(margin(capex, revenue))
            .buybacksTtm(buybacks)
            .dividendsTtm(dividends)
            .shareholderReturnTtm(shareholderReturn)
            .totalReturnPctFcf(isFiniteValue(fcf) && fcf > 0 ? safeDiv(shareholderReturn, fcf) : null)
            .rdToRevenue(margin(rnd, revenue))
            .effectiveTaxRate(taxRate)
            // returns
            .roe(isFiniteValue(equity) && equity > 0 ? margin(netIncome, equity) : null)
            .roic(roic(opIncome, taxRate, latest, asc, yoy))
            // shares & valuation
            .shareChange(new ShareChangeCalculator(yoy).compute(asc))
            .peRatio(isFiniteValue(netIncome) && netIncome > 0 ? safeDiv(marketCap, netIncome) : null)
            .psRatio(isFiniteValue(revenue) && revenue > 0 ? safeDiv(marketCap, revenue) : null)
            .pbRatio(isFiniteValue(equity) && equity > 0 ? safeDiv(marketCap, equity) : null)
            .pfcfRatio(isFiniteValue(fcf) && fcf > 0 ? safeDiv(marketCap, fcf) : null)
            .dataQuality(dataQuality(desc, asOf));

        FinancialState state = b.build();
        log.debug("Built state for {}: bucket={}, basis={}, periods={}", state.getTicker(), bucket,
            ttm == null ? "none" : ttm.basis(), asc.size());
        return state;
    }

    // ── Growth ────────────────────────────────────────────────────────────────

    private static Double revenueGrowth(TtmSnapshot ttm, TtmSnapshot priorTtm, List<FinancialPeriod> asc, YearOverYear yoy) {
        if (ttm != null && priorTtm != null) {
            Double g = pctChange(ttm.get(FinancialField.REVENUE), priorTtm.get(FinancialField.REVENUE));
            if (g != null) return g;
        }
        return yoy.latestChange(asc, FinancialField.REVENUE);
    }

    /** Three-year CAGR between the newest fiscal year and the one three years before it. */
    static Double cagr3y(List<FinancialPeriod> yearsAsc, FinancialField field) {
        if (yearsAsc.size() < 4) return null;
        FinancialPeriod end = yearsAsc.get(yearsAsc.size() - 1);
        FinancialPeriod start = yearsAsc.get(yearsAsc.size() - 4);
        return FinancialMath.cagr(field.get(end), field.get(start), 3);
    }

    private static Double comparableMargin(List<FinancialPeriod> asc, YearOverYear yoy,
                                           Function<FinancialPeriod, Double> numerator) {
        if (asc.isEmpty()) return null;
        FinancialPeriod latest = asc.get(asc.size() - 1);
        return yoy.comparable(asc, latest.getPeriodEnd())
            .map(prior -> margin(numerator.apply(prior), prior.getRevenue()))
            .orElse(null);
    }

    // percentage-point change of the operating margin against the same period a year earlier
    private static Double marginTrend(List<FinancialPeriod> asc, YearOverYear yoy) {
        if (asc.isEmpty()) return null;
        FinancialPeriod latest = asc.get(asc.size() - 1);
        Double now = margin(latest.getOperatingIncome(), latest.getRevenue());
        Double then = comparableMargin(asc, yoy, FinancialPeriod::getOperatingIncome);
        return now == null || then == null ? null : now - then;
    }

    // ── Position ──────────────────────────────────────────────────────────────

    static Double totalDebt(Double reported, Double financialDebt, Double leases) {
        Double components = FinancialMath.sumPresent(financialDebt, leases);
        if (!isFiniteValue(reported)) return components;
        if (!isFiniteValue(components)) return reported;
        return Math.max(reported, components);
    }

    private static Double days(Double balance, Double annualFlow) {
        Double ratio = safeDiv(balance, annualFlow);
        return ratio == null ? null : ratio * 365;
    }

    private static Double cashConversionCycle(FinancialPeriod latest, Double revenue, Double grossProfit) {
        Double dso = days(get(latest, FinancialField.ACCOUNTS_RECEIVABLE), revenue);
        if (dso == null) return null;
        Double cogs = isFiniteValue(revenue) && isFiniteValue(grossProfit) ? revenue - grossProfit : null;
        double dio = orZero(days(get(latest, FinancialField.INVENTORIES), cogs));
        double dpo = orZero(days(get(latest, FinancialField.ACCOUNTS_PAYABLE), cogs));
        return dso + dio - dpo;
    }

    static Double effectiveTaxRate(Double tax, Double pretax) {
        if (!isFiniteValue(tax) || !isFiniteValue(pretax) || pretax <= 0) return null;
        return FinancialMath.clamp(tax / pretax, 0, MAX_TAX_RATE);
    }

    private static Double roic(Double ebit, Double taxRate, FinancialPeriod latest, List<FinancialPeriod> asc,
                               YearOverYear yoy) {
        if (!isFiniteValue(ebit) || latest == null) return null;
        Double current = investedCapital(latest);
        if (current == null) return null;
        Optional<FinancialPeriod> yearAgo = yoy.comparable(asc, latest.getPeriodEnd());
        Double prior = yearAgo.map(FinancialStateBuilder::investedCapital).orElse(null);
        double average = prior == null ? current : (current + prior) / 2;
        if (average <= 0) return null;
        double nopat = ebit * (1 - (taxRate == null ? DEFAULT_TAX_RATE : taxRate));
        return nopat / average * 100;
    }

    private static Double investedCapital(FinancialPeriod p) {
        Double equity = p.getTotalEquity();
        if (!isFiniteValue(equity)) return null;
        Double financial = firstPresent(p.getFinancialDebt(), FinancialMath.sumPresent(p.getLongTermDebt(), p.getShortTermDebt()));
        Double debt = totalDebt(p.getTotalDebt(), financial, p.getLeaseLiabilities());
        return equity + orZero(debt) - orZero(p.getCash()) - orZero(p.getShortTermInvestments());
    }

    // ── Data quality ──────────────────────────────────────────────────────────

    private DataQuality dataQuality(List<FinancialPeriod> desc, LocalDate asOf) {
        RaterConfig.Normalizer cfg = config.normalizer();
        List<String> notes = new ArrayList<>();

        LocalDate incomeEnd = desc.stream().filter(p -> isFiniteValue(p.getRevenue()) || isFiniteValue(p.getNetIncome()))
            .map(FinancialPeriod::getPeriodEnd).max(Comparator.naturalOrder()).orElse(null);
        LocalDate balanceEnd = desc.stream().filter(p -> isFiniteValue(p.getTotalAssets()))
            .map(FinancialPeriod::getPeriodEnd).max(Comparator.naturalOrder()).orElse(null);
        boolean mismatch = false;
        if (incomeEnd != null && balanceEnd != null) {
            long gap = Math.abs(ChronoUnit.DAYS.between(incomeEnd, balanceEnd));
            if (gap > cfg.getPeriodMismatchDays()) {
                mismatch = true;
                notes.add(String.format("Income statement (%s) and balance sheet (%s) are %d days apart; ratios mix periods.",
                    incomeEnd, balanceEnd, gap));
            }
        }

        boolean stale = false;
        LocalDate newest = desc.isEmpty() ? null : desc.get(0).getPeriodEnd();
        if (newest != null && asOf != null) {
            long age = ChronoUnit.DAYS.between(newest, asOf);
            if (age > cfg.getStaleDataDays()) {
                stale = true;
                notes.add(String.format("Latest financial report ends %s (%d days ago); figures may be stale.", newest, age));
            }
        }
        return notes.isEmpty() ? DataQuality.clean() : new DataQuality(mismatch, stale, List.copyOf(notes));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static Double get(FinancialPeriod period, FinancialField field) {
        Double v = field.get(period);
        return isFiniteValue(v) ? v : null;
    }

    private static Double firstPresent(Double a, Double b) {
        return isFiniteValue(a) ? a : (isFiniteValue(b) ? b : null);
    }

    private static Double absOrNull(Double v) {
        return isFiniteValue(v) ? Math.abs(v) : null;
    }

    private static Double lastClose(List<PricePoint> prices) {
        if (prices == null || prices.isEmpty()) return null;
        return prices.stream().max(Comparator.comparing(PricePoint::date)).map(PricePoint::close).orElse(null);
    }
}
