package com.jay.fundrater.layer4_rating.rules;

import com.jay.fundrater.model.FinancialState;
import com.jay.fundrater.model.ShareChange;
import com.jay.fundrater.model.enums.SectorBucket;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CapitalRulesTest {

    private static FinancialState diluting(SectorBucket bucket, double yoy) {
        return FinancialState.builder().sectorBucket(bucket)
            .shareChange(new ShareChange(1.0, yoy, yoy, null, null)).build();
    }

    @Test
    void shareDilution_bandsIssuanceAndRewardsBuybacks() {
        assertThat(CapitalRules.SHARE_DILUTION.evaluate(diluting(SectorBucket.INDUSTRIAL, -2)).score()).isEqualTo(8);
        assertThat(CapitalRules.SHARE_DILUTION.evaluate(diluting(SectorBucket.INDUSTRIAL, 12)).score()).isEqualTo(-6);
        assertThat(CapitalRules.SHARE_DILUTION.evaluate(diluting(SectorBucket.INDUSTRIAL, 40)).score()).isEqualTo(-12);
    }

    @Test
    void shareDilution_biotechBandIsWiderAndLargeBiotechIsFloored() {
        assertThat(CapitalRules.SHARE_DILUTION.evaluate(diluting(SectorBucket.BIOTECH, 30)).score()).isEqualTo(-5);
        FinancialState large = diluting(SectorBucket.BIOTECH, 400).toBuilder().marketCap(5e9).build();
        assertThat(CapitalRules.SHARE_DILUTION.evaluate(large).score()).isEqualTo(-10);
    }

    @Test
    void shareDilution_missingWithoutShareCounts() {
        assertThat(CapitalRules.SHARE_DILUTION.evaluate(FinancialState.builder().build()).missing()).isTrue();
    }

    @Test
    void capitalReturn_isBonusOnly() {
        FinancialState returning = FinancialState.builder().shareholderReturnTtm(80.0).totalReturnPctFcf(0.8)
            .freeCashFlow(100.0).buybacksTtm(50.0).dividendsTtm(30.0).build();

        assertThat(CapitalRules.CAPITAL_RETURN.evaluate(returning).score()).isEqualTo(4);
        assertThat(CapitalRules.CAPITAL_RETURN.evaluate(returning.toBuilder().freeCashFlow(-5.0).build())
            .notApplicable()).isTrue();
    }

    @Test
    void workingCapital_notApplicableForBanks() {
        FinancialState bank = FinancialState.builder().sectorBucket(SectorBucket.FINANCIALS)
            .cashConversionCycleDays(10.0).build();

        assertThat(CapitalRules.WORKING_CAPITAL.evaluate(bank).notApplicable()).isTrue();
        assertThat(CapitalRules.WORKING_CAPITAL.evaluate(bank.toBuilder().sectorBucket(SectorBucket.RETAIL).build())
            .score()).isEqualTo(2);
    }
}
