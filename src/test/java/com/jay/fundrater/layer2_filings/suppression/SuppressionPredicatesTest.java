package com.jay.fundrater.layer2_filings.suppression;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.layer2_filings.FilingSignalCatalog;
import com.jay.fundrater.layer2_filings.SignalDefinition;
import com.jay.fundrater.model.enums.Severity;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SuppressionPredicatesTest {

    private static final RaterConfig.Scanner CFG = new RaterConfig.Scanner();
    private static final LocalDate FILED = LocalDate.of(2025, 3, 1);
    private static final SignalDefinition GOING_CONCERN = FilingSignalCatalog.byId("going_concern");
    private static final SignalDefinition CLINICAL_NEGATIVE = FilingSignalCatalog.byId("clinical_negative");

    @Test
    void negation_firesOnNoSubstantialDoubt() {
        MatchContext match = at("There is no substantial doubt about going concern.", "going concern", GOING_CONCERN);

        assertThat(new NegationPredicate().suppresses(match)).isTrue();
    }

    @Test
    void negation_keepsAffirmativeStatement() {
        MatchContext match = at("Management concluded that substantial doubt exists about our ability to continue as a going concern.",
            "going concern", GOING_CONCERN);

        assertThat(new NegationPredicate().suppresses(match)).isFalse();
    }

    @Test
    void modal_firesOnSpeculationButNotOnConcreteEvent() {
        MatchContext speculative = at("We may breach covenants in the event that sales fall short of plan.",
            "breach covenants", GOING_CONCERN);
        MatchContext concrete = at("We received notice that we breached covenants and the lender may demand payment.",
            "breached covenants", GOING_CONCERN);

        ModalLanguagePredicate modal = new ModalLanguagePredicate();
        assertThat(modal.suppresses(speculative)).isTrue();
        assertThat(modal.suppresses(concrete)).isFalse();
    }

    @Test
    void hypotheticalPrefix_firesOnRiskOf() {
        MatchContext match = at("We face the risk of a clinical hold on our lead programme.", "clinical hold", CLINICAL_NEGATIVE);

        assertThat(new HypotheticalPrefixPredicate().suppresses(match)).isTrue();
    }

    @Test
    void boilerplate_firesInsideRiskFactorsUnlessASubstantiveSectionIsNear() {
        MatchContext disclaimer = at("Item 1A. Risk Factors. A going concern opinion from our auditors harms us.",
            "going concern", GOING_CONCERN);
        MatchContext mdna = at("Risk factors aside, in results of operations we disclose a going concern opinion.",
            "going concern", GOING_CONCERN);

        BoilerplatePredicate boilerplate = new BoilerplatePredicate();
        assertThat(boilerplate.suppresses(disclaimer)).isTrue();
        assertThat(boilerplate.suppresses(mdna)).isFalse();
    }

    @Test
    void staleYear_firesOnEarlierYearsOnly() {
        StaleYearPredicate stale = new StaleYearPredicate(6);

        assertThat(stale.suppresses(at("In 2021 the FDA imposed a clinical hold on the study.", "clinical hold",
            CLINICAL_NEGATIVE))).isTrue();
        assertThat(stale.suppresses(at("In 2025 the FDA imposed a clinical hold on the study.", "clinical hold",
            CLINICAL_NEGATIVE))).isFalse();
    }

    @Test
    void resolution_firesWhenHoldWasLifted() {
        MatchContext match = at("The FDA imposed a clinical hold. The hold was lifted after we amended the protocol.",
            "clinical hold", CLINICAL_NEGATIVE);

        assertThat(new ResolutionPhrasePredicate().suppresses(match)).isTrue();
        assertThat(new ResolutionPhrasePredicate().suppresses(at("A going concern paragraph. The hold was lifted.",
            "going concern", GOING_CONCERN))).isFalse();
    }

    @Test
    void topicGuard_firesOnGovernmentRestructuring() {
        MatchContext match = at("The state announced a restructuring of its healthcare agencies.",
            "restructuring", new SignalDefinition("restructuring", "Restructuring", -2, Severity.WARNING,
                List.of("restructuring"), List.of()));

        assertThat(new TopicGuardPredicate().suppresses(match)).isTrue();
    }

    @Test
    void historical_firesOnPastFraming() {
        MatchContext match = at("The company previously disclosed a going concern paragraph.", "going concern", GOING_CONCERN);

        assertThat(new HistoricalFramingPredicate().suppresses(match)).isTrue();
    }

    @Test
    void chain_reportsFirstRejectingPredicate() {
        SuppressionChain chain = SuppressionChain.standard(CFG);

        assertThat(chain.rejection(at("There is no substantial doubt about going concern.", "going concern", GOING_CONCERN)))
            .contains("negation");
        assertThat(chain.rejection(at("Management concluded that substantial doubt exists about our ability to continue as a going concern.",
            "going concern", GOING_CONCERN))).isEmpty();
    }

    private static MatchContext at(String text, String phrase, SignalDefinition def) {
        int idx = text.toLowerCase().indexOf(phrase.toLowerCase());
        return MatchContext.at(text, idx, phrase, def, FILED, CFG);
    }
}
