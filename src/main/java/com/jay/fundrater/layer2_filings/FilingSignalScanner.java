package com.jay.fundrater.layer2_filings;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.layer2_filings.suppression.MatchContext;
import com.jay.fundrater.layer2_filings.suppression.SuppressionChain;
import com.jay.fundrater.model.FilingDocument;
import com.jay.fundrater.model.FilingSignal;
import com.jay.fundrater.model.enums.IssuerType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Layer 2 — Filing Signal Scanner.
 *
 * Scans the text of recent filings for the phrase families in {@link FilingSignalCatalog}.
 * For every family, each phrase hit is passed through the {@link SuppressionChain}; the first hit that
 * survives is the evidence for that filing.
 *
 * Across filings (newest first) the strongest |score| is kept, and the newer filing wins ties.
 * Conflicting negative/positive pairs are then reduced to the negative one.
 */
@Slf4j
@Component
public class FilingSignalScanner {

    private final RaterConfig.Scanner cfg;
    private final SuppressionChain chain;

    public FilingSignalScanner(RaterConfig config) {
        this.cfg = config.scanner();
        this.chain = SuppressionChain.standard(cfg);
    }

    /**
     * @param filings documents with text; order does not matter, they are sorted newest first here
     * @return de-duplicated signals in catalog order
     */
    public List<FilingSignal> scan(List<FilingDocument> filings, IssuerType issuerType) {
        List<FilingDocument> ordered = new ArrayList<>(filings);
        ordered.sort(Comparator.comparing(FilingDocument::getFiled,
            Comparator.nullsLast(Comparator.reverseOrder())));

        Map<String, FilingSignal> best = new LinkedHashMap<>();
        for (FilingDocument filing : ordered) {
            try {
                for (FilingSignal found : scanOne(filing)) {
                    FilingSignal existing = best.get(found.getId());
                    if (existing == null || Math.abs(found.getScore()) > Math.abs(existing.getScore())) {
                        best.put(found.getId(), found);
                    }
                }
            } catch (RuntimeException e) {
                log.warn("Skipping {} filed {} ({}): {}", filing.getForm(), filing.getFiled(),
                    filing.getAccession(), e.getMessage());
            }
        }

        if (issuerType == IssuerType.FOREIGN && best.remove(FilingSignalCatalog.GOING_CONCERN) != null) {
            log.debug("Dropped going-concern signal for foreign issuer");
        }
        resolveConflicts(best);
        return orderByCatalog(best);
    }

    /** Signals found in one filing, at most one per family. */
    List<FilingSignal> scanOne(FilingDocument filing) {
        String text = FilingText.stripTags(filing.getText());
        if (text.isEmpty()) return List.of();
        String lower = text.toLowerCase(Locale.ROOT);

        List<FilingSignal> found = new ArrayList<>();
        for (SignalDefinition def : FilingSignalCatalog.definitions()) {
            firstSurvivingHit(text, lower, def, filing.getFiled())
                .ifPresent(snippet -> found.add(toSignal(def, snippet, filing)));
        }
        return found;
    }

    private Optional<String> firstSurvivingHit(String text, String lower, SignalDefinition def, LocalDate filed) {
        for (String phrase : def.phrases()) {
            String needle = phrase.toLowerCase(Locale.ROOT);
            int from = 0;
            while (true) {
                int idx = lower.indexOf(needle, from);
                if (idx < 0) break;
                MatchContext match = MatchContext.at(text, idx, phrase, def, filed, cfg);
                Optional<String> rejectedBy = chain.rejection(match);
                if (rejectedBy.isEmpty()) return Optional.of(match.snippet());
                log.debug("{} '{}' @{} suppressed by {}", def.id(), phrase, idx, rejectedBy.get());
                from = idx + needle.length();
            }
        }
        return Optional.empty();
    }

    private static FilingSignal toSignal(SignalDefinition def, String snippet, FilingDocument filing) {
        return FilingSignal.builder()
            .id(def.id())
            .title(def.title())
            .score(def.score())
            .severity(def.severity())
            .snippet(snippet)
            .form(filing.getForm())
            .filed(filing.getFiled())
            .docUrl(filing.getDocUrl())
            .accession(filing.getAccession())
            .cik(filing.getCik())
            .build();
    }

    static void resolveConflicts(Map<String, FilingSignal> signals) {
        FilingSignalCatalog.CONFLICTS.forEach((negative, positive) -> {
            if (signals.containsKey(negative) && signals.remove(positive) != null) {
                log.debug("Dropped {} in favour of {}", positive, negative);
            }
        });
    }

    private static List<FilingSignal> orderByCatalog(Map<String, FilingSignal> signals) {
        List<FilingSignal> ordered = new ArrayList<>();
        for (SignalDefinition def : FilingSignalCatalog.definitions()) {
            FilingSignal s = signals.get(def.id());
            if (s != null) ordered.add(s);
        }
        return ordered;
    }
}
