package com.jay.fundrater.layer2_filings;

import com.jay.fundrater.model.enums.Severity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 2 — Filing Signal Catalog.
 *
 * Phrase families scanned for in 10-K / 10-Q / 8-K / proxy text. Each family carries a signed score
 * that is summed into the rating, and a severity used for display. Phrases are matched lower-case.
 *
 * The catalog is static. Changing a phrase list changes scan output, so bump {@code scanner.version}
 * in config.yaml alongside it to invalidate cached scans.
 */
public final class FilingSignalCatalog {

    // ── Shared phrase lists ───────────────────────────────────────────────────

    public static final List<String> GOING_CONCERN_PHRASES = List.of(
        "going concern",
        "going-concern",
        "ability to continue as a going concern",
        "continue as a going concern",
        "substantial doubt",
        "substantial doubt about our ability to continue as a going concern",
        "substantial doubt about its ability to continue as a going concern",
        "may not be able to continue operations",
        "ability to meet obligations",
        "doubt regarding continued operation",
        "inability to continue as a going concern");

    /** A clinical hold that has since been lifted is not a live risk. */
    public static final List<String> CLINICAL_HOLD_RESOLUTIONS = List.of(
        "lifted clinical hold",
        "lifted the clinical hold",
        "lifted the partial clinical hold",
        "lifted a partial clinical hold",
        "hold has been lifted",
        "hold was lifted",
        "remove the clinical hold",
        "removed the clinical hold",
        "resumed patient enrollment",
        "resume patient enrollment",
        "enrollment has resumed",
        "trial has resumed",
        "resumed enrollment");

    // ── Non-phrase signals produced by a deep scan ────────────────────────────

    public static final String AMENDED_FILINGS = "amended_filings";
    public static final String INSIDER_BUYING = "insider_buying";
    public static final String INSIDER_SELLING = "insider_selling";
    public static final String GOING_CONCERN = "going_concern";

    /**
     * Negative signal id → positive counterpart it cancels.
     * When both are found, only the negative one is kept.
     */
    public static final Map<String, String> CONFLICTS;

    private static final List<SignalDefinition> DEFINITIONS;

    static {
        Map<String, String> conflicts = new LinkedHashMap<>();
        conflicts.put("material_weakness", "material_weakness_remediated");
        conflicts.put("auditor_change", "auditor_clean");
        conflicts.put("audit_opinion_issue", "auditor_clean");
        conflicts.put("restatement", "auditor_clean");
        conflicts.put("clinical_negative", "clinical_positive");
        conflicts.put("clinical_failure", "clinical_positive");
        conflicts.put("safety_bad", "safety_good");
        conflicts.put("regulatory_negative", "regulatory_positive");
        conflicts.put("regulatory_setback", "regulatory_positive");
        conflicts.put("moa_weak", "moa_strength");
        conflicts.put("covenant_risk", "debt_refinance");
        conflicts.put("debt_refinance_risk", "debt_refinance");
        conflicts.put("dilution_risk", "buyback_authorized");
        conflicts.put("demand_decline", "backlog_record");
        CONFLICTS = Collections.unmodifiableMap(conflicts);

        List<SignalDefinition> d = new ArrayList<>();

        // ── Solvency & reporting ──────────────────────────────────────────────
        d.add(def(GOING_CONCERN, -10, Severity.CRITICAL, "Going-Concern Warning", GOING_CONCERN_PHRASES));
        d.add(def("material_weakness", -8, Severity.CRITICAL, "Internal Control Weakness",
            "material weakness in internal control",
            "material weakness in our internal control",
            "ineffective internal control",
            "controls over financial reporting were not effective",
            "not effective disclosure controls"));
        d.add(def("substantial_doubt", -5, Severity.WARNING, "Funding Uncertainty",
            "substantial doubt about our ability to continue",
            "may not have sufficient capital to fund operations",
            "may not have sufficient liquidity",
            "may not be able to fund operations for the next 12 months"));
        d.add(def("liquidity_shortage", -6, "Liquidity Shortage",
            "insufficient capital",
            "may not have adequate liquidity",
            "we do not have enough cash to fund operations beyond",
            "cash resources are expected to be depleted"));
        d.add(def("needs_financing", -3, "External Financing Required",
            "expect to raise additional capital",
            "will need to raise additional capital",
            "financing will be required to sustain operations",
            "may issue additional equity securities",
            "additional financing will be necessary",
            "our business depends on securing additional funding",
            "future financing may not be available",
            "our survival depends on obtaining financing",
            "we expect to raise additional capital"));
        d.add(def("dilution_risk", -4, "Shareholder Dilution Risk",
            "we may issue additional equity securities",
            "future equity raises will dilute investors",
            "substantial dilution to existing shareholders"));
        d.add(def("covenant_risk", -5, "Covenant Risk",
            "in breach of debt covenants",
            "in violation of covenants",
            "breach of covenants",
            "may breach covenants",
            "lender may accelerate",
            "lender may accelerate repayment",
            "default under our credit agreement",
            "may violate financial covenants"));
        d.add(def("debt_refinance_risk", -4, "Refinancing Pressure",
            "unable to refinance existing debt",
            "debt maturities create liquidity pressure",
            "high interest burden"));
        d.add(def("reverse_split", -4, "Reverse Split Authorized",
            "reverse split",
            "reverse stock split",
            "amend articles to effect a reverse split",
            "authorization to effect a reverse split",
            "needed to comply with listing requirements"));
        d.add(def("atm_or_shelf", -3, "Shelf/ATM Offering",
            "at-the-market equity offering",
            "shelf registration",
            "equity distribution agreement"));
        d.add(def("auditor_change", -4, "Auditor Turnover",
            "auditor resigned",
            "auditor withdrawal",
            "change in independent registered public accounting firm",
            "dismissed our independent auditor"));
        d.add(def("restatement", -8, "Restatement Warning",
            "financial statements should no longer be relied upon",
            "restatement of prior period results"));
        d.add(def("audit_opinion_issue", -6, "Audit Opinion Issue",
            "audit opinion includes an adverse opinion",
            "disagreement with auditor",
            "audit committee raised concerns"));
        d.add(def("restructuring", -2, "Restructuring Activity",
            "restructuring charges",
            "restructuring expense",
            "employee reductions",
            "workforce reduction",
            "severance costs"));

        // ── Operating risk ────────────────────────────────────────────────────
        d.add(def("demand_decline", -3, "Demand Decline",
            "decline in demand",
            "soft market conditions",
            "reduced customer orders"));
        d.add(def("supply_chain", -3, "Supply Chain Disruption",
            "supply chain disruptions",
            "component shortages",
            "inability to source materials"));
        d.add(def("inventory_problem", -3, "Inventory Problems",
            "inventory obsolescence",
            "excess inventory",
            "write-downs"));
        d.add(def("reg_investigation", -5, "Regulatory Investigation",
            "under investigation by",
            "received a subpoena",
            "regulatory inquiry",
            "doj/ftc/sec investigation"));
        d.add(def("litigation_risk", -4, "Litigation Risk",
            "class action lawsuit",
            "material litigation",
            "significant legal exposure",
            "pending litigation could materially affect results"));
        d.add(def("compliance_penalty", -3, "Compliance Risk",
            "non-compliance could result in penalties",
            "violation of regulations"));
        d.add(def("customer_concentration", -3, "Customer Concentration Risk",
            "customer a accounted for",
            "loss of a major customer would be material"));
        d.add(def("supplier_dependence", -3, "Supplier Dependence",
            "single-source supplier risk",
            "dependence on one supplier"));
        d.add(def("market_shrinkage", -3, "Market Shrinkage",
            "market size declining",
            "industry contraction"));

        // ── Clinical & regulatory ─────────────────────────────────────────────
        d.add(def("clinical_failure", -6, "Clinical Failure",
            "trial did not meet primary endpoint",
            "failure to achieve statistical significance"));
        d.add(withResolutions(def("regulatory_setback", -6, "Regulatory Setback",
            "fda placed a clinical hold",
            "complete response letter (crl)",
            "additional data required for approval",
            "fda asked for additional data")));
        d.add(def("biotech_cash_dependency", -5, "Funding Needed for Trials",
            "substantial doubt... funding trials",
            "funding trials depends on raising capital"));
        d.add(withResolutions(def("clinical_negative", -12, "Clinical Failure",
            "did not meet primary endpoint",
            "failed to achieve significance",
            "failed to achieve statistical significance",
            "trial failed",
            "trial paused",
            "trial terminated",
            "trial discontinued",
            "dose-limiting toxicity",
            "serious adverse reaction",
            "fda placed a clinical hold",
            "received a complete response letter",
            "complete response letter (crl)",
            "clinical hold")));
        d.add(def("clinical_positive", 10, Severity.INFO, "Clinical Pipeline Quality", List.of(
            "met primary endpoint",
            "achieved statistical significance",
            "trial success",
            "positive topline results",
            "robust safety profile",
            "well-tolerated",
            "well tolerated",
            "pdufa date scheduled",
            "pdufa date set",
            "phase 2 readout",
            "phase 3 enrollment complete")));
        d.add(def("safety_bad", -6, "Safety Concerns",
            "severe adverse events",
            "saes",
            "grade 3 toxicity",
            "grade 4 toxicity",
            "dose reduction required"));
        d.add(def("safety_good", 4, "Favorable Safety",
            "well tolerated",
            "well-tolerated",
            "no dose-limiting toxicities",
            "no dose limiting toxicities"));
        d.add(def("regulatory_positive", 6, "Regulatory Tailwind",
            "fast track designation granted",
            "breakthrough therapy designation",
            "priority review",
            "successful type a meeting",
            "successful type b meeting",
            "successful type c meeting",
            "fast track",
            "breakthrough therapy",
            "priority review granted"));
        d.add(withResolutions(def("regulatory_negative", -8, "Regulatory Risk",
            "fda clinical hold",
            "crl issued",
            "additional trials required",
            "manufacturing issues",
            "manufacturing deficiencies")));
        d.add(def("catalyst_upcoming", 3, "Upcoming Catalyst",
            "pdufa date",
            "nda submission planned",
            "phase 2 readout",
            "phase 3 readout",
            "phase 3 enrollment complete",
            "topline data expected",
            "data readout",
            "catalyst"));
        d.add(def("moa_strength", 3, "Mechanism Strength",
            "first-in-class",
            "best-in-class",
            "novel mechanism of action",
            "addressing unmet medical need"));
        d.add(def("moa_weak", -3, "Crowded Mechanism",
            "crowded space",
            "generic competition",
            "biosimilar threat",
            "market dominated by"));
        d.add(def("trial_execution_risk", -3, "Trial Execution Risk",
            "slow enrollment",
            "trial delays",
            "enrollment delays",
            "supply issues for investigational product",
            "supply issues for study drug"));
        d.add(def("non_dilutive_finance", 4, "Non-Dilutive Funding",
            "non-dilutive financing",
            "grant funding",
            "barda",
            "nih grant"));

        // ── Leadership & macro ────────────────────────────────────────────────
        d.add(def("leadership_turnover", -3, "Leadership Turnover",
            "ceo resigned",
            "cfo departure",
            "executive turnover"));
        d.add(def("board_conflict", -3, "Board/Governance Conflict",
            "board investigation",
            "governance concerns"));
        d.add(def("macro_sensitivity", -2, "Macro Sensitivity",
            "sensitive to interest rates",
            "limited pricing power",
            "foreign currency headwinds"));

        // ── Capital & credit events ───────────────────────────────────────────
        d.add(def("buyback_authorized", 3, "Buyback Increased",
            "share repurchase authorization increased",
            "repurchase program increased",
            "expanded share repurchase program",
            "repurchased shares",
            "repurchased common stock"));
        d.add(def("dividend_raised", 3, "Dividend Raised",
            "dividend increased",
            "raised our dividend",
            "increase our dividend",
            "quarterly dividend of",
            "initiating a dividend"));
        d.add(def("long_term_contract", 2, "Long-Term Contract Signed",
            "long-term contract",
            "multi-year contract",
            "multi year contract",
            "long-term agreement",
            "multi-year agreement",
            "backlog reached",
            "award of multi-year contract"));
        d.add(def("backlog_record", 3, "Record Backlog",
            "record backlog",
            "backlog at record",
            "highest backlog",
            "order book strong"));
        d.add(def("credit_upgrade", 4, "Credit Upgraded",
            "credit rating upgraded",
            "outlook raised to",
            "rating upgraded"));
        d.add(def("debt_refinance", 2, "Debt Refinanced",
            "refinanced at lower rate",
            "refinanced our debt",
            "reprice our term loan",
            "reprice our credit facility",
            "refinanced debt at lower rates",
            "extended maturities"));
        d.add(def("material_weakness_remediated", 4, "Controls Remediated",
            "material weakness has been remediated",
            "remediated the material weakness",
            "remediation of material weakness",
            "material weaknesses have been remediated"));
        d.add(def("auditor_clean", 2, "Auditor Clean Opinion",
            "no issues noted by auditor",
            "unqualified opinion",
            "clean opinion",
            "no material weaknesses identified"));

        DEFINITIONS = Collections.unmodifiableList(d);
    }

    private FilingSignalCatalog() {
    }

    public static List<SignalDefinition> definitions() {
        return DEFINITIONS;
    }

    public static SignalDefinition byId(String id) {
        for (SignalDefinition def : DEFINITIONS) {
            if (def.id().equals(id)) return def;
        }
        return null;
    }

    // ── Builders ──────────────────────────────────────────────────────────────

    private static SignalDefinition def(String id, int score, String title, String... phrases) {
        return def(id, score, Severity.forScore(score), title, Arrays.asList(phrases));
    }

    private static SignalDefinition def(String id, int score, Severity severity, String title, String... phrases) {
        return def(id, score, severity, title, Arrays.asList(phrases));
    }

    private static SignalDefinition def(String id, int score, Severity severity, String title, List<String> phrases) {
        return new SignalDefinition(id, title, score, severity, List.copyOf(phrases), List.of());
    }

    private static SignalDefinition withResolutions(SignalDefinition def) {
        return new SignalDefinition(def.id(), def.title(), def.score(), def.severity(), def.phrases(),
            CLINICAL_HOLD_RESOLUTIONS);
    }
}
