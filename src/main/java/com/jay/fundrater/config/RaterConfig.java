package com.jay.fundrater.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and exposes all tuning constants from config.yaml.
 * Values are read once at startup. A default instance (no file) carries the same values as the shipped config.yaml.
 */
@Slf4j
@Component
public class RaterConfig {

    @Value("${rater.config-file:config.yaml}")
    private String configFile = "config.yaml";

    @Autowired(required = false)
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using the Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null) return null;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, key -> env != null ? env.getProperty(key) : null);
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Rating rating = new Rating();
    private GrowthStage growthStage = new GrowthStage();
    private EventRisk eventRisk = new EventRisk();
    private Scanner scanner = new Scanner();
    private Normalizer normalizer = new Normalizer();
    private ServiceSettings service = new ServiceSettings();
    private Store store = new Store();
    private Sectors sectors = new Sectors();

    @PostConstruct
    public void load() {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
                resolvePlaceholders();
                return;
            }
            apply(yamlMapper().readValue(is, ConfigRoot.class));
            log.info("RaterConfig loaded from '{}'. Scanner version: {}, cache TTL: {}h",
                configFile, scanner.getVersion(), scanner.getCacheTtlHours());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load {}, rater will use defaults: {}", configFile, e.getMessage());
            resolvePlaceholders();
        }
    }

    /** Loads a specific classpath resource; used by tests and tooling outside the Spring context. */
    public static RaterConfig fromClasspath(String resource) {
        RaterConfig config = new RaterConfig();
        config.configFile = resource;
        config.load();
        return config;
    }

    static ObjectMapper yamlMapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    private void apply(ConfigRoot root) {
        if (root.getRating() != null)       this.rating      = root.getRating();
        if (root.getGrowthStage() != null)  this.growthStage = root.getGrowthStage();
        if (root.getEventRisk() != null)    this.eventRisk   = root.getEventRisk();
        if (root.getScanner() != null)      this.scanner     = root.getScanner();
        if (root.getNormalizer() != null)   this.normalizer  = root.getNormalizer();
        if (root.getService() != null)      this.service     = root.getService();
        if (root.getStore() != null)        this.store       = root.getStore();
        if (root.getSectors() != null)      this.sectors     = root.getSectors();
        resolvePlaceholders();
    }

    // Jackson reads ${VAR:default} as a literal string
    private void resolvePlaceholders() {
        store.setDataDir(resolve(store.getDataDir()));
        store.setFilingsDir(resolve(store.getFilingsDir()));
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Rating rating()               { return rating; }
    public GrowthStage growthStage()     { return growthStage; }
    public EventRisk eventRisk()         { return eventRisk; }
    public Scanner scanner()             { return scanner; }
    public Normalizer normalizer()       { return normalizer; }
    public ServiceSettings service()     { return service; }
    public Store store()                 { return store; }
    public Sectors sectors()             { return sectors; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Rating rating;
        private GrowthStage growthStage;
        private EventRisk eventRisk;
        private Scanner scanner;
        private Normalizer normalizer;
        private ServiceSettings service;
        private Store store;
        private Sectors sectors;
    }

    @Data public static class Rating {
        private double ratingMin = -60;
        private double ratingMax = 100;
        private double riskFreeRatePct = 4.5;
        private double macroRateThresholdPct = 4.0;
        private int macroPenalty = 5;
        private int reverseSplitPenalty = -6;
        private double pennyPriceThreshold = 5;
        private double pennyMarketCap = 200_000_000;
        private double pennyBiotechMarketCap = 50_000_000;
        /** Sector bucket label to (rule name to multiplier). A multiplier of 0 gates the rule. */
        private Map<String, Map<String, Double>> sectorTuning = new HashMap<>();
    }

    @Data public static class GrowthStage {
        private double revenueGrowthFloorPct = 20;
        private double revenueGrowthFullPct = 60;
        private double burnFloorPct = 0;
        private double burnFullPct = 40;
        private double capexFloorPct = 10;
        private double capexFullPct = 50;
        private double intensityThreshold = 0.6;
        private double softeningStrength = 0.5;
        private int hypergrowthPenaltyFloor = -4;
        private List<String> softenedRules = List.of("FCF margin", "Operating leverage");
        private double maxRecoveryShare = 0.5;
        private double midAssetsFloor = 500_000_000d;
        private double midAssetsCeiling = 50_000_000_000d;
        private double midMarketCapFloor = 1_000_000_000d;
        private double midMarketCapCeiling = 50_000_000_000d;
    }

    @Data public static class EventRisk {
        private boolean enabled = true;
        private double declinePct = 30;
        private int windowTradingDays = 5;
        private int scoreCeiling = 40;
        private double smallCapCeiling = 2_000_000_000d;
    }

    @Data public static class Scanner {
        private String version = "3";
        private long cacheTtlHours = 72;
        private int defaultDepth = 3;
        private int deepDepth = 10;
        private int negationWindow = 60;
        private int snippetRadius = 160;
        private int contextRadius = 320;
        private int resolutionRadius = 1800;
        private int staleYearSpan = 6;
        private int amendmentLookbackYears = 3;
        private int insiderLookbackDays = 180;
        private List<String> forms = List.of("10-Q", "10-K", "8-K", "DEF 14A", "DEF14A");
    }

    @Data public static class Normalizer {
        private int yoyToleranceDays = 30;
        private int minPeriodsForYoy = 5;
        private int minQuartersForPriorTtm = 8;
        private int periodMismatchDays = 65;
        private int staleDataDays = 180;
    }

    @Data public static class ServiceSettings {
        private int maxConcurrentTickers = 4;
        private long timeoutSeconds = 30;
    }

    @Data public static class Store {
        private String dataDir = "${RATER_DATA_DIR:data/edgar}";
        private String filingsDir = "${RATER_FILINGS_DIR:data/filings}";
    }

    @Data public static class Sectors {
        /** Ticker to sector label, applied before any SIC-based classification. */
        private Map<String, String> tickerOverrides = new HashMap<>();
        private List<String> fintechTickers = List.of("SOFI", "UPST", "AFRM", "SQ", "PYPL", "LC");
    }
}
