package com.jay.fundrater.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.fundrater.config.JsonMappers;
import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.model.TickerDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads {@code {dataDir}/{TICKER}-fundamentals.json}.
 * The same document carries the filing-signal cache; those fields are ignored here.
 */
@Slf4j
@Component
public class JsonFundamentalsStore implements FundamentalsStore {

    static final String SUFFIX = "-fundamentals.json";

    private final Path dataDir;
    private final ObjectMapper mapper = JsonMappers.documentMapper();

    @Autowired
    public JsonFundamentalsStore(RaterConfig config) {
        this(Path.of(config.store().getDataDir()));
    }

    public JsonFundamentalsStore(Path dataDir) {
        this.dataDir = dataDir;
    }

    @Override
    public Optional<TickerDataset> load(String ticker) {
        String key = ticker.trim().toUpperCase(Locale.ROOT);
        Path file = dataDir.resolve(key + SUFFIX);
        if (!Files.exists(file)) {
            log.debug("No fundamentals document for {} at {}", key, file);
            return Optional.empty();
        }
        try {
            TickerDataset dataset = mapper.readValue(file.toFile(), TickerDataset.class);
            if (dataset.getTicker() == null) dataset.setTicker(key);
            return Optional.of(dataset);
        } catch (IOException e) {
            log.warn("Could not read fundamentals for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<String> tickers() {
        if (!Files.isDirectory(dataDir)) return List.of();
        try (Stream<Path> files = Files.list(dataDir)) {
            return files.map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                .sorted()
                .toList();
        } catch (IOException e) {
            log.warn("Could not list fundamentals in {}: {}", dataDir, e.getMessage());
            return List.of();
        }
    }
}
