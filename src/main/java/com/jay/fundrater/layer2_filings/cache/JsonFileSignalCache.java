package com.jay.fundrater.layer2_filings.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jay.fundrater.config.JsonMappers;
import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.model.FilingScanMeta;
import com.jay.fundrater.model.FilingSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Filing-signal cache kept inside each ticker's {@code {TICKER}-fundamentals.json} document.
 *
 * Only the {@code filingSignals*} fields are touched; {@code periods} and everything else in the document
 * is carried over on every write. Writes go to a temp file that replaces the document in one move, so a
 * reader sees either the old or the new version. Concurrent writers: last one wins.
 */
@Slf4j
@Component
public class JsonFileSignalCache implements FilingSignalCache {

    static final String SIGNALS = "filingSignals";
    static final String META = "filingSignalsMeta";
    static final String CACHED_AT = "filingSignalsCachedAt";
    static final String VERSION = "filingSignalsScannerVersion";
    static final String DEPTH = "filingSignalsDepth";

    private final Path dataDir;
    private final ObjectMapper mapper = JsonMappers.documentMapper();
    private final Map<String, CachedSignals> memory = new ConcurrentHashMap<>();

    @Autowired
    public JsonFileSignalCache(RaterConfig config) {
        this(Path.of(config.store().getDataDir()));
    }

    public JsonFileSignalCache(Path dataDir) {
        this.dataDir = dataDir;
    }

    @Override
    public Optional<CachedSignals> load(String ticker) {
        String key = key(ticker);
        CachedSignals hot = memory.get(key);
        if (hot != null) return Optional.of(hot);

        Path file = documentPath(key);
        if (!Files.exists(file)) return Optional.empty();
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || !root.has(SIGNALS)) return Optional.empty();
            CachedSignals entry = fromDocument(root);
            memory.put(key, entry);
            return Optional.of(entry);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Could not read filing-signal cache for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(String ticker, CachedSignals entry) {
        String key = key(ticker);
        memory.put(key, entry);
        Path file = documentPath(key);
        try {
            Files.createDirectories(dataDir);
            ObjectNode root = readDocument(file);
            root.set(SIGNALS, mapper.valueToTree(entry.signals()));
            root.set(META, entry.meta() == null ? null : mapper.valueToTree(entry.meta()));
            root.put(CACHED_AT, entry.cachedAt() == null ? Instant.now().toString() : entry.cachedAt().toString());
            root.put(VERSION, entry.scannerVersion());
            root.put(DEPTH, entry.depth());
            writeAtomically(file, root);
            log.debug("Persisted {} filing signal(s) for {}", entry.signals().size(), key);
        } catch (IOException e) {
            log.warn("Could not persist filing-signal cache for {}: {}", key, e.getMessage());
        }
    }

    /** Drops the in-memory copy so the next load goes back to disk. */
    public void evict(String ticker) {
        memory.remove(key(ticker));
    }

    Path documentPath(String key) {
        return dataDir.resolve(key + "-fundamentals.json");
    }

    // ── Document I/O ──────────────────────────────────────────────────────────

    private CachedSignals fromDocument(JsonNode root) {
        List<FilingSignal> signals = mapper.convertValue(root.get(SIGNALS), new TypeReference<List<FilingSignal>>() {});
        JsonNode metaNode = root.get(META);
        FilingScanMeta meta = metaNode == null || metaNode.isNull() ? null : mapper.convertValue(metaNode, FilingScanMeta.class);
        String cachedAt = root.hasNonNull(CACHED_AT) ? root.get(CACHED_AT).asText()
            : root.hasNonNull("updatedAt") ? root.get("updatedAt").asText() : null;
        String version = root.hasNonNull(VERSION) ? root.get(VERSION).asText() : null;
        int depth = root.hasNonNull(DEPTH) ? root.get(DEPTH).asInt() : 0;
        return new CachedSignals(signals == null ? List.of() : signals, meta, parseInstant(cachedAt), version, depth);
    }

    private ObjectNode readDocument(Path file) {
        if (Files.exists(file)) {
            try {
                JsonNode existing = mapper.readTree(file.toFile());
                if (existing instanceof ObjectNode object) return object;
            } catch (IOException e) {
                log.warn("Existing document {} is unreadable, rewriting it: {}", file.getFileName(), e.getMessage());
            }
        }
        return mapper.createObjectNode();
    }

    private void writeAtomically(Path file, ObjectNode root) throws IOException {
        Path tmp = Files.createTempFile(dataDir, file.getFileName().toString(), ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), root);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable cache timestamp '{}'", raw);
            return null;
        }
    }

    private static String key(String ticker) {
        return ticker.trim().toUpperCase(Locale.ROOT);
    }
}
