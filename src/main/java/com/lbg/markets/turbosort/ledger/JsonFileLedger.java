package com.lbg.markets.turbosort.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.turbosort.config.TurbosortConfig;
import com.lbg.markets.turbosort.domain.DeliveryRecord;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ledger persisted as a single JSON document mapping source key to entry.
 * The whole document is rewritten on every persist, through a temp file and atomic rename.
 * A failed write is logged and the in-memory state stays authoritative until the next
 * successful one.
 */
@ApplicationScoped
public class JsonFileLedger extends InMemoryLedger {

    private static final Logger LOG = Logger.getLogger(JsonFileLedger.class);

    private static final TypeReference<Map<String, LedgerEntry>> DOCUMENT = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper;

    @Inject
    public JsonFileLedger(TurbosortConfig config, ObjectMapper mapper) {
        this(Paths.get(config.history().file()), mapper);
    }

    public JsonFileLedger(Path file, ObjectMapper mapper) {
        this.file = file.toAbsolutePath().normalize();
        this.mapper = mapper;
    }

    @PostConstruct
    void init() {
        load();
    }

    public Path file() {
        return file;
    }

    @Override
    public void load() {
        recordsByKey.clear();
        if (!Files.exists(file)) {
            LOG.infof("No history at %s, starting empty", file);
            return;
        }

        Map<String, LedgerEntry> document;
        try {
            document = mapper.readValue(file.toFile(), DOCUMENT);
        } catch (IOException e) {
            LOG.errorf(e, "History file %s is unreadable, starting with an empty history", file);
            moveAside();
            return;
        }

        if (document != null) {
            document.forEach(this::restore);
        }
        LOG.infof("Loaded history for %d files", recordsByKey.size());
    }

    private void restore(String sourceKey, LedgerEntry entry) {
        try {
            recordsByKey.put(sourceKey, entry.toRecord(sourceKey));
        } catch (RuntimeException e) {
            LOG.warnf("Dropping malformed history entry for %s: %s", sourceKey, e.getMessage());
        }
    }

    @Override
    public void persist() {
        Map<String, LedgerEntry> document = new TreeMap<>();
        for (DeliveryRecord record : recordsByKey.values()) {
            document.put(record.sourceKey(), LedgerEntry.from(record));
        }

        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            byte[] json = serialize(document);
            try (OutputStream out = Files.newOutputStream(temp)) {
                out.write(json);
            }
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            LOG.errorf(e, "Error saving history to %s; in-memory history is ahead of disk", file);
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                LOG.debugf("Could not remove %s: %s", temp, cleanup.getMessage());
            }
        }
    }

    private byte[] serialize(Map<String, LedgerEntry> document) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
    }

    private void moveAside() {
        Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            LOG.warnf("Moved unreadable history to %s", aside);
        } catch (IOException e) {
            LOG.errorf(e, "Could not move unreadable history %s aside; it will be overwritten", file);
        }
    }
}
