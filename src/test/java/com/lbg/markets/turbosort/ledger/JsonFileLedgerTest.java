package com.lbg.markets.turbosort.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.turbosort.domain.DeliveryRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileLedgerTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonFileLedger open(Path file) {
        JsonFileLedger ledger = new JsonFileLedger(file, mapper);
        ledger.load();
        return ledger;
    }

    @Test
    void missingFileStartsEmpty() {
        JsonFileLedger ledger = open(dir.resolve("history.json"));

        assertTrue(ledger.records().isEmpty());
    }

    @Test
    void recordsSurviveReload() {
        Path file = dir.resolve("history.json");
        Instant deliveredAt = Instant.parse("2024-03-01T10:15:30Z");

        JsonFileLedger first = open(file);
        first.put(new DeliveryRecord("/src/a.txt", "/dest/a.txt", "id-1", 42, deliveredAt));

        JsonFileLedger second = open(file);
        DeliveryRecord loaded = second.get("/src/a.txt").orElseThrow();
        assertEquals("/dest/a.txt", loaded.destinationPath());
        assertEquals("id-1", loaded.identity());
        assertEquals(42, loaded.sizeBytes());
        assertEquals(deliveredAt, loaded.deliveredAt());
        assertTrue(second.shouldSkip("/src/a.txt", "id-1"));
    }

    @Test
    void documentMapsSourceToEntry() throws IOException {
        Path file = dir.resolve("history.json");
        open(file).put(new DeliveryRecord("/src/a.txt", "/dest/a.txt", "id-1", 42, Instant.EPOCH));

        JsonNode entry = mapper.readTree(file.toFile()).get("/src/a.txt");

        assertEquals("/dest/a.txt", entry.get("destination").asText());
        assertEquals(42, entry.get("size").asLong());
        assertEquals("1970-01-01T00:00:00Z", entry.get("timestamp").asText());
        assertFalse(Files.exists(dir.resolve("history.json.tmp")));
    }

    @Test
    void legacyEntriesLoadWithoutIdentity() throws IOException {
        Path file = dir.resolve("history.json");
        Files.writeString(file, """
                {
                  "/src/old.jpg": {
                    "destination": "/dest/Family/1_DRIVE/old.jpg",
                    "timestamp": "2023-05-04T12:30:00.123456",
                    "size": 2048
                  }
                }
                """);

        JsonFileLedger ledger = open(file);

        DeliveryRecord record = ledger.get("/src/old.jpg").orElseThrow();
        assertEquals(2048, record.sizeBytes());
        Instant expected = LocalDateTime.parse("2023-05-04T12:30:00.123456").atZone(ZoneId.systemDefault()).toInstant();
        assertEquals(expected, record.deliveredAt());
        assertFalse(ledger.shouldSkip("/src/old.jpg", "any-identity"));
    }

    @Test
    void corruptFileIsMovedAsideAndLedgerStartsEmpty() throws IOException {
        Path file = dir.resolve("history.json");
        Files.writeString(file, "{ not json");

        JsonFileLedger ledger = open(file);

        assertTrue(ledger.records().isEmpty());
        assertFalse(Files.exists(file));
        List<String> aside;
        try (Stream<Path> files = Files.list(dir)) {
            aside = files.map(p -> p.getFileName().toString())
                    .filter(name -> name.startsWith("history.json.corrupt-"))
                    .collect(Collectors.toList());
        }
        assertEquals(1, aside.size());
    }

    @Test
    void malformedEntryIsDroppedOthersKept() throws IOException {
        Path file = dir.resolve("history.json");
        Files.writeString(file, """
                {
                  "/src/good.txt": {"destination": "/dest/good.txt", "timestamp": "2024-01-01T00:00:00Z", "size": 1},
                  "/src/bad.txt": {"timestamp": "2024-01-01T00:00:00Z", "size": 1}
                }
                """);

        JsonFileLedger ledger = open(file);

        assertTrue(ledger.get("/src/good.txt").isPresent());
        assertFalse(ledger.get("/src/bad.txt").isPresent());
    }

    @Test
    void pruneAndClearArePersisted() {
        Path file = dir.resolve("history.json");
        JsonFileLedger ledger = open(file);
        ledger.put(new DeliveryRecord("/src/a", "/dest/a", "a", 1, Instant.now()));
        ledger.put(new DeliveryRecord("/src/b", "/dest/b", "b", 1, Instant.now()));

        ledger.prune("/src/a"::equals);
        assertEquals(1, open(file).records().size());

        ledger.clear();
        assertTrue(open(file).records().isEmpty());
    }

    @Test
    void failedWriteKeepsInMemoryState() throws IOException {
        Path file = dir.resolve("history.json");
        Files.createDirectories(file.resolve("occupied"));
        JsonFileLedger ledger = new JsonFileLedger(file, mapper);

        ledger.put(new DeliveryRecord("/src/a", "/dest/a", "a", 1, Instant.now()));

        assertTrue(ledger.shouldSkip("/src/a", "a"));
        assertTrue(Files.isDirectory(file));
    }
}
