package com.lbg.markets.turbosort.orchestration;

import com.lbg.markets.turbosort.config.TurbosortConfig;
import com.lbg.markets.turbosort.destination.DestinationResolver;
import com.lbg.markets.turbosort.domain.DeliveryResult;
import com.lbg.markets.turbosort.domain.ScanSummary;
import com.lbg.markets.turbosort.domain.SourceItem;
import com.lbg.markets.turbosort.ledger.InMemoryLedger;
import com.lbg.markets.turbosort.ledger.Ledger;
import com.lbg.markets.turbosort.sink.LocalFsSink;
import com.lbg.markets.turbosort.sink.Sink;
import com.lbg.markets.turbosort.source.LocalFsSource;
import com.lbg.markets.turbosort.source.SourceProvider;
import com.lbg.markets.turbosort.support.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.lbg.markets.turbosort.support.TestFiles.touch;
import static com.lbg.markets.turbosort.support.TestFiles.write;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end delivery passes over a real temporary source and destination tree.
 */
class DeliveryScenarioTest {

    private static final String MARKER = ".turbosort";

    @TempDir
    Path base;

    private Path source;
    private Path destination;
    private Ledger ledger;

    @BeforeEach
    void setUp() throws IOException {
        source = Files.createDirectories(base.resolve("source"));
        destination = base.resolve("destination");
        ledger = new InMemoryLedger();
    }

    private DeliveryEngine engine(String... overrides) {
        return engine(new LocalFsSink(65536), overrides);
    }

    private DeliveryEngine engine(Sink sink, String... overrides) {
        TurbosortConfig config = TestConfigs.local(base, overrides);
        return new DeliveryEngine(config, new LocalFsSource(config), new DestinationResolver(config), sink, ledger);
    }

    private DeliveryEngine engine(SourceProvider provider) {
        TurbosortConfig config = TestConfigs.local(base);
        return new DeliveryEngine(config, provider, new DestinationResolver(config), new LocalFsSink(65536), ledger);
    }

    @Test
    void copiesFilesBesideMarkerIntoDestination() throws IOException {
        write(source.resolve("album/" + MARKER), "Family/Holiday");
        Path photo = write(source.resolve("album/photo.jpg"), "jpeg-bytes");

        ScanSummary summary = engine().fullScan();

        assertEquals(1, summary.directories());
        assertEquals(1, summary.copied());
        Path copied = destination.resolve("Family/Holiday/incoming/photo.jpg");
        assertEquals("jpeg-bytes", Files.readString(copied));
        assertEquals(Files.getLastModifiedTime(photo).toMillis(), Files.getLastModifiedTime(copied).toMillis());
        assertFalse(Files.exists(destination.resolve("Family/Holiday/incoming/" + MARKER)));
        assertTrue(ledger.get(photo.toString()).isPresent());
    }

    @Test
    void secondPassCopiesNothing() throws IOException {
        write(source.resolve("album/" + MARKER), "Docs");
        write(source.resolve("album/a.txt"), "a");
        write(source.resolve("album/b.txt"), "b");
        DeliveryEngine engine = engine();

        assertEquals(2, engine.fullScan().copied());
        ScanSummary again = engine.fullScan();

        assertEquals(0, again.copied());
        assertEquals(2, again.skipped());
    }

    @Test
    void modifiedFileIsCopiedAgain() throws IOException {
        write(source.resolve("album/" + MARKER), "Docs");
        Path file = write(source.resolve("album/a.txt"), "first");
        DeliveryEngine engine = engine();
        engine.fullScan();

        touch(file, "second version");
        List<DeliveryResult> results = engine.processDirectory(source.resolve("album").toString());

        assertEquals(DeliveryResult.Status.COPIED, results.get(0).status());
        assertEquals("second version", Files.readString(destination.resolve("Docs/incoming/a.txt")));
    }

    @Test
    void recopyLeavesDeliveredSiblingsUntouched() throws IOException {
        write(source.resolve("album/" + MARKER), "Docs");
        Path report = write(source.resolve("album/report"), "v1");
        write(source.resolve("album/report.tmp"), "keep me");
        DeliveryEngine engine = engine();
        assertEquals(2, engine.fullScan().copied());

        touch(report, "v2");
        ScanSummary second = engine.fullScan();
        assertEquals(1, second.copied());
        assertEquals(1, second.skipped());

        Path delivered = destination.resolve("Docs/incoming");
        assertEquals("v2", Files.readString(delivered.resolve("report")));
        assertEquals("keep me", Files.readString(delivered.resolve("report.tmp")));
        assertEquals(0, engine.fullScan().copied());
        try (Stream<Path> files = Files.list(delivered)) {
            assertEquals(Set.of("report", "report.tmp"),
                    files.map(p -> p.getFileName().toString()).collect(Collectors.toSet()));
        }
    }

    @Test
    void identicalFilesInDifferentDirectoriesAreBothDelivered() throws IOException {
        write(source.resolve("one/" + MARKER), "One");
        write(source.resolve("two/" + MARKER), "Two");
        write(source.resolve("one/same.txt"), "same");
        write(source.resolve("two/same.txt"), "same");

        ScanSummary summary = engine().fullScan();

        assertEquals(2, summary.copied());
        assertTrue(Files.exists(destination.resolve("One/incoming/same.txt")));
        assertTrue(Files.exists(destination.resolve("Two/incoming/same.txt")));
    }

    @Test
    void deletionsArePrunedAndForceRecopyCopiesTheRest() throws IOException {
        write(source.resolve("batch/" + MARKER), "Batch");
        for (int i = 0; i < 10; i++) {
            write(source.resolve("batch/file-" + i + ".txt"), "content " + i);
        }
        DeliveryEngine engine = engine();
        assertEquals(10, engine.fullScan().copied());
        assertEquals(0, engine.fullScan().copied());

        for (int i = 0; i < 3; i++) {
            Files.delete(source.resolve("batch/file-" + i + ".txt"));
        }
        ScanSummary afterDelete = engine.fullScan();
        assertEquals(3, afterDelete.pruned());
        assertEquals(0, afterDelete.copied());
        assertEquals(7, ledger.records().size());

        ScanSummary forced = engine("turbosort.force-recopy", "true").fullScan();
        assertEquals(7, forced.copied());
        assertEquals(0, forced.skipped());
    }

    @Test
    void fileRecreatedAfterPruneIsCopiedAgain() throws IOException {
        write(source.resolve("album/" + MARKER), "Docs");
        Path file = write(source.resolve("album/a.txt"), "a");
        DeliveryEngine engine = engine();
        engine.fullScan();

        Files.delete(file);
        assertEquals(1, engine.reconcile());

        write(file, "a");
        assertEquals(1, engine.fullScan().copied());
    }

    @Test
    void markerEditRedirectsOnlyFutureCopies() throws IOException {
        Path marker = write(source.resolve("album/" + MARKER), "Old");
        write(source.resolve("album/a.txt"), "a");
        DeliveryEngine engine = engine();
        engine.fullScan();

        Files.writeString(marker, "New");
        write(source.resolve("album/b.txt"), "b");
        engine.processDirectory(source.resolve("album").toString());

        assertTrue(Files.exists(destination.resolve("Old/incoming/a.txt")));
        assertFalse(Files.exists(destination.resolve("New/incoming/a.txt")));
        assertTrue(Files.exists(destination.resolve("New/incoming/b.txt")));
    }

    @Test
    void yearPrefixLayout() throws IOException {
        write(source.resolve("album/" + MARKER), "Family/2019/Reunion");
        write(source.resolve("album/a.jpg"), "a");

        engine("turbosort.destination.year-prefix", "true").fullScan();

        assertTrue(Files.exists(destination.resolve("2019/Family/2019/Reunion/incoming/a.jpg")));
    }

    @Test
    void emptyOrEscapingMarkerDeliversNothing() throws IOException {
        write(source.resolve("empty/" + MARKER), "  \n\n");
        write(source.resolve("empty/a.txt"), "a");
        write(source.resolve("escape/" + MARKER), "../../outside");
        write(source.resolve("escape/b.txt"), "b");

        ScanSummary summary = engine().fullScan();

        assertEquals(2, summary.directories());
        assertEquals(0, summary.copied());
        assertTrue(ledger.records().isEmpty());
        assertFalse(Files.exists(base.resolve("outside")));
    }

    @Test
    void itemVanishingBeforeCopyIsReportedAndNotRecorded() throws IOException {
        write(source.resolve("album/" + MARKER), "Docs");
        write(source.resolve("album/a.txt"), "a");
        Path doomed = write(source.resolve("album/b.txt"), "b");
        LocalFsSource local = new LocalFsSource(source, MARKER) {
            @Override
            public List<SourceItem> enumerateChildren(String location) throws IOException {
                List<SourceItem> items = super.enumerateChildren(location);
                Files.delete(doomed);
                return items;
            }
        };

        List<DeliveryResult> results = engine(local).processDirectory(source.resolve("album").toString());

        assertEquals(DeliveryResult.Status.COPIED, results.get(0).status());
        assertEquals(DeliveryResult.Status.VANISHED, results.get(1).status());
        assertFalse(ledger.get(doomed.toString()).isPresent());
    }

    @Test
    void copyFailureIsIsolatedToTheItem() throws IOException {
        write(source.resolve("album/" + MARKER), "Docs");
        write(source.resolve("album/a.txt"), "a");
        write(source.resolve("album/b.txt"), "b");
        LocalFsSink real = new LocalFsSink(65536);
        Sink flaky = (target, in, mtime) -> {
            if (target.getFileName().toString().equals("a.txt")) {
                throw new IOException("disk full");
            }
            return real.write(target, in, mtime);
        };
        DeliveryEngine engine = engine(flaky);

        ScanSummary summary = engine.fullScan();

        assertEquals(1, summary.failed());
        assertEquals(1, summary.copied());
        assertEquals(1, ledger.records().size());
        assertEquals(1, engine.failedThisSession());

        // The failed item is retried on the next pass
        assertEquals(1, engine().fullScan().copied());
    }

    @Test
    void directoryWithoutMarkerIsIgnored() throws IOException {
        write(source.resolve("plain/a.txt"), "a");

        assertTrue(engine().processDirectory(source.resolve("plain").toString()).isEmpty());
        assertFalse(Files.exists(destination));
    }
}
