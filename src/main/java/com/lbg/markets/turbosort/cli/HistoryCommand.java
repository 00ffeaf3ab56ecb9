package com.lbg.markets.turbosort.cli;

import com.lbg.markets.turbosort.domain.DeliveryRecord;
import com.lbg.markets.turbosort.domain.LedgerStats;
import com.lbg.markets.turbosort.ledger.Ledger;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@CommandLine.Command(name = "history",
        description = "Display the delivery history.")
public class HistoryCommand implements Callable<Integer> {

    private static final String RULE = "=".repeat(70);

    @Inject
    Ledger ledger;

    @CommandLine.Option(names = "--detailed", description = "Show one block per delivered file.")
    boolean detailed;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<DeliveryRecord> records = ledger.records().stream()
                .sorted(Comparator.comparing(DeliveryRecord::sourceKey))
                .collect(Collectors.toList());

        if (records.isEmpty()) {
            out.println("No files have been copied yet.");
            return CommandLine.ExitCode.OK;
        }

        out.println();
        out.println(RULE);
        out.printf("TurboSort Copy History - %d files%n", records.size());
        out.println(RULE);

        if (detailed) {
            for (DeliveryRecord record : records) {
                out.println();
                out.printf("Source: %s%n", record.sourceKey());
                out.printf("Destination: %s%n", record.destinationPath());
                out.printf("Timestamp: %s%n", record.deliveredAt());
                out.printf(Locale.ROOT, "Size: %d bytes (%.2f KB)%n", record.sizeBytes(), record.sizeBytes() / 1024.0);
                out.println("-".repeat(70));
            }
        } else {
            out.printf("%-40s | %-40s | %-10s%n", "Source", "Destination", "Size");
            out.printf("%s-+-%s-+-%s%n", "-".repeat(40), "-".repeat(40), "-".repeat(10));
            for (DeliveryRecord record : records) {
                out.printf(Locale.ROOT, "%-40s | %-40s | %-10.2f KB%n",
                        fileName(record.sourceKey()), fileName(record.destinationPath()),
                        record.sizeBytes() / 1024.0);
            }
        }

        LedgerStats stats = LedgerStats.of(records);
        out.println();
        out.printf(Locale.ROOT, "Total: %d files, %.2f MB%n", stats.totalFiles(), stats.totalMegabytes());
        out.println(RULE);
        out.println();
        return CommandLine.ExitCode.OK;
    }

    private static String fileName(String key) {
        int slash = key.lastIndexOf('/');
        if (slash >= 0) {
            return key.substring(slash + 1);
        }
        return Paths.get(key).getFileName().toString();
    }
}
