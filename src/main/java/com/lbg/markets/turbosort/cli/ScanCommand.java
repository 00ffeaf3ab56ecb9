package com.lbg.markets.turbosort.cli;

import com.lbg.markets.turbosort.domain.ScanSummary;
import com.lbg.markets.turbosort.orchestration.Orchestrator;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Single full scan, for cron-style use. Exits non-zero when any item failed.
 */
@CommandLine.Command(name = "scan",
        description = "Run one full scan and exit.")
public class ScanCommand implements Callable<Integer> {

    @Inject
    Orchestrator orchestrator;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        ScanSummary summary = orchestrator.scanOnce();
        spec.commandLine().getOut().printf("%d copied, %d skipped, %d vanished, %d failed, %d pruned%n",
                summary.copied(), summary.skipped(), summary.vanished(), summary.failed(), summary.pruned());
        return summary.failed() > 0 ? CommandLine.ExitCode.SOFTWARE : CommandLine.ExitCode.OK;
    }
}
