package com.lbg.markets.turbosort.cli;

import com.lbg.markets.turbosort.ledger.Ledger;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "clear-history",
        description = "Forget every delivery so the next scan copies everything again.")
public class ClearHistoryCommand implements Callable<Integer> {

    @Inject
    Ledger ledger;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        int entries = ledger.records().size();
        ledger.clear();
        spec.commandLine().getOut().printf("Cleared history of %d files%n", entries);
        return CommandLine.ExitCode.OK;
    }
}
