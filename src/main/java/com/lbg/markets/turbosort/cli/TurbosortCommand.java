package com.lbg.markets.turbosort.cli;

import com.lbg.markets.turbosort.orchestration.Orchestrator;
import io.quarkus.picocli.runtime.annotations.TopCommand;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Entry point. Without a subcommand, runs continuously like {@code turbosort run}.
 */
@TopCommand
@CommandLine.Command(name = "turbosort",
        mixinStandardHelpOptions = true,
        description = "Watches a source tree for marker files and delivers the files beside them.",
        subcommands = {
                RunCommand.class,
                ScanCommand.class,
                HistoryCommand.class,
                ClearHistoryCommand.class
        })
public class TurbosortCommand implements Callable<Integer> {

    @Inject
    Orchestrator orchestrator;

    @Override
    public Integer call() throws Exception {
        orchestrator.runUntilStopped();
        return CommandLine.ExitCode.OK;
    }
}
