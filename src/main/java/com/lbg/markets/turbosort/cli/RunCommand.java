package com.lbg.markets.turbosort.cli;

import com.lbg.markets.turbosort.orchestration.Orchestrator;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "run",
        description = "Scan once, then keep watching the source until stopped.")
public class RunCommand implements Callable<Integer> {

    @Inject
    Orchestrator orchestrator;

    @Override
    public Integer call() throws Exception {
        orchestrator.runUntilStopped();
        return CommandLine.ExitCode.OK;
    }
}
