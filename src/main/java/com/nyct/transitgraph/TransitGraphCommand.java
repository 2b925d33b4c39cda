package com.nyct.transitgraph;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "transit-graph", mixinStandardHelpOptions = true, version = "1.0-SNAPSHOT",
        description = "Build a station graph from GTFS and search it.",
        subcommands = {StatsCommand.class, PathCommand.class, AllPairsCommand.class})
public class TransitGraphCommand implements Callable<Integer> {
    static final int STATION_NOT_FOUND = 1;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new TransitGraphCommand()).execute(args));
    }
}
