package com.nyct.transitgraph;

import org.apache.commons.lang3.tuple.Pair;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "all-pairs", mixinStandardHelpOptions = true,
        description = "Shortest paths between every pair of connected stations.")
class AllPairsCommand implements Callable<Integer> {
    @Mixin
    FeedOptions feed;

    @Option(names = {"--threads"}, defaultValue = "1", description = "Worker threads (default: ${DEFAULT-VALUE})")
    int threads;

    @Option(names = {"--timeout"}, description = "Give up after this long, e.g. PT10M")
    Duration timeout;

    @Option(names = {"--output"}, description = "CSV output file")
    File outputFile;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws IOException, InterruptedException {
        final WeightedNetwork weighted = feed.loadWeightedNetwork();
        final PrintWriter out = spec.commandLine().getOut();

        final Map<Pair<String, String>, PathResult> paths =
                new AllPairsShortestPaths(weighted, threads, timeout).compute();
        final AllPairsSummary summary = AllPairsSummary.of(paths);

        out.printf("Found %d unique pairs of paths%n", summary.getPairCount());
        summary.getMinCost().ifPresent(c -> out.printf("Minimum: %s%n", CostFormatter.format(c, weighted.getCostModel())));
        summary.getMaxCost().ifPresent(c -> out.printf("Maximum: %s%n", CostFormatter.format(c, weighted.getCostModel())));
        summary.getMeanCost().ifPresent(c -> out.printf("Average: %s%n", CostFormatter.format(c, weighted.getCostModel())));
        out.flush();

        if (outputFile != null) {
            AllPairsCsvWriter.write(paths, outputFile);
        }

        return 0;
    }
}
