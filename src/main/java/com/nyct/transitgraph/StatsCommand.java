package com.nyct.transitgraph;

import freemarker.template.TemplateException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "stats", mixinStandardHelpOptions = true, description = "Print size and degree figures of the network.")
class StatsCommand implements Callable<Integer> {
    @Mixin
    FeedOptions feed;

    @Option(names = {"--report"}, description = "HTML report output file")
    File reportFile;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws IOException, TemplateException {
        final TransitNetwork network = feed.loadNetwork();
        final GraphStatistics stats = GraphStatistics.of(network);
        final PrintWriter out = spec.commandLine().getOut();

        out.printf("Nodes: %d%n", stats.getNodeCount());
        out.printf("Edges: %d%n", stats.getEdgeCount());
        out.printf("Transfer stations: %d%n", stats.getTransferCount());
        out.printf("Min degree: %d%n", stats.getMinDegree());
        out.printf("Max degree: %d%n", stats.getMaxDegree());
        out.printf(Locale.ROOT, "Avg degree: %.2f%n", stats.getMeanDegree());
        out.flush();

        if (reportFile != null) {
            NetworkReport.write(network, feed.gtfsFile.getName() + " (" + feed.routeTypeFilter() + ")", reportFile);
        }

        return 0;
    }
}
