package com.nyct.transitgraph;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "path", mixinStandardHelpOptions = true,
        description = "Find paths between two stations with depth-first, breadth-first and Dijkstra search.")
class PathCommand implements Callable<Integer> {
    @Mixin
    FeedOptions feed;

    @Parameters(index = "1", description = "Start station name")
    String from;

    @Parameters(index = "2", description = "Destination station name")
    String to;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        final WeightedNetwork weighted = feed.loadWeightedNetwork();
        final TransitNetwork network = weighted.getNetwork();
        final PrintWriter out = spec.commandLine().getOut();

        for (String station : new String[]{from, to}) {
            if (!network.containsNode(station)) {
                spec.commandLine().getErr().printf("Station '%s' not found in graph%n", station);
                return TransitGraphCommand.STATION_NOT_FOUND;
            }
        }

        final TraversalSearch traversal = new TraversalSearch(network);
        final PathResult dfs = traversal.dfs(from, to);
        final PathResult bfs = traversal.bfs(from, to);
        final PathComparison comparison = PathComparison.of(dfs, bfs);

        out.printf("DFS path (%s): %s%n", describeLength(dfs), dfs.getNodes());
        out.printf("BFS path (%s): %s%n", describeLength(bfs), bfs.getNodes());
        out.printf("Same path: %s%n", comparison.isSamePath());
        comparison.getLengthDifference().ifPresent(d -> out.printf("DFS minus BFS stations: %d%n", d));

        final PathResult shortest = new DijkstraSearch(weighted).shortestPath(from, to);
        if (!shortest.isFound()) {
            out.println("Dijkstra: path not found");
            out.flush();
            return 0;
        }

        out.printf("Dijkstra (%s): %s, %d stations%n", weighted.getCostModel(),
                CostFormatter.format(shortest.getCost(), weighted.getCostModel()), shortest.getNodes().size());
        for (int i = 0; i < shortest.getNodes().size() - 1; i++) {
            final String u = shortest.getNodes().get(i);
            final String v = shortest.getNodes().get(i + 1);
            out.printf("  %d. %s -> %s: %s%n", i + 1, u, v,
                    CostFormatter.format(weighted.weight(u, v), weighted.getCostModel()));
        }
        out.println("Legs:");
        new ItineraryBuilder(network).legs(shortest).forEach(leg -> out.printf("  %s (%d segments)%n", leg, leg.getSegmentCount()));
        out.flush();

        return 0;
    }

    private static String describeLength(PathResult path) {
        return path.isFound() ? path.getNodes().size() + " stations" : "not found";
    }
}
