package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.util.List;

/**
 * A station sequence and its cost. Traversal searches report the hop count as cost; Dijkstra reports the summed
 * edge weight. A missing path is the empty sequence with infinite cost.
 */
@Value
public class PathResult {
    private static final PathResult NOT_FOUND = new PathResult(ImmutableList.of(), Double.POSITIVE_INFINITY);

    ImmutableList<String> nodes;
    double cost;

    public static PathResult notFound() {
        return NOT_FOUND;
    }

    public static PathResult of(List<String> nodes, double cost) {
        return new PathResult(ImmutableList.copyOf(nodes), cost);
    }

    public static PathResult ofHops(List<String> nodes) {
        return of(nodes, nodes.size() - 1);
    }

    public boolean isFound() {
        return !nodes.isEmpty();
    }

    public int getEdgeCount() {
        return isFound() ? nodes.size() - 1 : 0;
    }
}
