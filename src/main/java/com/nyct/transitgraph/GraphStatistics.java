package com.nyct.transitgraph;

import com.google.common.collect.ImmutableMap;
import lombok.Value;

import static com.google.common.collect.ImmutableMap.toImmutableMap;

/**
 * Size and degree summary of a network. An empty network reports zero for every degree figure.
 */
@Value
public class GraphStatistics {
    int nodeCount;
    int edgeCount;
    long transferCount;
    int minDegree;
    int maxDegree;
    double meanDegree;
    ImmutableMap<String, Integer> degrees;

    public static GraphStatistics of(TransitNetwork network) {
        final ImmutableMap<String, Integer> degrees = network.nodeIds()
                .stream()
                .collect(toImmutableMap(id -> id, network::degree));

        return new GraphStatistics(
                network.nodeCount(),
                network.edgeCount(),
                network.getNodes().stream().filter(StationNode::isTransfer).count(),
                degrees.values().stream().mapToInt(Integer::intValue).min().orElse(0),
                degrees.values().stream().mapToInt(Integer::intValue).max().orElse(0),
                degrees.values().stream().mapToInt(Integer::intValue).average().orElse(0.0),
                degrees
        );
    }
}
