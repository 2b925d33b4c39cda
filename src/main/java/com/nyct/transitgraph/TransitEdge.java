package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * An undirected segment between two stations, with everything observed on it across all trips.
 * {@code nodeA} sorts before {@code nodeB}.
 */
@Value
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TransitEdge {
    @EqualsAndHashCode.Include
    String nodeA;
    @EqualsAndHashCode.Include
    String nodeB;
    ImmutableSet<String> routeIds;
    ImmutableSet<Integer> routeTypes;
    /** One sample per trip traversal, in seconds; duplicates kept. */
    ImmutableList<Integer> travelTimes;

    public String opposite(String node) {
        return node.equals(nodeA) ? nodeB : nodeA;
    }
}
