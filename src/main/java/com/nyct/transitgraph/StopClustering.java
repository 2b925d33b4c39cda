package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Value;

import java.util.Optional;

/**
 * Output of {@link StopClusterer}: the nodes in identifier order and the stop id to node id mapping.
 */
@Value
public class StopClustering {
    ImmutableList<StationNode> nodes;
    ImmutableMap<String, String> stopToNode;

    public Optional<String> nodeFor(String stopId) {
        return Optional.ofNullable(stopToNode.get(stopId));
    }
}
