package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-search bookkeeping: distance (or depth) and predecessor per station. A station with no entry is unvisited
 * and sits at infinite distance.
 */
class SearchState {
    private final Map<String, Double> distances = new HashMap<>();
    private final Map<String, String> predecessors = new HashMap<>();

    SearchState(String start) {
        distances.put(start, 0.0);
    }

    boolean isVisited(String node) {
        return distances.containsKey(node);
    }

    double distance(String node) {
        return distances.getOrDefault(node, Double.POSITIVE_INFINITY);
    }

    void reach(String node, String predecessor, double distance) {
        distances.put(node, distance);
        predecessors.put(node, predecessor);
    }

    /**
     * Walks predecessors back from {@code target} to the start.
     */
    ImmutableList<String> pathTo(String target) {
        final List<String> path = new ArrayList<>();
        for (String node = target; node != null; node = predecessors.get(node)) {
            path.add(node);
        }
        return ImmutableList.copyOf(path).reverse();
    }
}
