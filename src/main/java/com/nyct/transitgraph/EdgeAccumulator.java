package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable attributes of one node pair while trips are being walked.
 */
class EdgeAccumulator {
    private final Pair<String, String> key;
    private final Set<String> routeIds = new LinkedHashSet<>();
    private final Set<Integer> routeTypes = new LinkedHashSet<>();
    private final List<Integer> travelTimes = new ArrayList<>();

    EdgeAccumulator(Pair<String, String> key) {
        this.key = key;
    }

    static Pair<String, String> keyOf(String u, String v) {
        return u.compareTo(v) <= 0 ? Pair.of(u, v) : Pair.of(v, u);
    }

    void add(String routeId, int routeType, int travelSeconds) {
        routeIds.add(routeId);
        routeTypes.add(routeType);
        travelTimes.add(travelSeconds);
    }

    TransitEdge build() {
        return new TransitEdge(
                key.getLeft(),
                key.getRight(),
                ImmutableSet.copyOf(routeIds),
                ImmutableSet.copyOf(routeTypes),
                ImmutableList.copyOf(travelTimes)
        );
    }
}
