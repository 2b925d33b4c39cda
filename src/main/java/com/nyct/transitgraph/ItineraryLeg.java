package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import lombok.Value;

/**
 * A run of consecutive segments served by the same set of routes.
 */
@Value
public class ItineraryLeg {
    String from;
    String to;
    ImmutableList<String> routeNames;
    int segmentCount;

    @Override
    public String toString() {
        return String.format("%s - %s - %s", from, String.join(", ", routeNames), to);
    }
}
