package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import se.sawano.java.text.AlphanumericComparator;

import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * Splits a path into legs. A new leg starts wherever the set of routes serving the next segment changes, which is
 * where a rider would transfer.
 */
public class ItineraryBuilder {
    private final TransitNetwork network;

    public ItineraryBuilder(TransitNetwork network) {
        this.network = network;
    }

    public ImmutableList<ItineraryLeg> legs(PathResult path) {
        return legs(path.getNodes());
    }

    public ImmutableList<ItineraryLeg> legs(List<String> path) {
        final ImmutableList.Builder<ItineraryLeg> legs = ImmutableList.builder();
        if (path.size() < 2) {
            return legs.build();
        }

        String legStart = path.get(0);
        ImmutableSet<String> legRoutes = null;
        int segments = 0;

        for (int i = 0; i < path.size() - 1; i++) {
            final String u = path.get(i);
            final ImmutableSet<String> routes = network.edge(u, path.get(i + 1))
                    .map(TransitEdge::getRouteIds)
                    .orElseThrow(() -> new IllegalArgumentException("No segment between consecutive stations in path " + path));

            if (legRoutes != null && !routes.equals(legRoutes)) {
                legs.add(new ItineraryLeg(legStart, u, routeNames(legRoutes), segments));
                legStart = u;
                segments = 0;
            }
            legRoutes = routes;
            segments++;
        }
        legs.add(new ItineraryLeg(legStart, path.get(path.size() - 1), routeNames(legRoutes), segments));

        return legs.build();
    }

    private ImmutableList<String> routeNames(ImmutableSet<String> routeIds) {
        return routeIds.stream()
                .map(id -> network.route(id).map(RouteRecord::getDisplayName).orElse(id))
                .distinct()
                .sorted(new AlphanumericComparator())
                .collect(toImmutableList());
    }
}
