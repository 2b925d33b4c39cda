package com.nyct.transitgraph;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Iterators;
import com.google.common.collect.Multimaps;
import com.google.common.collect.PeekingIterator;
import lombok.Value;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableMap.toImmutableMap;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

/**
 * Folds every retained trip's stop sequence into an undirected station graph.
 */
public class TripGraphAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(TripGraphAssembler.class);

    private final RouteTypeFilter routeTypeFilter;

    public TripGraphAssembler(RouteTypeFilter routeTypeFilter) {
        this.routeTypeFilter = routeTypeFilter;
    }

    public TripGraphAssembler() {
        this(RouteTypeFilter.all());
    }

    /**
     * @throws FeedSchemaException if a record lacks a required column; nothing is assembled in that case
     */
    public TransitNetwork assemble(TimetableFeed feed) {
        feed.checkRequiredColumns();

        final List<RouteRecord> routes = feed.getRoutes()
                .stream()
                .filter(routeTypeFilter::accepts)
                .collect(toImmutableList());
        final Map<String, RouteRecord> routesById = routes.stream()
                .collect(toImmutableMap(RouteRecord::getRouteId, r -> r, (first, second) -> first));

        final Map<String, RouteRecord> routeForTrip = feed.getTrips()
                .stream()
                .filter(t -> routesById.containsKey(t.getRouteId()))
                .collect(toImmutableMap(TripRecord::getTripId, t -> routesById.get(t.getRouteId()), (first, second) -> first));

        final ImmutableListMultimap<String, TripStepRecord> stepsByTrip = Multimaps.index(
                feed.getTripSteps()
                        .stream()
                        .filter(st -> routeForTrip.containsKey(st.getTripId()))
                        .iterator(),
                TripStepRecord::getTripId
        );

        final Set<String> usedStopIds = stepsByTrip.values()
                .stream()
                .map(TripStepRecord::getStopId)
                .collect(toImmutableSet());

        final StopClustering clustering = StopClusterer.cluster(feed.getStops(), usedStopIds);

        final Map<Pair<String, String>, EdgeAccumulator> edges = new LinkedHashMap<>();
        for (String tripId : new TreeSet<>(stepsByTrip.keySet())) {
            final List<TripStep> steps = tripSteps(tripId, stepsByTrip.get(tripId), routeForTrip.get(tripId), clustering);
            addTripEdges(steps, edges);
        }

        final TransitNetwork network = new TransitNetwork(
                clustering.getNodes(),
                edges.values().stream().map(EdgeAccumulator::build).collect(toImmutableList()),
                routes
        );

        LOG.info("Assembled {} stations and {} segments from {} trips ({})",
                network.nodeCount(), network.edgeCount(), stepsByTrip.keySet().size(), routeTypeFilter);

        return network;
    }

    private static List<TripStep> tripSteps(String tripId,
                                            List<TripStepRecord> records,
                                            RouteRecord route,
                                            StopClustering clustering) {
        return records.stream()
                .sorted(Comparator.comparingInt(TripStepRecord::getStopSequence))
                .map(st -> clustering.nodeFor(st.getStopId())
                        .map(node -> new TripStep(
                                tripId,
                                node,
                                route.getRouteId(),
                                route.getRouteType(),
                                GtfsTime.parseSeconds(st.getArrivalTime()),
                                GtfsTime.parseSeconds(st.getDepartureTime())
                        )))
                .flatMap(Optional::stream)
                .collect(toImmutableList());
    }

    private static void addTripEdges(List<TripStep> steps, Map<Pair<String, String>, EdgeAccumulator> edges) {
        final PeekingIterator<TripStep> it = Iterators.peekingIterator(steps.iterator());

        while (it.hasNext()) {
            final TripStep now = it.next();
            if (it.hasNext()) {
                final TripStep next = it.peek();
                if (now.getNode().equals(next.getNode())) {
                    continue;
                }

                final Pair<String, String> key = EdgeAccumulator.keyOf(now.getNode(), next.getNode());
                edges.computeIfAbsent(key, EdgeAccumulator::new)
                        .add(now.getRouteId(),
                                now.getRouteType(),
                                GtfsTime.travelSeconds(now.getDepartureSeconds(), next.getArrivalSeconds()));
            }
        }
    }

    /**
     * One stop of one trip, already mapped to its station. Only lives while the trip is walked.
     */
    @Value
    static class TripStep {
        String tripId;
        String node;
        String routeId;
        int routeType;
        int arrivalSeconds;
        int departureSeconds;
    }
}
