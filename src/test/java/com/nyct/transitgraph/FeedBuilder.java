package com.nyct.transitgraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Terse in-memory timetable feeds for tests.
 */
class FeedBuilder {
    private final List<StopRecord> stops = new ArrayList<>();
    private final List<TripStepRecord> steps = new ArrayList<>();
    private final List<TripRecord> trips = new ArrayList<>();
    private final List<RouteRecord> routes = new ArrayList<>();

    FeedBuilder stop(String id, String name, double lat, double lon) {
        stops.add(new StopRecord(id, name, lat, lon));
        return this;
    }

    /** A stop whose id is also its name. */
    FeedBuilder stop(String id, double lat, double lon) {
        return stop(id, id, lat, lon);
    }

    FeedBuilder route(String id, int type) {
        return route(id, type, id);
    }

    FeedBuilder route(String id, int type, String shortName) {
        routes.add(new RouteRecord(id, type, shortName, null));
        return this;
    }

    FeedBuilder trip(String tripId, String routeId) {
        trips.add(new TripRecord(tripId, routeId));
        return this;
    }

    FeedBuilder step(String tripId, String stopId, int sequence, String arrival, String departure) {
        steps.add(new TripStepRecord(tripId, stopId, sequence, arrival, departure));
        return this;
    }

    /**
     * Adds a trip on {@code routeId} through {@code stopIds}, one minute between consecutive stops.
     */
    FeedBuilder trip(String tripId, String routeId, String... stopIds) {
        return timedTrip(tripId, routeId, 60, stopIds);
    }

    FeedBuilder timedTrip(String tripId, String routeId, int secondsPerHop, String... stopIds) {
        trip(tripId, routeId);
        int t = 8 * 3600;
        for (int i = 0; i < stopIds.length; i++) {
            final String time = GtfsTime.format(t);
            step(tripId, stopIds[i], i + 1, time, time);
            t += secondsPerHop;
        }
        return this;
    }

    TimetableFeed build() {
        return new TimetableFeed(stops, steps, trips, routes);
    }

    TransitNetwork assemble() {
        return new TripGraphAssembler().assemble(build());
    }
}
