package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.util.List;
import java.util.function.Function;

/**
 * An immutable snapshot of the four timetable tables the graph is assembled from.
 */
@Value
public class TimetableFeed {
    ImmutableList<StopRecord> stops;
    ImmutableList<TripStepRecord> tripSteps;
    ImmutableList<TripRecord> trips;
    ImmutableList<RouteRecord> routes;

    public TimetableFeed(List<StopRecord> stops,
                         List<TripStepRecord> tripSteps,
                         List<TripRecord> trips,
                         List<RouteRecord> routes) {
        this.stops = ImmutableList.copyOf(stops);
        this.tripSteps = ImmutableList.copyOf(tripSteps);
        this.trips = ImmutableList.copyOf(trips);
        this.routes = ImmutableList.copyOf(routes);
    }

    /**
     * Fails with {@link FeedSchemaException} on the first record lacking an identifier column the assembler joins on.
     * Names, coordinates and times are not checked here; they degrade leniently during assembly.
     */
    public void checkRequiredColumns() {
        requireColumn("stops", "stop_id", stops, StopRecord::getStopId);
        requireColumn("stop_times", "trip_id", tripSteps, TripStepRecord::getTripId);
        requireColumn("stop_times", "stop_id", tripSteps, TripStepRecord::getStopId);
        requireColumn("trips", "trip_id", trips, TripRecord::getTripId);
        requireColumn("trips", "route_id", trips, TripRecord::getRouteId);
        requireColumn("routes", "route_id", routes, RouteRecord::getRouteId);
    }

    private static <T> void requireColumn(String table, String column, List<T> rows, Function<T, String> getter) {
        for (int i = 0; i < rows.size(); i++) {
            if (getter.apply(rows.get(i)) == null) {
                throw FeedSchemaException.missingColumn(table, column, i + 1);
            }
        }
    }
}
