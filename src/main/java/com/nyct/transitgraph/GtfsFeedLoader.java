package com.nyct.transitgraph;

import com.google.common.collect.ImmutableList;
import org.onebusaway.gtfs.impl.GtfsRelationalDaoImpl;
import org.onebusaway.gtfs.model.Route;
import org.onebusaway.gtfs.model.Stop;
import org.onebusaway.gtfs.model.StopTime;
import org.onebusaway.gtfs.model.Trip;
import org.onebusaway.gtfs.serialization.GtfsReader;
import org.onebusaway.gtfs.services.GtfsMutableRelationalDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

/**
 * Reads a GTFS zip file or directory into a {@link TimetableFeed}.
 */
public class GtfsFeedLoader {
    private static final Logger LOG = LoggerFactory.getLogger(GtfsFeedLoader.class);

    static final ImmutableList<String> REQUIRED_TABLES = ImmutableList.of(
            "stops.txt", "routes.txt", "trips.txt", "stop_times.txt");

    /**
     * @throws FeedSchemaException if one of the four tables the graph needs is absent
     */
    public TimetableFeed load(File gtfsFile) throws IOException {
        checkRequiredTables(gtfsFile);

        final GtfsReader reader = new GtfsReader();
        reader.setInputLocation(gtfsFile);

        final GtfsMutableRelationalDao dao = new GtfsRelationalDaoImpl();
        reader.setEntityStore(dao);

        reader.run();

        final TimetableFeed feed = new TimetableFeed(
                dao.getAllStops()
                        .stream()
                        .sorted(Comparator.comparing((Stop s) -> s.getId().getId()))
                        .map(GtfsFeedLoader::toStopRecord)
                        .collect(toImmutableList()),
                dao.getAllStopTimes()
                        .stream()
                        .map(GtfsFeedLoader::toTripStepRecord)
                        .collect(toImmutableList()),
                dao.getAllTrips()
                        .stream()
                        .map(GtfsFeedLoader::toTripRecord)
                        .collect(toImmutableList()),
                dao.getAllRoutes()
                        .stream()
                        .map(GtfsFeedLoader::toRouteRecord)
                        .collect(toImmutableList())
        );

        LOG.info("Loaded {}: {} stops, {} stop times, {} trips, {} routes", gtfsFile,
                feed.getStops().size(), feed.getTripSteps().size(), feed.getTrips().size(), feed.getRoutes().size());

        return feed;
    }

    private static void checkRequiredTables(File gtfsFile) throws IOException {
        final Set<String> present;
        if (gtfsFile.isDirectory()) {
            present = REQUIRED_TABLES.stream()
                    .filter(name -> new File(gtfsFile, name).isFile())
                    .collect(toImmutableSet());
        } else if (gtfsFile.isFile()) {
            try (final ZipFile zip = new ZipFile(gtfsFile)) {
                present = zip.stream().map(ZipEntry::getName).collect(toImmutableSet());
            }
        } else {
            throw new IOException("GTFS location does not exist: " + gtfsFile);
        }

        final List<String> missing = REQUIRED_TABLES.stream()
                .filter(name -> !present.contains(name))
                .collect(toImmutableList());
        if (!missing.isEmpty()) {
            throw new FeedSchemaException(String.format("%s: required GTFS files missing: %s", gtfsFile, missing));
        }
    }

    private static StopRecord toStopRecord(Stop stop) {
        return new StopRecord(stop.getId().getId(), stop.getName(), stop.getLat(), stop.getLon());
    }

    private static TripStepRecord toTripStepRecord(StopTime st) {
        return new TripStepRecord(
                st.getTrip().getId().getId(),
                st.getStop().getId().getId(),
                st.getStopSequence(),
                st.isArrivalTimeSet() ? GtfsTime.format(st.getArrivalTime()) : null,
                st.isDepartureTimeSet() ? GtfsTime.format(st.getDepartureTime()) : null
        );
    }

    private static TripRecord toTripRecord(Trip trip) {
        return new TripRecord(trip.getId().getId(), trip.getRoute().getId().getId());
    }

    private static RouteRecord toRouteRecord(Route route) {
        return new RouteRecord(route.getId().getId(), route.getType(), route.getShortName(), route.getColor());
    }
}
