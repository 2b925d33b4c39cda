package com.nyct.transitgraph;

import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Options every subcommand shares: where the feed is, which routes to keep and how to weigh segments.
 */
public class FeedOptions {
    @Parameters(index = "0", description = "GTFS Zip file or directory")
    File gtfsFile;

    @Option(names = {"--route-types"}, split = ",", paramLabel = "TYPE",
            description = "Route type codes to keep, e.g. 402,109. All routes when omitted.")
    List<Integer> routeTypes;

    @Option(names = {"--cost-model"}, defaultValue = "GEOGRAPHIC",
            description = "Edge weight: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    CostModel costModel;

    @Option(names = {"--earth-radius-km"}, defaultValue = "6371.0",
            description = "Earth radius for the geographic model (default: ${DEFAULT-VALUE})")
    double earthRadiusKm;

    @Option(names = {"--default-travel-time"}, defaultValue = "60",
            description = "Seconds assumed for a segment without samples (default: ${DEFAULT-VALUE})")
    int defaultTravelTimeSeconds;

    RouteTypeFilter routeTypeFilter() {
        return routeTypes == null || routeTypes.isEmpty() ? RouteTypeFilter.all() : RouteTypeFilter.of(routeTypes);
    }

    WeightingSettings weightingSettings() {
        return WeightingSettings.builder()
                .earthRadiusKm(earthRadiusKm)
                .defaultTravelTimeSeconds(defaultTravelTimeSeconds)
                .build();
    }

    TransitNetwork loadNetwork() throws IOException {
        final TimetableFeed feed = new GtfsFeedLoader().load(gtfsFile);
        return new TripGraphAssembler(routeTypeFilter()).assemble(feed);
    }

    WeightedNetwork loadWeightedNetwork() throws IOException {
        return new EdgeWeighting(weightingSettings()).apply(loadNetwork(), costModel);
    }
}
